package ai.latex.postprocess.pipeline;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Post-processing steps. Enabled stages always run in declaration order.
 */
public enum Stage {
    RECONCILE,
    WHITESPACE;

    public static Stage from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Stage must be provided");
        }
        for (Stage stage : values()) {
            if (stage.name().equalsIgnoreCase(raw.trim())) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unsupported stage: " + raw);
    }

    /**
     * Parses a comma separated list such as {@code reconcile,whitespace}.
     */
    public static Set<Stage> parseList(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("At least one stage must be provided");
        }
        Set<Stage> stages = EnumSet.noneOf(Stage.class);
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(Stage::from)
                .forEach(stages::add);
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("At least one stage must be provided");
        }
        return stages;
    }
}
