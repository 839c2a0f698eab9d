package ai.latex.postprocess.config;

import ai.latex.postprocess.delimiter.BracketMatchingMode;
import ai.latex.postprocess.pipeline.Stage;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Set<Stage> stages,
        BracketMatchingMode bracketMatchingMode,
        Optional<Path> input,
        Optional<Path> output,
        boolean emitAlternatives,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(stages, "stages");
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("stages must contain at least one stage");
        }
        stages = Collections.unmodifiableSet(EnumSet.copyOf(stages));
        bracketMatchingMode = Objects.requireNonNull(bracketMatchingMode, "bracketMatchingMode");
        input = input == null ? Optional.empty() : input;
        output = output == null ? Optional.empty() : output;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        if (input.isPresent() && output.isPresent()
                && input.get().toAbsolutePath().normalize().equals(output.get().toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("input and output must not point to the same file");
        }
    }

    public boolean readsStandardInput() {
        return input.isEmpty();
    }

    public boolean writesStandardOutput() {
        return output.isEmpty();
    }
}
