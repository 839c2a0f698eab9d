package ai.latex.postprocess.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link LatexPostProcessor} to every line of a prediction file.
 */
public class LatexBatchProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LatexBatchProcessor.class);
    private static final String ALTERNATIVE_SEPARATOR = "\t";

    private final LatexPostProcessor postProcessor;
    private final boolean emitAlternatives;

    public LatexBatchProcessor(LatexPostProcessor postProcessor, boolean emitAlternatives) {
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor");
        this.emitAlternatives = emitAlternatives;
    }

    public BatchOutcome process(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return new BatchOutcome(List.of(), 0, 0, List.of());
        }
        List<String> output = new ArrayList<>(lines.size());
        List<Integer> failedLines = new ArrayList<>();
        int changed = 0;
        int neutralized = 0;
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            if (line == null || line.isEmpty()) {
                output.add(line == null ? "" : line);
                continue;
            }
            try {
                LatexPostProcessor.ProcessedLine processed = postProcessor.processDetailed(line);
                neutralized += processed.neutralizedDelimiters();
                if (!processed.text().equals(line)) {
                    changed++;
                    LOGGER.debug("Line {} rewritten:\n  before: {}\n  after:  {}", index + 1, line, processed.text());
                }
                output.add(emitAlternatives ? withAlternatives(processed.text()) : processed.text());
            } catch (RuntimeException ex) {
                LOGGER.error("Post-processing failed for line {}; keeping original text: {}", index + 1, ex.getMessage(), ex);
                failedLines.add(index);
                output.add(line);
            }
        }
        return new BatchOutcome(output, changed, neutralized, failedLines);
    }

    private String withAlternatives(String latex) {
        return String.join(ALTERNATIVE_SEPARATOR, postProcessor.alternatives(latex));
    }
}
