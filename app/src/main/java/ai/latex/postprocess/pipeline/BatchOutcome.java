package ai.latex.postprocess.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of a batch run over many LaTeX strings.
 *
 * @param lines processed output, one entry per input line
 * @param changedLines number of lines whose output differs from the input
 * @param neutralizedDelimiters total unmatched {@code \left}/{@code \right} commands removed
 * @param failedLines zero-based indexes of lines passed through unchanged after a failure
 */
public record BatchOutcome(List<String> lines,
                           int changedLines,
                           int neutralizedDelimiters,
                           List<Integer> failedLines) {

    public BatchOutcome {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        failedLines = List.copyOf(Objects.requireNonNull(failedLines, "failedLines"));
    }

    public int processedLines() {
        return lines.size();
    }
}
