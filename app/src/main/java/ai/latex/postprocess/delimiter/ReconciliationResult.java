package ai.latex.postprocess.delimiter;

import java.util.List;
import java.util.Objects;

/**
 * Corrected text together with the occurrences that were paired or neutralized on the way.
 */
public record ReconciliationResult(String text, int matchedPairs, List<DelimiterOccurrence> neutralized) {

    public ReconciliationResult {
        Objects.requireNonNull(text, "text");
        if (matchedPairs < 0) {
            throw new IllegalArgumentException("matchedPairs must not be negative");
        }
        neutralized = List.copyOf(Objects.requireNonNull(neutralized, "neutralized"));
    }

    public int neutralizedCount() {
        return neutralized.size();
    }
}
