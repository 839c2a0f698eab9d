package ai.latex.postprocess.delimiter;

import java.util.Objects;

/**
 * A single {@code \left} or {@code \right} found in a string together with its argument.
 *
 * <p>{@code start} points at the backslash of the command, {@code end} is exclusive and covers the
 * extracted argument. Offsets refer to the string that was scanned.
 */
public record DelimiterOccurrence(DelimiterKind kind, String argument, int start, int end) {

    public DelimiterOccurrence {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(argument, "argument");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid occurrence boundaries");
        }
    }

    public int commandEnd() {
        return start + kind.commandLength();
    }
}
