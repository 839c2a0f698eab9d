package ai.latex.postprocess.delimiter;

import java.util.Objects;

/**
 * Open and close forms of a delimiter argument that may be paired by {@code \left} / {@code \right}.
 */
public record BracketPair(String open, String close) {

    public BracketPair {
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(close, "close");
    }

    public boolean pairs(String first, String second) {
        return (open.equals(first) && close.equals(second)) || (open.equals(second) && close.equals(first));
    }
}
