package ai.latex.postprocess.delimiter;

/**
 * The two sizing commands recognised by the scanner.
 */
public enum DelimiterKind {
    LEFT("left"),
    RIGHT("right");

    private final String keyword;

    DelimiterKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Length of the command text including its backslash, e.g. 5 for {@code \left}.
     */
    public int commandLength() {
        return keyword.length() + 1;
    }
}
