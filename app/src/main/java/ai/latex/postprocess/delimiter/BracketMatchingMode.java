package ai.latex.postprocess.delimiter;

/**
 * Controls how delimiter arguments are compared when pairing {@code \left} with {@code \right}.
 */
public enum BracketMatchingMode {
    /**
     * Compare the arguments as scanned, after dropping their common prefix, against the table in
     * either orientation.
     */
    STRICT,
    /**
     * Additionally drop the first {@code len("left") + 1} / {@code len("right") + 1} characters of each
     * argument before comparing. Single-character delimiters then reduce to the empty pair and match
     * each other unconditionally.
     */
    LEGACY;

    public static BracketMatchingMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return STRICT;
        }
        for (BracketMatchingMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported bracket matching mode: " + raw);
    }
}
