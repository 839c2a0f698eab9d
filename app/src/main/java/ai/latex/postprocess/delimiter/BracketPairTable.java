package ai.latex.postprocess.delimiter;

import java.util.List;
import java.util.Objects;

/**
 * Static table of delimiter arguments considered compatible, plus the comparison used to consult it.
 */
public final class BracketPairTable {

    private static final List<BracketPair> PAIRS = List.of(
            new BracketPair("", ""),
            new BracketPair("(", ")"),
            new BracketPair("\\{", "."),
            new BracketPair("⟮", "⟯"),
            new BracketPair("[", "]"),
            new BracketPair("⟨", "⟩"),
            new BracketPair("{", "}"),
            new BracketPair("⌈", "⌉"),
            new BracketPair("┌", "┐"),
            new BracketPair("⌊", "⌋"),
            new BracketPair("└", "┘"),
            new BracketPair("⎰", "⎱"),
            new BracketPair("lt", "gt"),
            new BracketPair("lang", "rang"),
            new BracketPair("langle", "rangle"),
            new BracketPair("lbrace", "rbrace"),
            new BracketPair("lBrace", "rBrace"),
            new BracketPair("lbracket", "rbracket"),
            new BracketPair("lceil", "rceil"),
            new BracketPair("lcorner", "rcorner"),
            new BracketPair("lfloor", "rfloor"),
            new BracketPair("lgroup", "rgroup"),
            new BracketPair("lmoustache", "rmoustache"),
            new BracketPair("lparen", "rparen"),
            new BracketPair("lvert", "rvert"),
            new BracketPair("lVert", "rVert"));

    private BracketPairTable() {
    }

    public static List<BracketPair> pairs() {
        return PAIRS;
    }

    /**
     * Tests whether a {@code \right} argument closes a {@code \left} argument.
     */
    public static boolean compatible(String rightArgument, String leftArgument, BracketMatchingMode mode) {
        Objects.requireNonNull(rightArgument, "rightArgument");
        Objects.requireNonNull(leftArgument, "leftArgument");
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case STRICT -> strictCompatible(rightArgument, leftArgument);
            case LEGACY -> legacyCompatible(rightArgument, leftArgument);
        };
    }

    private static boolean strictCompatible(String rightArgument, String leftArgument) {
        String[] remainders = stripCommonPrefix(compact(rightArgument), compact(leftArgument));
        for (BracketPair pair : PAIRS) {
            if (pair.pairs(remainders[0], remainders[1])) {
                return true;
            }
        }
        return false;
    }

    // The right argument is cut by len("left") + 1 and the left by len("right") + 1; the lookup is one-way.
    private static boolean legacyCompatible(String rightArgument, String leftArgument) {
        String right = dropLeading(compact(rightArgument), DelimiterKind.LEFT.commandLength());
        String left = dropLeading(compact(leftArgument), DelimiterKind.RIGHT.commandLength());
        String[] remainders = stripCommonPrefix(right, left);
        for (BracketPair pair : PAIRS) {
            if (pair.open().equals(remainders[0]) && pair.close().equals(remainders[1])) {
                return true;
            }
        }
        return false;
    }

    private static String compact(String argument) {
        return argument.trim().replace(" ", "");
    }

    private static String dropLeading(String value, int count) {
        return value.length() <= count ? "" : value.substring(count);
    }

    private static String[] stripCommonPrefix(String first, String second) {
        int shared = 0;
        int limit = Math.min(first.length(), second.length());
        while (shared < limit && first.charAt(shared) == second.charAt(shared)) {
            shared++;
        }
        return new String[] {first.substring(shared), second.substring(shared)};
    }
}
