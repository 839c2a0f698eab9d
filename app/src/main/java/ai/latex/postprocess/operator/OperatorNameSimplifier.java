package ai.latex.postprocess.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces equivalent spellings of a formula where {@code \operatorname{sin}} and {@code \sin} are
 * interchangeable.
 */
public final class OperatorNameSimplifier {

    public static final List<String> OPERATORS = List.of(
            "arccos", "arcsin", "arctan", "arg", "cos", "cosh", "cot", "coth", "csc", "deg", "det", "dim",
            "exp", "gcd", "hom", "inf", "injlim", "ker", "lg", "lim", "liminf", "limsup", "ln", "log", "max",
            "min", "Pr", "projlim", "sec", "sin", "sinh", "sup", "tan", "tanh");

    private static final Pattern OPERATOR_NAME = Pattern.compile(
            "\\\\operatorname\\{(" + String.join("|", OPERATORS) + ")\\}");

    private OperatorNameSimplifier() {
    }

    /**
     * Rewrites every {@code \operatorname{NAME}} whose name is a predefined operator to {@code \NAME}.
     * A space is inserted when a letter follows, otherwise {@code \operatorname{sin}x} would turn into
     * the unknown command {@code \sinx}.
     */
    public static String simplify(String latex) {
        Objects.requireNonNull(latex, "latex");
        Matcher matcher = OPERATOR_NAME.matcher(latex);
        StringBuilder builder = new StringBuilder(latex.length());
        while (matcher.find()) {
            String replacement = "\\" + matcher.group(1);
            if (matcher.end() < latex.length() && isAsciiLetter(latex.charAt(matcher.end()))) {
                replacement += " ";
            }
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    /**
     * Returns the input followed by its simplified spelling when that differs.
     */
    public static List<String> alternatives(String latex) {
        String simplified = simplify(latex);
        List<String> variants = new ArrayList<>(2);
        variants.add(latex);
        if (!simplified.equals(latex)) {
            variants.add(simplified);
        }
        return List.copyOf(variants);
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }
}
