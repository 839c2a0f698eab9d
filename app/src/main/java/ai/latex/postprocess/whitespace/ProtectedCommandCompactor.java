package ai.latex.postprocess.whitespace;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes the spaces inside text-like command applications such as {@code \text {a b}} so that the
 * symbol-adjacency rules never see their content.
 */
public final class ProtectedCommandCompactor {

    public static final List<String> PROTECTED_COMMANDS = List.of("operatorname", "mathrm", "text", "mathbf");

    private static final Pattern PROTECTED_COMMAND = Pattern.compile(
            "\\\\(" + String.join("|", PROTECTED_COMMANDS) + ")\\s*\\*?\\s*\\{[^}]*\\}",
            Pattern.UNICODE_CHARACTER_CLASS);

    private ProtectedCommandCompactor() {
    }

    public static String compact(String latex) {
        Objects.requireNonNull(latex, "latex");
        Matcher matcher = PROTECTED_COMMAND.matcher(latex);
        StringBuilder builder = new StringBuilder(latex.length());
        while (matcher.find()) {
            String compacted = matcher.group().replace(" ", "");
            matcher.appendReplacement(builder, Matcher.quoteReplacement(compacted));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }
}
