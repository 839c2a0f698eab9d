package ai.latex.postprocess.whitespace;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses whitespace next to non-letter symbols until no rule applies any more. Whitespace between
 * two ASCII letters is never removed.
 */
public class FixedPointWhitespaceNormalizer implements WhitespaceNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FixedPointWhitespaceNormalizer.class);

    private static final String LETTER = "[a-zA-Z]";
    private static final String NON_LETTER = "[\\W_^\\d]";
    private static final String NOT_ESCAPED_SPACE = "(?!\\\\ )";

    private static final List<Pattern> RULES = List.of(
            rule(NOT_ESCAPED_SPACE + "(" + NON_LETTER + ")\\s+?(" + NON_LETTER + ")"),
            rule(NOT_ESCAPED_SPACE + "(" + NON_LETTER + ")\\s+?(" + LETTER + ")"),
            rule("(" + LETTER + ")\\s+?(" + NON_LETTER + ")"));

    @Override
    public String normalize(String latex) {
        Objects.requireNonNull(latex, "latex");
        String current = ProtectedCommandCompactor.compact(latex);
        int passes = 0;
        while (true) {
            passes++;
            String next = current;
            for (Pattern rule : RULES) {
                next = rule.matcher(next).replaceAll("$1$2");
            }
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        LOGGER.trace("Whitespace normalization settled after {} pass(es)", passes);
        return current;
    }

    private static Pattern rule(String regex) {
        return Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
    }
}
