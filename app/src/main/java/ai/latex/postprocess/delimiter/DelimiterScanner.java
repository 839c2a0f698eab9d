package ai.latex.postprocess.delimiter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates {@code \left} / {@code \right} commands and extracts the delimiter that follows each one.
 */
public class DelimiterScanner {

    private final Map<DelimiterKind, Pattern> patterns = new EnumMap<>(DelimiterKind.class);

    public DelimiterScanner() {
        for (DelimiterKind kind : DelimiterKind.values()) {
            patterns.put(kind, Pattern.compile("\\\\" + kind.keyword() + "\\s*\\S", Pattern.UNICODE_CHARACTER_CLASS));
        }
    }

    /**
     * Returns every occurrence of the given command, ordered by start offset. A command with nothing
     * but whitespace after it is not reported.
     */
    public List<DelimiterOccurrence> scan(String latex, DelimiterKind kind) {
        Objects.requireNonNull(latex, "latex");
        Objects.requireNonNull(kind, "kind");
        if (latex.isEmpty()) {
            return Collections.emptyList();
        }

        List<DelimiterOccurrence> occurrences = new ArrayList<>();
        Matcher matcher = patterns.get(kind).matcher(latex);
        int from = 0;
        // restart just past each start: in "\left\left(" the second keyword begins inside the first match
        while (from < latex.length() && matcher.find(from)) {
            int start = matcher.start();
            int end = extendOverCommandName(latex, matcher.end());
            String argument = latex.substring(Math.min(start + kind.commandLength(), end), end).trim();
            occurrences.add(new DelimiterOccurrence(kind, argument, start, end));
            from = start + 1;
        }
        return occurrences;
    }

    // "\left\big(" or "\left \langle": keep consuming while the last taken char opens a command name
    private int extendOverCommandName(String latex, int end) {
        int length = latex.length();
        while (end < length && isCommandLead(latex.charAt(end - 1))) {
            end++;
            while (end < length && Character.isLetter(latex.charAt(end))) {
                end++;
            }
        }
        return end;
    }

    private static boolean isCommandLead(char ch) {
        return ch == '\\' || ch == ' ';
    }
}
