package ai.latex.postprocess.delimiter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs each {@code \left} with the earliest compatible unpaired {@code \right} after it, then blanks the
 * command text of everything left unpaired so that only the bare delimiter remains.
 */
public class GreedyDelimiterReconciler implements DelimiterReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GreedyDelimiterReconciler.class);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final DelimiterScanner scanner;
    private final BracketMatchingMode matchingMode;

    public GreedyDelimiterReconciler() {
        this(new DelimiterScanner(), BracketMatchingMode.STRICT);
    }

    public GreedyDelimiterReconciler(DelimiterScanner scanner, BracketMatchingMode matchingMode) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.matchingMode = Objects.requireNonNull(matchingMode, "matchingMode");
    }

    @Override
    public ReconciliationResult reconcile(String latex) {
        String normalized = PunctuationNormalizer.normalize(latex);
        List<DelimiterOccurrence> lefts = scanner.scan(normalized, DelimiterKind.LEFT);
        List<DelimiterOccurrence> rights = scanner.scan(normalized, DelimiterKind.RIGHT);

        boolean[] leftMatched = new boolean[lefts.size()];
        boolean[] rightMatched = new boolean[rights.size()];
        int pairs = 0;
        for (int i = 0; i < lefts.size(); i++) {
            DelimiterOccurrence left = lefts.get(i);
            for (int j = 0; j < rights.size(); j++) {
                DelimiterOccurrence right = rights.get(j);
                if (!rightMatched[j]
                        && right.start() > left.start()
                        && BracketPairTable.compatible(right.argument(), left.argument(), matchingMode)) {
                    leftMatched[i] = true;
                    rightMatched[j] = true;
                    pairs++;
                    break;
                }
            }
        }

        List<DelimiterOccurrence> neutralized = new ArrayList<>();
        collectUnmatched(lefts, leftMatched, neutralized);
        collectUnmatched(rights, rightMatched, neutralized);
        if (!neutralized.isEmpty()) {
            LOGGER.debug("Neutralized {} unmatched delimiter command(s), kept {} pair(s)", neutralized.size(), pairs);
        }

        String collapsed = WHITESPACE_RUN.matcher(neutralize(normalized, neutralized)).replaceAll(" ").strip();
        return new ReconciliationResult(collapsed, pairs, neutralized);
    }

    /**
     * Overwrites the command text of each occurrence with spaces. The result has the same length as
     * {@code latex}, so offsets of the remaining occurrences stay valid.
     */
    static String neutralize(String latex, List<DelimiterOccurrence> occurrences) {
        char[] buffer = latex.toCharArray();
        for (DelimiterOccurrence occurrence : occurrences) {
            Arrays.fill(buffer, occurrence.start(), Math.min(occurrence.commandEnd(), buffer.length), ' ');
        }
        return new String(buffer);
    }

    private static void collectUnmatched(List<DelimiterOccurrence> occurrences, boolean[] matched,
                                         List<DelimiterOccurrence> target) {
        for (int i = 0; i < occurrences.size(); i++) {
            if (!matched[i]) {
                target.add(occurrences.get(i));
            }
        }
    }
}
