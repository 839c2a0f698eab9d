package ai.latex.postprocess.pipeline;

import ai.latex.postprocess.delimiter.BracketMatchingMode;
import ai.latex.postprocess.delimiter.DelimiterReconciler;
import ai.latex.postprocess.delimiter.DelimiterScanner;
import ai.latex.postprocess.delimiter.GreedyDelimiterReconciler;
import ai.latex.postprocess.delimiter.ReconciliationResult;
import ai.latex.postprocess.operator.OperatorNameSimplifier;
import ai.latex.postprocess.whitespace.FixedPointWhitespaceNormalizer;
import ai.latex.postprocess.whitespace.WhitespaceNormalizer;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for cleaning up LaTeX produced by a recognition model.
 *
 * <p>Instances hold no per-call state and can be shared between threads.
 */
public class LatexPostProcessor {

    private final DelimiterReconciler reconciler;
    private final WhitespaceNormalizer whitespaceNormalizer;
    private final Set<Stage> stages;

    public LatexPostProcessor() {
        this(BracketMatchingMode.STRICT, EnumSet.allOf(Stage.class));
    }

    public LatexPostProcessor(BracketMatchingMode matchingMode, Set<Stage> stages) {
        this(new GreedyDelimiterReconciler(new DelimiterScanner(), matchingMode),
                new FixedPointWhitespaceNormalizer(), stages);
    }

    public LatexPostProcessor(DelimiterReconciler reconciler, WhitespaceNormalizer whitespaceNormalizer,
                              Set<Stage> stages) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.whitespaceNormalizer = Objects.requireNonNull(whitespaceNormalizer, "whitespaceNormalizer");
        Objects.requireNonNull(stages, "stages");
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("At least one stage must be enabled");
        }
        this.stages = Collections.unmodifiableSet(EnumSet.copyOf(stages));
    }

    public String reconcileDelimiters(String latex) {
        return reconciler.reconcile(latex).text();
    }

    public ReconciliationResult reconcile(String latex) {
        return reconciler.reconcile(latex);
    }

    public String normalizeWhitespace(String latex) {
        return whitespaceNormalizer.normalize(latex);
    }

    /**
     * Runs the enabled stages, delimiter reconciliation first.
     */
    public String process(String latex) {
        return processDetailed(latex).text();
    }

    ProcessedLine processDetailed(String latex) {
        Objects.requireNonNull(latex, "latex");
        String current = latex;
        int neutralized = 0;
        if (stages.contains(Stage.RECONCILE)) {
            ReconciliationResult result = reconciler.reconcile(current);
            current = result.text();
            neutralized = result.neutralizedCount();
        }
        if (stages.contains(Stage.WHITESPACE)) {
            current = whitespaceNormalizer.normalize(current);
        }
        return new ProcessedLine(current, neutralized);
    }

    public List<String> alternatives(String latex) {
        return OperatorNameSimplifier.alternatives(latex);
    }

    public Set<Stage> stages() {
        return stages;
    }

    record ProcessedLine(String text, int neutralizedDelimiters) {
    }
}
