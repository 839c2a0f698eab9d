package ai.latex.postprocess.delimiter;

/**
 * Repairs unbalanced {@code \left} / {@code \right} commands in a LaTeX string.
 */
public interface DelimiterReconciler {

    ReconciliationResult reconcile(String latex);
}
