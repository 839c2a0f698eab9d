package ai.latex.postprocess.delimiter;

import java.util.Objects;

/**
 * Replaces full-width parentheses and commas emitted by recognition models with their ASCII forms.
 */
public final class PunctuationNormalizer {

    private PunctuationNormalizer() {
    }

    public static String normalize(String latex) {
        Objects.requireNonNull(latex, "latex");
        return latex.replace('（', '(')
                .replace('）', ')')
                .replace('，', ',');
    }
}
