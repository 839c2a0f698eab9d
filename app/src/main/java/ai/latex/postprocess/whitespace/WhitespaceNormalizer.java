package ai.latex.postprocess.whitespace;

/**
 * Removes tokenizer-introduced whitespace from LaTeX while keeping spacing that carries meaning.
 */
public interface WhitespaceNormalizer {

    String normalize(String latex);
}
