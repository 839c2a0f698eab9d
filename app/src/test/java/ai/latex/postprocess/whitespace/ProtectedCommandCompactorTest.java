package ai.latex.postprocess.whitespace;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProtectedCommandCompactorTest {

    @Test
    void removesOnlySpacesFromEachCommandApplication() {
        String compacted = ProtectedCommandCompactor.compact("\\text { a , b } = \\mathbf { v }");

        assertThat(compacted).isEqualTo("\\text{a,b} = \\mathbf{v}");
    }

    @Test
    void acceptsStarredForm() {
        assertThat(ProtectedCommandCompactor.compact("\\operatorname* {a r g} x"))
                .isEqualTo("\\operatorname*{arg} x");
    }

    @Test
    void allowsRunsOfWhitespaceBeforeBrace() {
        assertThat(ProtectedCommandCompactor.compact("\\text  { a b }")).isEqualTo("\\text{ab}");
    }

    @Test
    void stopsAtFirstClosingBrace() {
        assertThat(ProtectedCommandCompactor.compact("\\mathrm {d} x {y z}"))
                .isEqualTo("\\mathrm{d} x {y z}");
    }

    @Test
    void matchesArgumentAcrossLineBreaks() {
        assertThat(ProtectedCommandCompactor.compact("\\text { a\n b } {c d}"))
                .isEqualTo("\\text{a\nb} {c d}");
    }

    @Test
    void leavesOtherCommandsAlone() {
        assertThat(ProtectedCommandCompactor.compact("\\textbf { a b } \\mathit { c d }"))
                .isEqualTo("\\textbf { a b } \\mathit { c d }");
    }

    @Test
    void treatsReplacementTextLiterally() {
        assertThat(ProtectedCommandCompactor.compact("\\text { $ 5 }")).isEqualTo("\\text{$5}");
    }
}
