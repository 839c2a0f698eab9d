package ai.latex.postprocess.operator;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class OperatorNameSimplifierTest {

    @Test
    void rewritesKnownOperatorNames() {
        assertThat(OperatorNameSimplifier.simplify("\\operatorname{sin} x")).isEqualTo("\\sin x");
        assertThat(OperatorNameSimplifier.simplify("\\operatorname{liminf}_{n}")).isEqualTo("\\liminf_{n}");
        assertThat(OperatorNameSimplifier.simplify("\\operatorname{Pr}(A)")).isEqualTo("\\Pr(A)");
    }

    @Test
    void separatesOperatorFromFollowingLetter() {
        assertThat(OperatorNameSimplifier.simplify("\\operatorname{sin}x")).isEqualTo("\\sin x");
    }

    @Test
    void leavesUnknownOperatorNames() {
        assertThat(OperatorNameSimplifier.simplify("\\operatorname{foo}(x)")).isEqualTo("\\operatorname{foo}(x)");
    }

    @Test
    void alternativesListOriginalFirst() {
        assertThat(OperatorNameSimplifier.alternatives("\\operatorname{log} y"))
                .containsExactly("\\operatorname{log} y", "\\log y");
        assertThat(OperatorNameSimplifier.alternatives("\\log y")).containsExactly("\\log y");
    }
}
