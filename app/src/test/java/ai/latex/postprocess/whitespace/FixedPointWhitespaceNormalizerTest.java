package ai.latex.postprocess.whitespace;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class FixedPointWhitespaceNormalizerTest {

    private final WhitespaceNormalizer normalizer = new FixedPointWhitespaceNormalizer();

    @Test
    void stripsSpacesInsideOperatorName() {
        assertThat(normalizer.normalize("\\operatorname{ arg }")).isEqualTo("\\operatorname{arg}");
    }

    @Test
    void closesUpTokenizedFraction() {
        assertThat(normalizer.normalize("\\frac { a } { b }")).isEqualTo("\\frac{a}{b}");
    }

    @Test
    void needsSeveralPassesForChainedSymbols() {
        assertThat(normalizer.normalize("x ^ { 2 }")).isEqualTo("x^{2}");
        assertThat(normalizer.normalize("( x + 1 ]")).isEqualTo("(x+1]");
    }

    @Test
    void keepsSpaceBetweenLetters() {
        assertThat(normalizer.normalize("\\sin x")).isEqualTo("\\sin x");
        assertThat(normalizer.normalize("a b c")).isEqualTo("a b c");
    }

    @Test
    void keepsEscapedSpaceCommand() {
        assertThat(normalizer.normalize("a \\ b")).isEqualTo("a\\ b");
        assertThat(normalizer.normalize("1 \\ 2")).isEqualTo("1\\ 2");
    }

    @Test
    void treatsTabsLikeSpaces() {
        assertThat(normalizer.normalize("a\t+\tb")).isEqualTo("a+b");
    }

    @Test
    void compactsProtectedCommandsBeforeCollapsing() {
        assertThat(normalizer.normalize("\\text {hello world} + 1")).isEqualTo("\\text{helloworld}+1");
        assertThat(normalizer.normalize("\\mathrm { d } x")).isEqualTo("\\mathrm{d}x");
    }

    @Test
    void returnsInputWithoutWhitespaceUnchanged() {
        assertThat(normalizer.normalize("\\frac{a}{b}")).isEqualTo("\\frac{a}{b}");
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    void outputIsAFixedPoint() {
        List<String> inputs = List.of(
                "\\frac { a } { b }",
                "x ^ { 2 } + y _ { i j }",
                "\\left( x \\right) \\cdot \\text { a b }",
                "a \\ b ,  c",
                "f ( x ) = \\operatorname* { s u p } _ { n } x _ n");

        for (String input : inputs) {
            String once = normalizer.normalize(input);
            assertThat(normalizer.normalize(once)).as(input).isEqualTo(once);
        }
    }

    @Test
    void compactsProtectedArgumentSpanningLines() {
        String once = normalizer.normalize("\\mathrm{x  \n y}");

        assertThat(once).isEqualTo("\\mathrm{x\ny}");
        assertThat(normalizer.normalize(once)).isEqualTo(once);
        assertThat(normalizer.normalize("\\text{a\nb c}")).isEqualTo("\\text{a\nbc}");
    }

    @Test
    void neverJoinsTwoLetters() {
        String output = normalizer.normalize("\\alpha \\beta + a b - c d");

        assertThat(output).contains("a b").contains("c d");
    }
}
