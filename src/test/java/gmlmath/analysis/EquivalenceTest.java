package gmlmath.analysis;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.Expression;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EquivalenceTest {

    private static boolean same(String a, String b) throws ParseException {
        Parser parser = new Parser();
        return Equivalence.isEquivalent(
                parser.parseExpression(a), parser.parseExpression(b));
    }

    private static boolean close(String a, String b) throws ParseException {
        Parser parser = new Parser();
        return Equivalence.isApproximatelyEquivalent(
                parser.parseExpression(a), parser.parseExpression(b));
    }

    @Test
    void comparesStructure() throws ParseException {
        assertThat(same("a.b[i] * 2", "(a.b[i]) * 2")).isTrue();
        assertThat(same("f(x, y + 1)", "f(x, (y + 1))")).isTrue();
        assertThat(same("f(x)", "g(x)")).isFalse();
        assertThat(same("-x", "x")).isFalse();
        assertThat(same("1.0", "1")).isFalse();
        assertThat(same("a - b", "b - a")).isFalse();
    }

    @Test
    void isReflexiveForAnyNode() throws ParseException {
        Expression e = new Parser().parseExpression("foo(a)[2].bar");
        assertThat(Equivalence.isEquivalent(e, e.clone())).isTrue();
        assertThat(Equivalence.isEquivalent(null, null)).isTrue();
        assertThat(Equivalence.isEquivalent(e, null)).isFalse();
    }

    @Test
    void approximateMatchesNumbersAndCommutedOperands() throws ParseException {
        assertThat(close("1.0", "1")).isTrue();
        assertThat(close("b * a", "a * b")).isTrue();
        assertThat(close("x + 0.5", "0.50 + x")).isTrue();
        assertThat(close("a - b", "b - a")).isFalse();
        assertThat(close("a / b", "b / a")).isFalse();
    }

}
