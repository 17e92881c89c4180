package gmlmath.transforms.math;

import gmlmath.exec.ParseException;
import gmlmath.hir.*;
import org.junit.jupiter.api.Test;

import static gmlmath.transforms.math.RuleFixture.binary;
import static gmlmath.transforms.math.RuleFixture.hold;
import static org.assertj.core.api.Assertions.assertThat;

class ScalarRulesTest {

    @Test
    void foldsConstantOneMinusFactor() throws ParseException {
        assertThat(binary(new OneMinusFactorRule(), "x * (1 - 0.25)"))
                .isEqualTo("x * 0.75");
        assertThat(binary(new OneMinusFactorRule(), "x * (1 - y)")).isNull();
    }

    @Test
    void condensesScalarProduct() throws ParseException {
        assertThat(binary(new ScalarProductRule(), "1.3 * size * 0.12 / 1.5"))
                .isEqualTo("size * 0.104");
    }

    @Test
    void scalarProductOfOneLeavesSymbolicFactors() throws ParseException {
        assertThat(binary(new ScalarProductRule(), "2 * x * 0.5")).isEqualTo("x");
    }

    @Test
    void scalarProductNeedsTwoMeaningfulConstants() throws ParseException {
        assertThat(binary(new ScalarProductRule(), "x * 3")).isNull();
    }

    @Test
    void scalarProductKeepsCommentedFactors() throws ParseException {
        assertThat(binary(new ScalarProductRule(), "2 * x * /* tuned */ 0.5"))
                .isNull();
    }

    @Test
    void unitFractionGetsRatioHint() throws ParseException {
        ExpressionStatement holder = hold("s / 12 / 12");
        NormalizationContext ctx = new NormalizationContext("s / 12 / 12", holder);
        boolean changed = new ScalarProductRule().apply(
                (BinaryExpression)holder.getExpression(), ctx);
        assertThat(changed).isTrue();
        assertThat(holder.getExpression().toString())
                .isEqualTo("s * 0.0069444444444");
        assertThat(Literal.findRatioHint(holder.getExpression()))
                .isEqualTo("(1/144)");
    }

    @Test
    void ratioHintNeedsLargeDenominator() {
        assertThat(ScalarProductRule.computeRatioHint(1.0 / 144, 1, 144))
                .isEqualTo("(1/144)");
        assertThat(ScalarProductRule.computeRatioHint(0.25, 1, 4)).isNull();
        assertThat(ScalarProductRule.computeRatioHint(3.0 / 400, 3, 400)).isNull();
    }

    @Test
    void condensesNumericChainOverSeveralSymbols() throws ParseException {
        assertThat(binary(new NumericChainRule(), "a * b / 0.5"))
                .isEqualTo("a * b * 2");
        assertThat(binary(new NumericChainRule(), "a * b * 2")).isNull();
    }

    @Test
    void collectsDistributedCoefficients() throws ParseException {
        assertThat(binary(new DistributedScalarRule(), "a * 2 + a * 3"))
                .isEqualTo("a * 5");
        assertThat(binary(new DistributedScalarRule(), "2 * a + a * 3"))
                .isEqualTo("a * 5");
        assertThat(binary(new DistributedScalarRule(), "a * 3 - a * 2"))
                .isEqualTo("a");
        assertThat(binary(new DistributedScalarRule(), "a * 2 - a * 2"))
                .isEqualTo("0");
    }

    @Test
    void distributedCoefficientsNeedOneBase() throws ParseException {
        assertThat(binary(new DistributedScalarRule(), "a * 2 + b * 3")).isNull();
        assertThat(binary(new DistributedScalarRule(), "a * 2 + a")).isNull();
    }

    @Test
    void rewritesDivisionByReciprocal() throws ParseException {
        assertThat(binary(new DivisionByReciprocalRule(), "v / (1 / d)"))
                .isEqualTo("v * d");
        assertThat(binary(new DivisionByReciprocalRule(), "v / (2 / d)")).isNull();
    }

    @Test
    void cancelsReciprocalRatios() throws ParseException {
        assertThat(binary(new ReciprocalRatioRule(), "(a / b) * (b / a) * c"))
                .isEqualTo("c");
        assertThat(binary(new ReciprocalRatioRule(), "a * (1 / b) * b"))
                .isEqualTo("a");
        assertThat(binary(new ReciprocalRatioRule(), "a * (1 / b) * c")).isNull();
    }

    @Test
    void foldsNegativeDivisor() throws ParseException {
        assertThat(binary(new NegativeDivisionProductRule(), "(d / -2) * -1"))
                .isEqualTo("d * 0.5");
    }

    @Test
    void simpleScalarProductCancelsReciprocalPair() throws ParseException {
        assertThat(binary(new SimpleScalarProductRule(), "x * (1 / x) * y"))
                .isEqualTo("y");
        assertThat(binary(new SimpleScalarProductRule(), "x * 2 * 0.5"))
                .isEqualTo("x");
        assertThat(binary(new SimpleScalarProductRule(), "x * 3")).isNull();
    }

}
