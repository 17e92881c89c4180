package gmlmath.analysis;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.Expression;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MathPatternsTest {

    private static Expression expr(String text) throws ParseException {
        return new Parser().parseExpression(text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "a * pi / 180",
        "pi * a / 180",
        "a / 180 * pi",
        "pi * (a / 180)",
        "a * 0.017453292519943295",
        "pi * 0.005555555555555556 * a"
    })
    void matchesDegreeConversions(String text) throws ParseException {
        Expression angle = MathPatterns.matchDegreesToRadians(expr(text));
        assertThat(angle).isNotNull();
        assertThat(angle.toString()).isEqualTo("a");
    }

    @Test
    void rejectsOtherConversions() throws ParseException {
        assertThat(MathPatterns.matchDegreesToRadians(expr("a * pi / 90"))).isNull();
        assertThat(MathPatterns.matchDegreesToRadians(expr("a * b / 180"))).isNull();
        assertThat(MathPatterns.matchDegreesToRadians(expr("a + pi"))).isNull();
    }

    @Test
    void findsCommentsInDegreePattern() throws ParseException {
        assertThat(MathPatterns.hasCommentsInDegreesPattern(
                expr("a * /* deg */ pi / 180"), null, false)).isTrue();
        assertThat(MathPatterns.hasCommentsInDegreesPattern(
                expr("a * pi / 180"), null, false)).isFalse();
    }

    @Test
    void identifiesTrigCalls() throws ParseException {
        MathPatterns.TrigCall call = MathPatterns.identifyTrigCall(expr("dsin(dir)"));
        assertThat(call.getKind()).isEqualTo(MathPatterns.TrigKind.SIN);
        assertThat(call.getArgument().toString()).isEqualTo("dir");
        call = MathPatterns.identifyTrigCall(expr("cos(degtorad(a + 1))"));
        assertThat(call.getKind()).isEqualTo(MathPatterns.TrigKind.COS);
        assertThat(call.getArgument().toString()).isEqualTo("a + 1");
        assertThat(MathPatterns.identifyTrigCall(expr("cos(a)"))).isNull();
    }

    @Test
    void classifiesOperands() throws ParseException {
        assertThat(MathPatterns.isSafeOperand(expr("obj.list[i]"))).isTrue();
        assertThat(MathPatterns.isSafeOperand(expr("(x)"))).isTrue();
        assertThat(MathPatterns.isSafeOperand(expr("f(x)"))).isFalse();
        assertThat(MathPatterns.isSafeOperand(expr("x + 1"))).isFalse();
        assertThat(MathPatterns.isIdentityReplacementSafe(expr("f(x)"))).isTrue();
        assertThat(MathPatterns.isIdentityReplacementSafe(expr("-x"))).isFalse();
    }

    @Test
    void matchesCallsAndNames() throws ParseException {
        assertThat(MathPatterns.matchCall(expr("(lengthdir_x(a, b))"),
                "lengthdir_x", 2)).isNotNull();
        assertThat(MathPatterns.matchCall(expr("lengthdir_x(a)"),
                "lengthdir_x", 2)).isNull();
        assertThat(MathPatterns.isLnCall(expr("ln(2)"))).isTrue();
        assertThat(MathPatterns.getIdentifierName(expr("((s))"))).isEqualTo("s");
        assertThat(MathPatterns.isIdentifierNamed(expr("s.x"), "s")).isFalse();
    }

    @Test
    void splitsSignsAndDifferences() throws ParseException {
        MathPatterns.SignedOperand signed =
                MathPatterns.extractSignedOperand(expr("-(len)"));
        assertThat(signed.isNegative()).isTrue();
        assertThat(signed.getNode().toString()).isEqualTo("(len)");
        MathPatterns.Difference diff = MathPatterns.matchDifference(expr("(x2) - (x1)"));
        assertThat(diff.getMinuend().toString()).isEqualTo("x2");
        assertThat(diff.getSubtrahend().toString()).isEqualTo("x1");
    }

    @Test
    void readsScaledOperands() throws ParseException {
        MathPatterns.ScaledOperand scaled =
                MathPatterns.matchScaledOperand(expr("-(s / 4)"), null);
        assertThat(scaled.getCoefficient()).isCloseTo(-0.25, within(1e-12));
        assertThat(scaled.getBase().toString()).isEqualTo("s");
        scaled = MathPatterns.matchScaledOperand(expr("0.5 * (a + b)"), null);
        assertThat(scaled.getBase().toString()).isEqualTo("a + b");
        assertThat(scaled.getRawBase().toString()).isEqualTo("(a + b)");
        assertThat(MathPatterns.matchScaledOperand(expr("2 * 3"), null)).isNull();
        assertThat(MathPatterns.matchScaledOperand(expr("s / 0"), null)).isNull();
    }

}
