package gmlmath.transforms.math;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.*;
import org.junit.jupiter.api.Test;

import static gmlmath.transforms.math.RuleFixture.binary;
import static org.assertj.core.api.Assertions.assertThat;

class IdentityRulesTest {

    @Test
    void removesFactorOfOne() throws ParseException {
        assertThat(binary(new MultiplicativeIdentityRule(), "x * 1")).isEqualTo("x");
        assertThat(binary(new MultiplicativeIdentityRule(), "1 * foo(a)"))
                .isEqualTo("foo(a)");
    }

    @Test
    void keepsParenthesesAroundCompoundOperand() throws ParseException {
        assertThat(binary(new MultiplicativeIdentityRule(), "(a + b) * 1"))
                .isEqualTo("(a + b)");
    }

    @Test
    void identityResultIsMarked() throws ParseException {
        ExpressionStatement holder = RuleFixture.hold("x * 1");
        new MultiplicativeIdentityRule().apply(
                (BinaryExpression)holder.getExpression(),
                new NormalizationContext("x * 1", holder));
        assertThat(holder.getExpression().isIdentityDerived()).isTrue();
    }

    @Test
    void commentedOneIsKept() throws ParseException {
        assertThat(binary(new MultiplicativeIdentityRule(), "x * /* unit */ 1"))
                .isNull();
    }

    @Test
    void annihilatesProductWithZero() throws ParseException {
        assertThat(binary(new MultiplicationByZeroRule(), "foo(x) * 0"))
                .isEqualTo("0");
        assertThat(binary(new MultiplicationByZeroRule(), "x * 0.5")).isNull();
    }

    @Test
    void removesZeroAddend() throws ParseException {
        assertThat(binary(new AdditiveIdentityRule(), "x + 0")).isEqualTo("x");
        assertThat(binary(new AdditiveIdentityRule(), "0 + x")).isEqualTo("x");
        assertThat(binary(new AdditiveIdentityRule(), "y * 0 + x")).isEqualTo("x");
        assertThat(binary(new AdditiveIdentityRule(), "x + /* pad */ 0")).isNull();
    }

    @Test
    void removesInPlaceScalingByOne() throws ParseException {
        String text = "x *= 1;\ny = 2;";
        Program program = new Parser().parse(text);
        Statement first = program.getBody().getStatements().get(0);
        AssignmentExpression assign = (AssignmentExpression)
                ((ExpressionStatement)first).getExpression();
        NormalizationContext ctx = new NormalizationContext(text, program);
        assertThat(new CompoundIdentityAssignmentRule().apply(assign, ctx)).isTrue();
        assertThat(program.toString()).isEqualTo("y = 2;\n");
    }

    @Test
    void keepsCommentedScalingByOne() throws ParseException {
        String text = "// scale stays\nx /= 1;";
        Program program = new Parser().parse(text);
        Statement first = program.getBody().getStatements().get(0);
        AssignmentExpression assign = (AssignmentExpression)
                ((ExpressionStatement)first).getExpression();
        NormalizationContext ctx = new NormalizationContext(text, program);
        assertThat(new CompoundIdentityAssignmentRule().apply(assign, ctx))
                .isFalse();
    }

}
