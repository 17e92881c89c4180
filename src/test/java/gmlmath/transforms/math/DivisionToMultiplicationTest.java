package gmlmath.transforms.math;

import gmlmath.exec.ParseException;
import gmlmath.hir.ExpressionStatement;
import gmlmath.transforms.TransformPass;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DivisionToMultiplicationTest {

    private static String convert(String text) throws ParseException {
        ExpressionStatement holder = RuleFixture.hold(text);
        TransformPass.run(new DivisionToMultiplication(holder,
                new NormalizationContext(text, holder)));
        holder.verify();
        return holder.getExpression().toString();
    }

    @Test
    void multipliesByReciprocal() throws ParseException {
        assertThat(convert("x / 4")).isEqualTo("x * 0.25");
        assertThat(convert("x / (1 / 60)")).isEqualTo("x * 60");
    }

    @Test
    void dropsParenthesesAroundProduct() throws ParseException {
        assertThat(convert("(a * b) / 4")).isEqualTo("a * b * 0.25");
    }

    @Test
    void keepsDegreeConversions() throws ParseException {
        assertThat(convert("a / 180 * pi")).isEqualTo("a / 180 * pi");
        assertThat(convert("a * pi / 180")).isEqualTo("a * pi / 180");
    }

    @Test
    void keepsNonConstantAndZeroDivisors() throws ParseException {
        assertThat(convert("x / 0")).isEqualTo("x / 0");
        assertThat(convert("x / y")).isEqualTo("x / y");
    }

}
