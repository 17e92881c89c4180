package gmlmath.transforms.math;

import gmlmath.exec.ParseException;
import gmlmath.hir.ExpressionStatement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScalarCondensingTest {

    private static String condense(String text) throws ParseException {
        ExpressionStatement holder = RuleFixture.hold(text);
        new ScalarCondensing(holder).start();
        holder.verify();
        return holder.getExpression().toString();
    }

    @Test
    void foldsTrailingConstants() throws ParseException {
        assertThat(condense("foo * 2 * 3")).isEqualTo("foo * 6");
        assertThat(condense("a * 2 * 3 * 4")).isEqualTo("a * 24");
    }

    @Test
    void foldsLeadingConstants() throws ParseException {
        assertThat(condense("2 * (3 * foo)")).isEqualTo("6 * foo");
    }

    @Test
    void dropsUnitProduct() throws ParseException {
        assertThat(condense("x * 2 * 0.5")).isEqualTo("x");
    }

    @Test
    void countsFoldedProducts() throws ParseException {
        ExpressionStatement holder = RuleFixture.hold("foo * 2 * 3 + bar * 4");
        ScalarCondensing pass = new ScalarCondensing(holder);
        pass.start();
        assertThat(pass.getNumCondensed()).isEqualTo(1);
        assertThat(holder.getExpression().toString()).isEqualTo("foo * 6 + bar * 4");
    }

}
