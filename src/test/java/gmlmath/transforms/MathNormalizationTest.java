package gmlmath.transforms;

import gmlmath.analysis.NumericEvaluator;
import gmlmath.exec.OptionSet;
import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.DFIterator;
import gmlmath.hir.Expression;
import gmlmath.hir.ExpressionStatement;
import gmlmath.hir.IRTools;
import gmlmath.hir.Identifier;
import gmlmath.hir.Literal;
import gmlmath.hir.Program;
import gmlmath.hir.Traversable;
import gmlmath.transforms.math.NormalizationContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MathNormalizationTest {

    private static String normalize(String text) throws ParseException {
        return normalize(text, new OptionSet());
    }

    private static String normalize(String text, OptionSet options)
            throws ParseException {
        Program program = MathNormalization.normalize(
                new Parser().parse(text), options);
        program.verify();
        return program.toString();
    }

    /**
    * Replaces every identifier with its bound value and folds the result.
    */
    private static Double evaluateWith(Expression e, Map<String, String> values) {
        ExpressionStatement holder = new ExpressionStatement(e);
        List<Identifier> ids =
                new DFIterator<Identifier>(holder, Identifier.class).getList();
        for (Identifier id : ids) {
            IRTools.replaceExpression(id, new Literal(values.get(id.getName())));
        }
        return NumericEvaluator.evaluate(holder.getExpression());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "1.3 * size * 0.12 / 1.5",
        "x * 1",
        "y * (x + 0)",
        "x * (1 - 0.25) * 2",
        "s / 12 / 12",
        "2 * a / (6 / 3) * c",
        "foo * 2 * 3",
        "x * 2 * 0.5",
        "a - b * 1 + 0",
        "w * 3 / 6",
        "a * -2 / 4"
    })
    void preservesValue(String text) throws ParseException {
        Expression before = new Parser().parseExpression(text);
        Traversable ret = MathNormalization.normalize(before.clone(),
                new NormalizationContext(text, null));
        Expression after = (Expression)ret;
        Random random = new Random(text.hashCode());
        for (int round = 0; round < 20; round++) {
            Map<String, String> values = new HashMap<String, String>();
            for (Identifier id : new DFIterator<Identifier>(
                    before, Identifier.class).getList()) {
                values.put(id.getName(),
                        Double.toString(1 + random.nextInt(90) / 10.0));
            }
            Double expected = evaluateWith(before.clone(), values);
            Double actual = evaluateWith(after.clone(), values);
            assertThat(expected).isNotNull();
            assertThat(actual).isNotNull();
            assertThat(actual).isCloseTo(expected,
                    within(1e-9 * Math.max(1.0, Math.abs(expected))));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "var a = (a + b) /* c */ / 2;",
        "var l = ln(a) /* c */ / ln(2);",
        "dx = len * /* c */ dcos(ang);",
        "var r = power(x, /* c */ 0.5);",
        "var p = p * q /* c */ + r * s;",
        "var d = arctan2(y2 - y1 /* c */, x2 - x1);"
    })
    void leavesCommentedCallCandidatesAlone(String text) throws ParseException {
        assertThat(normalize(text)).isEqualTo(text + "\n");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "var a = x * 1;                         | var a = x;",
        "var b = 1.3 * size * 0.12 / 1.5;       | var b = size * 0.104;",
        "var r = a * pi / 180;                  | var r = degtorad(a);",
        "var m = (a + b) / 2;                   | var m = mean(a, b);",
        "var c = y * (x + 0);                   | var c = y * x;",
        "dx = len * dcos(dir);                  | dx = lengthdir_x(len, dir);",
        "var e = power(2.718281828459045, t);   | var e = exp(t);",
        "var l = ln(x) / ln(2);                 | var l = log2(x);"
    })
    void normalizesStatement(String input, String expected) throws ParseException {
        assertThat(normalize(input)).isEqualTo(expected + "\n");
    }

    @Test
    void replacesDistanceFormula() throws ParseException {
        assertThat(normalize(
                "var d = sqrt((x2 - x1) * (x2 - x1) + (y2 - y1) * (y2 - y1));"))
                .isEqualTo("var d = point_distance(x1, y1, x2, y2);\n");
    }

    @Test
    void promotesLengthdirReassignment() throws ParseException {
        assertThat(normalize("var s = size * 0.104;\n"
                + "s = s - s * 0.5 - lengthdir_x(s * 0.5, angle);"))
                .isEqualTo("var s = size * 0.052 * (1 - lengthdir_x(1, angle));\n");
    }

    @Test
    void keepsScaledInitializerFirst() throws ParseException {
        assertThat(normalize("var s = 10;\n"
                + "s = s - s / 2 - lengthdir_x(s / 2, angle);"))
                .isEqualTo("var s = 5 * (1 - lengthdir_x(1, angle));\n");
    }

    @Test
    void annotatesUnitFraction() throws ParseException {
        assertThat(normalize("var r = s / 12 / 12;"))
                .isEqualTo("var r = s * 0.0069444444444; /* (1/144) */\n");
    }

    @Test
    void keepsTrailingComment() throws ParseException {
        assertThat(normalize("var a = b * 1; // keep"))
                .isEqualTo("var a = b; // keep\n");
    }

    @Test
    void leavesCommentedOperandAlone() throws ParseException {
        assertThat(normalize("var a = b * /* unit */ 1;"))
                .isEqualTo("var a = b * /* unit */ 1;\n");
    }

    @Test
    void removesCompoundIdentity() throws ParseException {
        assertThat(normalize("x *= 1;\ny = 2;")).isEqualTo("y = 2;\n");
    }

    @Test
    void convertsDivisionWhenEnabled() throws ParseException {
        assertThat(normalize("var q = x / 4;")).isEqualTo("var q = x / 4;\n");
        OptionSet options = new OptionSet();
        options.parse(OptionSet.CONVERT_DIVISION);
        assertThat(normalize("var q = x / 4;", options))
                .isEqualTo("var q = x * 0.25;\n");
    }

    @Test
    void isIdempotent() throws ParseException {
        String text = "var s = size * 0.104;\n"
                + "s = s - s * 0.5 - lengthdir_x(s * 0.5, angle);\n\n"
                + "var a = x * (1 - 0.25) * 2;\n"
                + "var d = sqrt(sqr(x2 - x1) + sqr(y2 - y1));\n"
                + "var m = (a + b) * 0.5;\n";
        String once = normalize(text);
        assertThat(normalize(once)).isEqualTo(once);
    }

    @Test
    void normalizesBareExpression() throws ParseException {
        String text = "x * 1";
        Expression expr = new Parser().parseExpression(text);
        Traversable ret = MathNormalization.normalize(expr,
                new NormalizationContext(text, null));
        assertThat(ret).isInstanceOf(Identifier.class);
        assertThat(ret.getParent()).isNull();
        assertThat(ret.toString()).isEqualTo("x");
    }

}
