package gmlmath.transforms.math;

import gmlmath.exec.ParseException;
import org.junit.jupiter.api.Test;

import static gmlmath.transforms.math.RuleFixture.binary;
import static gmlmath.transforms.math.RuleFixture.call;
import static org.assertj.core.api.Assertions.assertThat;

class FunctionRulesTest {

    @Test
    void recognizesDegreeConversion() throws ParseException {
        assertThat(binary(new DegreesToRadiansRule(), "a * pi / 180"))
                .isEqualTo("degtorad(a)");
        assertThat(binary(new DegreesToRadiansRule(), "a / 180 * pi"))
                .isEqualTo("degtorad(a)");
        assertThat(binary(new DegreesToRadiansRule(), "a * pi / 90")).isNull();
    }

    @Test
    void wrapsTrigArgumentInDegtorad() throws ParseException {
        assertThat(call(new TrigDegreeArgumentRule(), "sin(a * pi / 180)"))
                .isEqualTo("sin(degtorad(a))");
        assertThat(call(new TrigDegreeArgumentRule(), "tan(a * pi / 180)"))
                .isNull();
    }

    @Test
    void rewritesRootOfSquaredDifferences() throws ParseException {
        assertThat(call(new PointDistanceRule(),
                "sqrt((x2 - x1) * (x2 - x1) + (y2 - y1) * (y2 - y1))"))
                .isEqualTo("point_distance(x1, y1, x2, y2)");
        assertThat(call(new PointDistanceRule(),
                "power((x2 - x1) * (x2 - x1) + (y2 - y1) * (y2 - y1), 0.5)"))
                .isEqualTo("point_distance(x1, y1, x2, y2)");
    }

    @Test
    void rewritesThreeDimensionalDistance() throws ParseException {
        assertThat(call(new PointDistanceRule(), "sqrt((x2 - x1) * (x2 - x1)"
                + " + (y2 - y1) * (y2 - y1) + (z2 - z1) * (z2 - z1))"))
                .isEqualTo("point_distance_3d(x1, y1, z1, x2, y2, z2)");
    }

    @Test
    void distanceNeedsDifferences() throws ParseException {
        assertThat(call(new PointDistanceRule(), "sqrt(dx * dx + dy * dy)"))
                .isNull();
    }

    @Test
    void rewritesHalfPowerAsSqrt() throws ParseException {
        assertThat(call(new PowerToSqrtRule(), "power(x, 0.5)")).isEqualTo("sqrt(x)");
        assertThat(call(new PowerToSqrtRule(), "power(x, 1 / 2)"))
                .isEqualTo("sqrt(x)");
        assertThat(call(new PowerToSqrtRule(), "power(x, 2)")).isNull();
    }

    @Test
    void rewritesPowerOfEulerAsExp() throws ParseException {
        assertThat(call(new PowerToExpRule(), "power(2.718281828459045, t)"))
                .isEqualTo("exp(t)");
        assertThat(call(new PowerToExpRule(), "power(2.7, t)")).isNull();
    }

    @Test
    void rewritesArctan2OfDifferences() throws ParseException {
        assertThat(call(new PointDirectionRule(), "arctan2(y2 - y1, x2 - x1)"))
                .isEqualTo("point_direction(x1, y1, x2, y2)");
        assertThat(call(new PointDirectionRule(), "arctan2(dy, dx)")).isNull();
    }

    @Test
    void rewritesLogBaseTwo() throws ParseException {
        assertThat(binary(new Log2Rule(), "ln(x) / ln(2)")).isEqualTo("log2(x)");
        assertThat(binary(new Log2Rule(), "ln(x) / ln(3)")).isNull();
    }

    @Test
    void rewritesAverageAsMean() throws ParseException {
        assertThat(binary(new MeanRule(), "(a + b) / 2")).isEqualTo("mean(a, b)");
        assertThat(binary(new MeanRule(), "0.5 * (a + b)")).isEqualTo("mean(a, b)");
        assertThat(binary(new MeanRule(), "(a - b) / 2")).isNull();
    }

    @Test
    void rewritesSelfProductAsSquare() throws ParseException {
        assertThat(binary(new SquareRule(), "x * x")).isEqualTo("sqr(x)");
        assertThat(binary(new SquareRule(), "a * x * x")).isEqualTo("a * sqr(x)");
        assertThat(binary(new SquareRule(), "f(x) * f(x)")).isNull();
    }

    @Test
    void rewritesRepeatedProductAsPower() throws ParseException {
        assertThat(binary(new RepeatedPowerRule(), "x * x * x"))
                .isEqualTo("power(x, 3)");
        assertThat(binary(new RepeatedPowerRule(), "x * x")).isNull();
    }

    @Test
    void rewritesPairwiseProductsAsDotProduct() throws ParseException {
        assertThat(binary(new DotProductRule(), "ax * bx + ay * by"))
                .isEqualTo("dot_product(ax, ay, bx, by)");
        assertThat(binary(new DotProductRule(), "ax * bx + ay * by + az * bz"))
                .isEqualTo("dot_product_3d(ax, ay, az, bx, by, bz)");
        assertThat(binary(new DotProductRule(), "x * x + y * y")).isNull();
    }

    @Test
    void rewritesScaledTrigAsLengthdir() throws ParseException {
        assertThat(binary(new LengthdirRule(), "len * dcos(dir)"))
                .isEqualTo("lengthdir_x(len, dir)");
        assertThat(binary(new LengthdirRule(), "-len * dsin(dir)"))
                .isEqualTo("lengthdir_y(len, dir)");
        assertThat(binary(new LengthdirRule(), "len * cos(degtorad(a))"))
                .isEqualTo("lengthdir_x(len, a)");
        assertThat(binary(new LengthdirRule(), "len * dsin(dir)")).isNull();
    }

    @Test
    void keepsCommentsInsideCallCandidates() throws ParseException {
        assertThat(binary(new MeanRule(), "(a + b) /* c */ / 2")).isNull();
        assertThat(binary(new MeanRule(), "(a /* c */ + b) * 0.5")).isNull();
        assertThat(binary(new Log2Rule(), "ln(a) /* c */ / ln(2)")).isNull();
        assertThat(binary(new Log2Rule(), "ln(a) / ln(/* two */ 2)")).isNull();
        assertThat(binary(new LengthdirRule(), "len * /* c */ dcos(ang)"))
                .isNull();
        assertThat(call(new PointDistanceRule(), "sqrt((x2 - x1) * (x2 - x1)"
                + " /* c */ + (y2 - y1) * (y2 - y1))")).isNull();
        assertThat(call(new PowerToSqrtRule(), "power(x, /* c */ 0.5)")).isNull();
        assertThat(call(new PowerToExpRule(),
                "power(/* e */ 2.718281828459045, t)")).isNull();
        assertThat(binary(new DotProductRule(), "p * q /* c */ + r * s"))
                .isNull();
        assertThat(call(new PointDirectionRule(),
                "arctan2(y2 - y1 /* c */, x2 - x1)")).isNull();
        assertThat(binary(new RepeatedPowerRule(), "(x * x) /* c */ * x"))
                .isNull();
    }

}
