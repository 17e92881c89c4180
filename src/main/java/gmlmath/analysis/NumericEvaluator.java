package gmlmath.analysis;

import gmlmath.hir.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
* NumericEvaluator reads numeric literals, folds constant sub-expressions and
* provides the magnitude-scaled tolerance used by every identity, zero or
* ratio check of the math normalization. None of the methods throws on
* unexpected input; anything that is not a finite constant yields null.
*/
public final class NumericEvaluator {

    /** The machine epsilon of double precision, 2^-52 */
    public static final double EPSILON = Math.ulp(1.0);

    /** Significant digits kept by canonical coefficient literals */
    public static final int DEFAULT_PRECISION = 12;

    /** Distance from e within which a literal counts as Euler's number */
    public static final double EULER_TOLERANCE = 1e-9;

    /** pi / 180 */
    public static final double DEGREES_TO_RADIANS = 0.017453292519943295;

    private static final Pattern decimal_pattern =
            Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern hex_pattern =
            Pattern.compile("0[xX][0-9a-fA-F]+");

    // No instantiation is used.
    private NumericEvaluator() {
    }

    /**
    * Returns the comparison tolerance around the expected value, scaled by
    * its magnitude: {@code EPSILON * max(1, |expected|) * 4}.
    *
    * @param expected the value being compared against.
    * @return the absolute tolerance.
    */
    public static double tolerance(double expected) {
        return EPSILON * Math.max(1.0, Math.abs(expected)) * 4;
    }

    /**
    * Checks if two values are equal within the larger of their tolerances.
    */
    public static boolean approximatelyEqual(double a, double b) {
        double tol = Math.max(tolerance(a), tolerance(b));
        return Math.abs(a - b) <= tol;
    }

    /**
    * Checks if the value lies within the tolerance of the expected value.
    */
    public static boolean isClose(double value, double expected) {
        return Math.abs(value - expected) <= tolerance(expected);
    }

    /**
    * Returns the value of a numeric literal. Decimal forms ({@code 1},
    * {@code 1.5}, {@code .5}, {@code 5.}, exponent forms) and {@code 0x}
    * hexadecimal are understood; every other node, including parenthesized
    * literals, yields null.
    *
    * @param e the expression to be read; may be null.
    * @return the finite value or null.
    */
    public static Double parseLiteral(Expression e) {
        if (!(e instanceof Literal)) {
            return null;
        }
        return parseNumber(((Literal)e).getValue());
    }

    /**
    * Parses the raw text of a numeric literal.
    *
    * @param text the raw literal text.
    * @return the finite value or null if the text is not a number.
    */
    public static Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String s = text.trim();
        double value;
        if (decimal_pattern.matcher(s).matches()) {
            value = Double.parseDouble(s);
        } else if (hex_pattern.matcher(s).matches()) {
            value = new BigInteger(s.substring(2), 16).doubleValue();
        } else {
            return null;
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return value;
    }

    /**
    * Folds a constant expression made of literals, unary signs and the four
    * arithmetic operators. Parentheses are looked through.
    *
    * @param e the expression to be folded.
    * @return the value, or null on a non-constant leaf or a division by a
    *   value within tolerance of zero.
    */
    public static Double evaluate(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (expr instanceof Literal) {
            return parseLiteral(expr);
        }
        if (expr instanceof UnaryExpression) {
            UnaryExpression ue = (UnaryExpression)expr;
            return applySign(ue.getOperator(), evaluate(ue.getExpression()));
        }
        if (expr instanceof BinaryExpression) {
            BinaryExpression be = (BinaryExpression)expr;
            BinaryOperator op = be.getOperator();
            if (op != BinaryOperator.ADD && op != BinaryOperator.SUBTRACT
                    && op != BinaryOperator.MULTIPLY
                    && op != BinaryOperator.DIVIDE) {
                return null;
            }
            Double lhs = evaluate(be.getLHS());
            Double rhs = evaluate(be.getRHS());
            if (lhs == null || rhs == null) {
                return null;
            }
            return combine(lhs, op, rhs);
        }
        return null;
    }

    /**
    * Folds a purely multiplicative constant: literals, unary signs, and the
    * operators {@code *} and {@code /}. Additive sub-expressions are not
    * folded, so {@code (1 - 0.5)} is not a factor.
    *
    * @param e the expression to be folded.
    * @return the value or null.
    */
    public static Double parseFactor(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (expr instanceof BinaryExpression) {
            BinaryExpression be = (BinaryExpression)expr;
            BinaryOperator op = be.getOperator();
            if (op != BinaryOperator.MULTIPLY && op != BinaryOperator.DIVIDE) {
                return null;
            }
            Double lhs = parseFactor(be.getLHS());
            Double rhs = parseFactor(be.getRHS());
            if (lhs == null || rhs == null) {
                return null;
            }
            return combine(lhs, op, rhs);
        }
        if (expr instanceof UnaryExpression) {
            UnaryExpression ue = (UnaryExpression)expr;
            return applySign(ue.getOperator(), parseFactor(ue.getExpression()));
        }
        return parseLiteral(expr);
    }

    private static Double applySign(UnaryOperator op, Double value) {
        if (value == null) {
            return null;
        }
        if (op == UnaryOperator.MINUS) {
            return -value;
        }
        if (op == UnaryOperator.PLUS) {
            return value;
        }
        return null;
    }

    private static Double combine(double lhs, BinaryOperator op, double rhs) {
        if (op == BinaryOperator.ADD) {
            return lhs + rhs;
        }
        if (op == BinaryOperator.SUBTRACT) {
            return lhs - rhs;
        }
        if (op == BinaryOperator.MULTIPLY) {
            return lhs * rhs;
        }
        if (Math.abs(rhs) <= tolerance(0)) {
            return null;
        }
        return lhs / rhs;
    }

    /**
    * Folds {@code 1 - c} where the left side evaluates to one.
    *
    * @param e a subtraction, possibly parenthesized.
    * @return the difference, or null when the shape does not match.
    */
    public static Double evaluateOneMinus(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!isBinary(expr, BinaryOperator.SUBTRACT)) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)expr;
        Double lhs = evaluate(be.getLHS());
        if (lhs == null || !isClose(lhs, 1)) {
            return null;
        }
        Double rhs = evaluate(be.getRHS());
        if (rhs == null) {
            return null;
        }
        return lhs - rhs;
    }

    /**
    * Produces the canonical literal text for a coefficient with the default
    * precision.
    *
    * @see #formatCoefficient(double, int)
    */
    public static String formatCoefficient(double value) {
        return formatCoefficient(value, DEFAULT_PRECISION);
    }

    /**
    * Produces the canonical literal text for a coefficient: the value is
    * rounded half-up to the given number of significant digits, trailing
    * zeros are dropped and the result uses plain notation. Negative zero
    * prints as {@code 0}.
    *
    * @param value the coefficient.
    * @param precision the number of significant digits.
    * @return the literal text, or null if the value is not finite.
    */
    public static String formatCoefficient(double value, int precision) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        if (value == 0) {
            return "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(
                new MathContext(precision, RoundingMode.HALF_UP));
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    /**
    * Returns the nearest integer if the value lies within tolerance of it.
    *
    * @param value the value to be rounded.
    * @return the integer or null.
    */
    public static Long toApproxInteger(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        double rounded = Math.rint(value);
        if (Math.abs(value - rounded) <= tolerance(Math.max(1, Math.abs(value)))) {
            return (long)rounded;
        }
        return null;
    }

    /** Returns the greatest common divisor of the absolute values. */
    public static long gcd(long a, long b) {
        long left = Math.abs(a);
        long right = Math.abs(b);
        while (right != 0) {
            long temp = right;
            right = left % right;
            left = temp;
        }
        return left;
    }

    /**
    * Checks if the node is a numeric literal within tolerance of the
    * expected value. Parentheses are looked through.
    */
    public static boolean isLiteralNumber(Expression e, double expected) {
        Double value = parseLiteral(ParenthesizedExpression.unwrap(e));
        return (value != null && isClose(value, expected));
    }

    /** Checks if the node is the literal {@code 0.5} or {@code 1/2}. */
    public static boolean isHalfExponent(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (expr == null) {
            return false;
        }
        if (isLiteralNumber(expr, 0.5)) {
            return true;
        }
        if (isBinary(expr, BinaryOperator.DIVIDE)) {
            BinaryExpression be = (BinaryExpression)expr;
            return isLiteralNumber(be.getLHS(), 1)
                    && isLiteralNumber(be.getRHS(), 2);
        }
        return false;
    }

    /** Checks if the node is a literal within 1e-9 of Euler's number. */
    public static boolean isEuler(Expression e) {
        Double value = parseLiteral(ParenthesizedExpression.unwrap(e));
        return (value != null && Math.abs(value - Math.E) <= EULER_TOLERANCE);
    }

    /** Checks if the node folds to -1 as a multiplicative factor. */
    public static boolean isNegativeOneFactor(Expression e) {
        Double value = parseFactor(e);
        return (value != null && isClose(value, -1));
    }

    /** Checks if the node is a numeric literal within tolerance of zero. */
    public static boolean isZeroLiteral(Expression e) {
        Double value = parseLiteral(e);
        return (value != null && Math.abs(value) <= tolerance(0));
    }

    /** Checks if the value is neither within tolerance of 1 nor of -1. */
    public static boolean isMeaningfulFactor(double value) {
        return !isClose(value, 1) && !isClose(value, -1);
    }

    /** Checks if the node is the identifier {@code pi}, in any letter case. */
    public static boolean isPi(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        return (expr instanceof Identifier
                && ((Identifier)expr).getName().equalsIgnoreCase("pi"));
    }

    /**
    * Checks if the expression is a binary expression with the given
    * operator. No parentheses are looked through.
    */
    public static boolean isBinary(Expression e, BinaryOperator op) {
        return (e instanceof BinaryExpression
                && ((BinaryExpression)e).getOperator() == op);
    }

}
