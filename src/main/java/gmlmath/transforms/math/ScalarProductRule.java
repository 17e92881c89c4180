package gmlmath.transforms.math;

import gmlmath.analysis.*;
import gmlmath.hir.*;

/**
* Condenses the numeric factors of a product or quotient into one trailing
* coefficient: {@code 1.3 * s * 0.12 / 1.5} becomes {@code s * 0.104}. A
* coefficient of one disappears and a coefficient of minus one becomes a
* unary minus. When the coefficient is a unit fraction with a large
* denominator built from several divisors, the literal carries a readable
* hint such as {@code (1/144)}. Products an author marked with an
* "original" comment are left alone.
*/
public class ScalarProductRule extends MathRule<BinaryExpression> {

    /** Significant digits of a coefficient that carries a ratio hint */
    static final int RATIO_PRECISION = 11;

    /** Smallest denominator worth a ratio hint */
    static final long MIN_HINT_DENOMINATOR = 100;

    public ScalarProductRule() {
        super("scalar-product");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        BinaryOperator op = node.getOperator();
        if (op != BinaryOperator.MULTIPLY && op != BinaryOperator.DIVIDE) {
            return false;
        }
        String source = ctx.getCommentSource();
        if (CommentGuard.hasOriginalComment(node, source)) {
            return false;
        }
        MultiplicativeChain chain = new MultiplicativeChain();
        if (!ChainDecomposer.collectMultiplicativeChain(node, chain, false, source)) {
            return false;
        }
        ScalarFactors factors = ScalarFactors.of(chain);
        if (factors == null || factors.symbolic.isEmpty()
                || !factors.has_numeric || !factors.isFinite()) {
            return false;
        }
        double coefficient = factors.coefficient;
        boolean positive_unit = NumericEvaluator.isClose(coefficient, 1);
        if (positive_unit || NumericEvaluator.isClose(coefficient, -1)) {
            Expression operand = ChainDecomposer.rebuildProduct(
                    factors.symbolic, node);
            Expression result = positive_unit ? operand : negate(operand, node);
            replace(node, result);
            unwrapEnclosingParentheses(result);
            return true;
        }
        if (Math.abs(coefficient) <= NumericEvaluator.tolerance(0)
                || factors.meaningful < 2) {
            return false;
        }
        String hint = null;
        if (factors.numeric_denominators >= 2) {
            hint = computeRatioHint(coefficient,
                    factors.has_numeric_numerator ? factors.numerator_product : 1,
                    factors.denominator_product);
        }
        String text = NumericEvaluator.formatCoefficient(coefficient,
                (hint != null) ? RATIO_PRECISION
                        : NumericEvaluator.DEFAULT_PRECISION);
        if (text == null) {
            return false;
        }
        Expression number = createNumber(text, node);
        if (hint != null) {
            Literal literal = (Literal)((number instanceof Literal) ? number
                    : ((UnaryExpression)number).getExpression());
            literal.setRatioHint(hint);
        }
        node.set(ChainDecomposer.rebuildProduct(factors.symbolic, node),
                BinaryOperator.MULTIPLY, number);
        return true;
    }

    /**
    * Returns a hint such as {@code (1/144)} when the coefficient equals
    * {@code numerator / denominator} and that ratio reduces to plus or minus
    * one over an integer of at least 100.
    *
    * @param coefficient the condensed coefficient.
    * @param numerator the product of the numeric numerators.
    * @param denominator the product of the numeric denominators.
    * @return the hint or null.
    */
    static String computeRatioHint(double coefficient, double numerator,
            double denominator) {
        if (Double.isNaN(numerator) || Double.isInfinite(numerator)
                || Double.isNaN(denominator) || Double.isInfinite(denominator)
                || Math.abs(denominator) <= NumericEvaluator.tolerance(1)) {
            return null;
        }
        if (denominator < 0) {
            numerator = -numerator;
            denominator = -denominator;
        }
        if (Math.abs(coefficient - numerator / denominator)
                > NumericEvaluator.tolerance(coefficient)) {
            return null;
        }
        Long num = NumericEvaluator.toApproxInteger(numerator);
        Long den = NumericEvaluator.toApproxInteger(denominator);
        if (num == null || den == null || den == 0) {
            return null;
        }
        long gcd = NumericEvaluator.gcd(num, den);
        if (gcd <= 0) {
            return null;
        }
        long reduced_num = num / gcd;
        long reduced_den = den / gcd;
        if (reduced_den <= 1 || Math.abs(reduced_num) != 1
                || reduced_den < MIN_HINT_DENOMINATOR) {
            return null;
        }
        return "(" + ((reduced_num < 0) ? "-" : "") + "1/" + reduced_den + ")";
    }

}
