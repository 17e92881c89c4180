package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/**
* Folds a sign flip into a constant divisor: {@code (d / -2) * -1} becomes
* {@code d * 0.5}.
*/
public class NegativeDivisionProductRule extends MathRule<BinaryExpression> {

    public NegativeDivisionProductRule() {
        super("negative-division-product");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.MULTIPLY || node.hasComments()) {
            return false;
        }
        String source = ctx.getCommentSource();
        if (CommentGuard.hasCommentBetween(node.getLHS(), node.getRHS(), source)) {
            return false;
        }
        return fold(node, node.getLHS(), node.getRHS(), source)
                || fold(node, node.getRHS(), node.getLHS(), source);
    }

    private boolean fold(BinaryExpression node, Expression fraction,
            Expression sign, String source) {
        if (!NumericEvaluator.isNegativeOneFactor(sign)
                || CommentGuard.hasComment(sign)) {
            return false;
        }
        Expression expr = ParenthesizedExpression.unwrap(fraction);
        if (!NumericEvaluator.isBinary(expr, BinaryOperator.DIVIDE)
                || expr.hasComments()) {
            return false;
        }
        BinaryExpression quotient = (BinaryExpression)expr;
        if (CommentGuard.hasComment(quotient.getLHS(), quotient.getRHS())
                || CommentGuard.hasCommentBetween(
                        quotient.getLHS(), quotient.getRHS(), source)) {
            return false;
        }
        Expression denominator = ParenthesizedExpression.unwrap(quotient.getRHS());
        Double value = NumericEvaluator.parseFactor(denominator);
        if (value == null || Math.abs(value) <= NumericEvaluator.tolerance(0)) {
            return false;
        }
        String text = format(-1 / value);
        if (text == null) {
            return false;
        }
        Expression numerator = ParenthesizedExpression.unwrap(quotient.getLHS());
        node.set(numerator.clone(), BinaryOperator.MULTIPLY,
                createNumber(text, denominator));
        return true;
    }

}
