package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/** Rewrites {@code v / (1 / d)} as {@code v * d}. */
public class DivisionByReciprocalRule extends MathRule<BinaryExpression> {

    public DivisionByReciprocalRule() {
        super("division-by-reciprocal");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.DIVIDE || node.hasComments()) {
            return false;
        }
        String source = ctx.getCommentSource();
        Expression lhs = node.getLHS();
        Expression rhs = node.getRHS();
        if (CommentGuard.hasComment(lhs, rhs)
                || CommentGuard.hasCommentBetween(lhs, rhs, source)) {
            return false;
        }
        Expression divisor = ParenthesizedExpression.unwrap(rhs);
        if (!NumericEvaluator.isBinary(divisor, BinaryOperator.DIVIDE)
                || divisor.hasComments()) {
            return false;
        }
        BinaryExpression reciprocal = (BinaryExpression)divisor;
        if (CommentGuard.hasComment(reciprocal.getLHS(), reciprocal.getRHS())
                || CommentGuard.hasCommentBetween(
                        reciprocal.getLHS(), reciprocal.getRHS(), source)
                || !NumericEvaluator.isLiteralNumber(reciprocal.getLHS(), 1)) {
            return false;
        }
        node.set(lhs.clone(), BinaryOperator.MULTIPLY,
                reciprocal.getRHS().clone());
        return true;
    }

}
