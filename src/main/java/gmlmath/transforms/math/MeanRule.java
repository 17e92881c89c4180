package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/**
* Rewrites the average of two values as {@code mean}: {@code (a + b) / 2}
* and {@code (a + b) * 0.5} become {@code mean(a, b)}.
*/
public class MeanRule extends MathRule<BinaryExpression> {

    public MeanRule() {
        super("mean");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (CommentGuard.hasCommentWithin(node, ctx.getCommentSource())) {
            return false;
        }
        Expression sum = null;
        if (node.getOperator() == BinaryOperator.DIVIDE) {
            if (NumericEvaluator.isLiteralNumber(
                    ParenthesizedExpression.unwrap(node.getRHS()), 2)) {
                sum = node.getLHS();
            }
        } else if (node.getOperator() == BinaryOperator.MULTIPLY) {
            if (NumericEvaluator.isLiteralNumber(node.getRHS(), 0.5)) {
                sum = node.getLHS();
            } else if (NumericEvaluator.isLiteralNumber(node.getLHS(), 0.5)) {
                sum = node.getRHS();
            }
        }
        Expression addition = ParenthesizedExpression.unwrap(sum);
        if (!NumericEvaluator.isBinary(addition, BinaryOperator.ADD)
                || addition.hasComments()) {
            return false;
        }
        BinaryExpression be = (BinaryExpression)addition;
        FunctionCall mean = createCall("mean", node,
                ParenthesizedExpression.unwrap(be.getLHS()).clone(),
                ParenthesizedExpression.unwrap(be.getRHS()).clone());
        replace(node, mean);
        unwrapEnclosingParentheses(mean);
        return true;
    }

}
