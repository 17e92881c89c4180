package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/**
* Replaces a product with a zero factor by the literal {@code 0}. When the
* product was a declarator initializer, a later alias declaration repeating
* the simplified value is removed.
*/
public class MultiplicationByZeroRule extends MathRule<BinaryExpression> {

    public MultiplicationByZeroRule() {
        super("multiplication-by-zero");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.MULTIPLY) {
            return false;
        }
        Expression lhs = node.getLHS();
        Expression rhs = node.getRHS();
        if (CommentGuard.hasComment(lhs, rhs) || CommentGuard.hasCommentBetween(
                lhs, rhs, ctx.getCommentSource())) {
            return false;
        }
        Expression zero;
        if (NumericEvaluator.isLiteralNumber(lhs, 0)) {
            zero = lhs;
        } else if (NumericEvaluator.isLiteralNumber(rhs, 0)) {
            zero = rhs;
        } else {
            return false;
        }
        Expression result = replace(node, createLiteral("0", zero));
        StatementTools.removeSimplifiedAlias(result);
        return true;
    }

}
