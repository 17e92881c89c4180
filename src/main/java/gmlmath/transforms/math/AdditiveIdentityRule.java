package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/**
* Removes a zero addend: {@code x + 0}, {@code 0 + x} and
* {@code x + y * 0} become {@code x}. The kept operand is moved, not copied,
* and marked identity-derived.
*/
public class AdditiveIdentityRule extends MathRule<BinaryExpression> {

    public AdditiveIdentityRule() {
        super("additive-identity");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.ADD) {
            return false;
        }
        String source = ctx.getCommentSource();
        Expression lhs = node.getLHS();
        Expression rhs = node.getRHS();
        if (CommentGuard.hasCommentBetween(lhs, rhs, source)) {
            return false;
        }
        Expression kept = null;
        if (isZero(rhs, source) && !CommentGuard.hasComment(lhs)) {
            kept = lhs;
        } else if (isZero(lhs, source) && !CommentGuard.hasComment(rhs)) {
            kept = rhs;
        }
        if (kept == null) {
            return false;
        }
        replace(node, kept);
        kept.setIdentityDerived(true);
        StatementTools.removeSimplifiedAlias(kept);
        return true;
    }

    private static boolean isZero(Expression e, String source) {
        if (CommentGuard.hasComment(e)) {
            return false;
        }
        return NumericEvaluator.isLiteralNumber(e, 0)
                || isAnnihilatedProduct(e, source);
    }

    // A product with a literal zero factor and no comment anywhere near it.
    private static boolean isAnnihilatedProduct(Expression e, String source) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!NumericEvaluator.isBinary(expr, BinaryOperator.MULTIPLY)
                || expr.hasComments()) {
            return false;
        }
        BinaryExpression be = (BinaryExpression)expr;
        if (CommentGuard.hasComment(be.getLHS(), be.getRHS())
                || CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(), source)) {
            return false;
        }
        return NumericEvaluator.isLiteralNumber(be.getLHS(), 0)
                || NumericEvaluator.isLiteralNumber(be.getRHS(), 0);
    }

}
