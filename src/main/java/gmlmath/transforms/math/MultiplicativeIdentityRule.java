package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.MathPatterns;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/**
* Removes a factor of one: {@code x * 1} and {@code 1 * x} become {@code x}.
* The remaining operand is marked identity-derived, and parentheses around it
* are dropped while they only wrap a simple operand or a call.
*/
public class MultiplicativeIdentityRule extends MathRule<BinaryExpression> {

    public MultiplicativeIdentityRule() {
        super("multiplicative-identity");
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
        Expression other;
        if (isOne(rhs)) {
            other = lhs;
        } else if (isOne(lhs)) {
            other = rhs;
        } else {
            return false;
        }
        Expression kept = MathPatterns.isSafeOperand(other)
                ? ParenthesizedExpression.unwrap(other) : other;
        Expression result = kept.clone();
        result.setIdentityDerived(true);
        replace(node, result);
        result = unwrapIdentityResult(result);
        unwrapEnclosingParentheses(result);
        return true;
    }

    // A literal one, looking through parentheses.
    private static boolean isOne(Expression e) {
        Double value = NumericEvaluator.parseLiteral(
                ParenthesizedExpression.unwrap(e));
        return (value != null && NumericEvaluator.isClose(value, 1));
    }

    private static Expression unwrapIdentityResult(Expression result) {
        while (result instanceof ParenthesizedExpression
                && MathPatterns.isIdentityReplacementSafe(
                        ((ParenthesizedExpression)result).getExpression())) {
            Expression inner = ((ParenthesizedExpression)result).getExpression();
            replace(result, inner);
            inner.setIdentityDerived(true);
            result = inner;
        }
        return result;
    }

}
