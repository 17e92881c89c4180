package gmlmath.transforms.math;

import gmlmath.analysis.*;
import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
* Rewrites the product of a simple operand with itself as {@code sqr}:
* {@code x * x} becomes {@code sqr(x)} and {@code a * x * x} becomes
* {@code a * sqr(x)}.
*/
public class SquareRule extends MathRule<BinaryExpression> {

    public SquareRule() {
        super("square");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.MULTIPLY || node.hasComments()) {
            return false;
        }
        Expression raw_lhs = node.getLHS();
        Expression raw_rhs = node.getRHS();
        Expression lhs = ParenthesizedExpression.unwrap(raw_lhs);
        Expression rhs = ParenthesizedExpression.unwrap(raw_rhs);
        if (CommentGuard.hasComment(raw_lhs, raw_rhs, lhs, rhs)
                || CommentGuard.hasCommentBetween(raw_lhs, raw_rhs,
                        ctx.getCommentSource())) {
            return false;
        }
        if (MathPatterns.isSafeOperand(lhs) && MathPatterns.isSafeOperand(rhs)
                && (Equivalence.isEquivalent(lhs, rhs)
                        || Equivalence.isApproximatelyEquivalent(lhs, rhs))) {
            FunctionCall sqr = createCall("sqr", node, lhs.clone());
            replace(node, sqr);
            unwrapEnclosingParentheses(sqr);
            return true;
        }
        List<Expression> factors = new ArrayList<Expression>();
        if (!ChainDecomposer.collectProductOperands(node, factors)) {
            return false;
        }
        for (int i = 0; i < factors.size(); i++) {
            Expression a = factors.get(i);
            if (a.hasComments() || !MathPatterns.isSafeOperand(a)) {
                continue;
            }
            for (int j = i + 1; j < factors.size(); j++) {
                Expression b = factors.get(j);
                if (b.hasComments() || !Equivalence.isEquivalent(a, b)) {
                    continue;
                }
                List<Expression> rest = new ArrayList<Expression>();
                for (int k = 0; k < factors.size(); k++) {
                    if (k != i && k != j) {
                        rest.add(factors.get(k));
                    }
                }
                Expression sqr = createCall("sqr", node, a.clone());
                Expression result = rest.isEmpty() ? sqr : createBinary(
                        ChainDecomposer.multiplyAll(rest, node),
                        BinaryOperator.MULTIPLY, sqr, node);
                replace(node, result);
                return true;
            }
        }
        return false;
    }

}
