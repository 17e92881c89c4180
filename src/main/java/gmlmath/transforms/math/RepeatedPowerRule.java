package gmlmath.transforms.math;

import gmlmath.analysis.ChainDecomposer;
import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.Equivalence;
import gmlmath.analysis.MathPatterns;
import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
* Rewrites a product of three or more copies of a simple operand as a
* power: {@code x * x * x} becomes {@code power(x, 3)}.
*/
public class RepeatedPowerRule extends MathRule<BinaryExpression> {

    public RepeatedPowerRule() {
        super("repeated-power");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.MULTIPLY
                || CommentGuard.hasCommentWithin(node, ctx.getCommentSource())) {
            return false;
        }
        List<Expression> factors = new ArrayList<Expression>();
        if (!ChainDecomposer.collectProductOperands(node, factors)
                || factors.size() <= 2) {
            return false;
        }
        Expression base = factors.get(0);
        if (base.hasComments() || !MathPatterns.isSafeOperand(base)) {
            return false;
        }
        for (int i = 1; i < factors.size(); i++) {
            Expression factor = factors.get(i);
            if (factor.hasComments() || !Equivalence.isEquivalent(base, factor)) {
                return false;
            }
        }
        FunctionCall power = createCall("power", node, base.clone(),
                createLiteral(Integer.toString(factors.size()), node));
        replace(node, power);
        unwrapEnclosingParentheses(power);
        return true;
    }

}
