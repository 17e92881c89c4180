package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/** Rewrites {@code power(2.718281828459045, x)} as {@code exp(x)}. */
public class PowerToExpRule extends MathRule<FunctionCall> {

    public PowerToExpRule() {
        super("power-to-exp");
    }

    public boolean apply(FunctionCall node, NormalizationContext ctx) {
        if (CommentGuard.hasCommentWithin(node, ctx.getCommentSource())
                || !"power".equals(node.getCalleeName())
                || node.getNumArguments() != 2
                || !NumericEvaluator.isEuler(node.getArgument(0))) {
            return false;
        }
        replace(node, createCall("exp", node, node.getArgument(1).clone()));
        return true;
    }

}
