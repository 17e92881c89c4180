package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/** Rewrites {@code power(x, 0.5)} and {@code power(x, 1/2)} as {@code sqrt(x)}. */
public class PowerToSqrtRule extends MathRule<FunctionCall> {

    public PowerToSqrtRule() {
        super("power-to-sqrt");
    }

    public boolean apply(FunctionCall node, NormalizationContext ctx) {
        if (CommentGuard.hasCommentWithin(node, ctx.getCommentSource())
                || !"power".equals(node.getCalleeName())
                || node.getNumArguments() != 2
                || !NumericEvaluator.isHalfExponent(node.getArgument(1))) {
            return false;
        }
        replace(node, createCall("sqrt", node, node.getArgument(0).clone()));
        return true;
    }

}
