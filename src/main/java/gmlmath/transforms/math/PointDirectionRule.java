package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.MathPatterns;
import gmlmath.analysis.MathPatterns.Difference;
import gmlmath.hir.*;

/**
* Rewrites {@code arctan2(y2 - y1, x2 - x1)} as
* {@code point_direction(x1, y1, x2, y2)}.
*/
public class PointDirectionRule extends MathRule<FunctionCall> {

    public PointDirectionRule() {
        super("point-direction");
    }

    public boolean apply(FunctionCall node, NormalizationContext ctx) {
        if (CommentGuard.hasCommentWithin(node, ctx.getCommentSource())
                || !"arctan2".equals(node.getCalleeName())
                || node.getNumArguments() != 2) {
            return false;
        }
        Difference dy = MathPatterns.matchDifference(node.getArgument(0));
        Difference dx = MathPatterns.matchDifference(node.getArgument(1));
        if (dy == null || dx == null) {
            return false;
        }
        replace(node, createCall("point_direction", node,
                dx.getSubtrahend().clone(), dy.getSubtrahend().clone(),
                dx.getMinuend().clone(), dy.getMinuend().clone()));
        return true;
    }

}
