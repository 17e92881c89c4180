package gmlmath.transforms.math;

import gmlmath.analysis.MathPatterns;
import gmlmath.hir.*;

/**
* Replaces a hand-written degree conversion such as {@code a * pi / 180} by
* {@code degtorad(a)}.
*/
public class DegreesToRadiansRule extends MathRule<BinaryExpression> {

    public DegreesToRadiansRule() {
        super("degrees-to-radians");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        BinaryOperator op = node.getOperator();
        if (op != BinaryOperator.MULTIPLY && op != BinaryOperator.DIVIDE) {
            return false;
        }
        if (MathPatterns.hasCommentsInDegreesPattern(
                node, ctx.getCommentSource(), true)) {
            return false;
        }
        Expression angle = MathPatterns.matchDegreesToRadians(node);
        if (angle == null) {
            return false;
        }
        replace(node, createCall("degtorad", node, angle.clone()));
        return true;
    }

}
