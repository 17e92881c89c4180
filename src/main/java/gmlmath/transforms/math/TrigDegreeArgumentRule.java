package gmlmath.transforms.math;

import gmlmath.analysis.MathPatterns;
import gmlmath.hir.*;

/**
* Rewrites a hand-written degree conversion inside {@code sin} or
* {@code cos}: {@code sin(a * pi / 180)} becomes {@code sin(degtorad(a))}.
*/
public class TrigDegreeArgumentRule extends MathRule<FunctionCall> {

    public TrigDegreeArgumentRule() {
        super("trig-degree-argument");
    }

    public boolean apply(FunctionCall node, NormalizationContext ctx) {
        String name = node.getCalleeName();
        if (node.hasComments() || node.getNumArguments() != 1
                || !("sin".equals(name) || "cos".equals(name))) {
            return false;
        }
        Expression arg = node.getArgument(0);
        Expression angle = MathPatterns.matchDegreesToRadians(arg);
        if (angle == null || MathPatterns.hasCommentsInDegreesPattern(arg,
                ctx.getCommentSource(), false)) {
            return false;
        }
        Expression conv = createCall("degtorad", arg, angle.clone());
        arg.transferCommentsTo(conv);
        node.setArgument(0, conv);
        return true;
    }

}
