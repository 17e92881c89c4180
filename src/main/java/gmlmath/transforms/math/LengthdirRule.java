package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.MathPatterns;
import gmlmath.analysis.MathPatterns.SignedOperand;
import gmlmath.analysis.MathPatterns.TrigCall;
import gmlmath.analysis.MathPatterns.TrigKind;
import gmlmath.hir.*;

/**
* Rewrites a length times the cosine or sine of an angle in degrees as a
* GameMaker vector component: {@code len * dcos(a)} becomes
* {@code lengthdir_x(len, a)} and {@code -len * dsin(a)} becomes
* {@code lengthdir_y(len, a)}. The sine form needs the minus sign because
* the y axis of the room points down.
*/
public class LengthdirRule extends MathRule<BinaryExpression> {

    public LengthdirRule() {
        super("lengthdir");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.MULTIPLY
                || CommentGuard.hasCommentWithin(node, ctx.getCommentSource())) {
            return false;
        }
        SignedOperand lhs = MathPatterns.extractSignedOperand(node.getLHS());
        SignedOperand rhs = MathPatterns.extractSignedOperand(node.getRHS());
        return tryRewrite(node, lhs, rhs) || tryRewrite(node, rhs, lhs);
    }

    private boolean tryRewrite(BinaryExpression node, SignedOperand length,
            SignedOperand trig) {
        TrigCall call = MathPatterns.identifyTrigCall(trig.getNode());
        if (call == null || length.getNode() == null
                || !MathPatterns.isSafeOperand(length.getNode())) {
            return false;
        }
        boolean negative = (length.isNegative() != trig.isNegative());
        String name;
        if (call.getKind() == TrigKind.COS && !negative) {
            name = "lengthdir_x";
        } else if (call.getKind() == TrigKind.SIN && negative) {
            name = "lengthdir_y";
        } else {
            return false;
        }
        replace(node, createCall(name, node, length.getNode().clone(),
                call.getArgument().clone()));
        return true;
    }

}
