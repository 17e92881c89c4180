package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/**
* Removes a statement that scales a variable by one in place:
* {@code x *= 1;} and {@code x /= 1;} have no effect.
*/
public class CompoundIdentityAssignmentRule
        extends MathRule<AssignmentExpression> {

    public CompoundIdentityAssignmentRule() {
        super("compound-identity-assignment");
    }

    public boolean apply(AssignmentExpression node, NormalizationContext ctx) {
        AssignmentOperator op = node.getOperator();
        if ((op != AssignmentOperator.MULTIPLY && op != AssignmentOperator.DIVIDE)
                || node.hasComments()) {
            return false;
        }
        Expression lhs = node.getLHS();
        Expression rhs = node.getRHS();
        if (CommentGuard.hasComment(lhs, rhs)
                || CommentGuard.hasCommentBetween(lhs, rhs, ctx.getCommentSource())
                || !NumericEvaluator.isLiteralNumber(rhs, 1)) {
            return false;
        }
        if (!(node.getParent() instanceof ExpressionStatement)) {
            return false;
        }
        ExpressionStatement stmt = (ExpressionStatement)node.getParent();
        if (stmt.hasComments()
                || !(stmt.getParent() instanceof CompoundStatement)) {
            return false;
        }
        return StatementTools.removeStatement(stmt);
    }

}
