package gmlmath.transforms.math;

import gmlmath.analysis.*;
import gmlmath.hir.*;

/**
* Rewrites {@code (s - s * 0.5) - lengthdir_x(s * 0.5, a)} into
* {@code s * 0.5 * (1 - lengthdir_x(1, a))}, and the same for
* {@code lengthdir_y}. When the difference is assigned back to {@code s}
* right after {@code var s = e;}, the scaling is folded into the declaration
* and the assignment is removed.
*/
public class LengthdirHalfDifferenceRule extends MathRule<BinaryExpression> {

    public LengthdirHalfDifferenceRule() {
        super("lengthdir-half-difference");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.SUBTRACT || node.hasComments()) {
            return false;
        }
        String source = ctx.getCommentSource();
        Expression raw_lhs = node.getLHS();
        Expression raw_rhs = node.getRHS();
        Expression lhs = ParenthesizedExpression.unwrap(raw_lhs);
        Expression rhs = ParenthesizedExpression.unwrap(raw_rhs);
        if (CommentGuard.hasComment(raw_lhs, raw_rhs, lhs, rhs)
                || CommentGuard.hasCommentBetween(raw_lhs, raw_rhs, source)
                || !NumericEvaluator.isBinary(lhs, BinaryOperator.SUBTRACT)) {
            return false;
        }
        BinaryExpression left = (BinaryExpression)lhs;
        if (CommentGuard.hasCommentBetween(left.getLHS(), left.getRHS(), source)) {
            return false;
        }
        Expression minuend = ParenthesizedExpression.unwrap(left.getLHS());
        if (!MathPatterns.isSafeOperand(minuend)) {
            return false;
        }
        MathPatterns.ScaledOperand scaled =
                MathPatterns.matchScaledOperand(left.getRHS(), source);
        if (scaled == null) {
            return false;
        }
        FunctionCall call = matchLengthdir(rhs, source);
        if (call == null) {
            return false;
        }
        MathPatterns.ScaledOperand length =
                MathPatterns.matchScaledOperand(call.getArgument(0), source);
        if (length == null
                || !Equivalence.isEquivalent(scaled.getBase(), minuend)
                || !Equivalence.isEquivalent(length.getBase(), minuend)
                || !NumericEvaluator.isClose(scaled.getCoefficient(), 0.5)
                || !NumericEvaluator.isClose(length.getCoefficient(), 0.5)) {
            return false;
        }
        String text = format(scaled.getCoefficient());
        if (text == null) {
            return false;
        }
        Expression angle = call.getArgument(1);
        ParenthesizedExpression diff = new ParenthesizedExpression(createBinary(
                createLiteral("1", node), BinaryOperator.SUBTRACT,
                createCall(call.getCalleeName(), call,
                        createLiteral("1", call.getArgument(0)), angle.clone()),
                node));
        diff.copySpanFrom(node);
        Expression result = createBinary(
                createBinary(left.getLHS().clone(), BinaryOperator.MULTIPLY,
                        createNumber(text, left.getRHS()), node),
                BinaryOperator.MULTIPLY, diff, node);
        replace(node, result);
        promote(result, MathPatterns.getIdentifierName(minuend), text, diff,
                angle, ctx);
        return true;
    }

    // lengthdir_x(len, dir) or lengthdir_y(len, dir) free of comments.
    private static FunctionCall matchLengthdir(Expression e, String source) {
        FunctionCall call = MathPatterns.matchCall(e, "lengthdir_x", 2);
        if (call == null) {
            call = MathPatterns.matchCall(e, "lengthdir_y", 2);
        }
        if (call == null || call.hasComments()) {
            return null;
        }
        Expression length = call.getArgument(0);
        Expression angle = call.getArgument(1);
        if (CommentGuard.hasComment(length, angle)
                || CommentGuard.hasCommentBetween(length, angle, source)) {
            return null;
        }
        return call;
    }

    /*
    * s = <result>; directly after var s = e; becomes
    * var s = e * 0.5 * (1 - lengthdir_x(1, a)); a constant e is folded
    * into one number.
    */
    private static void promote(Expression result, String name, String text,
            Expression diff, Expression angle, NormalizationContext ctx) {
        if (name == null || !(result.getParent() instanceof AssignmentExpression)) {
            return;
        }
        AssignmentExpression assign = (AssignmentExpression)result.getParent();
        if (assign.getOperator() != AssignmentOperator.NORMAL
                || assign.getRHS() != result || assign.hasComments()
                || !MathPatterns.isIdentifierNamed(assign.getLHS(), name)
                || !(assign.getParent() instanceof ExpressionStatement)) {
            return;
        }
        ExpressionStatement stmt = (ExpressionStatement)assign.getParent();
        if (stmt.hasComments() || StatementTools.references(angle, name)) {
            return;
        }
        VariableDeclaration decl =
                StatementTools.findPrecedingDeclaration(stmt, name);
        if (decl == null) {
            return;
        }
        VariableDeclarator declarator = decl.getDeclarator(0);
        Expression init = declarator.getInitializer();
        if (init == null || IRTools.containsComments(init)) {
            return;
        }
        String source = ctx.getCommentSource();
        Expression left_product = null;
        MathPatterns.ScaledOperand scaled =
                MathPatterns.matchScaledOperand(init, source);
        Double value = NumericEvaluator.evaluate(init);
        if (value != null) {
            String combined = format(value * Double.parseDouble(text));
            if (combined != null) {
                left_product = createNumber(combined, init);
            }
        } else if (scaled != null) {
            String combined = format(scaled.getCoefficient()
                    * Double.parseDouble(text));
            if (combined != null) {
                left_product = createBinary(scaled.getRawBase().clone(),
                        BinaryOperator.MULTIPLY, createNumber(combined, init),
                        init);
            }
        }
        if (left_product == null) {
            left_product = createBinary(init.clone(), BinaryOperator.MULTIPLY,
                    createNumber(text, init), init);
        }
        declarator.setInitializer(createBinary(left_product,
                BinaryOperator.MULTIPLY, diff.clone(), init));
        applyOnce(new ScalarProductRule(), declarator, ctx);
        applyOnce(new NumericChainRule(), declarator, ctx);
        applyOnce(new DistributedScalarRule(), declarator, ctx);
        StatementTools.removeStatement(stmt);
        PrintTools.printlnStatus(3, "[LengthdirHalfDifference]", "promoted", decl);
    }

    private static void applyOnce(MathRule<BinaryExpression> rule,
            VariableDeclarator declarator, NormalizationContext ctx) {
        Expression init = declarator.getInitializer();
        if (init instanceof BinaryExpression) {
            rule.apply((BinaryExpression)init, ctx);
        }
    }

}
