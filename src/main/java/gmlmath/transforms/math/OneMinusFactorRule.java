package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/**
* Folds a constant {@code (1 - c)} operand of a product into a literal, as in
* {@code x * (1 - 0.25)} to {@code x * 0.75}. Each operand is tried in turn.
*/
public class OneMinusFactorRule extends MathRule<BinaryExpression> {

    public OneMinusFactorRule() {
        super("one-minus-factor");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.MULTIPLY) {
            return false;
        }
        String source = ctx.getCommentSource();
        if (CommentGuard.hasCommentBetween(node.getLHS(), node.getRHS(), source)) {
            return false;
        }
        return foldOperand(node.getLHS(), source)
                || foldOperand(node.getRHS(), source);
    }

    private boolean foldOperand(Expression raw, String source) {
        Expression expr = ParenthesizedExpression.unwrap(raw);
        if (CommentGuard.hasComment(raw, expr)) {
            return false;
        }
        if (expr instanceof BinaryExpression) {
            BinaryExpression be = (BinaryExpression)expr;
            if (CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(), source)
                    || IRTools.containsComments(be)) {
                return false;
            }
        }
        Double value = NumericEvaluator.evaluateOneMinus(expr);
        if (value == null) {
            return false;
        }
        String text = format(value);
        if (text == null || (expr instanceof Literal
                && ((Literal)expr).getValue().equals(text))) {
            return false;
        }
        replace(raw, createNumber(text, raw));
        return true;
    }

}
