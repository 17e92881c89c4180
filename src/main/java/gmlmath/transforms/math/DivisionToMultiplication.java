package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.MathPatterns;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;
import gmlmath.transforms.TransformPass;

import java.util.List;

/**
* Turns division by a numeric constant into multiplication by its
* reciprocal: {@code x / 4} becomes {@code x * 0.25} and {@code x / (1 / 3)}
* becomes {@code x * 3}. Divisions that form a degree conversion are kept so
* the degree rules still recognize them.
*/
public class DivisionToMultiplication extends TransformPass {

    private static String pass_name = "[DivisionToMultiplication]";

    private final NormalizationContext ctx;

    private int num_converted;

    public DivisionToMultiplication(Traversable root, NormalizationContext ctx) {
        super(root);
        this.ctx = ctx;
    }

    public String getPassName() {
        return pass_name;
    }

    public void start() {
        num_converted = 0;
        List<BinaryExpression> nodes =
                new DFIterator<BinaryExpression>(root, BinaryExpression.class)
                        .getList();
        for (BinaryExpression be : nodes) {
            if ((be == root || IRTools.isDescendantOf(be, root))
                    && !StatementTools.isInOriginalForm(be)) {
                convert(be);
            }
        }
        PrintTools.printlnStatus(2, pass_name, "converted:", num_converted);
    }

    private void convert(BinaryExpression be) {
        if (be.getOperator() != BinaryOperator.DIVIDE) {
            return;
        }
        Expression lhs = be.getLHS();
        Expression rhs = be.getRHS();
        if (CommentGuard.hasComment(lhs, rhs)
                || CommentGuard.hasCommentBetween(lhs, rhs, ctx.getCommentSource())
                || isDegreeConversion(be)) {
            return;
        }
        String text = reciprocalText(ParenthesizedExpression.unwrap(rhs));
        if (text == null) {
            return;
        }
        be.setOperator(BinaryOperator.MULTIPLY);
        be.setRHS(MathRule.createNumber(text, rhs));
        if (lhs instanceof ParenthesizedExpression && !lhs.hasComments()) {
            Expression inner = ((ParenthesizedExpression)lhs).getExpression();
            if (NumericEvaluator.isBinary(inner, BinaryOperator.MULTIPLY)
                    && !inner.hasComments()) {
                MathRule.replace(lhs, inner);
            }
        }
        num_converted++;
    }

    private static boolean isDegreeConversion(BinaryExpression be) {
        if (MathPatterns.matchDegreesToRadians(be) != null) {
            return true;
        }
        Traversable parent = be.getParent();
        while (parent instanceof ParenthesizedExpression) {
            parent = parent.getParent();
        }
        return (parent instanceof Expression && MathPatterns
                .matchDegreesToRadians((Expression)parent) != null);
    }

    // 1 / c for a literal c, or d for a literal quotient 1 / d.
    private static String reciprocalText(Expression divisor) {
        Double value = NumericEvaluator.parseLiteral(divisor);
        if (value != null) {
            if (Math.abs(value) <= NumericEvaluator.tolerance(0)) {
                return null;
            }
            return MathRule.format(1 / value);
        }
        if (!NumericEvaluator.isBinary(divisor, BinaryOperator.DIVIDE)
                || divisor.hasComments()) {
            return null;
        }
        BinaryExpression quotient = (BinaryExpression)divisor;
        Double numerator = NumericEvaluator.parseLiteral(
                ParenthesizedExpression.unwrap(quotient.getLHS()));
        Double denominator = NumericEvaluator.parseLiteral(
                ParenthesizedExpression.unwrap(quotient.getRHS()));
        if (numerator == null || denominator == null
                || !NumericEvaluator.isClose(numerator, 1)) {
            return null;
        }
        return MathRule.format(denominator);
    }

}
