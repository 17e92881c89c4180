package gmlmath.transforms.math;

import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;
import gmlmath.transforms.TransformPass;

import java.util.List;

/**
* Folds two adjacent numeric factors of a product into one, working from the
* leaves up: {@code (x * 2) * 3} becomes {@code x * 6} and
* {@code 2 * (3 * x)} becomes {@code 6 * x}.
*/
public class ScalarCondensing extends TransformPass {

    private static String pass_name = "[ScalarCondensing]";

    private int num_condensed;

    public ScalarCondensing(Traversable root) {
        super(root);
    }

    public String getPassName() {
        return pass_name;
    }

    public void start() {
        num_condensed = 0;
        List<BinaryExpression> nodes =
                new DFIterator<BinaryExpression>(root, BinaryExpression.class)
                        .getList();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            BinaryExpression be = nodes.get(i);
            if ((be == root || IRTools.isDescendantOf(be, root))
                    && !StatementTools.isInOriginalForm(be)) {
                condense(be);
            }
        }
        PrintTools.printlnStatus(2, pass_name, "condensed:", num_condensed);
    }

    /** Returns the number of products folded by the last run. */
    public int getNumCondensed() {
        return num_condensed;
    }

    private void condense(BinaryExpression be) {
        if (be.getOperator() != BinaryOperator.MULTIPLY || be.hasComments()) {
            return;
        }
        Expression lhs = be.getLHS();
        Expression rhs = be.getRHS();
        Double outer = constantOf(rhs);
        if (outer != null) {
            BinaryExpression inner = productOf(lhs);
            Double value = (inner == null) ? null : constantOf(inner.getRHS());
            if (value != null && constantOf(inner.getLHS()) == null) {
                fold(be, inner.getLHS(), value * outer, true);
            }
            return;
        }
        outer = constantOf(lhs);
        if (outer != null) {
            BinaryExpression inner = productOf(rhs);
            Double value = (inner == null) ? null : constantOf(inner.getLHS());
            if (value != null && constantOf(inner.getRHS()) == null) {
                fold(be, inner.getRHS(), outer * value, false);
            }
        }
    }

    private void fold(BinaryExpression be, Expression operand, double value,
            boolean constant_last) {
        String text = MathRule.format(value);
        if (text == null) {
            return;
        }
        Expression kept = operand.clone();
        if (NumericEvaluator.isClose(value, 1)) {
            MathRule.replace(be, kept);
        } else {
            Expression number = MathRule.createNumber(text, be);
            if (constant_last) {
                be.set(kept, BinaryOperator.MULTIPLY, number);
            } else {
                be.set(number, BinaryOperator.MULTIPLY, kept);
            }
        }
        num_condensed++;
    }

    // An uncommented product, looking through uncommented parentheses.
    private static BinaryExpression productOf(Expression e) {
        while (e instanceof ParenthesizedExpression && !e.hasComments()) {
            e = ((ParenthesizedExpression)e).getExpression();
        }
        if (!NumericEvaluator.isBinary(e, BinaryOperator.MULTIPLY)
                || e.hasComments()) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)e;
        if (be.getLHS().hasComments() || be.getRHS().hasComments()) {
            return null;
        }
        return be;
    }

    private static Double constantOf(Expression e) {
        if (e == null || e.hasComments()) {
            return null;
        }
        return NumericEvaluator.parseFactor(e);
    }

}
