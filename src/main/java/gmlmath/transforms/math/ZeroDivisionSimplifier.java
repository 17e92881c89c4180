package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;
import gmlmath.transforms.TransformPass;

import java.util.List;

/**
* Replaces a quotient whose dividend is zero by {@code 0}, unless the divisor
* is known to be zero as well. When the quotient initialized a variable, a
* later {@code var <name>_simplified} copy of the same value is dropped.
*/
public class ZeroDivisionSimplifier extends TransformPass {

    private static String pass_name = "[ZeroDivisionSimplifier]";

    private final NormalizationContext ctx;

    public ZeroDivisionSimplifier(Traversable root, NormalizationContext ctx) {
        super(root);
        this.ctx = ctx;
    }

    public String getPassName() {
        return pass_name;
    }

    public void start() {
        List<BinaryExpression> nodes =
                new DFIterator<BinaryExpression>(root, BinaryExpression.class)
                        .getList();
        for (BinaryExpression be : nodes) {
            if ((be == root || IRTools.isDescendantOf(be, root))
                    && !StatementTools.isInOriginalForm(be)) {
                simplify(be);
            }
        }
    }

    private void simplify(BinaryExpression be) {
        if (be.getOperator() != BinaryOperator.DIVIDE || be.hasComments()) {
            return;
        }
        Expression lhs = be.getLHS();
        Expression rhs = be.getRHS();
        if (CommentGuard.hasComment(lhs, rhs)
                || CommentGuard.hasCommentBetween(lhs, rhs,
                        ctx.getCommentSource())) {
            return;
        }
        Double dividend = NumericEvaluator.evaluate(lhs);
        if (dividend == null
                || Math.abs(dividend) > NumericEvaluator.tolerance(0)) {
            return;
        }
        Double divisor = NumericEvaluator.evaluate(rhs);
        if (divisor != null
                && Math.abs(divisor) <= NumericEvaluator.tolerance(0)) {
            return;
        }
        Expression zero = MathRule.replace(be, MathRule.createLiteral("0", be));
        PrintTools.printlnStatus(3, pass_name, "simplified", be, "->", zero);
        StatementTools.removeSimplifiedAlias(zero);
    }

}
