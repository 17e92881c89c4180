package gmlmath.transforms.math;

import gmlmath.analysis.*;
import gmlmath.hir.*;

/**
* Condenses the constants of a quotient over several symbolic factors:
* {@code a * b / 0.5} becomes {@code a * b * 2}. Applies where the scalar
* product rule declines because only one constant contributes.
*/
public class NumericChainRule extends MathRule<BinaryExpression> {

    public NumericChainRule() {
        super("numeric-chain");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        BinaryOperator op = node.getOperator();
        if (op != BinaryOperator.MULTIPLY && op != BinaryOperator.DIVIDE) {
            return false;
        }
        MultiplicativeChain chain = new MultiplicativeChain();
        if (!ChainDecomposer.collectMultiplicativeChain(
                node, chain, false, ctx.getCommentSource())
                || chain.getDenominators().isEmpty()) {
            return false;
        }
        ScalarFactors factors = ScalarFactors.of(chain);
        if (factors == null || factors.symbolic.size() < 2
                || !factors.has_numeric || !factors.isFinite()) {
            return false;
        }
        double coefficient = factors.coefficient;
        if (Math.abs(coefficient) <= NumericEvaluator.tolerance(0)
                || !NumericEvaluator.isMeaningfulFactor(coefficient)) {
            return false;
        }
        if (factors.meaningful < 2
                && Math.abs(coefficient) <= 1 + NumericEvaluator.tolerance(1)) {
            return false;
        }
        String text = format(coefficient);
        if (text == null) {
            return false;
        }
        node.set(ChainDecomposer.rebuildProduct(factors.symbolic, node),
                BinaryOperator.MULTIPLY, createNumber(text, node));
        return true;
    }

}
