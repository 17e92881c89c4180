package gmlmath.transforms.math;

import gmlmath.analysis.*;
import gmlmath.exec.OptionSet;
import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
* Condenses a product whose constants cancel, such as {@code x * 2 * 0.5} or
* {@code x * (1 / x) * y}. A factor {@code 1 / x} cancels against a matching
* factor {@code x}. When the product collapses to its symbolic factors and
* the "record-original" option is on, the form before the rewrite is kept
* in a declaration placed in front of the simplified one.
*/
public class SimpleScalarProductRule extends MathRule<BinaryExpression> {

    public SimpleScalarProductRule() {
        super("simple-scalar-product");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.MULTIPLY) {
            return false;
        }
        MultiplicativeChain chain = new MultiplicativeChain();
        if (!ChainDecomposer.collectMultiplicativeChain(node, chain, false, null)) {
            return false;
        }
        List<Term> numerators = new ArrayList<Term>(chain.getNumerators());
        for (Term term : numerators) {
            if (CommentGuard.hasComment(term.getRaw(), term.getExpression())) {
                return false;
            }
        }
        boolean cancelled = cancelReciprocalPairs(numerators);
        double coefficient = 1;
        List<Term> symbolic = new ArrayList<Term>();
        for (Term term : numerators) {
            Double value = NumericEvaluator.parseFactor(term.getExpression());
            if (value == null) {
                symbolic.add(term);
            } else {
                coefficient *= value;
            }
        }
        List<Term> denominators = chain.getDenominators();
        if (denominators.isEmpty() && !cancelled
                && !NumericEvaluator.isClose(coefficient, 1)) {
            return false;
        }
        for (Term term : denominators) {
            Double value = NumericEvaluator.parseFactor(term.getExpression());
            if (value == null || Math.abs(value) <= NumericEvaluator.tolerance(0)) {
                return false;
            }
            coefficient /= value;
        }
        if (symbolic.isEmpty()) {
            return false;
        }
        String text = format(coefficient);
        if (text == null) {
            return false;
        }
        Expression product = ChainDecomposer.rebuildProduct(symbolic, node);
        if (NumericEvaluator.isClose(coefficient, 1)) {
            Expression original = node.clone();
            replace(node, product);
            product.setIdentityDerived(true);
            if (ctx.isEnabled(OptionSet.RECORD_ORIGINAL)) {
                StatementTools.recordOriginal(product, original);
            }
        } else {
            node.set(product, BinaryOperator.MULTIPLY, createNumber(text, node));
            node.setIdentityDerived(true);
        }
        return true;
    }

    // Drops each 1 / x together with a matching factor x.
    private static boolean cancelReciprocalPairs(List<Term> terms) {
        boolean ret = false;
        for (int i = 0; i < terms.size(); i++) {
            Expression divisor = reciprocalOf(terms.get(i).getExpression());
            if (divisor == null) {
                continue;
            }
            for (int j = 0; j < terms.size(); j++) {
                Expression other = terms.get(j).getExpression();
                if (j != i && !other.hasComments()
                        && Equivalence.isApproximatelyEquivalent(divisor, other)) {
                    terms.remove(Math.max(i, j));
                    terms.remove(Math.min(i, j));
                    i = -1;
                    ret = true;
                    break;
                }
            }
        }
        return ret;
    }

    private static Expression reciprocalOf(Expression e) {
        if (!NumericEvaluator.isBinary(e, BinaryOperator.DIVIDE)) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)e;
        Double numerator = NumericEvaluator.parseFactor(be.getLHS());
        if (numerator == null || !NumericEvaluator.isClose(numerator, 1)) {
            return null;
        }
        return ParenthesizedExpression.unwrap(be.getRHS());
    }

}
