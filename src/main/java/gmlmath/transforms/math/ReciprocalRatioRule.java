package gmlmath.transforms.math;

import gmlmath.analysis.*;
import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
* Cancels ratios against matching factors of the same product:
* {@code (a / b) * (b / a)} becomes {@code 1} and {@code a * (1 / b) * b}
* becomes {@code a}. A ratio cancelled against its denominator leaves its
* numerator behind unless that numerator is one.
*/
public class ReciprocalRatioRule extends MathRule<BinaryExpression> {

    private static class RatioTerm {
        int index;
        Expression numerator;
        Expression denominator;

        RatioTerm(int index, Expression numerator, Expression denominator) {
            this.index = index;
            this.numerator = numerator;
            this.denominator = denominator;
        }
    }

    public ReciprocalRatioRule() {
        super("reciprocal-ratio");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        BinaryOperator op = node.getOperator();
        if (op != BinaryOperator.MULTIPLY && op != BinaryOperator.DIVIDE) {
            return false;
        }
        String source = ctx.getCommentSource();
        MultiplicativeChain chain = new MultiplicativeChain();
        if (!ChainDecomposer.collectMultiplicativeChain(node, chain, false, source)) {
            return false;
        }
        List<Term> numerators = chain.getNumerators();
        if (numerators.size() < 2) {
            return false;
        }
        List<RatioTerm> ratios = collectRatios(numerators, source);
        if (ratios == null || ratios.isEmpty()) {
            return false;
        }
        Set<Integer> removed = new HashSet<Integer>();
        Set<Integer> ratio_indices = new HashSet<Integer>();
        List<Expression> kept_numerators = new ArrayList<Expression>();
        for (RatioTerm ratio : ratios) {
            ratio_indices.add(ratio.index);
        }
        // (a / b) * (b / a)
        for (int outer = 0; outer < ratios.size(); outer++) {
            RatioTerm first = ratios.get(outer);
            if (removed.contains(first.index)) {
                continue;
            }
            for (int inner = outer + 1; inner < ratios.size(); inner++) {
                RatioTerm second = ratios.get(inner);
                if (removed.contains(second.index)) {
                    continue;
                }
                if (Equivalence.isEquivalent(first.numerator, second.denominator)
                        && Equivalence.isEquivalent(
                                first.denominator, second.numerator)) {
                    removed.add(first.index);
                    removed.add(second.index);
                    break;
                }
            }
        }
        // (a / b) * b
        Expression[] replacements = new Expression[numerators.size()];
        for (RatioTerm ratio : ratios) {
            if (removed.contains(ratio.index)) {
                continue;
            }
            for (int i = 0; i < numerators.size(); i++) {
                Term term = numerators.get(i);
                if (i == ratio.index || removed.contains(i)
                        || ratio_indices.contains(i)
                        || CommentGuard.hasComment(term.getRaw(), term.getExpression())) {
                    continue;
                }
                if (!Equivalence.isEquivalent(
                        term.getExpression(), ratio.denominator)) {
                    continue;
                }
                Double value = NumericEvaluator.parseFactor(ratio.numerator);
                if (value == null || !NumericEvaluator.isClose(value, 1)) {
                    replacements[ratio.index] = ratio.numerator;
                }
                removed.add(ratio.index);
                removed.add(i);
                break;
            }
        }
        if (removed.isEmpty()) {
            return false;
        }
        for (int i = 0; i < numerators.size(); i++) {
            if (!removed.contains(i)) {
                kept_numerators.add(numerators.get(i).getRaw());
            } else if (replacements[i] != null) {
                kept_numerators.add(replacements[i]);
            }
        }
        Expression result = ChainDecomposer.multiplyAll(kept_numerators, node);
        for (Term term : chain.getDenominators()) {
            result = createBinary(result, BinaryOperator.DIVIDE,
                    term.getRaw().clone(), node);
        }
        replace(node, result);
        return true;
    }

    // Returns null if a ratio or any factor carries a comment.
    private static List<RatioTerm> collectRatios(List<Term> numerators,
            String source) {
        List<RatioTerm> ret = new ArrayList<RatioTerm>();
        for (int i = 0; i < numerators.size(); i++) {
            Term term = numerators.get(i);
            if (CommentGuard.hasComment(term.getRaw(), term.getExpression())) {
                return null;
            }
            Expression expr = term.getExpression();
            if (!NumericEvaluator.isBinary(expr, BinaryOperator.DIVIDE)) {
                continue;
            }
            BinaryExpression quotient = (BinaryExpression)expr;
            if (CommentGuard.hasComment(quotient.getLHS(), quotient.getRHS())
                    || CommentGuard.hasCommentBetween(
                            quotient.getLHS(), quotient.getRHS(), source)) {
                return null;
            }
            ret.add(new RatioTerm(i,
                    ParenthesizedExpression.unwrap(quotient.getLHS()),
                    ParenthesizedExpression.unwrap(quotient.getRHS())));
        }
        return ret;
    }

}
