package gmlmath.transforms.math;

import gmlmath.analysis.*;
import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
* Collects the coefficients of a sum of scaled copies of one operand:
* {@code a * 2 + a * 3} becomes {@code a * 5} and {@code a * 3 - a * 2}
* becomes {@code a}. Every addend needs an explicit numeric coefficient.
*/
public class DistributedScalarRule extends MathRule<BinaryExpression> {

    public DistributedScalarRule() {
        super("distributed-scalar");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        BinaryOperator op = node.getOperator();
        if ((op != BinaryOperator.ADD && op != BinaryOperator.SUBTRACT)
                || node.hasComments()) {
            return false;
        }
        String source = ctx.getCommentSource();
        if (hasCommentOnSpine(node, source)) {
            return false;
        }
        List<Term> terms = new ArrayList<Term>();
        ChainDecomposer.collectAdditiveChain(node, terms, false);
        if (terms.size() < 2) {
            return false;
        }
        MathPatterns.ScaledOperand first = null;
        double sum = 0;
        for (Term term : terms) {
            MathPatterns.ScaledOperand scaled = extractTerm(term, source);
            if (scaled == null) {
                return false;
            }
            if (first == null) {
                if (!MathPatterns.isSafeOperand(scaled.getBase())) {
                    return false;
                }
                first = scaled;
            } else if (!Equivalence.isEquivalent(first.getBase(), scaled.getBase())) {
                return false;
            }
            sum += term.isNegated() ? -scaled.getCoefficient()
                    : scaled.getCoefficient();
        }
        if (Double.isNaN(sum) || Double.isInfinite(sum)) {
            return false;
        }
        Expression base = first.getRawBase();
        if (Math.abs(sum) <= NumericEvaluator.tolerance(0)) {
            replace(node, createLiteral("0", node));
        } else if (NumericEvaluator.isClose(sum, 1)) {
            replace(node, base.clone());
        } else if (NumericEvaluator.isClose(sum, -1)) {
            replace(node, negate(base.clone(), node));
        } else {
            String text = format(sum);
            if (text == null) {
                return false;
            }
            node.set(base.clone(), BinaryOperator.MULTIPLY,
                    createNumber(text, node));
        }
        return true;
    }

    // Comments between the operands of any addition or subtraction of the sum.
    private static boolean hasCommentOnSpine(Expression e, String source) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!NumericEvaluator.isBinary(expr, BinaryOperator.ADD)
                && !NumericEvaluator.isBinary(expr, BinaryOperator.SUBTRACT)) {
            return false;
        }
        BinaryExpression be = (BinaryExpression)expr;
        return CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(), source)
                || hasCommentOnSpine(be.getLHS(), source)
                || hasCommentOnSpine(be.getRHS(), source);
    }

    // c * base or base * c with exactly one constant side.
    private static MathPatterns.ScaledOperand extractTerm(Term term,
            String source) {
        Expression expr = term.getExpression();
        if (CommentGuard.hasComment(term.getRaw(), expr)
                || !NumericEvaluator.isBinary(expr, BinaryOperator.MULTIPLY)) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)expr;
        Expression raw_lhs = be.getLHS();
        Expression raw_rhs = be.getRHS();
        Expression lhs = ParenthesizedExpression.unwrap(raw_lhs);
        Expression rhs = ParenthesizedExpression.unwrap(raw_rhs);
        if (CommentGuard.hasComment(raw_lhs, raw_rhs, lhs, rhs)
                || CommentGuard.hasCommentBetween(raw_lhs, raw_rhs, source)) {
            return null;
        }
        Double lvalue = NumericEvaluator.parseFactor(lhs);
        Double rvalue = NumericEvaluator.parseFactor(rhs);
        if (lvalue != null && rvalue == null) {
            return new MathPatterns.ScaledOperand(lvalue, rhs, raw_rhs);
        }
        if (rvalue != null && lvalue == null) {
            return new MathPatterns.ScaledOperand(rvalue, lhs, raw_lhs);
        }
        return null;
    }

}
