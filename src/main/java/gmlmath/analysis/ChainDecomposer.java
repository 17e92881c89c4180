package gmlmath.analysis;

import gmlmath.hir.*;

import java.util.List;

/**
* ChainDecomposer flattens products, quotients and sums into term lists and
* rebuilds left-associative trees from such lists. Decomposition never
* splits across a comment: a split point with a comment between its operands
* makes the whole decomposition fail.
*/
public final class ChainDecomposer {

    // No instantiation is used.
    private ChainDecomposer() {
    }

    /**
    * Collects the factors of a product or quotient. Left operands stay on the
    * active side and the right operand of a {@code /} moves to the other
    * side. A division whose divisor is not a numeric constant is kept as one
    * atomic term so an opaque divisor is never cancelled against anything.
    * A parenthesized {@code (1 - 0.5)} factor is collapsed to {@code 0.5} in
    * the tree before it is collected.
    *
    * @param node the product or quotient.
    * @param chain the chain receiving the terms.
    * @param in_denominator true if the node itself is a divisor.
    * @param source the source text used by the comment guard; may be null.
    * @return false if a comment sits between two operands being split.
    */
    public static boolean collectMultiplicativeChain(Expression node,
            MultiplicativeChain chain, boolean in_denominator, String source) {
        node = collapseUnitMinusHalfFactor(node, source);
        Expression expr = ParenthesizedExpression.unwrap(node);
        if (expr == null) {
            return false;
        }
        if (expr instanceof BinaryExpression) {
            BinaryExpression be = (BinaryExpression)expr;
            BinaryOperator op = be.getOperator();
            if (op == BinaryOperator.MULTIPLY || op == BinaryOperator.DIVIDE) {
                if (CommentGuard.hasCommentBetween(
                        be.getLHS(), be.getRHS(), source)) {
                    return false;
                }
                if (op == BinaryOperator.DIVIDE
                        && NumericEvaluator.parseFactor(be.getRHS()) == null) {
                    chain.add(new Term(node), in_denominator);
                    return true;
                }
                if (!collectMultiplicativeChain(
                        be.getLHS(), chain, in_denominator, source)) {
                    return false;
                }
                boolean flip = (op == BinaryOperator.DIVIDE);
                return collectMultiplicativeChain(be.getRHS(), chain,
                        flip ? !in_denominator : in_denominator, source);
            }
        }
        chain.add(new Term(node), in_denominator);
        return true;
    }

    /**
    * Replaces a parenthesized {@code (1 - 0.5)} by the literal {@code 0.5}.
    *
    * @param node the candidate factor.
    * @param source the source text used by the comment guard; may be null.
    * @return the literal that took the place of the node, or the node itself.
    */
    public static Expression
            collapseUnitMinusHalfFactor(Expression node, String source) {
        if (!(node instanceof ParenthesizedExpression) || node.hasComments()) {
            return node;
        }
        Expression diff = ParenthesizedExpression.unwrap(node);
        if (!NumericEvaluator.isBinary(diff, BinaryOperator.SUBTRACT)
                || diff.hasComments()) {
            return node;
        }
        BinaryExpression be = (BinaryExpression)diff;
        if (CommentGuard.hasComment(be.getLHS(), be.getRHS())
                || CommentGuard.hasCommentBetween(
                        be.getLHS(), be.getRHS(), source)) {
            return node;
        }
        Double lhs = NumericEvaluator.parseFactor(be.getLHS());
        Double rhs = NumericEvaluator.parseFactor(be.getRHS());
        if (lhs == null || rhs == null || !NumericEvaluator.isClose(lhs, 1)
                || !NumericEvaluator.isClose(rhs, 0.5)) {
            return node;
        }
        Expression half = new Literal("0.5").copySpanFrom(node);
        if (node.getParent() != null) {
            IRTools.replaceExpression(node, half);
        }
        return half;
    }

    /**
    * Collects the signed addends of a chain of {@code +} and {@code -}. The
    * right operand of a subtraction, and every addend below it, has its sign
    * flipped.
    *
    * @param node the sum or difference.
    * @param terms the list receiving the addends.
    * @param negated true if the node itself is subtracted.
    */
    public static void
            collectAdditiveChain(Expression node, List<Term> terms, boolean negated) {
        Expression expr = ParenthesizedExpression.unwrap(node);
        if (expr == null) {
            return;
        }
        if (expr instanceof BinaryExpression && !expr.hasComments()) {
            BinaryExpression be = (BinaryExpression)expr;
            if (be.getOperator() == BinaryOperator.ADD) {
                collectAdditiveChain(be.getLHS(), terms, negated);
                collectAdditiveChain(be.getRHS(), terms, negated);
                return;
            }
            if (be.getOperator() == BinaryOperator.SUBTRACT) {
                collectAdditiveChain(be.getLHS(), terms, negated);
                collectAdditiveChain(be.getRHS(), terms, !negated);
                return;
            }
        }
        terms.add(new Term(node, negated));
    }

    /**
    * Collects the operands of a chain of {@code +}, looking through
    * parentheses. Operands are added unwrapped.
    *
    * @param node the sum.
    * @param terms the list receiving the addends.
    */
    public static void
            collectAdditionTerms(Expression node, List<Expression> terms) {
        Expression expr = ParenthesizedExpression.unwrap(node);
        if (expr == null) {
            return;
        }
        if (NumericEvaluator.isBinary(expr, BinaryOperator.ADD)) {
            BinaryExpression be = (BinaryExpression)expr;
            collectAdditionTerms(be.getLHS(), terms);
            collectAdditionTerms(be.getRHS(), terms);
            return;
        }
        terms.add(expr);
    }

    /**
    * Collects the operands of a chain of {@code *}, looking through
    * parentheses. Operands are added unwrapped.
    *
    * @param node the product.
    * @param factors the list receiving the operands.
    * @return false if a product node inside the chain carries a comment.
    */
    public static boolean
            collectProductOperands(Expression node, List<Expression> factors) {
        Expression expr = ParenthesizedExpression.unwrap(node);
        if (expr == null) {
            return false;
        }
        if (!NumericEvaluator.isBinary(expr, BinaryOperator.MULTIPLY)) {
            factors.add(expr);
            return true;
        }
        if (expr.hasComments()) {
            return false;
        }
        BinaryExpression be = (BinaryExpression)expr;
        return collectProductOperands(be.getLHS(), factors)
                && collectProductOperands(be.getRHS(), factors);
    }

    /**
    * Builds a left-associative product of clones of the raw terms. A single
    * term is returned as a clone of itself and an empty list yields the
    * literal {@code 1}.
    *
    * @param terms the factors.
    * @param template the node whose span the new products take; may be null.
    * @return the new product.
    */
    public static Expression rebuildProduct(List<Term> terms, Expression template) {
        if (terms.isEmpty()) {
            return new Literal("1").copySpanFrom(template);
        }
        Expression ret = terms.get(0).getRaw().clone();
        for (int i = 1; i < terms.size(); i++) {
            ret = new BinaryExpression(ret, BinaryOperator.MULTIPLY,
                    terms.get(i).getRaw().clone()).copySpanFrom(template);
        }
        return ret;
    }

    /**
    * Builds a left-associative product of clones of the given expressions.
    *
    * @see #rebuildProduct(List, Expression)
    */
    public static Expression
            multiplyAll(List<Expression> factors, Expression template) {
        if (factors.isEmpty()) {
            return new Literal("1").copySpanFrom(template);
        }
        Expression ret = factors.get(0).clone();
        for (int i = 1; i < factors.size(); i++) {
            ret = new BinaryExpression(ret, BinaryOperator.MULTIPLY,
                    factors.get(i).clone()).copySpanFrom(template);
        }
        return ret;
    }

    /**
    * Builds a left-associative sum of clones of the signed terms. Negated
    * terms are subtracted; a leading negated term is negated with a unary
    * minus. An empty list yields the literal {@code 0}.
    *
    * @param terms the addends.
    * @param template the node whose span the new sums take; may be null.
    * @return the new sum.
    */
    public static Expression rebuildSum(List<Term> terms, Expression template) {
        if (terms.isEmpty()) {
            return new Literal("0").copySpanFrom(template);
        }
        Term first = terms.get(0);
        Expression ret = first.getRaw().clone();
        if (first.isNegated()) {
            ret = new UnaryExpression(UnaryOperator.MINUS, ret)
                    .copySpanFrom(template);
        }
        for (int i = 1; i < terms.size(); i++) {
            Term term = terms.get(i);
            BinaryOperator op = term.isNegated()
                    ? BinaryOperator.SUBTRACT : BinaryOperator.ADD;
            ret = new BinaryExpression(ret, op, term.getRaw().clone())
                    .copySpanFrom(template);
        }
        return ret;
    }

}
