package gmlmath.analysis;

import gmlmath.hir.*;

import java.util.List;

/**
* Structural equivalence of expressions. Both relations look through
* parentheses, are reflexive and symmetric, and treat calls as opaque values
* compared by callee and arguments.
*/
public final class Equivalence {

    // No instantiation is used.
    private Equivalence() {
    }

    /**
    * Checks exact structural equivalence: identifiers by name, literals by raw
    * text, member accesses, unary and binary expressions by operator and
    * operands, calls by callee name and arguments.
    *
    * @param a the first expression; may be null.
    * @param b the second expression; may be null.
    * @return true if the expressions have the same structure.
    */
    public static boolean isEquivalent(Expression a, Expression b) {
        Expression left = ParenthesizedExpression.unwrap(a);
        Expression right = ParenthesizedExpression.unwrap(b);
        if (left == right) {
            return true;
        }
        if (left == null || right == null
                || left.getClass() != right.getClass()) {
            return false;
        }
        if (left instanceof Identifier) {
            return ((Identifier)left).getName().equals(
                    ((Identifier)right).getName());
        }
        if (left instanceof Literal) {
            return ((Literal)left).getValue().equals(
                    ((Literal)right).getValue());
        }
        if (left instanceof AccessExpression) {
            AccessExpression l = (AccessExpression)left;
            AccessExpression r = (AccessExpression)right;
            return isEquivalent(l.getLHS(), r.getLHS())
                    && isEquivalent(l.getRHS(), r.getRHS());
        }
        if (left instanceof ArrayAccess) {
            ArrayAccess l = (ArrayAccess)left;
            ArrayAccess r = (ArrayAccess)right;
            return isEquivalent(l.getArrayName(), r.getArrayName())
                    && areAllEquivalent(l.getIndices(), r.getIndices());
        }
        if (left instanceof BinaryExpression) {
            BinaryExpression l = (BinaryExpression)left;
            BinaryExpression r = (BinaryExpression)right;
            return l.getOperator() == r.getOperator()
                    && isEquivalent(l.getLHS(), r.getLHS())
                    && isEquivalent(l.getRHS(), r.getRHS());
        }
        if (left instanceof UnaryExpression) {
            UnaryExpression l = (UnaryExpression)left;
            UnaryExpression r = (UnaryExpression)right;
            return l.getOperator() == r.getOperator()
                    && isEquivalent(l.getExpression(), r.getExpression());
        }
        if (left instanceof FunctionCall) {
            FunctionCall l = (FunctionCall)left;
            FunctionCall r = (FunctionCall)right;
            String lname = l.getCalleeName();
            String rname = r.getCalleeName();
            if (lname == null || rname == null) {
                if (!isEquivalent(l.getName(), r.getName())) {
                    return false;
                }
            } else if (!lname.equals(rname)) {
                return false;
            }
            return areAllEquivalent(l.getArguments(), r.getArguments());
        }
        return false;
    }

    /**
    * Checks approximate equivalence. In addition to exact equivalence,
    * numeric literals match within tolerance and the operands of {@code +}
    * and {@code *} may appear in either order.
    *
    * @param a the first expression; may be null.
    * @param b the second expression; may be null.
    * @return true if the expressions are approximately the same.
    */
    public static boolean isApproximatelyEquivalent(Expression a, Expression b) {
        if (isEquivalent(a, b)) {
            return true;
        }
        Expression left = ParenthesizedExpression.unwrap(a);
        Expression right = ParenthesizedExpression.unwrap(b);
        if (left == null || right == null
                || left.getClass() != right.getClass()) {
            return false;
        }
        if (left instanceof Literal) {
            Double lvalue = NumericEvaluator.parseLiteral(left);
            Double rvalue = NumericEvaluator.parseLiteral(right);
            return (lvalue != null && rvalue != null
                    && NumericEvaluator.approximatelyEqual(lvalue, rvalue));
        }
        if (left instanceof BinaryExpression) {
            BinaryExpression l = (BinaryExpression)left;
            BinaryExpression r = (BinaryExpression)right;
            if (l.getOperator() != r.getOperator()) {
                return false;
            }
            if (isApproximatelyEquivalent(l.getLHS(), r.getLHS())
                    && isApproximatelyEquivalent(l.getRHS(), r.getRHS())) {
                return true;
            }
            return l.getOperator().isCommutative()
                    && isApproximatelyEquivalent(l.getLHS(), r.getRHS())
                    && isApproximatelyEquivalent(l.getRHS(), r.getLHS());
        }
        if (left instanceof UnaryExpression) {
            UnaryExpression l = (UnaryExpression)left;
            UnaryExpression r = (UnaryExpression)right;
            return l.getOperator() == r.getOperator()
                    && isApproximatelyEquivalent(
                            l.getExpression(), r.getExpression());
        }
        return false;
    }

    private static boolean
            areAllEquivalent(List<Expression> a, List<Expression> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!isEquivalent(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

}
