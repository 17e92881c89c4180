package gmlmath.analysis;

import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
* Shape matchers shared by the rewrite rules: degree conversions, trig calls,
* differences, scaled operands and the operand kinds that may be duplicated
* or unwrapped without changing behaviour. Every matcher returns null (or
* false) when the shape does not match.
*/
public final class MathPatterns {

    /** The kind of a recognized trig call */
    public enum TrigKind { COS, SIN }

    /** A trig call in degrees together with its degree argument. */
    public static class TrigCall {
        private final TrigKind kind;
        private final Expression argument;

        TrigCall(TrigKind kind, Expression argument) {
            this.kind = kind;
            this.argument = argument;
        }

        public TrigKind getKind() {
            return kind;
        }

        public Expression getArgument() {
            return argument;
        }
    }

    /** An operand with a possible leading unary minus split off. */
    public static class SignedOperand {
        private final Expression node;
        private final boolean negative;

        SignedOperand(Expression node, boolean negative) {
            this.node = node;
            this.negative = negative;
        }

        public Expression getNode() {
            return node;
        }

        public boolean isNegative() {
            return negative;
        }
    }

    /** The two sides of a subtraction, both unwrapped. */
    public static class Difference {
        private final Expression minuend;
        private final Expression subtrahend;

        Difference(Expression minuend, Expression subtrahend) {
            this.minuend = minuend;
            this.subtrahend = subtrahend;
        }

        public Expression getMinuend() {
            return minuend;
        }

        public Expression getSubtrahend() {
            return subtrahend;
        }
    }

    /**
    * An operand written as a numeric coefficient times a base, such as
    * {@code 0.5 * s} or {@code s / 2}.
    */
    public static class ScaledOperand {
        private final double coefficient;
        private final Expression base;
        private final Expression raw_base;

        public ScaledOperand(double coefficient, Expression base, Expression raw_base) {
            this.coefficient = coefficient;
            this.base = base;
            this.raw_base = raw_base;
        }

        public double getCoefficient() {
            return coefficient;
        }

        /** Returns the base with parentheses stripped. */
        public Expression getBase() {
            return base;
        }

        /** Returns the base as it appears in the tree. */
        public Expression getRawBase() {
            return raw_base;
        }
    }

    // No instantiation is used.
    private MathPatterns() {
    }

    /**
    * Checks if the operand can be duplicated or reordered freely: an
    * identifier, a literal, or a member access built only from such
    * operands. Parentheses are looked through.
    */
    public static boolean isSafeOperand(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (expr instanceof Identifier || expr instanceof Literal) {
            return true;
        }
        if (expr instanceof AccessExpression) {
            AccessExpression ae = (AccessExpression)expr;
            return isSafeOperand(ae.getLHS()) && isSafeOperand(ae.getRHS());
        }
        if (expr instanceof ArrayAccess) {
            ArrayAccess aa = (ArrayAccess)expr;
            if (!isSafeOperand(aa.getArrayName())) {
                return false;
            }
            for (Expression index : aa.getIndices()) {
                if (!isSafeOperand(index)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
    * Checks if parentheses around the expression can be dropped after an
    * identity removal: identifiers, literals, calls and member accesses
    * without comments, possibly wrapped in further parentheses.
    */
    public static boolean isIdentityReplacementSafe(Expression e) {
        if (e == null || e.hasComments()) {
            return false;
        }
        if (e instanceof Identifier || e instanceof Literal
                || e instanceof FunctionCall || e instanceof AccessExpression
                || e instanceof ArrayAccess) {
            return true;
        }
        if (e instanceof ParenthesizedExpression) {
            return isIdentityReplacementSafe(
                    ((ParenthesizedExpression)e).getExpression());
        }
        return false;
    }

    /**
    * Returns the name of the identifier, looking through parentheses.
    *
    * @return the name or null if the node is not an identifier.
    */
    public static String getIdentifierName(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (expr instanceof Identifier) {
            return ((Identifier)expr).getName();
        }
        return null;
    }

    /** Checks if the node is an identifier with the given name. */
    public static boolean isIdentifierNamed(Expression e, String name) {
        String id = getIdentifierName(e);
        return (id != null && id.equals(name));
    }

    /**
    * Returns the call if the node is a call to the named function with the
    * given number of arguments, looking through parentheses.
    */
    public static FunctionCall matchCall(Expression e, String name, int num_args) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!(expr instanceof FunctionCall)) {
            return null;
        }
        FunctionCall call = (FunctionCall)expr;
        if (!name.equals(call.getCalleeName())
                || call.getNumArguments() != num_args) {
            return null;
        }
        return call;
    }

    /** Checks if the node is a call to {@code ln} with one argument. */
    public static boolean isLnCall(Expression e) {
        return (matchCall(e, "ln", 1) != null);
    }

    /**
    * Splits a leading unary minus off the operand.
    *
    * @param e the operand.
    * @return the operand without its minus and the sign; the node is null
    *   if the operand is null.
    */
    public static SignedOperand extractSignedOperand(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (expr instanceof UnaryExpression
                && ((UnaryExpression)expr).getOperator() == UnaryOperator.MINUS) {
            return new SignedOperand(((UnaryExpression)expr).getExpression(), true);
        }
        return new SignedOperand(expr, false);
    }

    /**
    * Recognizes a cosine or sine taking degrees: {@code dcos(a)},
    * {@code dsin(a)}, {@code cos(degtorad(a))} and {@code sin(degtorad(a))}.
    *
    * @return the kind and the degree argument, or null.
    */
    public static TrigCall identifyTrigCall(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!(expr instanceof FunctionCall)) {
            return null;
        }
        FunctionCall call = (FunctionCall)expr;
        String name = call.getCalleeName();
        if (name == null || call.getNumArguments() != 1) {
            return null;
        }
        Expression arg = call.getArgument(0);
        if (name.equals("dcos")) {
            return new TrigCall(TrigKind.COS, ParenthesizedExpression.unwrap(arg));
        }
        if (name.equals("dsin")) {
            return new TrigCall(TrigKind.SIN, ParenthesizedExpression.unwrap(arg));
        }
        if (name.equals("cos") || name.equals("sin")) {
            FunctionCall conv = matchCall(arg, "degtorad", 1);
            if (conv == null) {
                return null;
            }
            TrigKind kind = name.equals("cos") ? TrigKind.COS : TrigKind.SIN;
            return new TrigCall(kind,
                    ParenthesizedExpression.unwrap(conv.getArgument(0)));
        }
        return null;
    }

    /**
    * Recognizes a conversion of an angle from degrees to radians written by
    * hand: {@code a * pi / 180}, {@code a * 0.0174532925...},
    * {@code pi / 180 * a}, {@code a / 180 * pi} and products of {@code pi}
    * with the literal reciprocal of 180.
    *
    * @param e the candidate expression.
    * @return the angle in degrees, unwrapped, or null.
    */
    public static Expression matchDegreesToRadians(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (expr == null) {
            return null;
        }
        if (NumericEvaluator.isBinary(expr, BinaryOperator.DIVIDE)) {
            BinaryExpression be = (BinaryExpression)expr;
            Expression lhs = ParenthesizedExpression.unwrap(be.getLHS());
            if (!NumericEvaluator.isLiteralNumber(be.getRHS(), 180)) {
                return null;
            }
            if (NumericEvaluator.isBinary(lhs, BinaryOperator.MULTIPLY)) {
                BinaryExpression product = (BinaryExpression)lhs;
                Expression a = ParenthesizedExpression.unwrap(product.getLHS());
                Expression b = ParenthesizedExpression.unwrap(product.getRHS());
                if (NumericEvaluator.isPi(a)) {
                    return b;
                }
                if (NumericEvaluator.isPi(b)) {
                    return a;
                }
            }
            return null;
        }
        if (!NumericEvaluator.isBinary(expr, BinaryOperator.MULTIPLY)) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)expr;
        Expression lhs = ParenthesizedExpression.unwrap(be.getLHS());
        Expression rhs = ParenthesizedExpression.unwrap(be.getRHS());
        if (NumericEvaluator.isLiteralNumber(lhs,
                NumericEvaluator.DEGREES_TO_RADIANS)) {
            return rhs;
        }
        if (NumericEvaluator.isLiteralNumber(rhs,
                NumericEvaluator.DEGREES_TO_RADIANS)) {
            return lhs;
        }
        Expression angle = matchOver180(lhs, rhs);
        if (angle == null) {
            angle = matchOver180(rhs, lhs);
        }
        if (angle == null) {
            angle = matchReciprocalPi(expr);
        }
        return angle;
    }

    // quotient * pi where the quotient is x / 180
    private static Expression matchOver180(Expression quotient, Expression other) {
        if (!NumericEvaluator.isBinary(quotient, BinaryOperator.DIVIDE)
                || !NumericEvaluator.isPi(other)) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)quotient;
        if (!NumericEvaluator.isLiteralNumber(be.getRHS(), 180)) {
            return null;
        }
        return ParenthesizedExpression.unwrap(be.getLHS());
    }

    private static Expression matchReciprocalPi(Expression product) {
        List<Expression> operands = new ArrayList<Expression>(4);
        if (!ChainDecomposer.collectProductOperands(product, operands)) {
            return null;
        }
        int pi_index = -1;
        for (int i = 0; i < operands.size() && pi_index < 0; i++) {
            if (NumericEvaluator.isPi(operands.get(i))) {
                pi_index = i;
            }
        }
        if (pi_index < 0) {
            return null;
        }
        operands.remove(pi_index);
        int reciprocal_index = -1;
        for (int i = 0; i < operands.size() && reciprocal_index < 0; i++) {
            Double value = NumericEvaluator.parseLiteral(operands.get(i));
            if (value != null && NumericEvaluator.isClose(value, 1.0 / 180)) {
                reciprocal_index = i;
            }
        }
        if (reciprocal_index < 0) {
            return null;
        }
        operands.remove(reciprocal_index);
        if (operands.size() != 1) {
            return null;
        }
        return operands.get(0);
    }

    /**
    * Checks if a comment is attached anywhere inside a product or quotient
    * that could be read as a degree conversion, or sits between two of its
    * operands.
    *
    * @param e the candidate expression.
    * @param source the source text; may be null.
    * @param skip_self true to ignore comments on the expression itself.
    */
    public static boolean hasCommentsInDegreesPattern(Expression e,
            String source, boolean skip_self) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!NumericEvaluator.isBinary(expr, BinaryOperator.MULTIPLY)
                && !NumericEvaluator.isBinary(expr, BinaryOperator.DIVIDE)) {
            return false;
        }
        BinaryExpression be = (BinaryExpression)expr;
        if ((!skip_self && be.hasComments())
                || CommentGuard.hasComment(be.getLHS(), be.getRHS())) {
            return true;
        }
        if (CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(), source)) {
            return true;
        }
        return hasCommentsInDegreesPattern(be.getLHS(), source, false)
                || hasCommentsInDegreesPattern(be.getRHS(), source, false);
    }

    /**
    * Splits a subtraction into its unwrapped sides.
    *
    * @return the sides, or null if the node is not a subtraction.
    */
    public static Difference matchDifference(Expression e) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!NumericEvaluator.isBinary(expr, BinaryOperator.SUBTRACT)) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)expr;
        return new Difference(ParenthesizedExpression.unwrap(be.getLHS()),
                ParenthesizedExpression.unwrap(be.getRHS()));
    }

    /**
    * Recognizes a numeric multiple of a base: {@code c * base},
    * {@code base * c}, {@code base / c}, and signed forms of those.
    *
    * @param e the candidate operand.
    * @param source the source text; may be null.
    * @return the coefficient and the base, or null.
    */
    public static ScaledOperand matchScaledOperand(Expression e, String source) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (expr == null || expr.hasComments()) {
            return null;
        }
        if (expr instanceof UnaryExpression) {
            UnaryExpression ue = (UnaryExpression)expr;
            if (ue.getOperator() != UnaryOperator.MINUS
                    && ue.getOperator() != UnaryOperator.PLUS) {
                return null;
            }
            ScaledOperand inner = matchScaledOperand(ue.getExpression(), source);
            if (inner == null) {
                return null;
            }
            double coefficient = (ue.getOperator() == UnaryOperator.MINUS)
                    ? -inner.coefficient : inner.coefficient;
            return new ScaledOperand(coefficient, inner.base, inner.raw_base);
        }
        if (!(expr instanceof BinaryExpression)) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)expr;
        Expression raw_lhs = be.getLHS();
        Expression raw_rhs = be.getRHS();
        if (CommentGuard.hasComment(raw_lhs, raw_rhs)
                || CommentGuard.hasCommentBetween(raw_lhs, raw_rhs, source)) {
            return null;
        }
        Double lvalue = NumericEvaluator.parseFactor(raw_lhs);
        Double rvalue = NumericEvaluator.parseFactor(raw_rhs);
        if (be.getOperator() == BinaryOperator.MULTIPLY) {
            if (lvalue != null && rvalue == null) {
                return new ScaledOperand(lvalue,
                        ParenthesizedExpression.unwrap(raw_rhs), raw_rhs);
            }
            if (rvalue != null && lvalue == null) {
                return new ScaledOperand(rvalue,
                        ParenthesizedExpression.unwrap(raw_lhs), raw_lhs);
            }
            return null;
        }
        if (be.getOperator() == BinaryOperator.DIVIDE) {
            if (rvalue == null
                    || Math.abs(rvalue) <= NumericEvaluator.tolerance(0)) {
                return null;
            }
            return new ScaledOperand(1 / rvalue,
                    ParenthesizedExpression.unwrap(raw_lhs), raw_lhs);
        }
        return null;
    }

}
