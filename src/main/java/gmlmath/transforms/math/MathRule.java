package gmlmath.transforms.math;

import gmlmath.analysis.MathPatterns;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
* Base class of the rewrite rules run by {@link MathTraversal}. A rule
* inspects one node and either leaves the tree untouched and returns false,
* or rewrites the node and returns true. A rewrite either changes the fields
* of the node itself or puts a fully built replacement into the slot the node
* occupies; the driver finds the current occupant of that slot afterwards.
*
* @param <T> the kind of node the rule applies to.
*/
public abstract class MathRule<T extends Expression> {

    private final String name;

    /**
    * Constructs a rule with the given name used in status messages.
    *
    * @param name the rule name.
    */
    protected MathRule(String name) {
        this.name = name;
    }

    /** Returns the name of the rule */
    public String getName() {
        return name;
    }

    /**
    * Tries to rewrite the node.
    *
    * @param node the node to be rewritten.
    * @param ctx the normalization context.
    * @return true if the tree was changed.
    */
    public abstract boolean apply(T node, NormalizationContext ctx);

    @Override
    public String toString() {
        return name;
    }

    /**
    * Puts the replacement into the slot of the old node and moves the comments
    * of the old node onto it. The replacement may be a descendant of the old
    * node.
    *
    * @param old the node being replaced.
    * @param repl the replacement.
    * @return the replacement.
    */
    protected static Expression replace(Expression old, Expression repl) {
        old.transferCommentsTo(repl);
        IRTools.replaceExpression(old, repl);
        return repl;
    }

    /** Creates a literal with the given text and the span of the template. */
    protected static Literal createLiteral(String text, Expression template) {
        Literal ret = new Literal(text);
        ret.copySpanFrom(template);
        return ret;
    }

    /**
    * Creates a numeric constant from canonical coefficient text. A negative
    * value becomes a unary minus applied to a literal.
    */
    protected static Expression createNumber(String text, Expression template) {
        if (text.startsWith("-")) {
            return negate(createLiteral(text.substring(1), template), template);
        }
        return createLiteral(text, template);
    }

    /**
    * Creates a call to the named function with the given arguments. The
    * arguments must not have a parent.
    */
    protected static FunctionCall
            createCall(String name, Expression template, Expression... args) {
        List<Expression> arg_list = new ArrayList<Expression>(args.length);
        for (Expression arg : args) {
            arg_list.add(arg);
        }
        return createCall(name, template, arg_list);
    }

    /** Creates a call to the named function with the given arguments. */
    protected static FunctionCall
            createCall(String name, Expression template, List<Expression> args) {
        FunctionCall ret = new FunctionCall(name, args);
        ret.copySpanFrom(template);
        return ret;
    }

    /** Creates {@code lhs op rhs} with the span of the template. */
    protected static BinaryExpression createBinary(Expression lhs,
            BinaryOperator op, Expression rhs, Expression template) {
        BinaryExpression ret = new BinaryExpression(lhs, op, rhs);
        ret.copySpanFrom(template);
        return ret;
    }

    /** Creates {@code -e} with the span of the template. */
    protected static Expression negate(Expression e, Expression template) {
        return new UnaryExpression(UnaryOperator.MINUS, e).copySpanFrom(template);
    }

    /**
    * Removes parentheses enclosing the node as long as they wrap a simple
    * operand or a call and neither side carries a comment.
    *
    * @param node the node that may sit inside parentheses.
    * @return the node.
    */
    protected static Expression unwrapEnclosingParentheses(Expression node) {
        while (node.getParent() instanceof ParenthesizedExpression) {
            ParenthesizedExpression paren =
                    (ParenthesizedExpression)node.getParent();
            if (paren.getParent() == null || paren.hasComments()
                    || node.hasComments()) {
                break;
            }
            if (!MathPatterns.isSafeOperand(node)
                    && !(node instanceof FunctionCall)) {
                break;
            }
            replace(paren, node);
        }
        return node;
    }

    /** Returns the formatted coefficient or null if it is not finite. */
    protected static String format(double value) {
        return NumericEvaluator.formatCoefficient(value);
    }

}
