package gmlmath.hir;

import java.io.PrintWriter;

/**
* An expression wrapped in explicit parentheses. The parser keeps every pair of
* source parentheses as a node of its own so that spans and comments inside
* them survive rewriting.
*/
public class ParenthesizedExpression extends Expression {

    /**
    * Wraps the given expression.
    *
    * @param expr the inner expression.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public ParenthesizedExpression(Expression expr) {
        super(1);
        addChild(expr);
    }

    /** Returns the wrapped expression. */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    /**
    * Sets the wrapped expression.
    *
    * @param expr the new inner expression.
    */
    public void setExpression(Expression expr) {
        setChild(0, expr);
    }

    /**
    * Strips any number of enclosing parentheses.
    *
    * @param e the expression to be unwrapped; may be null.
    * @return the innermost non-parenthesized expression, or null.
    */
    public static Expression unwrap(Expression e) {
        while (e instanceof ParenthesizedExpression) {
            e = ((ParenthesizedExpression)e).getExpression();
        }
        return e;
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print("(");
        getExpression().print(o);
        o.print(")");
    }

}
