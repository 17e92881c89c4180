package gmlmath.hir;

import java.io.PrintWriter;

/** A statement consisting of a single expression followed by a semicolon. */
public class ExpressionStatement extends Statement {

    /**
    * Create a new expression statement.
    *
    * @param expr The expression part of the statement.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public ExpressionStatement(Expression expr) {
        super(1);
        addChild(expr);
    }

    /**
    * Returns the expression part of the statement.
    *
    * @return the expression part of the statement.
    */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    /**
    * Sets the expression part of the statement.
    *
    * @param expr the new expression.
    */
    public void setExpression(Expression expr) {
        setChild(0, expr);
    }

    @Override
    public ExpressionStatement clone() {
        return (ExpressionStatement)super.clone();
    }

    @Override
    protected String getRatioHint() {
        return Literal.findRatioHint(getExpression());
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        getExpression().print(o);
        o.print(";");
    }

}
