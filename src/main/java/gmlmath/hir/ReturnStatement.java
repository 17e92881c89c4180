package gmlmath.hir;

import java.io.PrintWriter;

/** Represents a return statement with an optional value. */
public class ReturnStatement extends Statement {

    /** Creates a return statement without a value. */
    public ReturnStatement() {
        super(1);
    }

    /**
    * Creates a return statement with the specified return value.
    *
    * @param expr the returned value.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public ReturnStatement(Expression expr) {
        super(1);
        addChild(expr);
    }

    /** Returns the returned value, or null. */
    public Expression getExpression() {
        return children.isEmpty() ? null : (Expression)children.get(0);
    }

    @Override
    public ReturnStatement clone() {
        return (ReturnStatement)super.clone();
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print("return");
        if (!children.isEmpty()) {
            o.print(" ");
            getExpression().print(o);
        }
        o.print(";");
    }

}
