package gmlmath.hir;

import java.io.PrintWriter;

/** Represents a while loop. */
public class WhileLoop extends Statement {

    /**
    * Creates a while loop.
    *
    * @param condition the loop condition.
    * @param body the loop body.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public WhileLoop(Expression condition, Statement body) {
        super(2);
        addChild(condition);
        addChild(body);
    }

    /** Returns the loop condition. */
    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    /** Returns the loop body. */
    public Statement getBody() {
        return (Statement)children.get(1);
    }

    @Override
    public WhileLoop clone() {
        return (WhileLoop)super.clone();
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print("while ");
        IfStatement.printCondition(getCondition(), o);
        IfStatement.printClause(getBody(), o);
    }

}
