package gmlmath.hir;

import java.io.PrintWriter;

/**
* Member access with the dot operator, such as {@code other.x}.
*/
public class AccessExpression extends Expression {

    /**
    * Creates a member access.
    *
    * @param lhs the object expression.
    * @param rhs the member name.
    * @throws NotAnOrphanException if either operand has a parent.
    */
    public AccessExpression(Expression lhs, Expression rhs) {
        super(2);
        addChild(lhs);
        addChild(rhs);
    }

    /** Returns the object expression. */
    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    /** Returns the member expression. */
    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        printOperand(getLHS(), o, PRIMARY_PRECEDENCE);
        o.print(".");
        getRHS().print(o);
    }

}
