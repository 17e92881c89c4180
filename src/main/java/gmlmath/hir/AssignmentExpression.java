package gmlmath.hir;

import java.io.PrintWriter;

/**
* Assignment, either plain or compound ({@code x *= 2}).
*/
public class AssignmentExpression extends Expression {

    protected AssignmentOperator op;

    /**
    * Creates an assignment expression.
    *
    * @param lhs the assigned expression.
    * @param op the assignment operator.
    * @param rhs the assigned value.
    * @throws NotAnOrphanException if either operand has a parent.
    */
    public AssignmentExpression(Expression lhs, AssignmentOperator op,
            Expression rhs) {
        super(2);
        if (op == null) {
            throw new IllegalArgumentException("operator is null");
        }
        addChild(lhs);
        this.op = op;
        addChild(rhs);
    }

    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public AssignmentOperator getOperator() {
        return op;
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    public void setRHS(Expression expr) {
        setChild(1, expr);
    }

    @Override
    public int getPrecedence() {
        return 0;
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        getLHS().print(o);
        o.print(" ");
        op.print(o);
        o.print(" ");
        getRHS().print(o);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((AssignmentExpression)o).op);
    }

}
