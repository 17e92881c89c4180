package gmlmath.hir;

import java.io.PrintWriter;

/**
* Represents an expression having a binary operator and two operands.
* Operands built by the parser keep their own parenthesized nodes; operands
* synthesized by a rewrite get parentheses on printing whenever precedence
* requires them.
*/
public class BinaryExpression extends Expression {

    /** The binary operator of the expression */
    protected BinaryOperator op;

    /**
    * Creates a binary expression.
    *
    * @param lhs The left-hand operand.
    * @param op The operator.
    * @param rhs The right-hand operand.
    * @throws NotAnOrphanException if <b>lhs</b> or <b>rhs</b> has a parent
    * object.
    */
    public BinaryExpression(Expression lhs, BinaryOperator op, Expression rhs) {
        super(2);
        if (op == null) {
            throw new IllegalArgumentException("operator is null");
        }
        addChild(lhs);
        this.op = op;
        addChild(rhs);
    }

    /**
    * Returns the lefthand expression.
    *
    * @return the left-hand operand.
    */
    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the operator of the expression.
    *
    * @return the operator.
    */
    public BinaryOperator getOperator() {
        return op;
    }

    /**
    * Returns the righthand expression.
    *
    * @return the right-hand operand.
    */
    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    /**
    * Sets the lefthand expression.
    *
    * @param expr The new left-hand operand.
    * @throws NotAnOrphanException if <b>expr</b> has a parent object.
    */
    public void setLHS(Expression expr) {
        setChild(0, expr);
    }

    /**
    * Sets the operator for the expression.
    *
    * @param op The operator.
    */
    public void setOperator(BinaryOperator op) {
        if (op == null) {
            throw new IllegalArgumentException("operator is null");
        }
        this.op = op;
    }

    /**
    * Sets the righthand expression.
    *
    * @param expr The new right-hand operand.
    * @throws NotAnOrphanException if <b>expr</b> has a parent object.
    */
    public void setRHS(Expression expr) {
        setChild(1, expr);
    }

    /**
    * Replaces both operands and the operator at once.
    *
    * @param lhs the new left-hand operand.
    * @param op the new operator.
    * @param rhs the new right-hand operand.
    */
    public void set(Expression lhs, BinaryOperator op, Expression rhs) {
        setOperator(op);
        setLHS(lhs);
        setRHS(rhs);
    }

    @Override
    public int getPrecedence() {
        return op.getPrecedence();
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        int prec = op.getPrecedence();
        printOperand(getLHS(), o, prec);
        o.print(" ");
        op.print(o);
        o.print(" ");
        Expression rhs = getRHS();
        if (rhs instanceof BinaryExpression
                && ((BinaryExpression)rhs).op == op && op.isAssociative()) {
            printOperand(rhs, o, prec);
        } else {
            printOperand(rhs, o, prec + 1);
        }
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((BinaryExpression)o).op);
    }

}
