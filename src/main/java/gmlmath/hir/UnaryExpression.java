package gmlmath.hir;

import java.io.PrintWriter;

/** Represents an expression having a prefix operator and one operand. */
public class UnaryExpression extends Expression {

    /** The unary operator of the expression */
    protected UnaryOperator op;

    /**
    * Constructs a unary expression with the specified operator and expression.
    *
    * @param op the unary operator.
    * @param expr the operand expression.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public UnaryExpression(UnaryOperator op, Expression expr) {
        super(1);
        this.op = op;
        addChild(expr);
    }

    /** Returns the operand of the expression. */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    /** Returns the operator of the expression. */
    public UnaryOperator getOperator() {
        return op;
    }

    /**
    * Sets the operand of the expression.
    *
    * @param expr the new operand.
    */
    public void setExpression(Expression expr) {
        setChild(0, expr);
    }

    @Override
    public int getPrecedence() {
        return UNARY_PRECEDENCE;
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        op.print(o);
        Expression expr = getExpression();
        String text = expr.toString();
        // "- -x" must not print as the decrement "--x"
        if (text.startsWith("-") || text.startsWith("+")) {
            o.print("(");
            o.print(text);
            o.print(")");
        } else {
            printOperand(expr, o, UNARY_PRECEDENCE);
        }
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((UnaryExpression)o).op);
    }

}
