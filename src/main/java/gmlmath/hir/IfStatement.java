package gmlmath.hir;

import java.io.PrintWriter;

/**
* Represents an if statement. Unlike blocks produced by rewrites, clauses
* keep the shape they had in the source: a single statement clause is not
* wrapped in braces.
*/
public class IfStatement extends Statement {

    /**
    * Create an <var>if</var> statement that has no <var>else</var> clause.
    *
    * @param condition The condition tested by the statement.
    * @param true_clause The code to execute if the condition is true.
    * @throws IllegalArgumentException if <b>condition</b> or <b>true_clause</b>
    * is null.
    * @throws NotAnOrphanException if <b>condition</b> or <b>true_clause</b> has
    * a parent.
    */
    public IfStatement(Expression condition, Statement true_clause) {
        super(2);
        addChild(condition);
        addChild(true_clause);
    }

    /**
    * Create an <var>if</var> statement that has an <var>else</var> clause.
    *
    * @param condition The condition tested by the statement.
    * @param true_clause The code to execute if the condition is true.
    * @param false_clause The code to execute if the condition is false.
    * @throws IllegalArgumentException if any argument is null.
    * @throws NotAnOrphanException if any argument has a parent.
    */
    public IfStatement(Expression condition, Statement true_clause,
                       Statement false_clause) {
        super(3);
        addChild(condition);
        addChild(true_clause);
        addChild(false_clause);
    }

    /** Returns the expression used as a branch condition. */
    public Expression getControlExpression() {
        return (Expression)children.get(0);
    }

    /**
    * Sets the condition expression with the specified new condition.
    *
    * @param cond the new condition expression.
    */
    public void setControlExpression(Expression cond) {
        setChild(0, cond);
    }

    /** Returns the then clause of the if statement. */
    public Statement getThenStatement() {
        return (Statement)children.get(1);
    }

    /**
    * Returns the false clause of the if statement.
    *
    * @return the false clause or null (if it does not exist).
    */
    public Statement getElseStatement() {
        if (children.size() > 2) {
            return (Statement)children.get(2);
        } else {
            return null;
        }
    }

    @Override
    public IfStatement clone() {
        return (IfStatement)super.clone();
    }

    /**
    * Prints a condition in parentheses unless it is already a parenthesized
    * expression of its own.
    */
    static void printCondition(Expression cond, PrintWriter o) {
        if (cond instanceof ParenthesizedExpression) {
            cond.print(o);
        } else {
            o.print("(");
            cond.print(o);
            o.print(")");
        }
    }

    /**
    * Prints a clause after its header, on the same line for blocks and on an
    * indented line of its own otherwise.
    */
    static void printClause(Statement clause, PrintWriter o) {
        if (clause instanceof CompoundStatement) {
            o.print(" ");
            clause.print(o);
        } else {
            o.print("\n");
            o.print(PrintTools.indentLines(clause.toString()));
        }
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print("if ");
        printCondition(getControlExpression(), o);
        Statement then_stmt = getThenStatement();
        printClause(then_stmt, o);
        Statement else_stmt = getElseStatement();
        if (else_stmt != null) {
            o.print((then_stmt instanceof CompoundStatement) ? " " : "\n");
            o.print("else");
            if (else_stmt instanceof IfStatement) {
                o.print(" ");
                else_stmt.print(o);
            } else {
                printClause(else_stmt, o);
            }
        }
    }

}
