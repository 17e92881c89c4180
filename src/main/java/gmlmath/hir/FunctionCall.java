package gmlmath.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a function or script call. The first child is the callee
* expression and the remaining children are the arguments in order.
*/
public class FunctionCall extends Expression {

    /**
    * Creates a function call with no arguments.
    *
    * @param function the callee expression, usually an {@link Identifier}.
    * @throws NotAnOrphanException if <b>function</b> has a parent.
    */
    public FunctionCall(Expression function) {
        super(1);
        addChild(function);
    }

    /**
    * Creates a function call with the given arguments.
    *
    * @param function the callee expression.
    * @param args the argument expressions.
    * @throws NotAnOrphanException if any of the expressions has a parent.
    */
    public FunctionCall(Expression function, List<Expression> args) {
        super(args.size() + 1);
        addChild(function);
        setArguments(args);
    }

    /**
    * Creates a call to the named function.
    *
    * @param name the name of the function.
    * @param args the argument expressions.
    */
    public FunctionCall(String name, List<Expression> args) {
        this(new Identifier(name), args);
    }

    /**
    * Appends an argument.
    *
    * @param expr the new argument.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public void addArgument(Expression expr) {
        addChild(expr);
    }

    /**
    * Returns the argument at the given position.
    *
    * @param n the zero-based argument index.
    */
    public Expression getArgument(int n) {
        return (Expression)children.get(n + 1);
    }

    /** Returns a copy of the argument list. */
    public List<Expression> getArguments() {
        List<Expression> ret = new ArrayList<Expression>(children.size() - 1);
        for (int i = 1; i < children.size(); i++) {
            ret.add((Expression)children.get(i));
        }
        return ret;
    }

    /** Returns the callee expression. */
    public Expression getName() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the name of the called function when the callee is a plain
    * identifier, possibly parenthesized.
    *
    * @return the callee name or null.
    */
    public String getCalleeName() {
        Expression name = ParenthesizedExpression.unwrap(getName());
        if (name instanceof Identifier) {
            return ((Identifier)name).getName();
        }
        return null;
    }

    /** Returns the number of arguments. */
    public int getNumArguments() {
        return children.size() - 1;
    }

    /**
    * Replaces the argument at the given position.
    *
    * @param n the zero-based argument index.
    * @param expr the new argument.
    */
    public void setArgument(int n, Expression expr) {
        setChild(n + 1, expr);
    }

    /**
    * Replaces all arguments with the given list.
    *
    * @param args the new argument expressions.
    */
    public void setArguments(List<Expression> args) {
        while (children.size() > 1) {
            children.remove(children.size() - 1).setParent(null);
        }
        for (Expression arg : args) {
            addChild(arg);
        }
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        getName().print(o);
        o.print("(");
        PrintTools.printListWithComma(children.subList(1, children.size()), o);
        o.print(")");
    }

}
