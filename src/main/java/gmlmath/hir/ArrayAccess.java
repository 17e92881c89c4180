package gmlmath.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Indexed member access such as {@code grid[i, j]}. The first child is the
* array expression and the remaining children are the indices.
*/
public class ArrayAccess extends Expression {

    /**
    * Creates an array access.
    *
    * @param array the accessed expression.
    * @param indices the index expressions.
    * @throws NotAnOrphanException if any of the expressions has a parent.
    */
    public ArrayAccess(Expression array, List<Expression> indices) {
        super(indices.size() + 1);
        addChild(array);
        for (Expression index : indices) {
            addChild(index);
        }
    }

    /** Returns the accessed expression. */
    public Expression getArrayName() {
        return (Expression)children.get(0);
    }

    /** Returns the index at the given position. */
    public Expression getIndex(int n) {
        return (Expression)children.get(n + 1);
    }

    /** Returns a copy of the index list. */
    public List<Expression> getIndices() {
        List<Expression> ret = new ArrayList<Expression>(children.size() - 1);
        for (int i = 1; i < children.size(); i++) {
            ret.add((Expression)children.get(i));
        }
        return ret;
    }

    /** Returns the number of indices. */
    public int getNumIndices() {
        return children.size() - 1;
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        printOperand(getArrayName(), o, PRIMARY_PRECEDENCE);
        o.print("[");
        PrintTools.printListWithComma(children.subList(1, children.size()), o);
        o.print("]");
    }

}
