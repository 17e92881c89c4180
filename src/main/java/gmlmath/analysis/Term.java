package gmlmath.analysis;

import gmlmath.hir.Expression;
import gmlmath.hir.ParenthesizedExpression;

/**
* One operand of a decomposed product or sum. The raw node is the operand as
* it hangs in the tree, parentheses included; the expression is the same
* operand with the parentheses stripped.
*/
public class Term {

    private final Expression raw;

    private final Expression expression;

    private final boolean negated;

    /**
    * Creates an unsigned term.
    *
    * @param raw the operand as found in the tree.
    */
    public Term(Expression raw) {
        this(raw, false);
    }

    /**
    * Creates a term with a sign.
    *
    * @param raw the operand as found in the tree.
    * @param negated true if the term is subtracted.
    */
    public Term(Expression raw, boolean negated) {
        this.raw = raw;
        this.expression = ParenthesizedExpression.unwrap(raw);
        this.negated = negated;
    }

    public Expression getRaw() {
        return raw;
    }

    public Expression getExpression() {
        return expression;
    }

    /** Checks if the term is subtracted from the rest of a sum. */
    public boolean isNegated() {
        return negated;
    }

    @Override
    public String toString() {
        return (negated ? "-" : "+") + expression;
    }

}
