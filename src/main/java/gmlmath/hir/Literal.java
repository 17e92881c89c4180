package gmlmath.hir;

import java.io.PrintWriter;

/**
* A literal constant. The raw source text is kept as the value so numbers
* print exactly the way they were written, and string or boolean literals
* pass through untouched.
*/
public class Literal extends Expression {

    private String value;

    /** Readable unit fraction such as (1/144) for a condensed coefficient */
    private String ratio_hint;

    /**
    * Creates a literal with the given raw text.
    *
    * @param value the literal text, e.g. {@code 0.5}, {@code $FF} or
    *   {@code "text"}.
    */
    public Literal(String value) {
        super(-1);
        if (value == null) {
            throw new IllegalArgumentException("literal value is null");
        }
        this.value = value;
    }

    /** Returns the raw text of the literal. */
    public String getValue() {
        return value;
    }

    /**
    * Replaces the raw text of the literal.
    *
    * @param value the new literal text.
    */
    public void setValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("literal value is null");
        }
        this.value = value;
    }

    /** Returns the unit-fraction hint of a condensed coefficient, or null. */
    public String getRatioHint() {
        return ratio_hint;
    }

    /**
    * Attaches a readable unit-fraction form to a condensed coefficient. The
    * enclosing statement prints it as a trailing comment.
    *
    * @param hint the fraction text such as {@code (1/144)}; null removes it.
    */
    public void setRatioHint(String hint) {
        ratio_hint = hint;
    }

    /**
    * Finds the ratio hint of an expression: the hint of the rightmost literal
    * reached through binary and assignment right-hand sides and signs.
    *
    * @param e the expression; may be null.
    * @return the hint or null.
    */
    public static String findRatioHint(Expression e) {
        while (e instanceof BinaryExpression || e instanceof AssignmentExpression
                || e instanceof UnaryExpression) {
            if (e instanceof BinaryExpression) {
                e = ((BinaryExpression)e).getRHS();
            } else if (e instanceof AssignmentExpression) {
                e = ((AssignmentExpression)e).getRHS();
            } else {
                e = ((UnaryExpression)e).getExpression();
            }
        }
        return (e instanceof Literal) ? ((Literal)e).ratio_hint : null;
    }

    /** Checks if the literal is a quoted string. */
    public boolean isString() {
        return value.startsWith("\"") || value.startsWith("'");
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print(value);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value.equals(((Literal)o).value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

}
