package gmlmath.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all expressions. Expressions are compared structurally when
* used in collections. Every expression carries an optional source span, an
* optional list of attached comments, and a marker telling whether it was
* produced by removing an identity operand.
*/
public abstract class Expression implements Cloneable, Traversable {

    /** Precedence of primary expressions (names, literals, calls, members) */
    public static final int PRIMARY_PRECEDENCE = 14;

    /** Precedence of prefix unary expressions */
    public static final int UNARY_PRECEDENCE = 13;

    /** The parent object of the expression */
    protected Traversable parent;

    /** All children must be Expressions. */
    protected List<Traversable> children;

    /** Offset of the first source character, or -1 if synthesized */
    protected int start_offset;

    /** Offset one past the last source character, or -1 if synthesized */
    protected int end_offset;

    /** Comments printed before this expression; null when none exist */
    protected List<Comment> comments;

    /** Comments printed after this expression; null when none exist */
    protected List<Comment> trailing_comments;

    /** Set when this node replaced an identity expression such as x * 1 */
    protected boolean identity_derived;

    /** Empty child list for expressions having no children */
    protected static final List empty_list =
            Collections.unmodifiableList(new ArrayList<Object>(0));

    /** Constructor for derived classes. */
    protected Expression() {
        this(1);
    }

    /**
    * Constructor for derived classes.
    *
    * @param size The initial size for the child list.
    */
    @SuppressWarnings("unchecked")
    protected Expression(int size) {
        parent = null;
        if (size < 0) {
            children = empty_list;
        } else {
            children = new ArrayList<Traversable>(size);
        }
        start_offset = -1;
        end_offset = -1;
        comments = null;
        trailing_comments = null;
        identity_derived = false;
    }

    /**
    * Creates and returns a deep copy of this expression. The copy keeps the
    * source span, the comments and the identity marker of the original.
    *
    * @return a deep copy of this expression.
    */
    @Override
    public Expression clone() {
        Expression o = null;
        try {
            o = (Expression)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.parent = null;
        if (children != empty_list) {
            o.children = new ArrayList<Traversable>(children.size());
            for (int i = 0; i < children.size(); i++) {
                Expression new_child = ((Expression)children.get(i)).clone();
                new_child.setParent(o);
                o.children.add(new_child);
            }
        }
        if (comments != null) {
            o.comments = new ArrayList<Comment>(comments.size());
            for (Comment comment : comments) {
                o.comments.add(comment.clone());
            }
        }
        if (trailing_comments != null) {
            o.trailing_comments =
                    new ArrayList<Comment>(trailing_comments.size());
            for (Comment comment : trailing_comments) {
                o.trailing_comments.add(comment.clone());
            }
        }
        return o;
    }

    /**
    * Checks if the given object has the same type with this expression and
    * its children are equal to this expression's. Sub classes with additional
    * fields call this method first and proceed with more checking.
    * @param o the object to be compared with.
    * @return true if the objects are structurally equal.
    */
    @Override
    public boolean equals(Object o) {
        if (o == null || this.getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    /**
    * Returns the hash code of the expression, consistent with the lexical
    * form printed by {@link #toString()}.
    */
    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /* Traversable interface */
    public List<Traversable> getChildren() {
        return children;
    }

    /* Traversable interface */
    public Traversable getParent() {
        return parent;
    }

    /**
    * Get the parent Statement containing this Expression.
    *
    * @return the enclosing Statement or null if this Expression
    *   is not inside a Statement.
    */
    public Statement getStatement() {
        Traversable t = this;
        do {
            t = t.getParent();
        } while (t != null && !(t instanceof Statement));
        return (Statement)t;
    }

    /**
    * Returns the binding strength of the expression used for deciding where
    * synthesized operands need parentheses when printed.
    */
    public int getPrecedence() {
        return PRIMARY_PRECEDENCE;
    }

    /**
    * Prints the leading comments, the expression itself and the trailing
    * comments. A line comment is always followed by a line break.
    *
    * @param o the target print writer.
    */
    public void print(PrintWriter o) {
        if (comments != null) {
            for (Comment comment : comments) {
                o.print(comment.getText());
                o.print(comment.isBlock() ? " " : "\n");
            }
        }
        defaultPrint(o);
        if (trailing_comments != null) {
            for (Comment comment : trailing_comments) {
                o.print(" ");
                o.print(comment.getText());
                if (!comment.isBlock()) {
                    o.print("\n");
                }
            }
        }
    }

    /**
    * Prints the expression without its comments.
    *
    * @param o the target print writer.
    */
    protected abstract void defaultPrint(PrintWriter o);

    /**
    * Prints an operand, wrapping it in parentheses when its precedence is
    * lower than the given minimum.
    */
    protected static void
            printOperand(Expression e, PrintWriter o, int min_precedence) {
        if (e.getPrecedence() < min_precedence) {
            o.print("(");
            e.print(o);
            o.print(")");
        } else {
            e.print(o);
        }
    }

    /**
    * This operation is not allowed.
    * @throws UnsupportedOperationException always
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Expressions do not support removal of arbitrary children.");
    }

    /**
    * @throws NotAnOrphanException if <b>t</b> has a parent object.
    * @throws IllegalArgumentException if <b>index</b> is out-of-range or
    * <b>t</b> is not an expression.
    */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        if (!(t instanceof Expression) || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        // Detach the old child
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    /* Traversable interface */
    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Swaps two expression on the IR tree.  If neither this expression nor
    * <var>expr</var> has a parent, then this function has no effect. Otherwise,
    * each expression ends up with the other's parent and exchange positions in
    * the parents' lists of children.
    *
    * @param expr The expression with which to swap this expression.
    * @throws IllegalArgumentException if <var>expr</var> is null.
    * @throws IllegalStateException if the parents do not list the
    *   expressions as their children.
    */
    public void swapWith(Expression expr) {
        if (expr == null) {
            throw new IllegalArgumentException();
        }
        if (this == expr) {
            // swap with self does nothing
            return;
        }
        // The rest of this must be done in a very particular order.
        Traversable this_parent = this.parent;
        Traversable expr_parent = expr.parent;
        int this_index = -1, expr_index = -1;
        if (this_parent != null) {
            this_index = Tools.identityIndexOf(this_parent.getChildren(), this);
            if (this_index == -1) {
                throw new IllegalStateException();
            }
        }
        if (expr_parent != null) {
            expr_index = Tools.identityIndexOf(expr_parent.getChildren(), expr);
            if (expr_index == -1) {
                throw new IllegalStateException();
            }
        }
        // detach both so setChild won't complain
        expr.parent = null;
        this.parent = null;
        if (this_parent != null) {
            this_parent.getChildren().set(this_index, expr);
            expr.setParent(this_parent);
        }
        if (expr_parent != null) {
            expr_parent.getChildren().set(expr_index, this);
            this.setParent(expr_parent);
        }
    }

    /** Returns the source offset of the first character, or -1. */
    public int getStart() {
        return start_offset;
    }

    /** Returns the source offset one past the last character, or -1. */
    public int getEnd() {
        return end_offset;
    }

    /** Checks if the expression carries a source span. */
    public boolean hasSpan() {
        return start_offset >= 0 && end_offset >= start_offset;
    }

    /**
    * Sets the source span of the expression.
    *
    * @param start the offset of the first character.
    * @param end the offset one past the last character.
    */
    public void setSpan(int start, int end) {
        start_offset = start;
        end_offset = end;
    }

    /**
    * Copies the source span of another expression onto this one.
    *
    * @param template the expression whose span is copied; may be null.
    * @return this expression.
    */
    public Expression copySpanFrom(Expression template) {
        if (template != null) {
            start_offset = template.start_offset;
            end_offset = template.end_offset;
        }
        return this;
    }

    /**
    * Returns the comments attached to this expression. The returned list is
    * empty and unmodifiable when there are none.
    */
    @SuppressWarnings("unchecked")
    public List<Comment> getComments() {
        return (comments == null) ? (List<Comment>)empty_list : comments;
    }

    /** Checks if any comment is attached to this expression. */
    public boolean hasComments() {
        return (comments != null && !comments.isEmpty())
                || (trailing_comments != null && !trailing_comments.isEmpty());
    }

    /**
    * Attaches the given comment to this expression.
    *
    * @param comment the comment to be attached.
    */
    public void addComment(Comment comment) {
        if (comments == null) {
            comments = new ArrayList<Comment>(1);
        }
        comments.add(comment);
    }

    /**
    * Returns the comments printed after this expression. The returned list
    * is empty and unmodifiable when there are none.
    */
    @SuppressWarnings("unchecked")
    public List<Comment> getTrailingComments() {
        return (trailing_comments == null)
                ? (List<Comment>)empty_list : trailing_comments;
    }

    /**
    * Attaches the given comment after this expression.
    *
    * @param comment the comment to be attached.
    */
    public void addTrailingComment(Comment comment) {
        if (trailing_comments == null) {
            trailing_comments = new ArrayList<Comment>(1);
        }
        trailing_comments.add(comment);
    }

    /**
    * Moves all comments of this expression onto another one, keeping their
    * leading or trailing position.
    *
    * @param target the expression receiving the comments.
    */
    public void transferCommentsTo(Expression target) {
        if (target == this) {
            return;
        }
        for (Comment comment : getComments()) {
            target.addComment(comment);
        }
        for (Comment comment : getTrailingComments()) {
            target.addTrailingComment(comment);
        }
        comments = null;
        trailing_comments = null;
    }

    /** Checks if this node was produced by removing an identity operand. */
    public boolean isIdentityDerived() {
        return identity_derived;
    }

    /**
    * Marks or unmarks this node as the result of an identity removal.
    *
    * @param f the new marker value.
    */
    public void setIdentityDerived(boolean f) {
        identity_derived = f;
    }

    /** Returns a string representation of the expression */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        PrintWriter pw = new PrintWriter(sw);
        print(pw);
        pw.flush();
        return sw.toString();
    }

    /**
    * Verifies three properties of this object:
    * (1) All children are not null, (2) the parent object has this
    * object as a child, (3) all children have this object as the parent.
    *
    * @throws IllegalStateException if any of the properties are not true.
    */
    public void verify() throws IllegalStateException {
        if (parent != null
                && Tools.identityIndexOf(parent.getChildren(), this) < 0) {
            throw new IllegalStateException(
                    "parent does not think this is a child");
        }
        for (Traversable t : children) {
            if (t == null) {
                throw new IllegalStateException("a child is null");
            }
            if (t.getParent() != this) {
                throw new IllegalStateException(
                        "a child does not think this is the parent");
            }
            ((Expression)t).verify();
        }
    }

    /**
    * Common operation used in constructors - adds the specified traversable
    * object at the end of the child list.
    *
    * @param t the new child object to be added.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

}
