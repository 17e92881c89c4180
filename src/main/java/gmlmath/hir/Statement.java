package gmlmath.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all statements. Statements compare by identity, carry the
* comments that precede them in the source, an optional comment trailing them
* on the same line, and a flag requesting a blank line after them.
*/
public abstract class Statement implements Cloneable, Traversable {

    /** The parent traversable object */
    protected Traversable parent;

    /** The list of children of the statement */
    protected List<Traversable> children;

    /** Offset of the first source character, or -1 if synthesized */
    protected int start_offset;

    /** Offset one past the last source character, or -1 if synthesized */
    protected int end_offset;

    /** Comments printed on their own lines before the statement */
    protected List<Comment> comments;

    /** Comment printed after the statement on the same line */
    protected Comment trailing_comment;

    /** Whether a blank line follows the statement when printed */
    protected boolean following_blank_line;

    /** Empty child list for statements with no child */
    protected static final List empty_list =
            Collections.unmodifiableList(new ArrayList<Object>(0));

    /** Constructor for derived classes. */
    protected Statement() {
        this(1);
    }

    /**
    * Constructor for derived classes that preallocates
    * space for multiple children.
    *
    * @param size The expected number of children for this statement.
    */
    @SuppressWarnings("unchecked")
    protected Statement(int size) {
        parent = null;
        if (size < 0) {
            children = empty_list;
        } else {
            children = new ArrayList<Traversable>(size);
        }
        start_offset = -1;
        end_offset = -1;
        comments = null;
        trailing_comment = null;
        following_blank_line = false;
    }

    /** Returns a deep copy of the statement */
    @Override
    public Statement clone() {
        Statement o = null;
        try {
            o = (Statement)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.parent = null;
        if (children != empty_list) {
            o.children = new ArrayList<Traversable>(children.size());
            for (int i = 0; i < children.size(); i++) {
                Traversable o_child = cloneChild(children.get(i));
                o_child.setParent(o);
                o.children.add(o_child);
            }
        }
        if (comments != null) {
            o.comments = new ArrayList<Comment>(comments.size());
            for (Comment comment : comments) {
                o.comments.add(comment.clone());
            }
        }
        if (trailing_comment != null) {
            o.trailing_comment = trailing_comment.clone();
        }
        return o;
    }

    /** Deep-copies a child of any IR kind. */
    static Traversable cloneChild(Traversable child) {
        if (child instanceof Statement) {
            return ((Statement)child).clone();
        } else if (child instanceof Expression) {
            return ((Expression)child).clone();
        } else if (child instanceof VariableDeclarator) {
            return ((VariableDeclarator)child).clone();
        }
        throw new InternalError("unknown child type " + child);
    }

    /**
    * Compares the statement with the specified object for equality.
    *
    * @param o the object to be compared.
    * @return true if {@code (o == this)}, false otherwise.
    */
    @Override
    public boolean equals(Object o) {
        return (o == this);
    }

    /**
    * Returns the identity hash code of the current statement object.
    */
    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    /**
    * Prints the leading comments, the statement, and the trailing comment.
    *
    * @param o the target print writer.
    */
    public void print(PrintWriter o) {
        if (comments != null) {
            for (Comment comment : comments) {
                o.print(comment.getText());
                o.print("\n");
            }
        }
        defaultPrint(o);
        String hint = getRatioHint();
        if (hint != null) {
            o.print(" /* ");
            o.print(hint);
            o.print(" */");
        }
        if (trailing_comment != null) {
            o.print(" ");
            o.print(trailing_comment.getText());
        }
    }

    /**
    * Returns the unit-fraction hint printed after the statement, or null.
    * Statements holding an expression directly override this.
    */
    protected String getRatioHint() {
        return null;
    }

    /**
    * Prints the statement itself without its comments.
    *
    * @param o the target print writer.
    */
    protected abstract void defaultPrint(PrintWriter o);

    /**
    * Removes a specific child of this statement;
    * some statements do not support this method.
    *
    * @param child The child to remove.
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
            "This statement does not support removal of arbitrary children.");
    }

    public void setChild(int index, Traversable t) {
        if (t == null || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        // Detach the old child
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Inserts the specified traversable object at the end of the child list.
    *
    * @param t the traversable object to be inserted.
    * @throws IllegalArgumentException if <b>t</b> is null.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t == null) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    /**
    * Inserts the specified traversable object at the specified position.
    *
    * @param t the traversable object to be inserted.
    * @throws IllegalArgumentException if <b>t</b> is null or index is
    * out-of-bound.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(int index, Traversable t) {
        if (t == null || index < 0 || index > children.size()) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(index, t);
        t.setParent(this);
    }

    public int getStart() {
        return start_offset;
    }

    public int getEnd() {
        return end_offset;
    }

    /**
    * Sets the source span of the statement.
    *
    * @param start the offset of the first character.
    * @param end the offset one past the last character.
    */
    public void setSpan(int start, int end) {
        start_offset = start;
        end_offset = end;
    }

    /**
    * Returns the comments preceding this statement; the list is empty and
    * unmodifiable when there are none.
    */
    @SuppressWarnings("unchecked")
    public List<Comment> getComments() {
        return (comments == null) ? (List<Comment>)empty_list : comments;
    }

    /** Checks if any comment precedes or trails this statement. */
    public boolean hasComments() {
        return (comments != null && !comments.isEmpty())
                || trailing_comment != null;
    }

    /**
    * Attaches a comment printed before the statement.
    *
    * @param comment the comment to be attached.
    */
    public void addComment(Comment comment) {
        if (comments == null) {
            comments = new ArrayList<Comment>(1);
        }
        comments.add(comment);
    }

    /** Drops the leading and trailing comments of this statement. */
    public void clearComments() {
        comments = null;
        trailing_comment = null;
    }

    /** Returns the comment trailing this statement, or null. */
    public Comment getTrailingComment() {
        return trailing_comment;
    }

    /**
    * Sets the comment trailing this statement on the same line.
    *
    * @param comment the trailing comment; null removes it.
    */
    public void setTrailingComment(Comment comment) {
        trailing_comment = comment;
    }

    /** Checks if a blank line is printed after this statement. */
    public boolean hasFollowingBlankLine() {
        return following_blank_line;
    }

    /**
    * Requests or cancels a blank line after this statement.
    *
    * @param f true to print a blank line after the statement.
    */
    public void setFollowingBlankLine(boolean f) {
        following_blank_line = f;
    }

    /** Returns a string representation of the statement */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
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
        for (Traversable child : children) {
            if (child == null) {
                throw new IllegalStateException("a child is null");
            }
            if (child.getParent() != this) {
                throw new IllegalStateException(
                        "a child does not think this is the parent");
            }
            if (child instanceof Statement) {
                ((Statement)child).verify();
            } else if (child instanceof Expression) {
                ((Expression)child).verify();
            } else if (child instanceof VariableDeclarator) {
                for (Traversable t : child.getChildren()) {
                    if (t.getParent() != child) {
                        throw new IllegalStateException(
                                "a declarator part has a wrong parent");
                    }
                    ((Expression)t).verify();
                }
            }
        }
    }

}
