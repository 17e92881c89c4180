package gmlmath.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* <b>CompoundStatement</b> represents a group of statements that are treated
* as a single statement.
*/
public class CompoundStatement extends Statement {

    /** Comments found after the last statement, before the closing brace */
    private List<Comment> closing_comments;

    /** Creates an empty compound statement. */
    public CompoundStatement() {
        super(4);
        closing_comments = null;
    }

    /**
    * Appends a comment printed after the last statement.
    *
    * @param comment the comment.
    */
    public void addClosingComment(Comment comment) {
        if (closing_comments == null) {
            closing_comments = new ArrayList<Comment>(1);
        }
        closing_comments.add(comment);
    }

    /** Returns the comments printed after the last statement. */
    @SuppressWarnings("unchecked")
    public List<Comment> getClosingComments() {
        return (closing_comments == null)
                ? (List<Comment>)empty_list : closing_comments;
    }

    /**
    * Adds a statement to the end of this compound statement.
    *
    * @param stmt The statement to add.
    * @throws IllegalArgumentException If <b>stmt</b> is null.
    * @throws NotAnOrphanException if <b>stmt</b> has a parent.
    */
    public void addStatement(Statement stmt) {
        addChild(stmt);
    }

    /**
    * Add a new statement before the reference statement.
    *
    * @param ref_stmt the reference statement.
    * @param new_stmt the statement to be added.
    * @throws IllegalArgumentException If <b>ref_stmt</b> is not found or
    * <b>new_stmt</b> is null.
    * @throws NotAnOrphanException if <b>new_stmt</b> has a parent.
    */
    public void addStatementBefore(Statement ref_stmt, Statement new_stmt) {
        int index = Tools.identityIndexOf(children, ref_stmt);
        if (index == -1) {
            throw new IllegalArgumentException();
        }
        addChild(index, new_stmt);
    }

    /** Returns a copy of the statement list. */
    public List<Statement> getStatements() {
        List<Statement> ret = new ArrayList<Statement>(children.size());
        for (Traversable t : children) {
            ret.add((Statement)t);
        }
        return ret;
    }

    /**
    * @throws NotAChildException if <b>child</b> is not a child.
    */
    @Override
    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index == -1) {
            throw new NotAChildException();
        }
        children.remove(index);
        child.setParent(null);
    }

    /**
    * Remove the given statement if it exists.
    *
    * @param stmt the statement to be removed.
    */
    public void removeStatement(Statement stmt) {
        removeChild(stmt);
    }

    @Override
    public CompoundStatement clone() {
        CompoundStatement o = (CompoundStatement)super.clone();
        if (closing_comments != null) {
            o.closing_comments = new ArrayList<Comment>(closing_comments.size());
            for (Comment comment : closing_comments) {
                o.closing_comments.add(comment.clone());
            }
        }
        return o;
    }

    /**
    * Prints the contained statements one per line, inserting a blank line
    * after every statement that asks for one, followed by the closing
    * comments.
    *
    * @param o the target print writer.
    */
    public void printStatements(PrintWriter o) {
        for (int i = 0; i < children.size(); i++) {
            Statement stmt = (Statement)children.get(i);
            if (i > 0) {
                o.print("\n");
                if (((Statement)children.get(i - 1)).hasFollowingBlankLine()) {
                    o.print("\n");
                }
            }
            stmt.print(o);
        }
        if (closing_comments != null) {
            for (int i = 0; i < closing_comments.size(); i++) {
                if (i > 0 || !children.isEmpty()) {
                    o.print("\n");
                }
                o.print(closing_comments.get(i).getText());
            }
        }
    }

    /** Checks if there is nothing to print inside the braces. */
    public boolean isEmpty() {
        return children.isEmpty()
                && (closing_comments == null || closing_comments.isEmpty());
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print("{\n");
        if (!isEmpty()) {
            StringWriter sw = new StringWriter(80);
            PrintWriter pw = new PrintWriter(sw);
            printStatements(pw);
            pw.flush();
            o.print(PrintTools.indentLines(sw.toString()));
            o.print("\n");
        }
        o.print("}");
    }

}
