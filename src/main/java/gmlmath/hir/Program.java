package gmlmath.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents an entire GML script. The top-level statements live in a
* {@link CompoundStatement} that prints without braces. The program keeps the
* source text it was parsed from so that passes can inspect the characters
* between two nodes.
*/
public final class Program implements Traversable {

    /** The only child is the top-level statement list. */
    private List<Traversable> children;

    private String source_text;

    /** Make an empty program. */
    public Program() {
        this(null);
    }

    /**
    * Make an empty program remembering the text it is parsed from.
    *
    * @param source_text the source text; may be null.
    */
    public Program(String source_text) {
        this.source_text = source_text;
        children = new ArrayList<Traversable>(1);
        CompoundStatement body = new CompoundStatement();
        children.add(body);
        body.setParent(this);
    }

    /** Returns the top-level statement list. */
    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(0);
    }

    /**
    * Appends a top-level statement.
    *
    * @param stmt the statement to be added.
    */
    public void addStatement(Statement stmt) {
        getBody().addStatement(stmt);
    }

    /** Returns the source text, or null when the program was built by hand. */
    public String getSourceText() {
        return source_text;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    /** A program is the root of the tree; its parent is always null. */
    public Traversable getParent() {
        return null;
    }

    public void setParent(Traversable t) {
        throw new UnsupportedOperationException("a program has no parent");
    }

    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "a program does not support removal of its statement list.");
    }

    public void setChild(int index, Traversable t) {
        throw new UnsupportedOperationException(
                "a program does not support replacement of its statement list.");
    }

    /**
    * Prints the whole script. The output ends with a newline unless the
    * script is empty.
    *
    * @param o the target print writer.
    */
    public void print(PrintWriter o) {
        CompoundStatement body = getBody();
        body.printStatements(o);
        if (!body.isEmpty()) {
            o.print("\n");
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(256);
        PrintWriter pw = new PrintWriter(sw);
        print(pw);
        pw.flush();
        return sw.toString();
    }

    /**
    * Checks the consistency of parent and child links in the whole tree.
    *
    * @throws IllegalStateException if a link is broken.
    */
    public void verify() throws IllegalStateException {
        getBody().verify();
    }

}
