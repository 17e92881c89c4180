package gmlmath.hir;

import java.io.PrintWriter;

/**
* A plain name: a variable, a built-in constant such as {@code pi}, or the
* callee of a function call.
*/
public class Identifier extends Expression {

    private String name;

    /**
    * Creates an identifier with the given name.
    *
    * @param name the name of the identifier.
    */
    public Identifier(String name) {
        super(-1);
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException("invalid identifier name");
        }
        this.name = name;
    }

    /** Returns the name of the identifier. */
    public String getName() {
        return name;
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print(name);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && name.equals(((Identifier)o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

}
