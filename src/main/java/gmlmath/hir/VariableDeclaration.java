package gmlmath.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* A {@code var} statement declaring one or more local variables. A declaration
* can be flagged as an <i>original form</i>, which keeps a copy of the
* hand-written arithmetic next to its simplified replacement. Original forms
* print as a comment and are never rewritten.
*/
public class VariableDeclaration extends Statement {

    /** Prefix printed in front of an original-form declaration */
    public static final String ORIGINAL_PREFIX = "// original: ";

    private boolean original_form;

    private boolean original_recorded;

    /**
    * Creates a declaration of a single variable.
    *
    * @param declarator the declared variable.
    */
    public VariableDeclaration(VariableDeclarator declarator) {
        super(1);
        addChild(declarator);
        original_form = false;
        original_recorded = false;
    }

    /**
    * Creates a declaration of several variables.
    *
    * @param declarators the declared variables, in order; must not be empty.
    */
    public VariableDeclaration(List<VariableDeclarator> declarators) {
        super(declarators.size());
        if (declarators.isEmpty()) {
            throw new IllegalArgumentException("no declarator");
        }
        for (VariableDeclarator d : declarators) {
            addChild(d);
        }
        original_form = false;
        original_recorded = false;
    }

    /** Returns the n-th declarator. */
    public VariableDeclarator getDeclarator(int n) {
        return (VariableDeclarator)children.get(n);
    }

    /** Returns a copy of the list of declarators. */
    public List<VariableDeclarator> getDeclarators() {
        List<VariableDeclarator> ret =
                new ArrayList<VariableDeclarator>(children.size());
        for (Traversable t : children) {
            ret.add((VariableDeclarator)t);
        }
        return ret;
    }

    /** Returns the number of declared variables. */
    public int getNumDeclarators() {
        return children.size();
    }

    /**
    * Looks up a declarator by variable name.
    *
    * @param name the variable name.
    * @return the matching declarator or null.
    */
    public VariableDeclarator findDeclarator(String name) {
        for (Traversable t : children) {
            VariableDeclarator d = (VariableDeclarator)t;
            if (d.getName().equals(name)) {
                return d;
            }
        }
        return null;
    }

    /** Checks if this declaration is a preserved copy of the original text. */
    public boolean isOriginalForm() {
        return original_form;
    }

    public void setOriginalForm(boolean f) {
        original_form = f;
    }

    /** Checks if an original-form copy was already recorded for this one. */
    public boolean isOriginalRecorded() {
        return original_recorded;
    }

    public void setOriginalRecorded(boolean f) {
        original_recorded = f;
    }

    @Override
    public VariableDeclaration clone() {
        return (VariableDeclaration)super.clone();
    }

    @Override
    protected String getRatioHint() {
        for (VariableDeclarator declarator : getDeclarators()) {
            String hint = Literal.findRatioHint(declarator.getInitializer());
            if (hint != null) {
                return hint;
            }
        }
        return null;
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        if (original_form) {
            o.print(ORIGINAL_PREFIX);
        }
        o.print("var ");
        PrintTools.printListWithComma(children, o);
        o.print(";");
    }

}
