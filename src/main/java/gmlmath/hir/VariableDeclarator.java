package gmlmath.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* One name introduced by a {@code var} statement, with an optional
* initializer. The first child is the declared {@link Identifier} and the
* second child, if any, is the initial value.
*/
public class VariableDeclarator implements Cloneable, Traversable {

    private Traversable parent;

    private List<Traversable> children;

    /**
    * Creates a declarator without an initializer.
    *
    * @param id the declared name.
    */
    public VariableDeclarator(Identifier id) {
        this(id, null);
    }

    /**
    * Creates a declarator with the given initial value.
    *
    * @param id the declared name.
    * @param init the initial value; may be null.
    */
    public VariableDeclarator(Identifier id, Expression init) {
        parent = null;
        children = new ArrayList<Traversable>(2);
        addChild(id);
        if (init != null) {
            addChild(init);
        }
    }

    private void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    /** Returns the declared identifier. */
    public Identifier getID() {
        return (Identifier)children.get(0);
    }

    /** Returns the declared name. */
    public String getName() {
        return getID().getName();
    }

    /** Returns the initial value, or null if there is none. */
    public Expression getInitializer() {
        return (children.size() > 1) ? (Expression)children.get(1) : null;
    }

    /**
    * Sets or removes the initial value.
    *
    * @param init the new initial value; null removes the initializer.
    * @throws NotAnOrphanException if <b>init</b> has a parent.
    */
    public void setInitializer(Expression init) {
        if (init == null) {
            if (children.size() > 1) {
                children.remove(1).setParent(null);
            }
        } else if (children.size() > 1) {
            setChild(1, init);
        } else {
            addChild(init);
        }
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Declarators refuse to lose their name; use {@link #setInitializer}
    * with a null argument to drop the initial value.
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Declarators do not support removal of arbitrary children.");
    }

    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        if (index < 0 || index >= children.size()
                || (index == 0 && !(t instanceof Identifier))
                || !(t instanceof Expression)) {
            throw new IllegalArgumentException();
        }
        children.get(index).setParent(null);
        children.set(index, t);
        t.setParent(this);
    }

    @Override
    public VariableDeclarator clone() {
        Expression init = getInitializer();
        return new VariableDeclarator((Identifier)getID().clone(),
                (init == null) ? null : init.clone());
    }

    public void print(PrintWriter o) {
        getID().print(o);
        Expression init = getInitializer();
        if (init != null) {
            o.print(" = ");
            init.print(o);
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        PrintWriter pw = new PrintWriter(sw);
        print(pw);
        pw.flush();
        return sw.toString();
    }

}
