package gmlmath.hir;

import java.util.List;

/**
* <b>IRTools</b> provides tools that perform search/replace in the IR tree.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Puts {@code repl} into the slot of the parent of {@code old}. Unlike
    * {@link Expression#swapWith}, the replacement may still hang below
    * {@code old} (for example when lifting the operand of a parenthesized
    * expression); the stale link inside the discarded subtree is left as is.
    *
    * @param old the expression being replaced; must have a parent.
    * @param repl the replacement.
    * @throws IllegalArgumentException if {@code old} has no parent.
    * @throws NotAChildException if the parent does not list {@code old}.
    */
    public static void replaceExpression(Expression old, Expression repl) {
        if (old == repl) {
            return;
        }
        Traversable parent = old.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("expression has no parent");
        }
        List<Traversable> children = parent.getChildren();
        int index = Tools.identityIndexOf(children, old);
        if (index < 0) {
            throw new NotAChildException();
        }
        Traversable repl_parent = repl.getParent();
        if (repl_parent != null && !isDescendantOf(repl, old)) {
            throw new NotAnOrphanException(repl.getClass().getName());
        }
        children.set(index, repl);
        repl.setParent(parent);
        old.setParent(null);
    }

    /**
    * Returns the nearest ancestor object of the given traversable object
    * that has the specified type.
    *
    * @param t the traversable object to be searched from.
    * @param type the IR type being searched for.
    * @return the youngest ancestor of {@code t} having the type {@code type}.
    */
    @SuppressWarnings("unchecked")
    public static <T extends Traversable> T
            getAncestorOfType(Traversable t, Class<T> type) {
        if (t == null) {
            return null;
        }
        Traversable ret = t.getParent();
        while (ret != null && !type.isInstance(ret)) {
            ret = ret.getParent();
        }
        return (T)ret;
    }

    /**
    * Returns a list of descendents of the traversable object {@code t} with the
    * specified type {@code type}.
    *
    * @param t the traversable object to be searched.
    * @param type the IR type to be searched for.
    * @return the list of descendents having the type {@code type}.
    */
    public static <T extends Traversable> List<T>
            getDescendentsOfType(Traversable t, Class<T> type) {
        List<T> ret = (new DFIterator<T>(t, type)).getList();
        if (type.isInstance(t)) {
            ret.remove(0);
        }
        return ret;
    }

    /**
    * Checks if the specified traversable object {@code des} is a descendant of
    * the other traversable object {@code anc} in the IR tree.
    *
    * @param des a possible descendant of {@code anc}.
    * @param anc a possible ancestor of {@code des}.
    * @return true if {@code des} is a descendant of {@code anc}, false if not.
    */
    public static boolean isDescendantOf(Traversable des, Traversable anc) {
        Traversable t = des;
        while (t != null && t != anc) {
            t = t.getParent();
        }
        return (des != anc && t == anc);
    }

    /**
    * Checks if the tree rooted at {@code t} contains an expression of the
    * given class.
    *
    * @param t the traversable object to be searched.
    * @param type the IR type to be searched for.
    * @return true if an instance is found.
    */
    public static boolean
            containsClass(Traversable t, Class<? extends Traversable> type) {
        return new DFIterator<Traversable>(t, type).hasNext();
    }

    /**
    * Checks if any expression in the tree rooted at {@code t} has a comment
    * attached.
    *
    * @param t the traversable object to be searched.
    * @return true if a commented expression is found.
    */
    public static boolean containsComments(Traversable t) {
        DFIterator<Expression> iter =
                new DFIterator<Expression>(t, Expression.class);
        while (iter.hasNext()) {
            if (iter.next().hasComments()) {
                return true;
            }
        }
        return false;
    }

    /**
    * Returns the program that contains {@code t}.
    *
    * @param t the traversable object.
    * @return the enclosing program or null if {@code t} is detached.
    */
    public static Program getProgram(Traversable t) {
        if (t instanceof Program) {
            return (Program)t;
        }
        return getAncestorOfType(t, Program.class);
    }

}
