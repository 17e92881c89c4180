package gmlmath.transforms.math;

import gmlmath.analysis.Equivalence;
import gmlmath.hir.*;

import java.util.List;

/**
* Statement-level queries and edits used by rules whose rewrite reaches past
* the expression they matched. Every query is scoped to the statement list
* that holds the statement in question; nothing searches the whole tree.
*/
public final class StatementTools {

    /** Suffix of a declaration that repeats a simplified initializer */
    public static final String ALIAS_SUFFIX = "_simplified";

    // No instantiation is used.
    private StatementTools() {
    }

    /**
    * Returns the declarator whose initializer is the given expression.
    *
    * @param init the candidate initializer.
    * @return the declarator or null.
    */
    public static VariableDeclarator getDeclaratorOf(Expression init) {
        Traversable parent = (init == null) ? null : init.getParent();
        if (parent instanceof VariableDeclarator
                && ((VariableDeclarator)parent).getInitializer() == init) {
            return (VariableDeclarator)parent;
        }
        return null;
    }

    /**
    * Returns the statement list holding the statement, or null if the
    * statement is the body of another statement.
    */
    public static CompoundStatement getBlock(Statement stmt) {
        Traversable parent = stmt.getParent();
        return (parent instanceof CompoundStatement)
                ? (CompoundStatement)parent : null;
    }

    /**
    * Checks if the node sits inside a declaration that holds a recorded
    * original form.
    */
    public static boolean isInOriginalForm(Traversable t) {
        VariableDeclaration decl = (t instanceof VariableDeclaration)
                ? (VariableDeclaration)t
                : IRTools.getAncestorOfType(t, VariableDeclaration.class);
        return (decl != null && decl.isOriginalForm());
    }

    /**
    * Checks if an identifier with the given name occurs in the tree.
    */
    public static boolean references(Traversable t, String name) {
        DFIterator<Identifier> iter =
                new DFIterator<Identifier>(t, Identifier.class);
        while (iter.hasNext()) {
            if (iter.next().getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Looks backwards from the statement, within its statement list, for the
    * single-variable declaration of the name. The search gives up at the
    * first statement in between that mentions the name, so the declared
    * value is known to reach the statement unchanged.
    *
    * @param stmt the statement the search starts from; excluded.
    * @param name the variable name.
    * @return the declaration or null.
    */
    public static VariableDeclaration
            findPrecedingDeclaration(Statement stmt, String name) {
        CompoundStatement block = getBlock(stmt);
        if (block == null) {
            return null;
        }
        List<Statement> stmts = block.getStatements();
        int index = Tools.identityIndexOf(stmts, stmt);
        for (int i = index - 1; i >= 0; i--) {
            Statement s = stmts.get(i);
            if (s instanceof VariableDeclaration) {
                VariableDeclaration decl = (VariableDeclaration)s;
                if (decl.isOriginalForm()) {
                    continue;
                }
                if (decl.findDeclarator(name) != null) {
                    return (decl.getNumDeclarators() == 1) ? decl : null;
                }
            }
            if (references(s, name)) {
                return null;
            }
        }
        return null;
    }

    /**
    * Looks forwards from the statement, within its statement list, for the
    * single-variable declaration of the name.
    *
    * @param stmt the statement the search starts from; excluded.
    * @param name the variable name.
    * @return the declaration or null.
    */
    public static VariableDeclaration
            findFollowingDeclaration(Statement stmt, String name) {
        CompoundStatement block = getBlock(stmt);
        if (block == null) {
            return null;
        }
        List<Statement> stmts = block.getStatements();
        int index = Tools.identityIndexOf(stmts, stmt);
        for (int i = index + 1; i < stmts.size(); i++) {
            Statement s = stmts.get(i);
            if (s instanceof VariableDeclaration) {
                VariableDeclaration decl = (VariableDeclaration)s;
                if (!decl.isOriginalForm() && decl.findDeclarator(name) != null) {
                    return (decl.getNumDeclarators() == 1) ? decl : null;
                }
            }
        }
        return null;
    }

    /**
    * Removes the statement from its statement list. A blank line that
    * followed the removed statement is kept by moving the request to the
    * statement before it.
    *
    * @param stmt the statement to be removed.
    * @return false if the statement is not part of a statement list.
    */
    public static boolean removeStatement(Statement stmt) {
        CompoundStatement block = getBlock(stmt);
        if (block == null) {
            return false;
        }
        List<Statement> stmts = block.getStatements();
        int index = Tools.identityIndexOf(stmts, stmt);
        if (stmt.hasFollowingBlankLine() && index > 0) {
            stmts.get(index - 1).setFollowingBlankLine(true);
        }
        block.removeStatement(stmt);
        return true;
    }

    /**
    * Inserts a copy of the declaration holding the simplified initializer,
    * with the given expression as its initializer, in front of it. The copy is
    * flagged as an original form so later passes leave it alone. Nothing is
    * done when the declaration declares several variables or already has a
    * recorded copy.
    *
    * @param simplified the simplified initializer.
    * @param original the expression before simplification; must be orphan.
    * @return true if a copy was inserted.
    */
    public static boolean
            recordOriginal(Expression simplified, Expression original) {
        VariableDeclarator declarator = getDeclaratorOf(simplified);
        if (declarator == null
                || !(declarator.getParent() instanceof VariableDeclaration)) {
            return false;
        }
        VariableDeclaration decl = (VariableDeclaration)declarator.getParent();
        CompoundStatement block = getBlock(decl);
        if (block == null || decl.getNumDeclarators() != 1
                || decl.isOriginalRecorded() || decl.isOriginalForm()) {
            return false;
        }
        VariableDeclaration copy = decl.clone();
        copy.getDeclarator(0).setInitializer(original);
        copy.clearComments();
        copy.setOriginalForm(true);
        copy.setFollowingBlankLine(false);
        block.addStatementBefore(decl, copy);
        decl.setOriginalRecorded(true);
        PrintTools.printlnStatus(3, "[RecordOriginal]", "kept", copy);
        return true;
    }

    /**
    * Removes a later {@code var <name>_simplified = e;} when the declaration
    * of {@code <name>} now has the equivalent initializer {@code e} and no
    * statement after the alias mentions it.
    *
    * @param simplified the simplified initializer.
    * @return true if an alias declaration was removed.
    */
    public static boolean removeSimplifiedAlias(Expression simplified) {
        VariableDeclarator declarator = getDeclaratorOf(simplified);
        if (declarator == null
                || !(declarator.getParent() instanceof VariableDeclaration)) {
            return false;
        }
        String alias_name = declarator.getName() + ALIAS_SUFFIX;
        VariableDeclaration alias = findFollowingDeclaration(
                (Statement)declarator.getParent(), alias_name);
        if (alias == null || alias.hasComments()) {
            return false;
        }
        Expression alias_init = alias.getDeclarator(0).getInitializer();
        if (alias_init == null
                || !Equivalence.isEquivalent(alias_init, simplified)) {
            return false;
        }
        List<Statement> stmts = getBlock(alias).getStatements();
        for (int i = Tools.identityIndexOf(stmts, alias) + 1;
                i < stmts.size(); i++) {
            if (references(stmts.get(i), alias_name)) {
                return false;
            }
        }
        PrintTools.printlnStatus(3, "[RemoveAlias]", "removed", alias);
        return removeStatement(alias);
    }

}
