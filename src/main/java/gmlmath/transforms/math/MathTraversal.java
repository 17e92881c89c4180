package gmlmath.transforms.math;

import gmlmath.hir.*;
import gmlmath.transforms.TransformPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
* Walks the tree depth-first and rewrites every expression with the rules of
* a {@link RuleTable} until none applies. A node is rewritten before its
* children are visited; when a rewrite below a node changes the tree, the
* rules of the node are tried again. Each node gets at most
* {@link #MAX_ITERATIONS} rounds, after which it is left as it is and its
* children are not visited. Declarations that hold a recorded original form
* are never entered.
*/
public class MathTraversal extends TransformPass {

    /** Upper bound of rewrite rounds spent on one node */
    public static final int MAX_ITERATIONS = 1000;

    private static String pass_name = "[MathTraversal]";

    private final NormalizationContext ctx;

    private final RuleTable rules;

    private final Set<Traversable> visited;

    private int num_rewrites;

    public MathTraversal(Traversable root, NormalizationContext ctx) {
        this(root, ctx, RuleTable.createDefault());
    }

    public MathTraversal(Traversable root, NormalizationContext ctx,
            RuleTable rules) {
        super(root);
        this.ctx = ctx;
        this.rules = rules;
        visited = Collections.newSetFromMap(
                new IdentityHashMap<Traversable, Boolean>());
        num_rewrites = 0;
    }

    public String getPassName() {
        return pass_name;
    }

    public void start() {
        visited.clear();
        num_rewrites = 0;
        visit(root);
        PrintTools.printlnStatus(2, pass_name, "rewrites:", num_rewrites);
    }

    /** Returns the number of rewrites performed by the last run. */
    public int getNumRewrites() {
        return num_rewrites;
    }

    private void visit(Traversable t) {
        if (t == null || !visited.add(t)) {
            return;
        }
        if (t instanceof VariableDeclaration
                && ((VariableDeclaration)t).isOriginalForm()) {
            return;
        }
        if (t instanceof Expression) {
            visitExpression((Expression)t);
        } else {
            visitChildren(t);
        }
    }

    private void visitChildren(Traversable t) {
        List<Traversable> children = new ArrayList<Traversable>(t.getChildren());
        for (Traversable child : children) {
            visit(child);
        }
    }

    private void visitExpression(Expression node) {
        Statement stmt = node.getStatement();
        boolean attached = (stmt != null && stmt.getParent() != null);
        int iterations = 0;
        while (true) {
            Traversable parent = node.getParent();
            int index = (parent == null) ? -1
                    : Tools.identityIndexOf(parent.getChildren(), node);
            MathRule<?> rule = applyFirst(node);
            if (rule == null) {
                int before = num_rewrites;
                visitChildren(node);
                if (num_rewrites == before || node.getParent() != parent
                        || (attached && stmt.getParent() == null)) {
                    return;
                }
            } else {
                num_rewrites++;
                PrintTools.printlnStatus(3, pass_name, rule.getName(), "->",
                        (index < 0) ? node : parent.getChildren().get(index));
                if (attached && stmt.getParent() == null) {
                    return;
                }
                if (index >= 0) {
                    List<Traversable> children = parent.getChildren();
                    if (index >= children.size()
                            || !(children.get(index) instanceof Expression)) {
                        return;
                    }
                    node = (Expression)children.get(index);
                }
                visited.add(node);
            }
            if (++iterations >= MAX_ITERATIONS) {
                PrintTools.printlnStatus(1, pass_name,
                        "giving up after", MAX_ITERATIONS, "rounds on", node);
                return;
            }
        }
    }

    // Returns the rule that changed the node, or null.
    private MathRule<?> applyFirst(Expression node) {
        if (node instanceof BinaryExpression) {
            for (MathRule<BinaryExpression> rule : rules.getBinaryRules()) {
                if (rule.apply((BinaryExpression)node, ctx)) {
                    return rule;
                }
            }
        } else if (node instanceof AssignmentExpression) {
            for (MathRule<AssignmentExpression> rule
                    : rules.getAssignmentRules()) {
                if (rule.apply((AssignmentExpression)node, ctx)) {
                    return rule;
                }
            }
        } else if (node instanceof FunctionCall) {
            for (MathRule<FunctionCall> rule : rules.getCallRules()) {
                if (rule.apply((FunctionCall)node, ctx)) {
                    return rule;
                }
            }
        }
        return null;
    }

}
