package gmlmath.transforms;

import gmlmath.exec.OptionSet;
import gmlmath.hir.*;
import gmlmath.transforms.math.*;

/**
* Entry point of math normalization. Runs the passes in their fixed order on
* a program, a statement or a single expression and returns the same tree,
* changed in place:
* <ol>
* <li>division to multiplication ("convert-division"),</li>
* <li>the rule traversal,</li>
* <li>lengthdir assignment merging ("merge-lengthdir"),</li>
* <li>scalar condensing ("condense-scalars"),</li>
* <li>zero-numerator division ("zero-division"),</li>
* <li>identity parentheses cleanup ("cleanup-parentheses").</li>
* </ol>
*/
public final class MathNormalization {

    private static String pass_name = "[MathNormalization]";

    // No instantiation is used.
    private MathNormalization() {
    }

    /**
    * Normalizes a parsed program using its own source text.
    *
    * @param program the program.
    * @param options the options in effect.
    * @return the program.
    */
    public static Program normalize(Program program, OptionSet options) {
        normalize(program, NormalizationContext.forProgram(program, options));
        return program;
    }

    /**
    * Normalizes the tree. An expression without a parent is wrapped in a
    * temporary statement while the passes run, so it may be replaced as a
    * whole; the return value is then the expression that took its place.
    *
    * @param tree the tree to be normalized.
    * @param ctx the normalization context.
    * @return the normalized tree.
    */
    public static Traversable normalize(Traversable tree, NormalizationContext ctx) {
        if (tree == null) {
            return null;
        }
        ctx.setRootIfAbsent(tree);
        ExpressionStatement holder = null;
        Traversable root = tree;
        if (tree instanceof Expression && tree.getParent() == null) {
            holder = new ExpressionStatement((Expression)tree);
            root = holder;
        }
        double timer = Tools.getTime();
        if (ctx.isEnabled(OptionSet.CONVERT_DIVISION)) {
            TransformPass.run(new DivisionToMultiplication(root, ctx));
        }
        TransformPass.run(new MathTraversal(root, ctx));
        if (ctx.isEnabled(OptionSet.MERGE_LENGTHDIR)) {
            TransformPass.run(new LengthdirAssignmentMerger(root, ctx));
        }
        if (ctx.isEnabled(OptionSet.CONDENSE_SCALARS)) {
            TransformPass.run(new ScalarCondensing(root));
        }
        if (ctx.isEnabled(OptionSet.ZERO_DIVISION)) {
            TransformPass.run(new ZeroDivisionSimplifier(root, ctx));
        }
        if (ctx.isEnabled(OptionSet.CLEANUP_PARENTHESES)) {
            TransformPass.run(new IdentityParenthesesCleanup(root));
        }
        PrintTools.printlnStatus(1, pass_name, "done in",
                String.format("%.2f seconds", Tools.getTime(timer)));
        if (holder == null) {
            return tree;
        }
        Expression ret = holder.getExpression();
        ret.setParent(null);
        return ret;
    }

}
