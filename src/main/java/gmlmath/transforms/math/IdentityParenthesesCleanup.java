package gmlmath.transforms.math;

import gmlmath.analysis.MathPatterns;
import gmlmath.hir.*;
import gmlmath.transforms.TransformPass;

import java.util.List;

/**
* Drops parentheses left around an operand that an identity removal
* produced, such as {@code (x)} after {@code (x * 1)} was simplified. The
* parentheses stay when they are the operand of {@code %} or {@code !}.
*/
public class IdentityParenthesesCleanup extends TransformPass {

    private static String pass_name = "[IdentityParenthesesCleanup]";

    public IdentityParenthesesCleanup(Traversable root) {
        super(root);
    }

    public String getPassName() {
        return pass_name;
    }

    public void start() {
        List<ParenthesizedExpression> parens =
                new DFIterator<ParenthesizedExpression>(root,
                        ParenthesizedExpression.class).getList();
        for (ParenthesizedExpression paren : parens) {
            if (paren.getParent() != null
                    && IRTools.isDescendantOf(paren, root)
                    && !StatementTools.isInOriginalForm(paren)) {
                cleanup(paren);
            }
        }
    }

    private void cleanup(ParenthesizedExpression paren) {
        Expression inner = paren.getExpression();
        if (paren.hasComments() || inner == null || !inner.isIdentityDerived()
                || !MathPatterns.isIdentityReplacementSafe(inner)) {
            return;
        }
        Traversable parent = paren.getParent();
        if (parent instanceof BinaryExpression && ((BinaryExpression)parent)
                .getOperator() == BinaryOperator.MODULUS) {
            return;
        }
        if (parent instanceof UnaryExpression && ((UnaryExpression)parent)
                .getOperator() == UnaryOperator.LOGICAL_NEGATION) {
            return;
        }
        MathRule.replace(paren, inner);
        PrintTools.printlnStatus(3, pass_name, "unwrapped", inner);
    }

}
