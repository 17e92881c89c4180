package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.MathPatterns;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

/** Rewrites {@code ln(x) / ln(2)} as {@code log2(x)}. */
public class Log2Rule extends MathRule<BinaryExpression> {

    public Log2Rule() {
        super("log2");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.DIVIDE
                || CommentGuard.hasCommentWithin(node, ctx.getCommentSource())) {
            return false;
        }
        FunctionCall numerator = MathPatterns.matchCall(node.getLHS(), "ln", 1);
        FunctionCall denominator = MathPatterns.matchCall(node.getRHS(), "ln", 1);
        if (numerator == null || denominator == null
                || !NumericEvaluator.isLiteralNumber(ParenthesizedExpression
                        .unwrap(denominator.getArgument(0)), 2)) {
            return false;
        }
        replace(node, createCall("log2", node, numerator.getArgument(0).clone()));
        return true;
    }

}
