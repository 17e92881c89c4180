package gmlmath.transforms.math;

import gmlmath.analysis.CommentGuard;
import gmlmath.analysis.ChainDecomposer;
import gmlmath.analysis.Equivalence;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
* Rewrites a sum of two or three pairwise products as a dot product:
* {@code ax * bx + ay * by} becomes {@code dot_product(ax, ay, bx, by)} and
* the three-term form becomes {@code dot_product_3d}. Sums containing a
* square are left for the distance rules.
*/
public class DotProductRule extends MathRule<BinaryExpression> {

    public DotProductRule() {
        super("dot-product");
    }

    public boolean apply(BinaryExpression node, NormalizationContext ctx) {
        if (node.getOperator() != BinaryOperator.ADD
                || CommentGuard.hasCommentWithin(node, ctx.getCommentSource())) {
            return false;
        }
        List<Expression> terms = new ArrayList<Expression>();
        ChainDecomposer.collectAdditionTerms(node, terms);
        if (terms.size() < 2 || terms.size() > 3) {
            return false;
        }
        List<Expression> left = new ArrayList<Expression>();
        List<Expression> right = new ArrayList<Expression>();
        for (Expression term : terms) {
            if (!NumericEvaluator.isBinary(term, BinaryOperator.MULTIPLY)
                    || term.hasComments()) {
                return false;
            }
            BinaryExpression product = (BinaryExpression)term;
            if (Equivalence.isEquivalent(product.getLHS(), product.getRHS())) {
                return false;
            }
            left.add(product.getLHS());
            right.add(product.getRHS());
        }
        List<Expression> args = new ArrayList<Expression>();
        for (Expression e : left) {
            args.add(ParenthesizedExpression.unwrap(e).clone());
        }
        for (Expression e : right) {
            args.add(ParenthesizedExpression.unwrap(e).clone());
        }
        String name = (terms.size() == 2) ? "dot_product" : "dot_product_3d";
        FunctionCall call = createCall(name, node, args);
        replace(node, call);
        unwrapEnclosingParentheses(call);
        return true;
    }

}
