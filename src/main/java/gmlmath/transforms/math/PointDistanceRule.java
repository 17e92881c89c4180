package gmlmath.transforms.math;

import gmlmath.analysis.*;
import gmlmath.analysis.MathPatterns.Difference;
import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
* Rewrites the root of a sum of squared differences as a distance:
* {@code sqrt((x2 - x1) * (x2 - x1) + (y2 - y1) * (y2 - y1))} becomes
* {@code point_distance(x1, y1, x2, y2)}. Three coordinates give
* {@code point_distance_3d}; {@code power(s, 0.5)} is accepted in place of
* {@code sqrt(s)}.
*/
public class PointDistanceRule extends MathRule<FunctionCall> {

    public PointDistanceRule() {
        super("point-distance");
    }

    public boolean apply(FunctionCall node, NormalizationContext ctx) {
        if (CommentGuard.hasCommentWithin(node, ctx.getCommentSource())) {
            return false;
        }
        String name = node.getCalleeName();
        Expression radicand;
        if ("sqrt".equals(name) && node.getNumArguments() == 1) {
            radicand = node.getArgument(0);
        } else if ("power".equals(name) && node.getNumArguments() == 2
                && NumericEvaluator.isHalfExponent(node.getArgument(1))) {
            radicand = node.getArgument(0);
        } else {
            return false;
        }
        List<Difference> diffs = matchSquaredDifferences(radicand);
        if (diffs == null) {
            return false;
        }
        List<Expression> args = new ArrayList<Expression>();
        for (Difference diff : diffs) {
            args.add(diff.getSubtrahend().clone());
        }
        for (Difference diff : diffs) {
            args.add(diff.getMinuend().clone());
        }
        String callee = (diffs.size() == 2) ? "point_distance"
                : "point_distance_3d";
        replace(node, createCall(callee, node, args));
        return true;
    }

    private static List<Difference> matchSquaredDifferences(Expression e) {
        List<Expression> terms = new ArrayList<Expression>();
        ChainDecomposer.collectAdditionTerms(e, terms);
        if (terms.size() < 2 || terms.size() > 3) {
            return null;
        }
        List<Difference> ret = new ArrayList<Difference>();
        for (Expression term : terms) {
            if (!NumericEvaluator.isBinary(term, BinaryOperator.MULTIPLY)
                    || term.hasComments()) {
                return null;
            }
            BinaryExpression product = (BinaryExpression)term;
            Expression lhs = product.getLHS();
            Expression rhs = product.getRHS();
            if (!Equivalence.isEquivalent(lhs, rhs)
                    && !Equivalence.isApproximatelyEquivalent(lhs, rhs)) {
                return null;
            }
            Difference diff = MathPatterns.matchDifference(lhs);
            if (diff == null) {
                return null;
            }
            ret.add(diff);
        }
        return ret;
    }

}
