package gmlmath.transforms.math;

import gmlmath.exec.OptionSet;
import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.*;

/**
* Applies a single rule once to a parsed expression held by a statement, so
* rules that replace the node have a slot to put the result in.
*/
final class RuleFixture {

    // No instantiation is used.
    private RuleFixture() {
    }

    static ExpressionStatement hold(String text) throws ParseException {
        return new ExpressionStatement(new Parser().parseExpression(text));
    }

    /**
    * Returns the printed result, or null if the rule declined.
    */
    static <T extends Expression> String
            rewrite(MathRule<T> rule, Class<T> type, String text)
            throws ParseException {
        ExpressionStatement holder = hold(text);
        NormalizationContext ctx = new NormalizationContext(text, null,
                holder, new OptionSet());
        if (!rule.apply(type.cast(holder.getExpression()), ctx)) {
            return null;
        }
        holder.verify();
        return holder.getExpression().toString();
    }

    static String binary(MathRule<BinaryExpression> rule, String text)
            throws ParseException {
        return rewrite(rule, BinaryExpression.class, text);
    }

    static String call(MathRule<FunctionCall> rule, String text)
            throws ParseException {
        return rewrite(rule, FunctionCall.class, text);
    }

}
