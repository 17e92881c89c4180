package gmlmath.transforms.math;

import gmlmath.analysis.*;

import java.util.ArrayList;
import java.util.List;

/**
* The numeric part of a decomposed product: the running coefficient, the
* products of the numeric numerators and denominators, and the symbolic
* factors left over. Used by the scalar condensing rules.
*/
class ScalarFactors {

    List<Term> symbolic;
    double coefficient;
    boolean has_numeric;
    int meaningful;
    double numerator_product;
    double denominator_product;
    boolean has_numeric_numerator;
    int numeric_denominators;

    private ScalarFactors() {
        symbolic = new ArrayList<Term>();
        coefficient = 1;
        has_numeric = false;
        meaningful = 0;
        numerator_product = 1;
        denominator_product = 1;
        has_numeric_numerator = false;
        numeric_denominators = 0;
    }

    /**
    * Splits the chain into numeric and symbolic factors.
    *
    * @param chain the decomposed product.
    * @return the factors, or null if a factor carries a comment or a
    *   divisor is not a non-zero constant.
    */
    static ScalarFactors of(MultiplicativeChain chain) {
        ScalarFactors ret = new ScalarFactors();
        for (Term term : chain.getNumerators()) {
            if (CommentGuard.hasComment(term.getRaw(), term.getExpression())) {
                return null;
            }
            Double value = NumericEvaluator.parseFactor(term.getExpression());
            if (value == null) {
                ret.symbolic.add(term);
                continue;
            }
            ret.has_numeric = true;
            ret.has_numeric_numerator = true;
            ret.coefficient *= value;
            ret.numerator_product *= value;
            if (NumericEvaluator.isMeaningfulFactor(value)) {
                ret.meaningful++;
            }
        }
        for (Term term : chain.getDenominators()) {
            if (CommentGuard.hasComment(term.getRaw(), term.getExpression())) {
                return null;
            }
            Double value = NumericEvaluator.parseFactor(term.getExpression());
            if (value == null || Math.abs(value) <= NumericEvaluator.tolerance(0)) {
                return null;
            }
            ret.has_numeric = true;
            ret.coefficient /= value;
            ret.denominator_product *= value;
            ret.numeric_denominators++;
            if (NumericEvaluator.isMeaningfulFactor(value)) {
                ret.meaningful++;
            }
        }
        return ret;
    }

    boolean isFinite() {
        return !Double.isNaN(coefficient) && !Double.isInfinite(coefficient);
    }

}
