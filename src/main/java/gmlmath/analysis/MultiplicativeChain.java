package gmlmath.analysis;

import java.util.ArrayList;
import java.util.List;

/**
* The factors of a product or quotient, split into the terms that multiply
* and the terms that divide.
*/
public class MultiplicativeChain {

    private final List<Term> numerators;

    private final List<Term> denominators;

    public MultiplicativeChain() {
        numerators = new ArrayList<Term>(4);
        denominators = new ArrayList<Term>(2);
    }

    public List<Term> getNumerators() {
        return numerators;
    }

    public List<Term> getDenominators() {
        return denominators;
    }

    /**
    * Appends a term to the numerators or the denominators.
    *
    * @param term the term to be added.
    * @param in_denominator true to add it to the denominators.
    */
    public void add(Term term, boolean in_denominator) {
        if (in_denominator) {
            denominators.add(term);
        } else {
            numerators.add(term);
        }
    }

    @Override
    public String toString() {
        return numerators + " / " + denominators;
    }

}
