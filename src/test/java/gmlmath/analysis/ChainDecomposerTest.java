package gmlmath.analysis;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.Expression;
import gmlmath.hir.ExpressionStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChainDecomposerTest {

    private static Expression expr(String text) throws ParseException {
        return new Parser().parseExpression(text);
    }

    @Test
    void splitsNumeratorsAndDenominators() throws ParseException {
        MultiplicativeChain chain = new MultiplicativeChain();
        assertThat(ChainDecomposer.collectMultiplicativeChain(
                expr("2 * a / (6 / 3) * c"), chain, false, null)).isTrue();
        assertThat(texts(chain.getNumerators())).containsExactly("2", "a", "3", "c");
        assertThat(texts(chain.getDenominators())).containsExactly("6");
    }

    @Test
    void keepsOpaqueDivisionWhole() throws ParseException {
        MultiplicativeChain chain = new MultiplicativeChain();
        ChainDecomposer.collectMultiplicativeChain(
                expr("3 * (x / y)"), chain, false, null);
        assertThat(texts(chain.getNumerators())).containsExactly("3", "x / y");
        assertThat(chain.getDenominators()).isEmpty();
    }

    @Test
    void refusesToSplitAcrossComment() throws ParseException {
        String text = "a *       b";
        MultiplicativeChain chain = new MultiplicativeChain();
        assertThat(ChainDecomposer.collectMultiplicativeChain(
                expr(text), chain, false, "a * /*x*/ b")).isFalse();
    }

    @Test
    void collapsesUnitMinusHalf() throws ParseException {
        ExpressionStatement holder = new ExpressionStatement(expr("x * (1 - 0.5)"));
        MultiplicativeChain chain = new MultiplicativeChain();
        ChainDecomposer.collectMultiplicativeChain(
                holder.getExpression(), chain, false, null);
        assertThat(texts(chain.getNumerators())).containsExactly("x", "0.5");
        assertThat(holder.getExpression().toString()).isEqualTo("x * 0.5");
    }

    @Test
    void signsAdditiveTerms() throws ParseException {
        List<Term> terms = new ArrayList<Term>();
        ChainDecomposer.collectAdditiveChain(expr("a - (b - c) + d"), terms, false);
        assertThat(terms).extracting("negated").containsExactly(false, true, false, false);
        assertThat(texts(terms)).containsExactly("a", "b", "c", "d");
        assertThat(ChainDecomposer.rebuildSum(terms, null).toString())
                .isEqualTo("a - b + c + d");
    }

    @Test
    void rebuildsProducts() throws ParseException {
        List<Expression> factors = new ArrayList<Expression>();
        assertThat(ChainDecomposer.collectProductOperands(
                expr("a * (b * c)"), factors)).isTrue();
        assertThat(factors).hasSize(3);
        assertThat(ChainDecomposer.multiplyAll(factors, null).toString())
                .isEqualTo("a * b * c");
        assertThat(ChainDecomposer.multiplyAll(new ArrayList<Expression>(), null)
                .toString()).isEqualTo("1");
        assertThat(ChainDecomposer.rebuildProduct(new ArrayList<Term>(), null)
                .toString()).isEqualTo("1");
    }

    private static List<String> texts(List<Term> terms) {
        List<String> ret = new ArrayList<String>();
        for (Term term : terms) {
            ret.add(term.getExpression().toString());
        }
        return ret;
    }

}
