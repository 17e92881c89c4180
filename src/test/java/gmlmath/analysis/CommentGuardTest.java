package gmlmath.analysis;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.BinaryExpression;
import gmlmath.hir.Expression;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommentGuardTest {

    // Spans of "a *       b" line up with sources of the same length.
    private static BinaryExpression spaced() throws ParseException {
        return (BinaryExpression)new Parser().parseExpression("a *       b");
    }

    @Test
    void findsMarkersBetweenSiblings() throws ParseException {
        BinaryExpression be = spaced();
        assertThat(CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(),
                "a * /*x*/ b")).isTrue();
        assertThat(CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(),
                "a * // x\nb")).isTrue();
        assertThat(CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(),
                "a * #x    b")).isTrue();
        assertThat(CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(),
                "a *       b")).isFalse();
    }

    @Test
    void missingSourceOrSpanIsSafe() throws ParseException {
        BinaryExpression be = spaced();
        assertThat(CommentGuard.hasCommentBetween(be.getLHS(), be.getRHS(), null))
                .isFalse();
        Expression copy = be.getRHS().clone();
        copy.setSpan(-1, -1);
        assertThat(CommentGuard.hasCommentBetween(be.getLHS(), copy,
                "a * /*x*/ b")).isFalse();
    }

    @Test
    void scansWholeSubtree() throws ParseException {
        BinaryExpression be = spaced();
        assertThat(CommentGuard.hasCommentWithin(be, "a *       b")).isFalse();
        assertThat(CommentGuard.hasCommentWithin(be, "a * /*x*/ b")).isTrue();
        assertThat(CommentGuard.hasCommentWithin(be, null)).isFalse();
        Expression nested = new Parser().parseExpression("f(a, (b /* k */))");
        assertThat(CommentGuard.hasCommentWithin(nested, null)).isTrue();
        assertThat(CommentGuard.hasComment(nested)).isFalse();
    }

    @Test
    void detectsAttachedComments() throws ParseException {
        BinaryExpression be = (BinaryExpression)new Parser()
                .parseExpression("a * /* k */ b");
        assertThat(CommentGuard.hasComment(be.getLHS(), be.getRHS())).isTrue();
        assertThat(CommentGuard.hasComment((Expression)null)).isFalse();
    }

    @Test
    void recognizesOriginalNotes() throws ParseException {
        String text = "s * 2 * 3 // original value";
        Expression e = new Parser().parseExpression("/* original */ s * 2 * 3");
        assertThat(CommentGuard.hasOriginalComment(e, null)).isTrue();
        Expression plain = new Parser().parseExpression("s * 2 * 3");
        assertThat(CommentGuard.hasOriginalComment(plain, text)).isTrue();
        assertThat(CommentGuard.hasOriginalComment(plain, "s * 2 * 3")).isFalse();
    }

}
