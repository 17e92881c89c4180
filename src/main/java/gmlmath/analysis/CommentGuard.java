package gmlmath.analysis;

import gmlmath.hir.*;

/**
* CommentGuard decides whether a rewrite could drop or reorder a comment.
* Comments attached to nodes are checked directly; comments the front end
* could not attach to a node are found by scanning the source text between
* the spans of two siblings. A missing source text or a missing span is
* treated as safe.
*/
public final class CommentGuard {

    /** Marker word that protects a hand-written expression from condensing */
    public static final String ORIGINAL_MARKER = "original";

    /** Number of characters scanned after a node for an "original" note */
    private static final int ORIGINAL_LOOKAHEAD = 200;

    // No instantiation is used.
    private CommentGuard() {
    }

    /**
    * Checks if the source text strictly between the end of {@code left} and
    * the start of {@code right} contains a comment or directive marker
    * ({@code //}, {@code /*} or {@code #}).
    *
    * @param left the left sibling.
    * @param right the right sibling.
    * @param source the source text the spans refer to; may be null.
    * @return true if a marker is found.
    */
    public static boolean
            hasCommentBetween(Expression left, Expression right, String source) {
        if (source == null || source.length() == 0 || left == null
                || right == null || !left.hasSpan() || !right.hasSpan()) {
            return false;
        }
        int from = left.getEnd();
        int to = right.getStart();
        if (to <= from || to > source.length()) {
            return false;
        }
        String between = source.substring(from, to);
        return between.contains("/*") || between.contains("//")
                || between.contains("#");
    }

    /**
    * Checks if the expression or any node below it carries a comment, or if
    * its source text contains a comment marker. Rules that rebuild a whole
    * subtree into a call use this before consuming the operands.
    *
    * @param e the subtree about to be rewritten.
    * @param source the source text the spans refer to; may be null.
    * @return true if a comment could be dropped or moved.
    */
    public static boolean hasCommentWithin(Expression e, String source) {
        if (e == null) {
            return false;
        }
        if (IRTools.containsComments(e)) {
            return true;
        }
        if (source == null || !e.hasSpan() || e.getEnd() > source.length()) {
            return false;
        }
        String text = source.substring(e.getStart(), e.getEnd());
        return text.contains("/*") || text.contains("//");
    }

    /** Checks if comments are attached to the expression; null is safe. */
    public static boolean hasComment(Expression e) {
        return (e != null && e.hasComments());
    }

    /**
    * Checks if any of the expressions has an attached comment.
    */
    public static boolean hasComment(Expression... exprs) {
        for (Expression e : exprs) {
            if (hasComment(e)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Checks if the node or one of its ancestors below the enclosing function
    * or program carries a comment mentioning "original", or if the rest of
    * the source line following one of them has such a comment. Authors use
    * such notes to keep a hand-written form visible.
    *
    * @param e the expression about to be condensed.
    * @param source the source text; may be null.
    * @return true if the expression is protected.
    */
    public static boolean hasOriginalComment(Expression e, String source) {
        Traversable current = e;
        while (current != null) {
            if (mentionsOriginal(current)) {
                return true;
            }
            if (source != null && followedByOriginalNote(current, source)) {
                return true;
            }
            current = current.getParent();
            if (current instanceof Procedure || current instanceof Program) {
                break;
            }
        }
        return false;
    }

    private static boolean mentionsOriginal(Traversable t) {
        if (t instanceof Expression) {
            Expression e = (Expression)t;
            for (Comment comment : e.getComments()) {
                if (comment.getValue().contains(ORIGINAL_MARKER)) {
                    return true;
                }
            }
            for (Comment comment : e.getTrailingComments()) {
                if (comment.getValue().contains(ORIGINAL_MARKER)) {
                    return true;
                }
            }
        } else if (t instanceof Statement) {
            Statement s = (Statement)t;
            for (Comment comment : s.getComments()) {
                if (comment.getValue().contains(ORIGINAL_MARKER)) {
                    return true;
                }
            }
            Comment trailing = s.getTrailingComment();
            if (trailing != null
                    && trailing.getValue().contains(ORIGINAL_MARKER)) {
                return true;
            }
        }
        return false;
    }

    private static boolean followedByOriginalNote(Traversable t, String source) {
        int end = -1;
        if (t instanceof Expression) {
            end = ((Expression)t).getEnd();
        } else if (t instanceof Statement) {
            end = ((Statement)t).getEnd();
        }
        if (end < 0 || end > source.length()) {
            return false;
        }
        String snippet = source.substring(end,
                Math.min(source.length(), end + ORIGINAL_LOOKAHEAD));
        int eol = snippet.indexOf('\n');
        String line = (eol < 0) ? snippet : snippet.substring(0, eol);
        return line.contains(ORIGINAL_MARKER)
                && (line.contains("//") || line.contains("/*"));
    }

}
