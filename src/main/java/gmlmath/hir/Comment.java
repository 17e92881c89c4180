package gmlmath.hir;

/**
* A source comment attached to an IR node. The text is kept verbatim,
* including its delimiters, so printing a comment reproduces it exactly.
*/
public class Comment implements Cloneable {

    private String text;

    private int start_offset;

    private int end_offset;

    /**
    * Creates a comment with the given raw text and no source position.
    *
    * @param text the raw comment text such as {@code // note}.
    */
    public Comment(String text) {
        this(text, -1, -1);
    }

    /**
    * Creates a comment with the given raw text and source span.
    *
    * @param text the raw comment text.
    * @param start the offset of the first character.
    * @param end the offset one past the last character.
    */
    public Comment(String text, int start, int end) {
        if (text == null) {
            throw new IllegalArgumentException("comment text is null");
        }
        this.text = text;
        this.start_offset = start;
        this.end_offset = end;
    }

    /** Returns the raw text of the comment, delimiters included. */
    public String getText() {
        return text;
    }

    /** Returns the comment body without its delimiters. */
    public String getValue() {
        if (text.startsWith("//")) {
            return text.substring(2).trim();
        }
        if (text.startsWith("/*") && text.endsWith("*/") && text.length() >= 4) {
            return text.substring(2, text.length() - 2).trim();
        }
        return text;
    }

    /** Checks if this is a block comment. */
    public boolean isBlock() {
        return text.startsWith("/*");
    }

    public int getStart() {
        return start_offset;
    }

    public int getEnd() {
        return end_offset;
    }

    @Override
    public Comment clone() {
        try {
            return (Comment)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
    }

    @Override
    public String toString() {
        return text;
    }

}
