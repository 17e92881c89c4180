package gmlmath.exec;

/**
* Thrown when GML source text cannot be parsed. The exception carries the
* position of the first syntax error.
*/
public class ParseException extends Exception {

    private static final long serialVersionUID = 3482L;

    private final int line;

    private final int column;

    /**
    * Creates a parse exception.
    *
    * @param message the error message including a source excerpt.
    * @param line the 1-based line of the error.
    * @param column the 0-based column of the error.
    */
    public ParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    /** Returns the 1-based line of the first syntax error. */
    public int getLine() {
        return line;
    }

    /** Returns the 0-based column of the first syntax error. */
    public int getColumn() {
        return column;
    }

}
