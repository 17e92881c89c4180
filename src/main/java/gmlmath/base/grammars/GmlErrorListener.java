package gmlmath.base.grammars;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
* Error listener that records the first lexer or parser error instead of
* printing it. The recorded message includes the offending source line and
* a caret pointing at the error column.
*/
public class GmlErrorListener extends BaseErrorListener {

    private final String source_text;

    private String message;

    private int line;

    private int column;

    public GmlErrorListener(String source_text) {
        this.source_text = source_text;
        message = null;
        line = -1;
        column = -1;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
                            Object offendingSymbol,
                            int line,
                            int charPositionInLine,
                            String msg,
                            RecognitionException e) {
        if (message != null) {
            return;
        }
        this.line = line;
        this.column = charPositionInLine;
        StringBuilder sb = new StringBuilder(80);
        sb.append("syntax error at line ").append(line);
        sb.append(", column ").append(charPositionInLine);
        sb.append(": ").append(msg);
        if (source_text != null && !source_text.isEmpty()) {
            String[] lines = source_text.split("\n", -1);
            if (line > 0 && line <= lines.length) {
                sb.append("\n").append(lines[line - 1]).append("\n");
                for (int i = 0; i < charPositionInLine; i++) {
                    sb.append(" ");
                }
                sb.append("^");
            }
        }
        message = sb.toString();
    }

    /** Checks if an error was reported. */
    public boolean hasError() {
        return message != null;
    }

    /** Returns the message of the first error, or null. */
    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

}
