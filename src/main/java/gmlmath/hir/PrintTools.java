package gmlmath.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* Printing helpers shared by the IR classes and the passes: list rendering,
* block indentation and verbosity-gated status lines on standard error.
*/
public final class PrintTools {

    public static final String line_sep = System.getProperty("line.separator");

    /** Indentation unit used by block statements */
    public static final String indent = "    ";

    /** Global verbosity taken from the "verbosity" option */
    private static int verbosity = 0;

    private PrintTools() {
    }

    /**
    * Sets the global verbosity level.
    *
    * @param level the new verbosity level; 0 prints nothing but errors.
    */
    public static void setVerbosity(int level) {
        verbosity = level;
    }

    /** Returns the global verbosity level. */
    public static int getVerbosity() {
        return verbosity;
    }

    /**
    * Writes the items, joined by single spaces, to standard error when the
    * global verbosity reaches {@code min_verbosity}. Nothing is composed
    * below that level.
    * @param min_verbosity the level at which the line becomes visible.
    * @param items the pieces of the status line.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= verbosity) {
            if (items.length > 0) {
                StringBuilder sb = new StringBuilder(80);
                sb.append(items[0]);
                for (int i = 1; i < items.length; i++) {
                    sb.append(" ").append(items[i]);
                }
                System.err.println(sb.toString());
            }
        }
    }

    /**
    * Prints each element of {@code list} to {@code w}, with {@code sep}
    * between neighbours. Every element must be {@link Printable}.
    * @param list the elements, or null for nothing.
    * @param w the destination writer.
    * @param sep the text placed between two elements.
    */
    public static void
            printListWithSeparator(List list, PrintWriter w, String sep) {
        if (list == null) {
            return;
        }
        int list_size = list.size();
        if (list_size > 0) {
            ((Printable)list.get(0)).print(w);
            for (int i = 1; i < list_size; i++) {
                w.print(sep);
                ((Printable)list.get(i)).print(w);
            }
        }
    }

    /** Same as {@link #printListWithSeparator} with {@code ", "}. */
    public static void printListWithComma(List list, PrintWriter w) {
        printListWithSeparator(list, w, ", ");
    }

    /**
    * Prefixes every non-empty line of the given text with one indentation
    * unit.
    * @param text the text to be indented.
    * @return the indented text.
    */
    public static String indentLines(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append("\n");
            }
            if (lines[i].length() > 0) {
                sb.append(indent);
            }
            sb.append(lines[i]);
        }
        return sb.toString();
    }

}
