package gmlmath.hir;

import java.io.PrintWriter;
import java.util.HashMap;

/**
* Prefix operators that act on a single expression.
*/
public class UnaryOperator implements Printable {

    private static HashMap<String, UnaryOperator> op_map =
            new HashMap<String, UnaryOperator>(8);

    private static String[] names = {"-", "+", "!", "~"};

    /**
    * -
    */
    public static final UnaryOperator MINUS = new UnaryOperator(0);

    /**
    * +
    */
    public static final UnaryOperator PLUS = new UnaryOperator(1);

    /**
    * &#33; (also spelled not)
    */
    public static final UnaryOperator LOGICAL_NEGATION = new UnaryOperator(2);

    /**
    * ~
    */
    public static final UnaryOperator BITWISE_COMPLEMENT =
            new UnaryOperator(3);

    static {
        op_map.put("not", LOGICAL_NEGATION);
    }

    protected int value;

    private UnaryOperator(int value) {
        this.value = value;
        op_map.put(names[value], this);
    }

    /**
    * Returns a unary operator that matches the specified string <tt>s</tt>.
    * @param s the string to be matched.
    * @return the matching operator or null if not found.
    */
    public static UnaryOperator fromString(String s) {
        UnaryOperator op = op_map.get(s);
        if (op == null && s != null) {
            op = op_map.get(s.toLowerCase());
        }
        return op;
    }

    /* Printable interface */
    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }

}
