package gmlmath.hir;

import java.io.PrintWriter;
import java.util.HashMap;

/**
* Infix operators that act on two expressions. GML keyword spellings such as
* {@code mod}, {@code and} or {@code xor} map onto the same operator objects as
* their symbolic forms, so operators compare by identity.
*/
public class BinaryOperator implements Printable {

    private static HashMap<String, BinaryOperator> op_map =
            new HashMap<String, BinaryOperator>(32);

    private static String[] names = {
            "+", "-", "*", "/", "%", "div", "&&", "||", "^^", "==", "!=",
            "<", "<=", ">", ">=", "&", "|", "^", "<<", ">>"};

    private static int[] precedences = {
            10, 10, 11, 11, 11, 11, 3, 1, 2, 7, 7,
            8, 8, 8, 8, 6, 4, 5, 9, 9};

    /**
    * +
    */
    public static final BinaryOperator ADD = new BinaryOperator(0);

    /**
    * -
    */
    public static final BinaryOperator SUBTRACT = new BinaryOperator(1);

    /**
    * *
    */
    public static final BinaryOperator MULTIPLY = new BinaryOperator(2);

    /**
    * /
    */
    public static final BinaryOperator DIVIDE = new BinaryOperator(3);

    /**
    * % (also spelled mod)
    */
    public static final BinaryOperator MODULUS = new BinaryOperator(4);

    /**
    * div
    */
    public static final BinaryOperator INTEGER_DIVIDE = new BinaryOperator(5);

    /**
    * &amp;&amp; (also spelled and)
    */
    public static final BinaryOperator LOGICAL_AND = new BinaryOperator(6);

    /**
    * || (also spelled or)
    */
    public static final BinaryOperator LOGICAL_OR = new BinaryOperator(7);

    /**
    * ^^ (also spelled xor)
    */
    public static final BinaryOperator LOGICAL_XOR = new BinaryOperator(8);

    /**
    * ==
    */
    public static final BinaryOperator COMPARE_EQ = new BinaryOperator(9);

    /**
    * &#33;=
    */
    public static final BinaryOperator COMPARE_NE = new BinaryOperator(10);

    /**
    * &lt;
    */
    public static final BinaryOperator COMPARE_LT = new BinaryOperator(11);

    /**
    * &lt;=
    */
    public static final BinaryOperator COMPARE_LE = new BinaryOperator(12);

    /**
    * &gt;
    */
    public static final BinaryOperator COMPARE_GT = new BinaryOperator(13);

    /**
    * &gt;=
    */
    public static final BinaryOperator COMPARE_GE = new BinaryOperator(14);

    /**
    * &amp;
    */
    public static final BinaryOperator BITWISE_AND = new BinaryOperator(15);

    /**
    * |
    */
    public static final BinaryOperator BITWISE_INCLUSIVE_OR =
            new BinaryOperator(16);

    /**
    * ^
    */
    public static final BinaryOperator BITWISE_EXCLUSIVE_OR =
            new BinaryOperator(17);

    /**
    * &lt;&lt;
    */
    public static final BinaryOperator SHIFT_LEFT = new BinaryOperator(18);

    /**
    * &gt;&gt;
    */
    public static final BinaryOperator SHIFT_RIGHT = new BinaryOperator(19);

    static {
        op_map.put("mod", MODULUS);
        op_map.put("and", LOGICAL_AND);
        op_map.put("or", LOGICAL_OR);
        op_map.put("xor", LOGICAL_XOR);
        op_map.put("<>", COMPARE_NE);
    }

    protected int value;

    /**
    * Used internally -- you may not create arbitrary binary operators
    * and may only use the ones provided as static members.
    *
    * @param value The numeric code of the operator.
    */
    private BinaryOperator(int value) {
        this.value = value;
        op_map.put(names[value], this);
    }

    /**
    * Returns a binary operator that matches the specified string <tt>s</tt>.
    * Keyword spellings are matched case-insensitively.
    * @param s the string to be matched.
    * @return the matching operator or null if not found.
    */
    public static BinaryOperator fromString(String s) {
        BinaryOperator op = op_map.get(s);
        if (op == null && s != null) {
            op = op_map.get(s.toLowerCase());
        }
        return op;
    }

    /** Returns the binding strength of the operator. */
    public int getPrecedence() {
        return precedences[value];
    }

    /**
    * Checks if the operands of the operator can be swapped without changing
    * the value of the expression.
    */
    public boolean isCommutative() {
        return this == ADD || this == MULTIPLY;
    }

    /**
    * Checks if a chain of the operator can be regrouped freely, so a right
    * operand using the same operator needs no parentheses.
    */
    public boolean isAssociative() {
        return this == ADD || this == MULTIPLY || this == LOGICAL_AND
                || this == LOGICAL_OR || this == BITWISE_AND
                || this == BITWISE_INCLUSIVE_OR;
    }

    /* Printable interface */
    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    /** Returns a string representation of the binary operator. */
    @Override
    public String toString() {
        return names[value];
    }

}
