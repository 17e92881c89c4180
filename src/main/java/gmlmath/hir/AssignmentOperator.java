package gmlmath.hir;

import java.io.PrintWriter;
import java.util.HashMap;

/**
* Operators of assignment expressions.
*/
public class AssignmentOperator implements Printable {

    private static HashMap<String, AssignmentOperator> op_map =
            new HashMap<String, AssignmentOperator>(8);

    private static String[] names = {"=", "+=", "-=", "*=", "/="};

    /**
    * =
    */
    public static final AssignmentOperator NORMAL = new AssignmentOperator(0);

    /**
    * +=
    */
    public static final AssignmentOperator ADD = new AssignmentOperator(1);

    /**
    * -=
    */
    public static final AssignmentOperator SUBTRACT =
            new AssignmentOperator(2);

    /**
    * *=
    */
    public static final AssignmentOperator MULTIPLY =
            new AssignmentOperator(3);

    /**
    * /=
    */
    public static final AssignmentOperator DIVIDE = new AssignmentOperator(4);

    protected int value;

    private AssignmentOperator(int value) {
        this.value = value;
        op_map.put(names[value], this);
    }

    /**
    * Returns an assignment operator that matches the specified string.
    * @param s the string to be matched.
    * @return the matching operator or null if not found.
    */
    public static AssignmentOperator fromString(String s) {
        return op_map.get(s);
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
