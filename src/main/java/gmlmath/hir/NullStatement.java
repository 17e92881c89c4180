package gmlmath.hir;

import java.io.PrintWriter;

/**
* Represents an empty statement. Empty statements are kept by the IR so that
* a script prints back the way it was written, e.g. {@code while (step());}.
*/
public class NullStatement extends Statement {

    /** Creates a new null statement. */
    public NullStatement() {
        super(-1);
    }

    @Override
    public NullStatement clone() {
        return (NullStatement)super.clone();
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print(";");
    }

}
