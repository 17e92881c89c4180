package gmlmath.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* A named function declaration. The parameter names are held as
* {@link Identifier} children ahead of the body, which is always the last
* child.
*/
public class Procedure extends Statement {

    private String name;

    /**
    * Creates a function declaration.
    *
    * @param name the function name.
    * @param params the parameter names.
    * @param body the function body.
    */
    public Procedure(String name, List<Identifier> params,
                     CompoundStatement body) {
        super(params.size() + 1);
        this.name = name;
        for (Identifier param : params) {
            addChild(param);
        }
        addChild(body);
    }

    public String getName() {
        return name;
    }

    /** Returns a copy of the parameter list. */
    public List<Identifier> getParameters() {
        List<Identifier> ret =
                new ArrayList<Identifier>(children.size() - 1);
        for (int i = 0; i < children.size() - 1; i++) {
            ret.add((Identifier)children.get(i));
        }
        return ret;
    }

    /** Returns the body of the function. */
    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(children.size() - 1);
    }

    @Override
    public Procedure clone() {
        return (Procedure)super.clone();
    }

    @Override
    protected void defaultPrint(PrintWriter o) {
        o.print("function ");
        o.print(name);
        o.print("(");
        PrintTools.printListWithComma(children.subList(0, children.size() - 1), o);
        o.print(") ");
        getBody().print(o);
    }

}
