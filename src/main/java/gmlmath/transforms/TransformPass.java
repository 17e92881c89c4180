package gmlmath.transforms;

import gmlmath.hir.*;

/**
* Base class of all transformation passes. Every pass checks the parent and
* child links of the tree it worked on before returning, unless the check is
* disabled by the pass.
*/
public abstract class TransformPass {

    /** The tree the pass transforms */
    protected Traversable root;

    /** Flags for skipping consistency checking */
    protected boolean disable_protection;

    /** Constructs a transform pass working on the given tree */
    protected TransformPass(Traversable root) {
        this.root = root;
        disable_protection = false;
    }

    /** Returns the name of the transform pass */
    public abstract String getPassName();

    /**
    * Invokes the specified transform pass.
    * @param pass the transform pass that is to be run.
    * @throws InternalError if the pass left broken links behind.
    */
    public static void run(TransformPass pass) {
        double timer = Tools.getTime();
        PrintTools.printlnStatus(2, pass.getPassName(), "begin");
        pass.start();
        PrintTools.printlnStatus(2, pass.getPassName(), "end in",
                String.format("%.2f seconds", Tools.getTime(timer)));
        if (!pass.disable_protection) {
            try {
                verifyTree(pass.root);
            } catch (IllegalStateException e) {
                throw new InternalError("Inconsistent IR after "
                        + pass.getPassName() + ": " + e.getMessage());
            }
        }
    }

    private static void verifyTree(Traversable t) {
        if (t instanceof Program) {
            ((Program)t).verify();
        } else if (t instanceof Statement) {
            ((Statement)t).verify();
        } else if (t instanceof Expression) {
            ((Expression)t).verify();
        }
    }

    /** Starts a transform pass */
    public abstract void start();

}
