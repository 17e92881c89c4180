package gmlmath.hir;

/**
* Signals an attempt to attach a node that is still linked into another tree.
* Callers detach or clone the node first.
*/
public class NotAnOrphanException extends RuntimeException {

    private static final long serialVersionUID = 3480L;

    public NotAnOrphanException() {
        super();
    }

    /** @param node_type the class name of the offending node. */
    public NotAnOrphanException(String node_type) {
        super(node_type + " already has a parent");
    }

}
