package gmlmath.hir;

/**
* Thrown when a child IR object is expected but the object is not a child of
* the IR object the operation was performed on.
*/
public class NotAChildException extends RuntimeException {

    private static final long serialVersionUID = 3481L;

    public NotAChildException() {
        super();
    }

    public NotAChildException(String message) {
        super(message);
    }

}
