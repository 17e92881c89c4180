package gmlmath.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print its data. Every IR class
* provides a default way of printing itself as GML source code, and
* {@code toString} of every IR class is consistent with its print method.
*/
public interface Printable {

    /**
    * Prints the source code for the IR represented by the object.
    *
    * @param o The writer on which to print the data.
    */
    void print(PrintWriter o);

}
