package gmlmath.hir;

import java.util.List;

/**
* <b>Tools</b> provides a set of general-purpose static methods used across
* the IR and the passes.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the index of the given object in the list using identity (==)
    * comparison instead of {@code equals}.
    *
    * @param l the list to be searched.
    * @param o the object to be searched for.
    * @return the index of the object or -1 if not found.
    */
    public static int identityIndexOf(List l, Object o) {
        int size = l.size();
        for (int i = 0; i < size; i++) {
            if (l.get(i) == o) {
                return i;
            }
        }
        return -1;
    }

    /**
    * Returns the current system time in seconds.
    *
    * @return the current system time in seconds
    */
    public static double getTime() {
        return (System.currentTimeMillis() / 1000.0);
    }

    /**
    * Returns the elapsed time in seconds since the given reference time.
    *
    * @param since the reference time
    * @return the elapsed time in seconds
    */
    public static double getTime(double since) {
        return (System.currentTimeMillis() / 1000.0 - since);
    }

}
