package gmlmath.hir;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Depth-first iterator over the IR tree that returns only nodes of a requested
* type. The iterator keeps no work list; it finds the next item by walking the
* tree from the last returned node, so it must not be used across rewrites of
* the region it is iterating over.
*/
public class DFIterator<E extends Traversable> {

    /** The initial IR node of the iterator. */
    private Traversable root;

    /** The next IR node to be returned. */
    private Traversable next;

    /** The IR node type to be returned during iteration. */
    private Class<? extends Traversable> type;

    /**
    * Constructs a new iterator that returns any traversable nodes during
    * iteration.
    * @param root the initial node for the iteration.
    */
    public DFIterator(Traversable root) {
        this(root, Traversable.class);
    }

    /**
    * Constructs a new iterator that returns the specified IR type during
    * iteration.
    * @param root the initial node for the iteration.
    * @param c the IR class type to be iterated over.
    */
    public DFIterator(Traversable root, Class<? extends Traversable> c) {
        this.root = root;
        type = c;
        reset();
    }

    /**
    * Checks if there is a next element of the requested type.
    * @return true if there exist a next element of the requested type.
    */
    public boolean hasNext() {
        return next != null;
    }

    /**
    * Returns the next IR node.
    * @return the next IR node.
    * @exception NoSuchElementException no more elements found.
    */
    @SuppressWarnings("unchecked")
    public E next() {
        if (next == null) {
            throw new NoSuchElementException();
        }
        E ret = (E)next;
        next = findNext(ret);
        return ret;
    }

    /**
    * Initializes the iterator by placing the first item to be returned for a
    * call to {@link #next()}.
    */
    public void reset() {
        if (type.isInstance(root)) {
            next = root;
        } else {
            next = findNext(root);
        }
    }

    /**
    * Searches the subtree rooted at {@code t} first and then the rest of the
    * tree under the root, skipping subtrees already visited.
    */
    private Traversable findNext(Traversable t) {
        Traversable ret = findNext(t, 0);
        if (ret == null && t != root) {
            Traversable child = t;
            Traversable parent = child.getParent();
            while (ret == null && parent != null) {
                int t_pos = Tools.identityIndexOf(parent.getChildren(), child);
                ret = findNext(parent, t_pos + 1);
                if (parent == root) {
                    break;
                }
                child = parent;
                parent = child.getParent();
            }
        }
        return ret;
    }

    /**
    * Performs depth-first search within the tree rooted at {@code t},
    * starting from its {@code pos}-th child.
    */
    private Traversable findNext(Traversable t, int pos) {
        Traversable ret = null;
        List<Traversable> children = t.getChildren();
        if (children != null) {
            for (int i = pos; i < children.size() && ret == null; i++) {
                Traversable child = children.get(i);
                if (child == null) {
                    continue;
                }
                if (type.isInstance(child)) {
                    ret = child;
                } else {
                    ret = findNext(child, 0);
                }
            }
        }
        return ret;
    }

    /**
    * Returns a list of traversed elements of type {@code E} using the current
    * iterator.
    * @return the collected list.
    */
    public List<E> getList() {
        List<E> ret = new ArrayList<E>();
        reset();
        while (hasNext()) {
            ret.add(next());
        }
        return ret;
    }

}
