package gmlmath.transforms.math;

import gmlmath.exec.OptionSet;
import gmlmath.hir.*;

/**
* The read-only bundle every rewrite receives: the source text the spans
* refer to, an optional pre-formatting text used for comment lookups, the
* root of the whole tree and the options in effect. Rules never change the
* context.
*/
public class NormalizationContext {

    private final String source_text;

    private final String original_text;

    private Traversable root;

    private final OptionSet options;

    /**
    * Creates a context with default options.
    *
    * @param source_text the source text; may be null.
    * @param root the root of the whole tree; may be null until normalization
    *   starts, in which case the normalized tree becomes the root.
    */
    public NormalizationContext(String source_text, Traversable root) {
        this(source_text, null, root, new OptionSet());
    }

    /**
    * Creates a context.
    *
    * @param source_text the source text the node spans refer to; may be null.
    * @param original_text the text comment lookups prefer when non-empty;
    *   may be null.
    * @param root the root of the whole tree; may be null.
    * @param options the options in effect.
    */
    public NormalizationContext(String source_text, String original_text,
            Traversable root, OptionSet options) {
        if (options == null) {
            throw new IllegalArgumentException("options is null");
        }
        this.source_text = source_text;
        this.original_text = original_text;
        this.root = root;
        this.options = options;
    }

    /** Creates a context for a parsed program using its own source text. */
    public static NormalizationContext forProgram(Program program,
            OptionSet options) {
        return new NormalizationContext(program.getSourceText(), null,
                program, options);
    }

    public String getSourceText() {
        return source_text;
    }

    public String getOriginalText() {
        return original_text;
    }

    /**
    * Returns the text scanned for comments between two nodes: the original
    * text when one is given, the source text otherwise.
    */
    public String getCommentSource() {
        if (original_text != null && original_text.length() > 0) {
            return original_text;
        }
        return source_text;
    }

    public Traversable getRoot() {
        return root;
    }

    /** Sets the root when the context was created without one. */
    public void setRootIfAbsent(Traversable t) {
        if (root == null) {
            root = t;
        }
    }

    public OptionSet getOptions() {
        return options;
    }

    /** Checks if the named option is turned on. */
    public boolean isEnabled(String name) {
        return options.isEnabled(name);
    }

}
