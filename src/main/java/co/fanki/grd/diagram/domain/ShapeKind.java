package co.fanki.grd.diagram.domain;

/**
 * The visual shape of a diagram node, derived from its bracket style.
 *
 * <p>Shapes are informational only. They never change how the graph is
 * traversed or scored.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ShapeKind {

    /** Plain box, declared as {@code id[label]}. */
    BOX('[', ']'),

    /** Rounded box, declared as {@code id(label)}. */
    ROUNDED('(', ')'),

    /** Decision diamond, declared as {@code id{label}}. */
    DECISION('{', '}');

    private final char open;

    private final char close;

    ShapeKind(final char theOpen, final char theClose) {
        this.open = theOpen;
        this.close = theClose;
    }

    /**
     * Resolves the shape declared by an opening bracket.
     *
     * @param bracket the opening bracket character
     * @return the matching shape
     * @throws IllegalArgumentException if the bracket is not a known one
     */
    public static ShapeKind fromOpeningBracket(final char bracket) {
        for (final ShapeKind kind : values()) {
            if (kind.open == bracket) {
                return kind;
            }
        }
        throw new IllegalArgumentException(
                "Unknown node bracket: " + bracket);
    }

    /**
     * Renders a node declaration using this shape.
     *
     * @param id the node identifier
     * @param label the node label
     * @return the declaration text, e.g. {@code A[Label]}
     */
    public String render(final String id, final String label) {
        return id + open + label + close;
    }

}
