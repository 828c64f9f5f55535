package co.fanki.grd.diagram.domain;

import co.fanki.grd.shared.Preconditions;
import co.fanki.grd.shared.ValueObject;

/**
 * A connection between two node identifiers.
 *
 * <p>Endpoints are plain identifiers. They are not required to match a
 * declared node: the builder records every edge it sees and leaves the
 * existence check to the analysis layer.</p>
 *
 * @param from the source identifier
 * @param to the target identifier
 * @param kind directed or undirected
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DiagramEdge(String from, String to, EdgeKind kind)
        implements ValueObject {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an edge.
     *
     * @param from the source identifier
     * @param to the target identifier
     * @param kind the edge kind
     */
    public DiagramEdge {
        Preconditions.requireNonBlank(from, "Edge source is required");
        Preconditions.requireNonBlank(to, "Edge target is required");
        Preconditions.requireNonNull(kind, "Edge kind is required");
    }

    /** Checks if this edge carries an execution dependency. */
    public boolean isDirected() {
        return kind == EdgeKind.DIRECTED;
    }

    /** Checks if source and target are the same identifier. */
    public boolean isSelfLoop() {
        return from.equals(to);
    }

    @Override
    public String toString() {
        return from + " " + kind.connector() + " " + to;
    }

}
