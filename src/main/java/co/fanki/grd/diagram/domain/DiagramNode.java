package co.fanki.grd.diagram.domain;

import co.fanki.grd.shared.Preconditions;
import co.fanki.grd.shared.ValueObject;

/**
 * A step declared in a reasoning diagram.
 *
 * @param id the identifier, unique within a diagram
 * @param label the free text shown in the node, may be empty
 * @param shape the shape derived from the bracket style
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DiagramNode(String id, String label, ShapeKind shape)
        implements ValueObject {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a node, normalizing a null label to empty.
     *
     * @param id the node identifier
     * @param label the node label
     * @param shape the node shape
     */
    public DiagramNode {
        Preconditions.requireNonBlank(id, "Node id is required");
        Preconditions.requireNonNull(shape, "Node shape is required");
        label = label == null ? "" : label;
    }

    @Override
    public String toString() {
        return shape.render(id, label);
    }

}
