package co.fanki.grd.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects of the diagram model.
 *
 * <p>Nodes and edges are compared by their attributes, never by
 * identity. Implementations are immutable and validate their state on
 * construction.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
