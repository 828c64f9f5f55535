package co.fanki.grd.diagram.domain;

import co.fanki.grd.diagram.domain.DiagramTokenizer.EdgeDeclaration;
import co.fanki.grd.diagram.domain.DiagramTokenizer.NodeDeclaration;
import co.fanki.grd.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Assembles tokenizer matches into a {@link GraphStructure}.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>The first declaration of an identifier wins; redeclarations are
 *       ignored, whatever their label or shape</li>
 *   <li>Edges are kept in match order, self-loops and edges to
 *       undeclared identifiers included</li>
 *   <li>If nothing matched at all, the diagram is malformed</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphBuilder.class);

    private GraphBuilder() {
    }

    /**
     * Builds a graph from the two match streams.
     *
     * @param nodeMatches the node declarations, in source order
     * @param edgeMatches the edge declarations, in source order
     * @return the built graph
     * @throws MalformedDiagramException if both streams are empty
     */
    public static GraphStructure build(
            final Stream<NodeDeclaration> nodeMatches,
            final Stream<EdgeDeclaration> edgeMatches) {

        Preconditions.requireNonNull(nodeMatches, "Node matches are required");
        Preconditions.requireNonNull(edgeMatches, "Edge matches are required");

        final Map<String, DiagramNode> nodes = new LinkedHashMap<>();
        final Iterator<NodeDeclaration> nodeIterator = nodeMatches.iterator();
        while (nodeIterator.hasNext()) {
            final NodeDeclaration declaration = nodeIterator.next();
            if (nodes.containsKey(declaration.id())) {
                LOG.debug("Ignoring redeclaration of node {}",
                        declaration.id());
                continue;
            }
            nodes.put(declaration.id(), declaration.toNode());
        }

        final List<DiagramEdge> edges = new ArrayList<>();
        final Iterator<EdgeDeclaration> edgeIterator = edgeMatches.iterator();
        while (edgeIterator.hasNext()) {
            edges.add(edgeIterator.next().toEdge());
        }

        if (nodes.isEmpty() && edges.isEmpty()) {
            throw new MalformedDiagramException(
                    "No node or edge declarations recognized in diagram");
        }

        return new GraphStructure(nodes, edges);
    }

}
