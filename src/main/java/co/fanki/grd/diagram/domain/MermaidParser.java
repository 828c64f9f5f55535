package co.fanki.grd.diagram.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for validating and parsing reasoning diagrams written in
 * the supported Mermaid flowchart subset.
 *
 * <p>Validation and parsing are independent: {@link #validate} only
 * inspects the text, while {@link #parse} builds the full graph and
 * accepts diagrams the validator would reject (for example, a diagram
 * without a {@code flowchart} line).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MermaidParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            MermaidParser.class);

    private MermaidParser() {
    }

    /**
     * Validates the diagram text.
     *
     * @param text the diagram text, may be null
     * @return the validation outcome, never null
     * @see StructuralValidator
     */
    public static ValidationResult validate(final String text) {
        return StructuralValidator.validate(text);
    }

    /**
     * Parses the diagram text into a graph.
     *
     * @param text the diagram text
     * @return the parsed graph
     * @throws MalformedDiagramException if no node or edge syntax is
     *         recognized
     */
    public static GraphStructure parse(final String text) {
        final GraphStructure graph = GraphBuilder.build(
                DiagramTokenizer.nodes(text),
                DiagramTokenizer.edges(text));

        LOG.debug("Parsed diagram with {} nodes and {} edges",
                graph.nodeCount(), graph.edgeCount());

        return graph;
    }

}
