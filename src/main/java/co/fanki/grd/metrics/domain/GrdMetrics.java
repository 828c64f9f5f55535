package co.fanki.grd.metrics.domain;

import co.fanki.grd.diagram.domain.GraphAnalysis;
import co.fanki.grd.diagram.domain.GraphAnalyzer;
import co.fanki.grd.diagram.domain.GraphStructure;
import co.fanki.grd.diagram.domain.MermaidParser;
import co.fanki.grd.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic quality metrics for reasoning diagrams.
 *
 * <p>Every metric is pure and total: degenerate graphs (no nodes, no
 * start or end, nothing reachable) score zero on the affected metric
 * instead of failing.</p>
 *
 * <p>Overall quality weights:</p>
 * <ul>
 *   <li>validity: 0.4</li>
 *   <li>completeness: 0.3</li>
 *   <li>traceability: 0.3</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GrdMetrics {

    private static final Logger LOG = LoggerFactory.getLogger(
            GrdMetrics.class);

    static final double VALIDITY_WEIGHT = 0.4;
    static final double COMPLETENESS_WEIGHT = 0.3;
    static final double TRACEABILITY_WEIGHT = 0.3;

    static final int MIN_REASONABLE_NODES = 3;
    static final int MAX_REASONABLE_NODES = 20;

    private GrdMetrics() {
    }

    /**
     * Scores the structural validity of the diagram text.
     *
     * @param text the diagram text, may be null
     * @return 1.0 if the text passes validation, 0.0 otherwise
     */
    public static double structuralValidity(final String text) {
        return MermaidParser.validate(text).valid() ? 1.0 : 0.0;
    }

    /**
     * Scores how complete the graph is.
     *
     * <p>Adds 0.3 for having start nodes, 0.3 for having end nodes, 0.2
     * for a node count between 3 and 20 (0.1 above 20) and 0.2 for having
     * edges.</p>
     *
     * @param graph the parsed graph
     * @return the completeness score, capped at 1.0
     */
    public static double completeness(final GraphStructure graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        double score = 0.0;

        if (!graph.startNodes().isEmpty()) {
            score += 0.3;
        }
        if (!graph.endNodes().isEmpty()) {
            score += 0.3;
        }

        final int nodeCount = graph.nodeCount();
        if (nodeCount >= MIN_REASONABLE_NODES
                && nodeCount <= MAX_REASONABLE_NODES) {
            score += 0.2;
        } else if (nodeCount > MAX_REASONABLE_NODES) {
            score += 0.1;
        }

        if (graph.edgeCount() > 0) {
            score += 0.2;
        }

        return Math.min(score, 1.0);
    }

    /**
     * Scores how traceable the graph is as an execution plan.
     *
     * <p>Average of the reachability ratio and the cycle indicator, or
     * 0.0 when the execution order or the node set is empty.</p>
     *
     * @param graph the parsed graph
     * @return the traceability score
     */
    public static double executionTraceability(final GraphStructure graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final GraphAnalysis analysis = GraphAnalyzer.analyze(graph);
        if (analysis.executionOrder().isEmpty() || graph.isEmpty()) {
            return 0.0;
        }

        return (analysis.reachabilityRatio() + analysis.cycleIndicator())
                / 2.0;
    }

    /**
     * Scores the overall quality of the diagram text.
     *
     * @param text the diagram text
     * @return the overall score, in [0, 1]
     * @see #overallQuality(String, GraphStructure)
     */
    public static double overallQuality(final String text) {
        return overallQuality(text, null);
    }

    /**
     * Scores the overall quality of the diagram text.
     *
     * <p>Returns 0.0 without parsing when the text fails validation. When
     * no graph is supplied the text is parsed, and any parse failure
     * yields 0.0.</p>
     *
     * @param text the diagram text
     * @param graph the already parsed graph, or null to parse the text
     * @return the overall score, in [0, 1]
     */
    public static double overallQuality(final String text,
            final GraphStructure graph) {
        return evaluate(text, graph).overall();
    }

    /**
     * Computes every score of the diagram text.
     *
     * @param text the diagram text
     * @return the scores, all zero when the text is invalid or unparseable
     */
    public static QualityScore evaluate(final String text) {
        return evaluate(text, null);
    }

    /**
     * Computes every score of the diagram text.
     *
     * @param text the diagram text
     * @param graph the already parsed graph, or null to parse the text
     * @return the scores, all zero when the text is invalid or unparseable
     */
    public static QualityScore evaluate(final String text,
            final GraphStructure graph) {
        final double validity = structuralValidity(text);
        if (validity == 0.0) {
            return QualityScore.zero();
        }

        GraphStructure parsed = graph;
        if (parsed == null) {
            try {
                parsed = MermaidParser.parse(text);
            } catch (final RuntimeException e) {
                LOG.debug("Scoring unparseable diagram as 0: {}",
                        e.getMessage());
                return QualityScore.zero();
            }
        }

        final double completeness = completeness(parsed);
        final double traceability = executionTraceability(parsed);

        final double overall = validity * VALIDITY_WEIGHT
                + completeness * COMPLETENESS_WEIGHT
                + traceability * TRACEABILITY_WEIGHT;

        return new QualityScore(validity, completeness, traceability,
                Math.max(0.0, Math.min(overall, 1.0)));
    }

}
