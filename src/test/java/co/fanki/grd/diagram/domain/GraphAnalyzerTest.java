package co.fanki.grd.diagram.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphAnalyzer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphAnalyzerTest {

    private static final double DELTA = 1e-9;

    private static final String PLAN = """
            flowchart TD
                Start[Problem Analysis] --> Step1[Do Work]
                Step1 --> Answer[Final Answer]
            """;

    /** A reachable chain plus a loop that no start node leads into. */
    private static final String CHAIN_AND_LOOP = """
            flowchart TD
                A[Read] --> B[Answer]
                C[Guess] --> D[Retry]
                D --> C
            """;

    @Test
    void whenAnalyzing_givenLinearPlan_shouldReportFullCoverage() {
        final GraphAnalysis analysis =
                GraphAnalyzer.analyze(MermaidParser.parse(PLAN));

        assertEquals(List.of("Start", "Step1", "Answer"),
                analysis.executionOrder());
        assertEquals(1.0, analysis.reachabilityRatio(), DELTA);
        assertEquals(GraphAnalyzer.ACYCLIC, analysis.cycleIndicator(), DELTA);
        assertFalse(analysis.hasCycle());
        assertTrue(analysis.unreachableNodes().isEmpty());
        assertTrue(analysis.danglingEdges().isEmpty());
    }

    @Test
    void whenAnalyzing_givenEdgeToUndeclaredNode_shouldFlagDanglingEdge() {
        final GraphAnalysis analysis = GraphAnalyzer.analyze(
                MermaidParser.parse("graph TD\n A[a] --> B[b]\n B --> Z"));

        assertEquals(List.of(new DiagramEdge("B", "Z", EdgeKind.DIRECTED)),
                analysis.danglingEdges());
        assertEquals(List.of("A", "B"), analysis.executionOrder());
    }

    @Test
    void whenAnalyzing_givenUnreachableLoop_shouldReportPartialCoverage() {
        final GraphStructure graph = MermaidParser.parse(CHAIN_AND_LOOP);

        assertEquals(List.of("A", "B"), GraphAnalyzer.executionOrder(graph));
        assertEquals(0.5, GraphAnalyzer.reachabilityRatio(graph), DELTA);
        assertEquals(GraphAnalyzer.LIKELY_CYCLIC_OR_DISCONNECTED,
                GraphAnalyzer.cycleIndicator(graph), DELTA);
        assertTrue(GraphAnalyzer.hasCycle(graph));
        assertEquals(List.of("C", "D"), GraphAnalyzer.unreachableNodes(graph));
    }

    @Test
    void whenAnalyzing_givenTwoAcyclicComponents_shouldReachEverything() {
        final GraphStructure graph = MermaidParser.parse(
                "graph TD\n A[a] --> B[b]\n C[c] --> D[d]");

        assertEquals(1.0, GraphAnalyzer.reachabilityRatio(graph), DELTA);
        assertEquals(GraphAnalyzer.ACYCLIC,
                GraphAnalyzer.cycleIndicator(graph), DELTA);
    }

    @Test
    void whenAnalyzing_givenReachableSelfLoop_shouldOnlyBeCaughtByPreciseCheck() {
        final GraphStructure graph = MermaidParser.parse(
                "graph TD\n A[a] --> B[b]\n B --> B");

        assertEquals(GraphAnalyzer.ACYCLIC,
                GraphAnalyzer.cycleIndicator(graph), DELTA);
        assertTrue(GraphAnalyzer.hasCycle(graph));
    }

    @Test
    void whenAnalyzing_givenIsolatedNode_shouldCountItAsStart() {
        final GraphStructure graph = MermaidParser.parse(
                "graph TD\n A[a] --> B[b]\n Lonely[alone]");

        assertEquals(List.of("A", "Lonely", "B"),
                GraphAnalyzer.executionOrder(graph));
        assertFalse(GraphAnalyzer.hasCycle(graph));
    }

    @Test
    void whenAnalyzing_givenEdgeToUndeclaredNode_shouldIgnoreItForCycles() {
        final GraphStructure graph = MermaidParser.parse(
                "graph TD\n A[a] --> Z\n Z --> A");

        assertFalse(GraphAnalyzer.hasCycle(graph));
    }

    @Test
    void whenAnalyzing_givenGraphWithoutNodes_shouldReportZeroRatio() {
        final GraphStructure graph = MermaidParser.parse("graph TD\n A --> B");

        assertTrue(GraphAnalyzer.executionOrder(graph).isEmpty());
        assertEquals(0.0, GraphAnalyzer.reachabilityRatio(graph), DELTA);
        assertFalse(GraphAnalyzer.hasCycle(graph));
    }

    @Test
    void whenAnalyzing_givenNullGraph_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> GraphAnalyzer.analyze(null));
        assertThrows(IllegalArgumentException.class,
                () -> GraphAnalyzer.reachabilityRatio(null));
    }

}
