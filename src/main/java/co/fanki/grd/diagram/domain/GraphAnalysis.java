package co.fanki.grd.diagram.domain;

import java.util.List;

/**
 * Analysis results computed from a {@link GraphStructure}.
 *
 * @param executionOrder the breadth-first execution order
 * @param reachabilityRatio the share of declared nodes in the order
 * @param cycleIndicator 1.0 when every node is in the order, else 0.5
 * @param hasCycle whether the directed edges between declared nodes form
 *        a cycle
 * @param unreachableNodes declared nodes missing from the order
 * @param danglingEdges edges referencing an undeclared identifier
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphAnalysis(
        List<String> executionOrder,
        double reachabilityRatio,
        double cycleIndicator,
        boolean hasCycle,
        List<String> unreachableNodes,
        List<DiagramEdge> danglingEdges) {

    /**
     * Creates an analysis, copying the lists.
     *
     * @param executionOrder the execution order
     * @param reachabilityRatio the reachability ratio
     * @param cycleIndicator the cycle indicator
     * @param hasCycle the precise cycle flag
     * @param unreachableNodes the unreachable nodes
     * @param danglingEdges the edges with an undeclared endpoint
     */
    public GraphAnalysis {
        executionOrder = List.copyOf(executionOrder);
        unreachableNodes = List.copyOf(unreachableNodes);
        danglingEdges = List.copyOf(danglingEdges);
    }

}
