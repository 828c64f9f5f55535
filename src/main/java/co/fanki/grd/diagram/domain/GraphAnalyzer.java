package co.fanki.grd.diagram.domain;

import co.fanki.grd.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives execution order and reachability figures from a graph.
 *
 * <p>The cycle indicator is a coarse heuristic: it compares the length
 * of the execution order with the node count, so a diagram with
 * unreachable nodes scores the same as one with a real cycle. The
 * scoring formulas depend on that heuristic. {@link #hasCycle} is the
 * precise check, reported as a diagnostic only.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphAnalyzer {

    /** Cycle indicator when every declared node is in the order. */
    public static final double ACYCLIC = 1.0;

    /** Cycle indicator when some declared node is not in the order. */
    public static final double LIKELY_CYCLIC_OR_DISCONNECTED = 0.5;

    private GraphAnalyzer() {
    }

    /**
     * Runs every analysis over the graph.
     *
     * @param graph the graph to analyze
     * @return the analysis results
     */
    public static GraphAnalysis analyze(final GraphStructure graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final List<String> order = graph.executionOrder();
        return new GraphAnalysis(
                order,
                ratio(order, graph),
                indicator(order, graph),
                hasCycle(graph),
                unreachable(order, graph),
                graph.danglingEdges());
    }

    /**
     * Returns the breadth-first execution order of the graph.
     *
     * @param graph the graph
     * @return the identifiers in execution order
     * @see GraphStructure#executionOrder()
     */
    public static List<String> executionOrder(final GraphStructure graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return graph.executionOrder();
    }

    /**
     * Returns the share of declared nodes that appear in the execution
     * order, or 0.0 when no node was declared.
     *
     * @param graph the graph
     * @return the ratio, in [0, 1]
     */
    public static double reachabilityRatio(final GraphStructure graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return ratio(graph.executionOrder(), graph);
    }

    /**
     * Returns {@link #ACYCLIC} when the execution order covers every
     * declared node, {@link #LIKELY_CYCLIC_OR_DISCONNECTED} otherwise.
     *
     * @param graph the graph
     * @return the cycle indicator
     */
    public static double cycleIndicator(final GraphStructure graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return indicator(graph.executionOrder(), graph);
    }

    /**
     * Checks whether the directed edges between declared nodes contain a
     * cycle, self-loops included.
     *
     * <p>Kahn's algorithm: repeatedly removes nodes with no remaining
     * incoming edge. Whatever cannot be removed sits on a cycle.</p>
     *
     * @param graph the graph
     * @return true if a directed cycle exists
     */
    public static boolean hasCycle(final GraphStructure graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final Map<String, Integer> indegree = new HashMap<>();
        for (final String id : graph.nodeIds()) {
            indegree.put(id, 0);
        }
        for (final String id : graph.nodeIds()) {
            for (final String next : graph.successors(id)) {
                indegree.merge(next, 1, Integer::sum);
            }
        }

        final ArrayDeque<String> queue = new ArrayDeque<>();
        for (final String id : graph.nodeIds()) {
            if (indegree.get(id) == 0) {
                queue.add(id);
            }
        }

        int removed = 0;
        while (!queue.isEmpty()) {
            final String current = queue.removeFirst();
            removed++;
            for (final String next : graph.successors(current)) {
                final int remaining = indegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    queue.addLast(next);
                }
            }
        }

        return removed < graph.nodeCount();
    }

    /**
     * Returns the declared nodes that the execution order never reaches.
     *
     * @param graph the graph
     * @return the unreachable identifiers, in declaration order
     */
    public static List<String> unreachableNodes(final GraphStructure graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return unreachable(graph.executionOrder(), graph);
    }

    private static double ratio(final List<String> order,
            final GraphStructure graph) {
        if (graph.isEmpty()) {
            return 0.0;
        }
        return (double) order.size() / graph.nodeCount();
    }

    private static double indicator(final List<String> order,
            final GraphStructure graph) {
        return order.size() == graph.nodeCount()
                ? ACYCLIC : LIKELY_CYCLIC_OR_DISCONNECTED;
    }

    private static List<String> unreachable(final List<String> order,
            final GraphStructure graph) {
        final Set<String> reached = Set.copyOf(order);
        final List<String> result = new ArrayList<>();
        for (final String id : graph.nodeIds()) {
            if (!reached.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }

}
