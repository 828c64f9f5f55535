package co.fanki.grd.diagram.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

/**
 * Immutable graph parsed from a reasoning diagram.
 *
 * <p>Holds the declared nodes (keyed by identifier, in declaration order)
 * and every edge in match order. Edges may point to identifiers that were
 * never declared; those endpoints are kept as-is and simply never show up
 * in the node set, the start/end sets or the execution order.</p>
 *
 * <p>Start and end nodes are derived once at construction, looking at
 * directed edges only:</p>
 * <ul>
 *   <li>start: declared nodes with no incoming directed edge</li>
 *   <li>end: declared nodes with no outgoing directed edge</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphStructure {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Declared nodes keyed by identifier, insertion ordered. */
    private final Map<String, DiagramNode> nodes;

    /** Edges in the order they were matched. */
    private final List<DiagramEdge> edges;

    private final Set<String> startNodes;

    private final Set<String> endNodes;

    /** Declared targets of directed edges, keyed by declared source. */
    private final Map<String, List<String>> successors;

    /**
     * Creates a graph structure from already deduplicated nodes.
     *
     * @param theNodes the nodes keyed by identifier, in declaration order
     * @param theEdges the edges in match order
     */
    GraphStructure(final Map<String, DiagramNode> theNodes,
            final List<DiagramEdge> theEdges) {
        this.nodes = Collections.unmodifiableMap(
                new LinkedHashMap<>(theNodes));
        this.edges = List.copyOf(theEdges);

        final Set<String> withIncoming = new HashSet<>();
        final Set<String> withOutgoing = new HashSet<>();
        final Map<String, Set<String>> adjacency = new HashMap<>();
        for (final DiagramEdge edge : edges) {
            if (edge.isDirected()) {
                withOutgoing.add(edge.from());
                withIncoming.add(edge.to());
                if (nodes.containsKey(edge.from())
                        && nodes.containsKey(edge.to())) {
                    adjacency.computeIfAbsent(edge.from(),
                            k -> new LinkedHashSet<>()).add(edge.to());
                }
            }
        }

        final Map<String, List<String>> targets = new HashMap<>();
        adjacency.forEach((from, to) -> targets.put(from, List.copyOf(to)));
        this.successors = Collections.unmodifiableMap(targets);

        final Set<String> starts = new LinkedHashSet<>();
        final Set<String> ends = new LinkedHashSet<>();
        for (final String id : nodes.keySet()) {
            if (!withIncoming.contains(id)) {
                starts.add(id);
            }
            if (!withOutgoing.contains(id)) {
                ends.add(id);
            }
        }
        this.startNodes = Collections.unmodifiableSet(starts);
        this.endNodes = Collections.unmodifiableSet(ends);
    }

    /**
     * Returns a graph with no nodes and no edges.
     *
     * <p>Parsing never produces it, since text without any recognizable
     * declaration is malformed. Useful as the neutral input of the
     * metrics.</p>
     *
     * @return the empty graph
     */
    public static GraphStructure empty() {
        return new GraphStructure(Map.of(), List.of());
    }

    /**
     * Returns the declared nodes in declaration order.
     *
     * @return unmodifiable list of nodes
     */
    public List<DiagramNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /**
     * Returns the declared node identifiers in declaration order.
     *
     * @return unmodifiable set of identifiers
     */
    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    /**
     * Returns the node declared with the given identifier.
     *
     * @param id the node identifier
     * @return the node, or null if it was never declared
     */
    public DiagramNode node(final String id) {
        return nodes.get(id);
    }

    /**
     * Checks if the given identifier was declared as a node.
     *
     * @param id the identifier to check
     * @return true if a node with that identifier exists
     */
    public boolean contains(final String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Returns every edge in match order, including edges that reference
     * undeclared identifiers.
     *
     * @return unmodifiable list of edges
     */
    public List<DiagramEdge> edges() {
        return edges;
    }

    /**
     * Returns the edges whose endpoints are not both declared nodes.
     *
     * @return the dangling edges in match order
     */
    public List<DiagramEdge> danglingEdges() {
        final List<DiagramEdge> result = new ArrayList<>();
        for (final DiagramEdge edge : edges) {
            if (!contains(edge.from()) || !contains(edge.to())) {
                result.add(edge);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the declared nodes with no incoming directed edge.
     *
     * @return unmodifiable set of identifiers, in declaration order
     */
    public Set<String> startNodes() {
        return startNodes;
    }

    /**
     * Returns the declared nodes with no outgoing directed edge.
     *
     * @return unmodifiable set of identifiers, in declaration order
     */
    public Set<String> endNodes() {
        return endNodes;
    }

    /**
     * Returns the declared targets of directed edges leaving the given
     * declared node, in edge order and without repetition.
     *
     * <p>Precomputed at construction; undeclared identifiers have no
     * successors.</p>
     *
     * @param id the source identifier
     * @return the successor identifiers
     */
    public List<String> successors(final String id) {
        return successors.getOrDefault(id, List.of());
    }

    /**
     * Returns the order in which the diagram steps would be executed.
     *
     * <p>Breadth-first traversal over directed edges, seeded with all the
     * start nodes in declaration order. Each node is visited once. Nodes
     * that cannot be reached from a start node are left out, and the
     * result is empty when there are no start nodes at all.</p>
     *
     * @return the identifiers in execution order
     */
    public List<String> executionOrder() {
        final Set<String> visited = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>();

        for (final String start : startNodes) {
            if (visited.add(start)) {
                queue.add(start);
            }
        }

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final String next : successors(current)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }

        return List.copyOf(visited);
    }

    /**
     * Returns the number of declared nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of edges, dangling ones included.
     *
     * @return the edge count
     */
    public int edgeCount() {
        return edges.size();
    }

    /** Checks if no node was declared. */
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Renders this structure as a JSON tree.
     *
     * @return the JSON representation
     */
    public ObjectNode toJsonTree() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ArrayNode nodesArray = root.putArray("nodes");
        for (final DiagramNode node : nodes.values()) {
            final ObjectNode item = nodesArray.addObject();
            item.put("id", node.id());
            item.put("label", node.label());
            item.put("shape", node.shape().name());
        }

        final ArrayNode edgesArray = root.putArray("edges");
        for (final DiagramEdge edge : edges) {
            final ObjectNode item = edgesArray.addObject();
            item.put("from", edge.from());
            item.put("to", edge.to());
            item.put("type", edge.kind().label());
        }

        root.put("nodeCount", nodeCount());
        root.put("edgeCount", edgeCount());

        final ArrayNode starts = root.putArray("startNodes");
        startNodes.forEach(starts::add);
        final ArrayNode ends = root.putArray("endNodes");
        endNodes.forEach(ends::add);

        return root;
    }

    /**
     * Serializes this structure to a JSON string.
     *
     * @return the JSON representation
     */
    public String toJson() {
        return toJsonTree().toString();
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GraphStructure)) {
            return false;
        }
        final GraphStructure that = (GraphStructure) other;
        return List.copyOf(nodes.values()).equals(
                List.copyOf(that.nodes.values()))
                && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(List.copyOf(nodes.values()), edges);
    }

    @Override
    public String toString() {
        return "GraphStructure{nodes=" + nodes.keySet()
                + ", edges=" + edges + "}";
    }

}
