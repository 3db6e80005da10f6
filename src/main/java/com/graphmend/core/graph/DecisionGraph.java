package com.graphmend.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * DecisionGraph — the mutable graph value threaded through the repair pipeline.
 *
 * Nodes are indexed by id (insertion order preserved), so lookup, removal and
 * redirection never scan the node list. Edges are an ordered list; parallel
 * edges between the same pair are allowed.
 *
 * OWNERSHIP: a stage that receives a graph owns it until it returns. Callers
 * must not share one instance between concurrent pipeline runs.
 */
public class DecisionGraph {

    public static final String DEFAULT_VERSION = "1";
    public static final long   DEFAULT_SEED    = 17L;

    private String    version;
    private long      defaultSeed;
    private GraphMeta meta;

    private final LinkedHashMap<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge>                  edges = new ArrayList<>();

    public DecisionGraph() {
        this(DEFAULT_VERSION, DEFAULT_SEED, new GraphMeta());
    }

    public DecisionGraph(String version, long defaultSeed, GraphMeta meta) {
        this.version     = version != null ? version : DEFAULT_VERSION;
        this.defaultSeed = defaultSeed;
        this.meta        = meta != null ? meta : new GraphMeta();
    }

    // =========================================================================
    // Header
    // =========================================================================

    public String    getVersion()     { return version; }
    public long      getDefaultSeed() { return defaultSeed; }
    public GraphMeta getMeta()        { return meta; }

    public void setVersion(String version)      { this.version = version; }
    public void setDefaultSeed(long seed)       { this.defaultSeed = seed; }
    public void setMeta(GraphMeta meta)         { this.meta = meta != null ? meta : new GraphMeta(); }

    // =========================================================================
    // Nodes
    // =========================================================================

    public DecisionGraph addNode(GraphNode node) {
        if (nodes.containsKey(node.getId())) {
            throw new IllegalArgumentException("Duplicate node id: " + node.getId());
        }
        nodes.put(node.getId(), node);
        return this;
    }

    public GraphNode getNode(String id) {
        return nodes.get(id);
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    /** Kind of the node with this id, or null when no such node exists. */
    public NodeKind kindOf(String id) {
        GraphNode node = nodes.get(id);
        return node != null ? node.getKind() : null;
    }

    /** Snapshot of nodes in current order. */
    public List<GraphNode> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public List<GraphNode> nodesOfKind(NodeKind kind) {
        return nodes.values().stream()
                .filter(n -> n.getKind() == kind)
                .collect(Collectors.toList());
    }

    public List<String> idsOfKind(NodeKind kind) {
        return nodes.values().stream()
                .filter(n -> n.getKind() == kind)
                .map(GraphNode::getId)
                .collect(Collectors.toList());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public Map<NodeKind, Integer> countByKind() {
        Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
        for (GraphNode node : nodes.values()) {
            counts.merge(node.getKind(), 1, Integer::sum);
        }
        return counts;
    }

    public boolean removeNode(String id) {
        return nodes.remove(id) != null;
    }

    /** Reorder the node index. */
    public void sortNodes(Comparator<GraphNode> comparator) {
        List<GraphNode> ordered = new ArrayList<>(nodes.values());
        ordered.sort(comparator);
        nodes.clear();
        for (GraphNode node : ordered) {
            nodes.put(node.getId(), node);
        }
    }

    // =========================================================================
    // Edges
    // =========================================================================

    public DecisionGraph addEdge(GraphEdge edge) {
        edges.add(edge);
        return this;
    }

    /** Read-only view of the live edge list. */
    public List<GraphEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<GraphEdge> outgoing(String nodeId) {
        return edges.stream().filter(e -> e.getFrom().equals(nodeId)).collect(Collectors.toList());
    }

    public List<GraphEdge> incoming(String nodeId) {
        return edges.stream().filter(e -> e.getTo().equals(nodeId)).collect(Collectors.toList());
    }

    public boolean hasEdge(String from, String to) {
        for (GraphEdge edge : edges) {
            if (edge.getFrom().equals(from) && edge.getTo().equals(to)) {
                return true;
            }
        }
        return false;
    }

    /** @return number of edges removed */
    public int removeEdgesIf(Predicate<GraphEdge> predicate) {
        int before = edges.size();
        edges.removeIf(predicate);
        return before - edges.size();
    }

    public void replaceEdges(List<GraphEdge> replacement) {
        edges.clear();
        edges.addAll(replacement);
    }

    public void sortEdges(Comparator<GraphEdge> comparator) {
        edges.sort(comparator);
    }

    // =========================================================================
    // Copy
    // =========================================================================

    /** Deep copy: nodes, edges and meta are all new instances. */
    public DecisionGraph copy() {
        DecisionGraph copy = new DecisionGraph(version, defaultSeed, meta.copy());
        for (GraphNode node : nodes.values()) {
            copy.addNode(node.copy());
        }
        for (GraphEdge edge : edges) {
            copy.addEdge(edge.copy());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "DecisionGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
