package com.graphmend.core.finalize;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * DeterminismFinalizer — stable edge ids and a canonical ordering.
 *
 * Edge ids follow "{from}::{to}::{index}" with index counted per (from, to)
 * pair. An existing id is kept unless it is blank, repeats an earlier edge's
 * id, or is a generated id whose endpoints no longer match the edge (left
 * behind by goal redirection). Nodes are then ordered by id, edges by
 * (from, to, id), and meta roots/leaves/positions recomputed.
 *
 * Running it twice changes nothing the second time.
 */
@Component
public class DeterminismFinalizer {

    private static final Logger log = LoggerFactory.getLogger(DeterminismFinalizer.class);

    static final String SEPARATOR = "::";

    private static final Pattern GENERATED_ID = Pattern.compile(".+::.+::\\d+");

    public static final Comparator<GraphNode> NODE_ORDER = Comparator.comparing(GraphNode::getId);

    public static final Comparator<GraphEdge> EDGE_ORDER = Comparator
            .comparing(GraphEdge::getFrom)
            .thenComparing(GraphEdge::getTo)
            .thenComparing(e -> e.getId() != null ? e.getId() : "");

    private final GraphMetaCalculator metaCalculator;

    public DeterminismFinalizer(GraphMetaCalculator metaCalculator) {
        this.metaCalculator = metaCalculator;
    }

    /** Finalises in place and returns the same graph. */
    public DecisionGraph finalizeGraph(DecisionGraph graph) {
        int assigned = assignEdgeIds(graph.getEdges());
        graph.sortNodes(NODE_ORDER);
        graph.sortEdges(EDGE_ORDER);
        graph.setMeta(metaCalculator.calculate(graph));

        if (assigned > 0) {
            log.debug("[Finalizer] Assigned {} edge id(s)", assigned);
        }
        return graph;
    }

    // =========================================================================
    // Predicates
    // =========================================================================

    /** Every edge has a non-blank, unique id that agrees with its endpoints. */
    public boolean hasStableEdgeIds(DecisionGraph graph) {
        Set<String> seen = new HashSet<>();
        for (GraphEdge edge : graph.getEdges()) {
            String id = edge.getId();
            if (id == null || id.isBlank() || isStale(edge) || !seen.add(id)) {
                return false;
            }
        }
        return true;
    }

    public boolean isSorted(DecisionGraph graph) {
        return isOrdered(graph.getNodes(), NODE_ORDER) && isOrdered(graph.getEdges(), EDGE_ORDER);
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private int assignEdgeIds(List<GraphEdge> edges) {
        Set<String> taken = new HashSet<>();
        boolean[]   needs = new boolean[edges.size()];

        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            String    id   = edge.getId();
            needs[i] = id == null || id.isBlank() || isStale(edge) || !taken.add(id);
        }

        Map<String, Integer> counters = new HashMap<>();
        int assigned = 0;
        for (int i = 0; i < edges.size(); i++) {
            if (!needs[i]) {
                continue;
            }
            GraphEdge edge   = edges.get(i);
            String    prefix = edge.getFrom() + SEPARATOR + edge.getTo() + SEPARATOR;
            int       index  = counters.getOrDefault(prefix, 0);
            while (taken.contains(prefix + index)) {
                index++;
            }
            edge.setId(prefix + index);
            taken.add(prefix + index);
            counters.put(prefix, index + 1);
            assigned++;
        }
        return assigned;
    }

    private boolean isStale(GraphEdge edge) {
        String id = edge.getId();
        return id != null
                && GENERATED_ID.matcher(id).matches()
                && !id.startsWith(edge.getFrom() + SEPARATOR + edge.getTo() + SEPARATOR);
    }

    private static <T> boolean isOrdered(List<T> items, Comparator<T> order) {
        for (int i = 1; i < items.size(); i++) {
            if (order.compare(items.get(i - 1), items.get(i)) > 0) {
                return false;
            }
        }
        return true;
    }
}
