package com.graphmend.core.repair;

import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes factor nodes that no decision reaches along edge direction.
 *
 * Only FACTOR is prunable; every other kind survives regardless of
 * reachability. With zero decisions nothing is pruned.
 */
@Component
public class UnreachablePruner {

    private static final Logger log = LoggerFactory.getLogger(UnreachablePruner.class);

    public StageOutcome prune(DecisionGraph graph) {
        List<String> decisionIds = graph.idsOfKind(NodeKind.DECISION);
        if (decisionIds.isEmpty()) {
            log.warn("[Pruner] No decision node; pruning skipped");
            return StageOutcome.unchanged(RepairStages.UNREACHABLE_PRUNER, graph);
        }

        Set<String> reached = forwardReach(graph, decisionIds);

        List<String> doomed = new ArrayList<>();
        for (GraphNode node : graph.getNodes()) {
            if (!node.getKind().isProtected() && !reached.contains(node.getId())) {
                doomed.add(node.getId());
            }
        }
        if (doomed.isEmpty()) {
            return StageOutcome.unchanged(RepairStages.UNREACHABLE_PRUNER, graph);
        }

        Set<String> doomedSet = new HashSet<>(doomed);
        int edgesRemoved = graph.removeEdgesIf(e -> doomedSet.contains(e.getFrom()) || doomedSet.contains(e.getTo()));
        doomed.forEach(graph::removeNode);

        log.info("[Pruner] Removed {} unreachable factor(s) {} and {} edge(s)", doomed.size(), doomed, edgesRemoved);
        return StageOutcome.of(RepairStages.UNREACHABLE_PRUNER, graph, List.of(), List.of(),
                doomed.size() + edgesRemoved);
    }

    private Set<String> forwardReach(DecisionGraph graph, List<String> startIds) {
        Map<String, List<String>> forward = new HashMap<>();
        for (GraphEdge edge : graph.getEdges()) {
            forward.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
        }

        Set<String>   visited = new HashSet<>(startIds);
        Deque<String> queue   = new ArrayDeque<>(startIds);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : forward.getOrDefault(current, List.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }
}
