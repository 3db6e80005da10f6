package com.graphmend.core.cycle;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.StructuralMeta;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first cycle detection over forward edges.
 *
 * Used only when the caller did not run the external stabiliser and so has no
 * StructuralMeta to pass in. Never breaks a cycle.
 */
@Component
public class CycleDetector {

    /**
     * @return each cycle as a node path that starts and ends on the same id
     */
    public List<List<String>> findCycles(DecisionGraph graph) {
        Map<String, List<String>> forward = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodes()) {
            forward.put(node.getId(), new ArrayList<>());
        }
        for (GraphEdge edge : graph.getEdges()) {
            if (!graph.hasNode(edge.getFrom()) || !graph.hasNode(edge.getTo())) {
                continue;
            }
            forward.get(edge.getFrom()).add(edge.getTo());
        }

        Set<String>        visited  = new HashSet<>();
        Set<String>        onStack  = new HashSet<>();
        List<List<String>> cycles   = new ArrayList<>();

        for (String nodeId : forward.keySet()) {
            if (!visited.contains(nodeId)) {
                dfs(nodeId, new ArrayList<>(), forward, visited, onStack, cycles);
            }
        }
        return cycles;
    }

    public StructuralMeta detect(DecisionGraph graph) {
        List<List<String>> cycles = findCycles(graph);
        if (cycles.isEmpty()) {
            return StructuralMeta.none();
        }
        Set<String> nodeIds = new LinkedHashSet<>();
        for (List<String> cycle : cycles) {
            nodeIds.addAll(cycle);
        }
        return StructuralMeta.cycles(new ArrayList<>(nodeIds));
    }

    private void dfs(String node, List<String> path, Map<String, List<String>> forward,
                     Set<String> visited, Set<String> onStack, List<List<String>> cycles) {
        visited.add(node);
        onStack.add(node);
        path.add(node);

        for (String next : forward.getOrDefault(node, List.of())) {
            if (!visited.contains(next)) {
                dfs(next, path, forward, visited, onStack, cycles);
            } else if (onStack.contains(next)) {
                int start = path.indexOf(next);
                List<String> cycle = new ArrayList<>(path.subList(start, path.size()));
                cycle.add(next);
                cycles.add(cycle);
            }
        }

        path.remove(path.size() - 1);
        onStack.remove(node);
    }
}
