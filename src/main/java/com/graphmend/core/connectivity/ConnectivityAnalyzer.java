package com.graphmend.core.connectivity;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ConnectivityAnalyzer — read-only reachability diagnostic.
 *
 * Adjacency is UNDIRECTED: the question is "is the decision wired into the
 * same component as an option and a goal", not causal direction.
 *
 * A decision passes when its BFS reaches at least one option AND at least one
 * goal. The graph passes when ANY decision passes.
 */
@Component
public class ConnectivityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityAnalyzer.class);

    public ConnectivityDiagnostic analyze(DecisionGraph graph) {
        if (graph == null) {
            return ConnectivityDiagnostic.empty();
        }

        List<String> decisions = new ArrayList<>();
        List<String> options   = new ArrayList<>();
        List<String> goals     = new ArrayList<>();

        for (GraphNode node : graph.getNodes()) {
            switch (node.getKind()) {
                case DECISION -> decisions.add(node.getId());
                case OPTION   -> options.add(node.getId());
                case GOAL     -> goals.add(node.getId());
                default       -> { }
            }
        }

        if (decisions.isEmpty()) {
            List<String> unreachable = new ArrayList<>(options);
            unreachable.addAll(goals);
            log.debug("[Connectivity] No decision nodes — {} option/goal nodes unreachable", unreachable.size());
            return new ConnectivityDiagnostic(false, List.of(), List.of(), List.of(), unreachable, options, goals);
        }

        Map<String, Set<String>> adjacency = buildUndirectedAdjacency(graph);

        Set<String> allReachable   = new HashSet<>();
        boolean     foundValidPath = false;

        for (String decisionId : decisions) {
            Set<String> reached = traverse(decisionId, adjacency);
            allReachable.addAll(reached);

            boolean hasOption = false;
            boolean hasGoal   = false;
            for (String id : reached) {
                NodeKind kind = graph.kindOf(id);
                if (kind == NodeKind.OPTION) hasOption = true;
                if (kind == NodeKind.GOAL)   hasGoal = true;
            }
            if (hasOption && hasGoal) {
                foundValidPath = true;
            }
        }

        List<String> reachableOptions = new ArrayList<>();
        List<String> reachableGoals   = new ArrayList<>();
        List<String> unreachable      = new ArrayList<>();

        for (GraphNode node : graph.getNodes()) {
            if (node.getKind() != NodeKind.OPTION && node.getKind() != NodeKind.GOAL) {
                continue;
            }
            if (!allReachable.contains(node.getId())) {
                unreachable.add(node.getId());
            } else if (node.getKind() == NodeKind.OPTION) {
                reachableOptions.add(node.getId());
            } else {
                reachableGoals.add(node.getId());
            }
        }

        ConnectivityDiagnostic diagnostic = new ConnectivityDiagnostic(
                foundValidPath, decisions, reachableOptions, reachableGoals, unreachable, options, goals);

        log.debug("[Connectivity] {}", diagnostic);
        return diagnostic;
    }

    private Map<String, Set<String>> buildUndirectedAdjacency(DecisionGraph graph) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodes()) {
            adjacency.put(node.getId(), new LinkedHashSet<>());
        }
        for (GraphEdge edge : graph.getEdges()) {
            adjacency.computeIfAbsent(edge.getFrom(), k -> new LinkedHashSet<>()).add(edge.getTo());
            adjacency.computeIfAbsent(edge.getTo(), k -> new LinkedHashSet<>()).add(edge.getFrom());
        }
        return adjacency;
    }

    private Set<String> traverse(String start, Map<String, Set<String>> adjacency) {
        Set<String>        visited = new HashSet<>();
        ArrayDeque<String> queue   = new ArrayDeque<>();
        queue.add(start);
        visited.add(start);

        while (!queue.isEmpty()) {
            String current = queue.removeFirst();
            for (String next : adjacency.getOrDefault(current, Set.of())) {
                if (visited.add(next)) {
                    queue.addLast(next);
                }
            }
        }
        return visited;
    }
}
