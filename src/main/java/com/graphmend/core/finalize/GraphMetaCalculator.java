package com.graphmend.core.finalize;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphMeta;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.Position;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Roots, leaves and a layered layout for {@link GraphMeta}.
 *
 * Layers come from Kahn's algorithm; nodes on a cycle never reach in-degree 0
 * and get no position.
 */
@Component
public class GraphMetaCalculator {

    static final double ORIGIN_X = 400;
    static final double ORIGIN_Y = 100;
    static final double SPACING  = 150;

    /** Fresh meta for the graph. source is carried over from the current meta. */
    public GraphMeta calculate(DecisionGraph graph) {
        Set<String> hasIncoming = new HashSet<>();
        Set<String> hasOutgoing = new HashSet<>();
        for (GraphEdge edge : graph.getEdges()) {
            hasIncoming.add(edge.getTo());
            hasOutgoing.add(edge.getFrom());
        }

        List<String> ids = graph.getNodes().stream().map(GraphNode::getId).collect(Collectors.toList());

        GraphMeta meta = new GraphMeta(graph.getMeta().getSource());
        meta.setRoots(ids.stream().filter(id -> !hasIncoming.contains(id)).sorted().collect(Collectors.toList()));
        meta.setLeaves(ids.stream().filter(id -> !hasOutgoing.contains(id)).sorted().collect(Collectors.toList()));
        meta.setSuggestedPositions(layout(ids, graph.getEdges()));
        return meta;
    }

    Map<String, Position> layout(List<String> ids, List<GraphEdge> edges) {
        Map<String, Position> positions = new LinkedHashMap<>();
        List<List<String>>    layers    = assignLayers(ids, edges);

        for (int layerIdx = 0; layerIdx < layers.size(); layerIdx++) {
            List<String> layer = layers.get(layerIdx);
            for (int i = 0; i < layer.size(); i++) {
                double x = ORIGIN_X + (i - layer.size() / 2.0) * SPACING;
                double y = ORIGIN_Y + layerIdx * SPACING;
                positions.put(layer.get(i), new Position(x, y));
            }
        }
        return positions;
    }

    private List<List<String>> assignLayers(List<String> ids, List<GraphEdge> edges) {
        Map<String, List<String>> adjacency = new HashMap<>();
        Map<String, Integer>      inDegree  = new HashMap<>();
        for (String id : ids) {
            adjacency.put(id, new ArrayList<>());
            inDegree.put(id, 0);
        }
        for (GraphEdge edge : edges) {
            List<String> targets = adjacency.get(edge.getFrom());
            if (targets != null && inDegree.containsKey(edge.getTo())) {
                targets.add(edge.getTo());
                inDegree.merge(edge.getTo(), 1, Integer::sum);
            }
        }

        List<List<String>> layers  = new ArrayList<>();
        List<String>       current = ids.stream().filter(id -> inDegree.get(id) == 0).collect(Collectors.toList());

        while (!current.isEmpty()) {
            List<String> layer = new ArrayList<>(current);
            Collections.sort(layer);
            layers.add(layer);

            Set<String> next = new LinkedHashSet<>();
            for (String id : current) {
                for (String neighbour : adjacency.get(id)) {
                    int remaining = inDegree.merge(neighbour, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(neighbour);
                    }
                }
            }
            current = new ArrayList<>(next);
        }
        return layers;
    }
}
