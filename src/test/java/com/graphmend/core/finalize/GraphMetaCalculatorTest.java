package com.graphmend.core.finalize;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphMeta;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.graph.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.graphmend.core.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphMetaCalculatorTest {

    private final GraphMetaCalculator calculator = new GraphMetaCalculator();

    @Test
    void testRootsAndLeavesAreSorted() {
        DecisionGraph graph = graph(
                node("b", NodeKind.FACTOR),
                node("a", NodeKind.FACTOR),
                node("c", NodeKind.OUTCOME),
                node("lonely", NodeKind.ACTION));
        graph.addEdge(edge("b", "c"));
        graph.addEdge(edge("a", "c"));

        GraphMeta meta = calculator.calculate(graph);

        assertEquals(List.of("a", "b", "lonely"), meta.getRoots());
        assertEquals(List.of("c", "lonely"), meta.getLeaves());
    }

    @Test
    void testLayeredPositions() {
        DecisionGraph graph = graph(
                node("a", NodeKind.FACTOR),
                node("b", NodeKind.FACTOR),
                node("c", NodeKind.OUTCOME));
        graph.addEdge(edge("a", "c"));
        graph.addEdge(edge("b", "c"));

        GraphMeta meta = calculator.calculate(graph);

        Position a = meta.getSuggestedPositions().get("a");
        Position b = meta.getSuggestedPositions().get("b");
        Position c = meta.getSuggestedPositions().get("c");
        assertEquals(250.0, a.getX());
        assertEquals(100.0, a.getY());
        assertEquals(400.0, b.getX());
        assertEquals(325.0, c.getX());
        assertEquals(250.0, c.getY());
    }

    @Test
    void testCycleNodesGetNoPosition() {
        DecisionGraph graph = graph(node("a", NodeKind.FACTOR), node("b", NodeKind.FACTOR));
        graph.addEdge(edge("a", "b"));
        graph.addEdge(edge("b", "a"));

        GraphMeta meta = calculator.calculate(graph);

        assertTrue(meta.getSuggestedPositions().isEmpty());
        assertTrue(meta.getRoots().isEmpty());
    }
}
