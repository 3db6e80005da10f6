package com.graphmend.core.cycle;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.graph.StructuralMeta;
import com.graphmend.core.warning.StructuralWarning;
import com.graphmend.core.warning.StructuralWarningType;
import com.graphmend.core.warning.WarningSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.graphmend.core.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CycleHandlerTest {

    private final CycleDetector detector = new CycleDetector();
    private final CycleHandler  handler  = new CycleHandler(detector);

    private DecisionGraph loop() {
        DecisionGraph graph = graph(
                node("a", NodeKind.FACTOR),
                node("b", NodeKind.FACTOR),
                node("c", NodeKind.OUTCOME));
        graph.addEdge(edge("a", "b"));
        graph.addEdge(edge("b", "c"));
        graph.addEdge(edge("c", "a"));
        return graph;
    }

    @Test
    void testDetectorFindsLoop() {
        List<List<String>> cycles = detector.findCycles(loop());

        assertEquals(1, cycles.size());
        assertEquals(List.of("a", "b", "c", "a"), cycles.get(0));

        StructuralMeta meta = detector.detect(loop());
        assertTrue(meta.hadCycles());
        assertEquals(List.of("a", "b", "c"), meta.getCycleNodeIds());
    }

    @Test
    void testAcyclicGraphHasNoCycles() {
        assertFalse(detector.detect(connectedChain()).hadCycles());
    }

    @Test
    void testSuppliedMetaWins() {
        StructuralMeta supplied = StructuralMeta.cycles(List.of("x"));

        assertSame(supplied, handler.resolve(connectedChain(), supplied));
        assertTrue(handler.resolve(loop(), null).hadCycles());
    }

    @Test
    void testCycleWarningIsHighAndDeduplicated() {
        Optional<StructuralWarning> warning = handler.classify(StructuralMeta.cycles(List.of("a", "b", "a")));

        assertTrue(warning.isPresent());
        assertEquals(StructuralWarningType.CYCLE_DETECTED, warning.get().getType());
        assertEquals(WarningSeverity.HIGH, warning.get().getSeverity());
        assertEquals(List.of("a", "b"), warning.get().getNodeIds());

        assertTrue(handler.classify(StructuralMeta.none()).isEmpty());
        assertTrue(handler.classify(null).isEmpty());
    }
}
