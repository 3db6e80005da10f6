package com.graphmend.core.repair;

import com.graphmend.core.audit.FieldDeletionEvent;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.FactorCategory;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.graphmend.core.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FactorCategoryReconcilerTest {

    private final FactorCategoryReconciler reconciler = new FactorCategoryReconciler();

    private Map<String, Object> controllableData(double value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(GraphNode.DATA_VALUE, value);
        data.put(GraphNode.DATA_FACTOR_TYPE, "price");
        data.put(GraphNode.DATA_UNCERTAINTY_DRIVERS, List.of("market"));
        return data;
    }

    @Test
    void testUncontrolledFactorBecomesExternal() {
        DecisionGraph graph = connectedChain();
        GraphNode stray = factor("fac9", FactorCategory.CONTROLLABLE);
        stray.setData(controllableData(0.6));
        graph.addNode(stray);
        graph.addEdge(edge("fac9", "out1"));

        StageOutcome outcome = reconciler.reconcile(graph);

        assertEquals(FactorCategory.EXTERNAL, stray.getCategory());
        assertFalse(stray.hasData());
        assertNotNull(stray.getPrior());
        assertEquals(0.3, stray.getPrior().getRangeMin(), 1e-9);
        assertEquals(0.9, stray.getPrior().getRangeMax(), 1e-9);

        List<String> fields = outcome.getFieldDeletions().stream()
                .map(FieldDeletionEvent::getField)
                .collect(Collectors.toList());
        assertEquals(List.of("data.value", "data.factor_type", "data.uncertainty_drivers", "data"), fields);
        for (FieldDeletionEvent event : outcome.getFieldDeletions()) {
            assertEquals(RepairStages.UNREACHABLE_FACTORS, event.getStage());
            assertEquals("fac9", event.getNodeId());
            assertEquals(FieldDeletionEvent.REASON_UNREACHABLE_FACTOR_RECLASSIFIED, event.getReason());
        }
        assertEquals(FactorCategory.CONTROLLABLE, graph.getNode("fac1").getCategory());
    }

    @Test
    void testFactorChainFromOptionKeepsCategory() {
        DecisionGraph graph = connectedChain();
        GraphNode downstream = factor("fac2", FactorCategory.CONTROLLABLE);
        downstream.setData(controllableData(0.4));
        graph.addNode(downstream);
        graph.addEdge(edge("fac1", "fac2"));

        StageOutcome outcome = reconciler.reconcile(graph);

        assertFalse(outcome.changed());
        assertEquals(FactorCategory.CONTROLLABLE, downstream.getCategory());
        assertTrue(downstream.hasDataField(GraphNode.DATA_VALUE));
    }

    @Test
    void testInterventionsKeepDataMap() {
        DecisionGraph graph = graph(node("opt1", NodeKind.OPTION));
        GraphNode stray = factor("fac9", FactorCategory.OBSERVABLE);
        Map<String, Object> data = controllableData(1.0);
        data.put(GraphNode.DATA_INTERVENTIONS, Map.of("fac1", 0.5));
        stray.setData(data);
        graph.addNode(stray);

        StageOutcome outcome = reconciler.reconcile(graph);

        assertTrue(stray.hasData());
        assertTrue(stray.hasDataField(GraphNode.DATA_INTERVENTIONS));
        assertFalse(stray.hasDataField(GraphNode.DATA_VALUE));
        assertEquals(3, outcome.getFieldDeletions().size());
        assertEquals(0.0, stray.getPrior().getRangeMin());
        assertEquals(1.0, stray.getPrior().getRangeMax());
    }

    @Test
    void testNoValueMeansNoPrior() {
        DecisionGraph graph = graph(factor("fac9", FactorCategory.CONTROLLABLE));

        StageOutcome outcome = reconciler.reconcile(graph);

        assertEquals(FactorCategory.EXTERNAL, graph.getNode("fac9").getCategory());
        assertNull(graph.getNode("fac9").getPrior());
        assertTrue(outcome.getFieldDeletions().isEmpty());
        assertTrue(outcome.changed());
    }
}
