package com.graphmend.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphmend.communication.InMemoryRepairEventBus;
import com.graphmend.config.EngineSettings;
import com.graphmend.core.GraphErrorCode;
import com.graphmend.core.event.RepairEvent;
import com.graphmend.core.event.RepairEventType;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.graphmend.core.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphValidationServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<RepairEvent> events = new ArrayList<>();
    private GraphValidationService service;

    @BeforeEach
    void setUp() {
        InMemoryRepairEventBus bus = new InMemoryRepairEventBus();
        bus.subscribe(events::add);
        service = EngineAssembly.validationService(bus, EngineSettings.defaults());
    }

    private static GraphEdge findEdge(DecisionGraph graph, String from, String to) {
        return graph.getEdges().stream()
                .filter(e -> e.getFrom().equals(from) && e.getTo().equals(to))
                .findFirst()
                .orElseThrow();
    }

    // -------------------------------------------------------------------------
    // Size gate
    // -------------------------------------------------------------------------

    @Test
    void testTooManyNodesIsRejected() {
        DecisionGraph graph = new DecisionGraph();
        for (int i = 0; i < 51; i++) {
            graph.addNode(node("out" + i, NodeKind.OUTCOME));
        }

        ValidationResult result = service.validateAndFixGraph(graph);

        assertFalse(result.isValid());
        assertFalse(result.hasGraph());
        assertEquals(GraphErrorCode.CEE_GRAPH_TOO_LARGE, result.getErrorCode());
        assertTrue(result.getError().contains("node limit"));
        assertTrue(result.getError().contains("51"));
        assertEquals(RepairEventType.GRAPH_REJECTED, events.get(0).getType());
    }

    @Test
    void testTooManyEdgesIsRejected() {
        DecisionGraph graph = graph(node("a", NodeKind.OPTION), node("b", NodeKind.OUTCOME));
        for (int i = 0; i < 201; i++) {
            graph.addEdge(edge("a", "b"));
        }

        ValidationResult result = service.validateAndFixGraph(graph);

        assertFalse(result.isValid());
        assertEquals(GraphErrorCode.CEE_GRAPH_TOO_LARGE, result.getErrorCode());
        assertTrue(result.getError().contains("edge limit"));
    }

    @Test
    void testSizeGateCanBeSwitchedOff() {
        DecisionGraph graph = connectedChain();
        for (int i = 0; i < 60; i++) {
            graph.addNode(node("risk_extra" + i, NodeKind.RISK));
        }
        ValidationOptions options = ValidationOptions.builder(EngineSettings.defaults())
                .checkSizeLimits(false)
                .build();

        ValidationResult result = service.validateAndFixGraph(graph, null, options);

        assertTrue(result.isValid());
        assertTrue(result.hasGraph());
    }

    @Test
    void testMissingGraphIsMalformed() {
        ValidationResult result = service.validateAndFixGraph((DecisionGraph) null);

        assertFalse(result.isValid());
        assertEquals(GraphErrorCode.CEE_GRAPH_MALFORMED, result.getErrorCode());
    }

    @Test
    void testMalformedJsonIsRejected() throws Exception {
        JsonNode payload = MAPPER.readTree("""
                {"nodes": [{"kind": "goal"}], "edges": []}
                """);

        ValidationResult result = service.validateAndFixGraph(payload, null,
                ValidationOptions.from(EngineSettings.defaults()));

        assertFalse(result.isValid());
        assertEquals(GraphErrorCode.CEE_GRAPH_MALFORMED, result.getErrorCode());
        assertNotNull(result.getError());
    }

    // -------------------------------------------------------------------------
    // Repair
    // -------------------------------------------------------------------------

    @Test
    void testCleanGraphPassesThrough() {
        ValidationResult result = service.validateAndFixGraph(connectedChain());

        assertTrue(result.isValid());
        assertNull(result.getErrorCode());
        assertFalse(result.getFixes().isSingleGoalApplied());
        assertEquals(0, result.getFixes().getOutcomeBeliefsFilled());
        assertFalse(result.getFixes().isDecisionBranchesNormalized());
        assertTrue(result.getStructure().isValid());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void testOptionToOutcomeBeliefIsDefaulted() {
        DecisionGraph graph = connectedChain();
        graph.addNode(node("out2", NodeKind.OUTCOME));
        graph.addEdge(edge("opt1", "out2"));

        ValidationResult result = service.validateAndFixGraph(graph);

        assertEquals(1, result.getFixes().getOutcomeBeliefsFilled());
        assertEquals(0.5, findEdge(result.getGraph(), "opt1", "out2").getBelief(), 1e-9);
    }

    @Test
    void testCustomDefaultOutcomeBelief() {
        DecisionGraph graph = connectedChain();
        graph.addNode(node("out2", NodeKind.OUTCOME));
        graph.addEdge(edge("opt1", "out2"));
        ValidationOptions options = ValidationOptions.builder(EngineSettings.defaults())
                .defaultOutcomeBelief(0.3)
                .build();

        ValidationResult result = service.validateAndFixGraph(graph, null, options);

        assertEquals(0.3, findEdge(result.getGraph(), "opt1", "out2").getBelief(), 1e-9);
    }

    @Test
    void testMultipleGoalsAreMerged() {
        DecisionGraph graph = connectedChain();
        graph.addNode(goal("goal2", "Cut costs"));
        graph.addEdge(edge("risk1", "goal2"));

        ValidationResult result = service.validateAndFixGraph(graph);

        assertTrue(result.getFixes().isSingleGoalApplied());
        assertEquals(2, result.getFixes().getOriginalGoalCount());
        assertEquals(List.of("goal1"), result.getGraph().idsOfKind(NodeKind.GOAL));
        assertTrue(result.getGraph().getNode("goal1").getLabel().startsWith("Compound Goal: "));
    }

    @Test
    void testCallerGraphIsNotMutated() {
        DecisionGraph graph = connectedChain();
        graph.addNode(goal("goal2", "Cut costs"));
        graph.addEdge(edge("ghost", "out1"));
        int nodesBefore = graph.nodeCount();
        int edgesBefore = graph.edgeCount();

        service.validateAndFixGraph(graph);

        assertEquals(nodesBefore, graph.nodeCount());
        assertEquals(edgesBefore, graph.edgeCount());
        assertTrue(graph.hasNode("goal2"));
        assertNull(graph.getEdges().get(0).getId());
    }

    @Test
    void testStructureFailureStillReturnsGraph() {
        DecisionGraph graph = graph(
                goal("goal1", "Grow revenue"),
                node("dec1", NodeKind.DECISION),
                node("out1", NodeKind.OUTCOME));
        graph.addEdge(edge("dec1", "out1"));

        ValidationResult result = service.validateAndFixGraph(graph);

        assertTrue(result.isValid());
        assertTrue(result.hasGraph());
        assertFalse(result.getStructure().isValid());
        assertEquals(GraphErrorCode.CEE_GRAPH_INVALID, result.getStructure().getErrorCode());
        assertTrue(result.getStructure().getMissingKinds().contains(NodeKind.OPTION));
    }

    @Test
    void testStructureChecksDoNotRepair() {
        DecisionGraph graph = connectedChain();
        graph.removeEdgesIf(e -> e.getTo().equals("goal1"));

        assertFalse(service.checkConnectedMinimumStructure(graph).isPassed());
        assertEquals(GraphErrorCode.CEE_GRAPH_CONNECTIVITY_FAILED,
                service.checkMinimumStructure(graph).getErrorCode());
        assertFalse(graph.hasEdge("out1", "goal1"));
    }
}
