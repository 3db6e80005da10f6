package com.graphmend.core.connectivity;

import com.graphmend.core.GraphErrorCode;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.graphmend.core.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MinimumStructureValidatorTest {

    private final MinimumStructureValidator validator = new MinimumStructureValidator(new ConnectivityAnalyzer());

    @Test
    void testMissingKindsAreInvalid() {
        DecisionGraph graph = graph(node("dec", NodeKind.DECISION), node("out1", NodeKind.OUTCOME));

        MinimumStructureResult result = validator.check(graph);

        assertFalse(result.isValid());
        assertEquals(GraphErrorCode.CEE_GRAPH_INVALID, result.getErrorCode());
        assertEquals(List.of(NodeKind.GOAL, NodeKind.OPTION), result.getMissingKinds());
        assertTrue(result.getMessage().startsWith("Graph missing required elements:"));
        assertNull(result.getConnectivity());
    }

    @Test
    void testMissingOutcomeAndRisk() {
        DecisionGraph graph = graph(
                node("dec", NodeKind.DECISION),
                node("opt1", NodeKind.OPTION),
                goal("goal1", "Goal"));
        graph.addEdge(edge("dec", "opt1"));
        graph.addEdge(edge("opt1", "goal1"));

        MinimumStructureResult result = validator.check(graph);

        assertEquals(GraphErrorCode.CEE_GRAPH_INVALID, result.getErrorCode());
        assertEquals(MinimumStructureResult.REASON_MISSING_OUTCOME_OR_RISK, result.getReason());
    }

    @Test
    void testDisconnectedIsConnectivityFailure() {
        DecisionGraph graph = graph(
                node("dec", NodeKind.DECISION),
                node("opt1", NodeKind.OPTION),
                node("out1", NodeKind.OUTCOME),
                goal("goal1", "Goal"));
        graph.addEdge(edge("dec", "opt1"));

        MinimumStructureResult result = validator.check(graph);

        assertFalse(result.isValid());
        assertTrue(result.isConnectivityFailure());
        assertEquals(GraphErrorCode.CEE_GRAPH_CONNECTIVITY_FAILED, result.getErrorCode());
        assertEquals("Graph has all required node types but they are not connected via edges", result.getMessage());
        assertEquals(ConnectivityFailureClass.NO_PATH_TO_GOAL, result.getConnectivity().getFailureClass());
        assertTrue(result.getConditionalHint().contains("goal is not connected"));
    }

    @Test
    void testConnectedChainIsValid() {
        MinimumStructureResult result = validator.check(connectedChain());

        assertTrue(result.isValid());
        assertNull(result.getErrorCode());
    }
}
