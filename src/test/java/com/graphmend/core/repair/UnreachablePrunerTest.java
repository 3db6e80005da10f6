package com.graphmend.core.repair;

import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.FactorCategory;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;
import org.junit.jupiter.api.Test;

import static com.graphmend.core.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class UnreachablePrunerTest {

    private final UnreachablePruner pruner = new UnreachablePruner();

    @Test
    void testUnreachableFactorIsRemovedWithItsEdges() {
        DecisionGraph graph = connectedChain();
        graph.addNode(factor("fac9", FactorCategory.EXTERNAL));
        graph.addEdge(edge("fac9", "out1"));

        StageOutcome outcome = pruner.prune(graph);

        assertFalse(graph.hasNode("fac9"));
        assertFalse(graph.hasEdge("fac9", "out1"));
        assertEquals(2, outcome.getMutationCount());
        assertTrue(graph.hasNode("fac1"));
    }

    @Test
    void testProtectedKindsSurviveEvenWhenIsolated() {
        DecisionGraph graph = graph(
                node("dec1", NodeKind.DECISION),
                node("opt1", NodeKind.OPTION),
                goal("goal1", "Goal"),
                node("out1", NodeKind.OUTCOME),
                node("risk1", NodeKind.RISK),
                node("act1", NodeKind.ACTION),
                factor("fac1", FactorCategory.CONTROLLABLE));

        pruner.prune(graph);

        for (NodeKind kind : NodeKind.values()) {
            if (kind.isProtected()) {
                assertFalse(graph.nodesOfKind(kind).isEmpty(), kind + " must survive");
            }
        }
        assertFalse(graph.hasNode("fac1"));
        assertEquals(6, graph.nodeCount());
    }

    @Test
    void testNoDecisionSkipsPruning() {
        DecisionGraph graph = graph(
                factor("fac1", FactorCategory.EXTERNAL),
                node("out1", NodeKind.OUTCOME));

        StageOutcome outcome = pruner.prune(graph);

        assertFalse(outcome.changed());
        assertTrue(graph.hasNode("fac1"));
    }

    @Test
    void testReachabilityFollowsEdgeDirection() {
        DecisionGraph graph = connectedChain();
        graph.addNode(factor("upstream", FactorCategory.EXTERNAL));
        graph.addEdge(edge("upstream", "dec1"));

        pruner.prune(graph);

        assertFalse(graph.hasNode("upstream"));
        for (GraphNode node : connectedChain().getNodes()) {
            assertTrue(graph.hasNode(node.getId()));
        }
    }
}
