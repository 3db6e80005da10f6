package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.FactorCategory;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.graphmend.core.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CanonicalEdgeEnforcerTest {

    private final CanonicalEdgeEnforcer enforcer = new CanonicalEdgeEnforcer();

    private DecisionGraph optionToFactor(GraphEdge edge) {
        DecisionGraph graph = graph(
                node("opt1", NodeKind.OPTION),
                factor("fac1", FactorCategory.CONTROLLABLE),
                node("out1", NodeKind.OUTCOME));
        graph.addEdge(edge);
        graph.addEdge(edge("fac1", "out1").withStrengthMean(0.4));
        return graph;
    }

    @Test
    void testNonCanonicalValuesAreNormalised() {
        DecisionGraph graph = optionToFactor(edge("opt1", "fac1")
                .withStrengthMean(0.5)
                .withStrengthStd(0.15)
                .withBeliefExists(0.8)
                .withEffectDirection(EffectDirection.POSITIVE));

        StageOutcome outcome = enforcer.enforce(graph);

        GraphEdge fixed = outcome.getGraph().getEdges().get(0);
        assertEquals(1.0, fixed.getStrengthMean());
        assertEquals(0.01, fixed.getStrengthStd());
        assertEquals(1.0, fixed.getBeliefExists());

        List<RepairAction> actions = outcome.getRepairs().stream()
                .map(RepairRecord::getAction)
                .collect(Collectors.toList());
        assertEquals(List.of(RepairAction.NORMALISED, RepairAction.NORMALISED, RepairAction.NORMALISED), actions);
        assertEquals(0.5, outcome.getRepairs().get(0).getFromValue());
        assertEquals(1.0, outcome.getRepairs().get(0).getToValue());
        assertEquals("opt1", outcome.getRepairs().get(0).getEdgeFrom());
    }

    @Test
    void testAbsentFieldsAreDefaulted() {
        DecisionGraph graph = optionToFactor(edge("opt1", "fac1").withStrengthMean(0.2));

        StageOutcome outcome = enforcer.enforce(graph);

        assertEquals(4, outcome.getRepairs().size());
        assertEquals(RepairAction.NORMALISED, outcome.getRepairs().get(0).getAction());
        assertEquals(RepairAction.DEFAULTED, outcome.getRepairs().get(1).getAction());
        assertNull(outcome.getRepairs().get(1).getFromValue());
        RepairRecord direction = outcome.getRepairs().get(3);
        assertEquals(RepairRecord.FIELD_EFFECT_DIRECTION, direction.getField());
        assertEquals("positive", direction.getToValue());
    }

    @Test
    void testNegativeDirectionIsFlipped() {
        GraphEdge negative = canonical("opt1", "fac1").withEffectDirection(EffectDirection.NEGATIVE);

        StageOutcome outcome = enforcer.enforce(optionToFactor(negative));

        assertEquals(1, outcome.getRepairs().size());
        assertEquals("negative", outcome.getRepairs().get(0).getFromValue());
        assertEquals(EffectDirection.POSITIVE, outcome.getGraph().getEdges().get(0).getEffectDirection());
    }

    @Test
    void testSecondPassIsNoOp() {
        DecisionGraph graph = optionToFactor(edge("opt1", "fac1").withStrengthMean(0.5).withStrengthStd(0.15));

        StageOutcome first  = enforcer.enforce(graph);
        StageOutcome second = enforcer.enforce(first.getGraph());

        assertFalse(first.getRepairs().isEmpty());
        assertTrue(second.getRepairs().isEmpty());
        assertSame(first.getGraph(), second.getGraph());
    }

    @Test
    void testCanonicalGraphReturnedBySameReference() {
        DecisionGraph graph = connectedChain();

        StageOutcome outcome = enforcer.enforce(graph);

        assertSame(graph, outcome.getGraph());
        assertFalse(outcome.changed());
    }

    @Test
    void testNearlyCanonicalValueIsStillRewritten() {
        DecisionGraph graph = optionToFactor(canonical("opt1", "fac1").withStrengthMean(1.0000005));

        assertFalse(enforcer.isCanonical(graph.getEdges().get(0)));

        StageOutcome outcome = enforcer.enforce(graph);

        assertEquals(1, outcome.getRepairs().size());
        RepairRecord record = outcome.getRepairs().get(0);
        assertEquals(RepairRecord.FIELD_STRENGTH_MEAN, record.getField());
        assertEquals(RepairAction.NORMALISED, record.getAction());
        assertEquals(1.0, outcome.getGraph().getEdges().get(0).getStrengthMean());
    }

    @Test
    void testOtherPairsAreUntouched() {
        DecisionGraph graph = optionToFactor(canonical("opt1", "fac1"));

        enforcer.enforce(graph);

        assertEquals(0.4, graph.getEdges().get(1).getStrengthMean());
        assertNull(graph.getEdges().get(1).getStrengthStd());
    }

    @Test
    void testInputGraphIsNotMutated() {
        DecisionGraph graph = optionToFactor(edge("opt1", "fac1").withStrengthMean(0.5));

        StageOutcome outcome = enforcer.enforce(graph);

        assertNotSame(graph, outcome.getGraph());
        assertEquals(0.5, graph.getEdges().get(0).getStrengthMean());
    }
}
