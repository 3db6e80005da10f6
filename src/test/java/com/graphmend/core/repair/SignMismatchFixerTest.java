package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.FactorCategory;
import com.graphmend.core.graph.NodeKind;
import org.junit.jupiter.api.Test;

import static com.graphmend.core.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SignMismatchFixerTest {

    private final SignMismatchFixer fixer = new SignMismatchFixer();

    private DecisionGraph factorToOutcome(Double mean, EffectDirection direction) {
        DecisionGraph graph = graph(
                factor("fac1", FactorCategory.CONTROLLABLE),
                node("out1", NodeKind.OUTCOME));
        graph.addEdge(edge("fac1", "out1").withStrengthMean(mean).withEffectDirection(direction));
        return graph;
    }

    @Test
    void testNegativeMeanOnPositiveEdgeIsFlipped() {
        DecisionGraph graph = factorToOutcome(-0.6, EffectDirection.POSITIVE);

        StageOutcome outcome = fixer.fix(graph);

        assertEquals(0.6, graph.getEdges().get(0).getStrengthMean());
        assertEquals(1, outcome.getRepairs().size());
        RepairRecord record = outcome.getRepairs().get(0);
        assertEquals(RepairRecord.FIELD_STRENGTH_MEAN, record.getField());
        assertEquals(RepairAction.NORMALISED, record.getAction());
        assertEquals(-0.6, record.getFromValue());
        assertEquals(0.6, record.getToValue());
    }

    @Test
    void testPositiveMeanOnNegativeEdgeIsFlipped() {
        DecisionGraph graph = factorToOutcome(0.4, EffectDirection.NEGATIVE);

        fixer.fix(graph);

        assertEquals(-0.4, graph.getEdges().get(0).getStrengthMean());
    }

    @Test
    void testZeroOrUndirectedEdgesAreLeftAlone() {
        assertFalse(fixer.fix(factorToOutcome(0.0, EffectDirection.NEGATIVE)).changed());
        assertFalse(fixer.fix(factorToOutcome(-0.3, null)).changed());
        assertFalse(fixer.fix(factorToOutcome(null, EffectDirection.POSITIVE)).changed());
    }

    @Test
    void testConsistentGraphIsUnchanged() {
        DecisionGraph graph = connectedChain();

        StageOutcome outcome = fixer.fix(graph);

        assertFalse(outcome.changed());
        assertEquals(RepairStages.SIGN_MISMATCH, outcome.getStage());
    }
}
