package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.GraphEdge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flips strength.mean when its sign contradicts effect_direction.
 * The declared direction wins; a zero mean never contradicts anything.
 */
@Component
public class SignMismatchFixer {

    private static final Logger log = LoggerFactory.getLogger(SignMismatchFixer.class);

    public StageOutcome fix(DecisionGraph graph) {
        List<RepairRecord> repairs = new ArrayList<>();

        for (GraphEdge edge : graph.getEdges()) {
            EffectDirection direction = edge.getEffectDirection();
            Double mean = edge.getStrengthMean();
            if (direction == null || mean == null) {
                continue;
            }
            boolean mismatch = direction == EffectDirection.NEGATIVE ? mean > 0 : mean < 0;
            if (!mismatch) {
                continue;
            }
            double flipped = -mean;
            edge.setStrengthMean(flipped);
            repairs.add(RepairRecord.forEdge(edge, RepairRecord.FIELD_STRENGTH_MEAN, RepairAction.NORMALISED)
                    .fromValue(mean)
                    .toValue(flipped)
                    .reason("Mean sign flipped to match effect_direction=" + direction.wireName())
                    .build());
        }

        if (repairs.isEmpty()) {
            return StageOutcome.unchanged(RepairStages.SIGN_MISMATCH, graph);
        }
        log.info("[SignMismatch] Flipped {} strength mean(s)", repairs.size());
        return StageOutcome.of(RepairStages.SIGN_MISMATCH, graph, repairs, List.of(), repairs.size());
    }
}
