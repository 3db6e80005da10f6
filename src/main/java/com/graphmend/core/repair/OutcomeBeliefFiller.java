package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.NodeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Gives every option→outcome edge without a belief the default belief.
 * Existing beliefs are never overwritten.
 */
@Component
public class OutcomeBeliefFiller {

    private static final Logger log = LoggerFactory.getLogger(OutcomeBeliefFiller.class);

    public StageOutcome fill(DecisionGraph graph, double defaultBelief) {
        List<RepairRecord> repairs = new ArrayList<>();

        for (GraphEdge edge : graph.getEdges()) {
            if (edge.getBelief() != null) {
                continue;
            }
            if (graph.kindOf(edge.getFrom()) != NodeKind.OPTION || graph.kindOf(edge.getTo()) != NodeKind.OUTCOME) {
                continue;
            }
            edge.setBelief(defaultBelief);
            repairs.add(RepairRecord.forEdge(edge, RepairRecord.FIELD_BELIEF, RepairAction.DEFAULTED)
                    .toValue(defaultBelief)
                    .reason("Missing option→outcome belief set to default")
                    .build());
        }

        if (repairs.isEmpty()) {
            return StageOutcome.unchanged(RepairStages.OUTCOME_BELIEFS, graph);
        }
        log.info("[OutcomeBeliefs] Filled {} option→outcome belief(s) with default {}", repairs.size(), defaultBelief);
        return StageOutcome.of(RepairStages.OUTCOME_BELIEFS, graph, repairs, List.of(), repairs.size());
    }
}
