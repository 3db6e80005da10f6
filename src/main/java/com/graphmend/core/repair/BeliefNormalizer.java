package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.params.Tolerance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rescales each decision's decision→option beliefs so they sum to 1.0.
 *
 * A group already summing to 1.0 (within {@link Tolerance#EPSILON}) is left
 * value-for-value. A group summing to 0 is left alone and logged.
 */
@Component
public class BeliefNormalizer {

    private static final Logger log = LoggerFactory.getLogger(BeliefNormalizer.class);

    static final String REASON = "Decision branch beliefs renormalised to sum to 1.0";

    public StageOutcome normalize(DecisionGraph graph) {
        List<RepairRecord> repairs = new ArrayList<>();
        int groupsRescaled = 0;

        for (String decisionId : graph.idsOfKind(NodeKind.DECISION)) {
            List<GraphEdge> branches = new ArrayList<>();
            double sum = 0.0;
            for (GraphEdge edge : graph.outgoing(decisionId)) {
                if (graph.kindOf(edge.getTo()) == NodeKind.OPTION && edge.getBelief() != null) {
                    branches.add(edge);
                    sum += edge.getBelief();
                }
            }

            if (branches.isEmpty() || Tolerance.approxEquals(sum, 1.0)) {
                continue;
            }
            if (sum == 0.0) {
                log.warn("[BeliefNormalizer] Decision '{}' has {} branch belief(s) summing to 0; left unchanged",
                        decisionId, branches.size());
                continue;
            }

            boolean changed = false;
            for (GraphEdge edge : branches) {
                double before = edge.getBelief();
                double after  = before / sum;
                if (Tolerance.approxEquals(before, after)) {
                    continue;
                }
                edge.setBelief(after);
                repairs.add(RepairRecord.forEdge(edge, RepairRecord.FIELD_BELIEF, RepairAction.NORMALISED)
                        .fromValue(before)
                        .toValue(after)
                        .reason(REASON)
                        .build());
                changed = true;
            }
            if (changed) {
                groupsRescaled++;
                log.debug("[BeliefNormalizer] Decision '{}' rescaled from sum {}", decisionId, sum);
            }
        }

        if (groupsRescaled == 0) {
            return StageOutcome.unchanged(RepairStages.BELIEF_NORMALISATION, graph);
        }
        log.info("[BeliefNormalizer] Renormalised {} decision group(s), {} belief(s) changed",
                groupsRescaled, repairs.size());
        return StageOutcome.of(RepairStages.BELIEF_NORMALISATION, graph, repairs, List.of(), repairs.size());
    }
}
