package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Replaces NaN and infinite numbers with fixed fallbacks.
 *
 * Edge fields: strength.mean → 0.5, strength.std → 0.1, belief_exists → 0.8.
 * Factor nodes: a numeric data.value → 0.5. Absent values are left absent.
 */
@Component
public class NumericSanitizer {

    private static final Logger log = LoggerFactory.getLogger(NumericSanitizer.class);

    static final double FALLBACK_MEAN         = 0.5;
    static final double FALLBACK_STD          = 0.1;
    static final double FALLBACK_EXISTENCE    = 0.8;
    static final double FALLBACK_FACTOR_VALUE = 0.5;

    public StageOutcome sanitize(DecisionGraph graph) {
        List<RepairRecord> repairs = new ArrayList<>();

        for (GraphEdge edge : graph.getEdges()) {
            replaceEdgeValue(edge, RepairRecord.FIELD_STRENGTH_MEAN, edge.getStrengthMean(),
                    FALLBACK_MEAN, edge::setStrengthMean, repairs);
            replaceEdgeValue(edge, RepairRecord.FIELD_STRENGTH_STD, edge.getStrengthStd(),
                    FALLBACK_STD, edge::setStrengthStd, repairs);
            replaceEdgeValue(edge, RepairRecord.FIELD_BELIEF_EXISTS, edge.getBeliefExists(),
                    FALLBACK_EXISTENCE, edge::setBeliefExists, repairs);
        }

        for (GraphNode node : graph.nodesOfKind(NodeKind.FACTOR)) {
            Object value = node.getDataField(GraphNode.DATA_VALUE);
            if (!(value instanceof Number) || Double.isFinite(((Number) value).doubleValue())) {
                continue;
            }
            node.putDataField(GraphNode.DATA_VALUE, FALLBACK_FACTOR_VALUE);
            repairs.add(RepairRecord.forNode(node.getId(), RepairRecord.FIELD_DATA_VALUE, RepairAction.NORMALISED)
                    .fromValue(value)
                    .toValue(FALLBACK_FACTOR_VALUE)
                    .reason("Non-finite factor value")
                    .build());
        }

        if (repairs.isEmpty()) {
            return StageOutcome.unchanged(RepairStages.NAN_VALUES, graph);
        }
        log.info("[NumericSanitizer] Replaced {} non-finite value(s)", repairs.size());
        return StageOutcome.of(RepairStages.NAN_VALUES, graph, repairs, List.of(), repairs.size());
    }

    private static void replaceEdgeValue(GraphEdge edge, String field, Double current, double fallback,
                                         Consumer<Double> setter, List<RepairRecord> repairs) {
        if (current == null || Double.isFinite(current)) {
            return;
        }
        setter.accept(fallback);
        repairs.add(RepairRecord.forEdge(edge, field, RepairAction.NORMALISED)
                .fromValue(current)
                .toValue(fallback)
                .reason("Non-finite " + field)
                .build());
    }
}
