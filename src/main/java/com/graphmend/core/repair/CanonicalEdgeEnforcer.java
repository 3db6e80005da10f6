package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.params.EdgeParameterTable;
import com.graphmend.core.params.EdgeTemplate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Forces option→factor edges onto the canonical structural parameters.
 *
 * Fields are compared exactly, not within tolerance.
 * One record per field actually rewritten: DEFAULTED when the field was
 * absent, NORMALISED otherwise. When every option→factor edge is already
 * canonical the input graph is returned as the same reference.
 */
@Component
public class CanonicalEdgeEnforcer {

    private static final Logger log = LoggerFactory.getLogger(CanonicalEdgeEnforcer.class);

    static final String REASON = "Option→factor edge set to canonical structural parameters";

    private final EdgeTemplate canonical = EdgeParameterTable.require(NodeKind.OPTION, NodeKind.FACTOR);

    public StageOutcome enforce(DecisionGraph graph) {
        if (graph.getEdges().stream().noneMatch(e -> isOptionToFactor(graph, e) && !isCanonical(e))) {
            return StageOutcome.unchanged(RepairStages.CANONICAL_EDGES, graph);
        }

        DecisionGraph      fixed   = graph.copy();
        List<RepairRecord> repairs = new ArrayList<>();
        int                edges   = 0;

        for (GraphEdge edge : fixed.getEdges()) {
            if (!isOptionToFactor(fixed, edge) || isCanonical(edge)) {
                continue;
            }
            edges++;

            if (!matches(edge.getStrengthMean(), canonical.getStrengthMean())) {
                repairs.add(record(edge, RepairRecord.FIELD_STRENGTH_MEAN, edge.getStrengthMean(),
                        canonical.getStrengthMean()));
                edge.setStrengthMean(canonical.getStrengthMean());
            }
            if (!matches(edge.getStrengthStd(), canonical.getStrengthStd())) {
                repairs.add(record(edge, RepairRecord.FIELD_STRENGTH_STD, edge.getStrengthStd(),
                        canonical.getStrengthStd()));
                edge.setStrengthStd(canonical.getStrengthStd());
            }
            if (!matches(edge.getBeliefExists(), canonical.getBeliefExists())) {
                repairs.add(record(edge, RepairRecord.FIELD_BELIEF_EXISTS, edge.getBeliefExists(),
                        canonical.getBeliefExists()));
                edge.setBeliefExists(canonical.getBeliefExists());
            }
            if (edge.getEffectDirection() != canonical.getEffectDirection()) {
                EffectDirection before = edge.getEffectDirection();
                repairs.add(record(edge, RepairRecord.FIELD_EFFECT_DIRECTION,
                        before != null ? before.wireName() : null,
                        canonical.getEffectDirection().wireName()));
                edge.setEffectDirection(canonical.getEffectDirection());
            }
        }

        log.info("[CanonicalEdges] Canonicalised {} option→factor edge(s), {} field(s) rewritten",
                edges, repairs.size());
        return StageOutcome.of(RepairStages.CANONICAL_EDGES, fixed, repairs, List.of(), repairs.size());
    }

    public boolean isCanonical(GraphEdge edge) {
        return matches(edge.getStrengthMean(), canonical.getStrengthMean())
                && matches(edge.getStrengthStd(), canonical.getStrengthStd())
                && matches(edge.getBeliefExists(), canonical.getBeliefExists())
                && edge.getEffectDirection() == canonical.getEffectDirection();
    }

    /** Exact: a value a hair off the canonical one is still rewritten. */
    private static boolean matches(Double actual, double canonicalValue) {
        return actual != null && actual == canonicalValue;
    }

    private boolean isOptionToFactor(DecisionGraph graph, GraphEdge edge) {
        return graph.kindOf(edge.getFrom()) == NodeKind.OPTION && graph.kindOf(edge.getTo()) == NodeKind.FACTOR;
    }

    private RepairRecord record(GraphEdge edge, String field, Object before, Object after) {
        return RepairRecord.forEdge(edge, field, RepairAction.forPriorValue(before))
                .fromValue(before)
                .toValue(after)
                .reason(REASON)
                .build();
    }
}
