package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.graph.Provenance;
import com.graphmend.core.params.EdgeParameterTable;
import com.graphmend.core.params.EdgeTemplate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FactorGoalSplitter — a factor may not point straight at a goal.
 *
 * Every factor→goal edge is replaced by factor→outcome→goal through a
 * synthetic outcome node {@code out_<factorId>_impact}, created once per
 * factor. The factor→outcome edge keeps the original strength (legacy
 * weight / belief are read when strength.mean / belief_exists are absent);
 * the outcome→goal edge gets {@link EdgeParameterTable#SPLIT_DEFAULTS}.
 *
 * Both new edges are marked origin=repair with synthetic provenance. A field
 * filled from a constant is recorded as DEFAULTED, one filled from a legacy
 * field as NORMALISED.
 */
@Component
public class FactorGoalSplitter {

    private static final Logger log = LoggerFactory.getLogger(FactorGoalSplitter.class);

    static final String SPLIT_QUOTE = "Split factor→goal into factor→outcome→goal";

    public StageOutcome split(DecisionGraph graph) {
        List<GraphEdge> factorToGoal = new ArrayList<>();
        for (GraphEdge edge : graph.getEdges()) {
            if (graph.kindOf(edge.getFrom()) == NodeKind.FACTOR && graph.kindOf(edge.getTo()) == NodeKind.GOAL) {
                factorToGoal.add(edge);
            }
        }
        if (factorToGoal.isEmpty()) {
            return StageOutcome.unchanged(RepairStages.FACTOR_GOAL_SPLIT, graph);
        }

        EdgeTemplate defaults = EdgeParameterTable.SPLIT_DEFAULTS;
        List<RepairRecord>  repairs   = new ArrayList<>();
        Map<String, String> outcomeOf = new HashMap<>();
        Set<String>         pairs     = new HashSet<>();
        for (GraphEdge edge : graph.getEdges()) {
            pairs.add(edge.pairKey());
        }

        int nodesAdded = 0;
        List<GraphEdge> rebuilt = new ArrayList<>();
        List<GraphEdge> added   = new ArrayList<>();
        for (GraphEdge edge : graph.getEdges()) {
            if (!factorToGoal.contains(edge)) {
                rebuilt.add(edge);
                continue;
            }
            String factorId  = edge.getFrom();
            String outcomeId = outcomeOf.get(factorId);
            if (outcomeId == null) {
                outcomeId = outcomeIdFor(graph, factorId);
                if (!graph.hasNode(outcomeId)) {
                    GraphNode factor = graph.getNode(factorId);
                    String label = factor.getLabel() != null ? factor.getLabel() : factorId;
                    graph.addNode(new GraphNode(outcomeId, NodeKind.OUTCOME, label + " Impact"));
                    nodesAdded++;
                }
                outcomeOf.put(factorId, outcomeId);
            }

            GraphEdge causal = splitEdge(factorId, outcomeId);
            causal.setEffectDirection(edge.getEffectDirection() != null
                    ? edge.getEffectDirection() : EffectDirection.POSITIVE);
            causal.setStrengthMean(pick(edge.getStrengthMean(), edge.getWeight(), defaults.getStrengthMean()));
            causal.setStrengthStd(pick(edge.getStrengthStd(), null, defaults.getStrengthStd()));
            causal.setBeliefExists(pick(edge.getBeliefExists(), edge.getBelief(), defaults.getBeliefExists()));
            if (pairs.add(causal.pairKey())) {
                rebuilt.add(causal);
                added.add(causal);
                recordFallback(repairs, causal, RepairRecord.FIELD_STRENGTH_MEAN, edge.getStrengthMean(), edge.getWeight());
                recordFallback(repairs, causal, RepairRecord.FIELD_STRENGTH_STD, edge.getStrengthStd(), null);
                recordFallback(repairs, causal, RepairRecord.FIELD_BELIEF_EXISTS, edge.getBeliefExists(), edge.getBelief());
                if (edge.getEffectDirection() == null) {
                    repairs.add(defaulted(causal, RepairRecord.FIELD_EFFECT_DIRECTION, EffectDirection.POSITIVE.wireName()));
                }
            }

            GraphEdge bridge = splitEdge(outcomeId, edge.getTo())
                    .withStrengthMean(defaults.getStrengthMean())
                    .withStrengthStd(defaults.getStrengthStd())
                    .withBeliefExists(defaults.getBeliefExists())
                    .withEffectDirection(defaults.getEffectDirection());
            if (pairs.add(bridge.pairKey())) {
                rebuilt.add(bridge);
                added.add(bridge);
                repairs.add(defaulted(bridge, RepairRecord.FIELD_STRENGTH_MEAN, defaults.getStrengthMean()));
                repairs.add(defaulted(bridge, RepairRecord.FIELD_STRENGTH_STD, defaults.getStrengthStd()));
                repairs.add(defaulted(bridge, RepairRecord.FIELD_BELIEF_EXISTS, defaults.getBeliefExists()));
                repairs.add(defaulted(bridge, RepairRecord.FIELD_EFFECT_DIRECTION,
                        defaults.getEffectDirection().wireName()));
            }
        }
        graph.replaceEdges(rebuilt);

        log.info("[FactorGoalSplit] Split {} factor→goal edge(s), {} outcome node(s) created",
                factorToGoal.size(), nodesAdded);
        return StageOutcome.of(RepairStages.FACTOR_GOAL_SPLIT, graph, repairs, List.of(),
                nodesAdded + factorToGoal.size() + added.size());
    }

    /** out_<factor>_impact, or a numbered variant when that id belongs to a non-outcome node. */
    private static String outcomeIdFor(DecisionGraph graph, String factorId) {
        String base = "out_" + factorId + "_impact";
        String candidate = base;
        int suffix = 2;
        while (graph.hasNode(candidate) && graph.kindOf(candidate) != NodeKind.OUTCOME) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private static GraphEdge splitEdge(String from, String to) {
        return GraphEdge.of(from, to)
                .withOrigin(GraphEdge.ORIGIN_REPAIR)
                .withProvenance(Provenance.synthetic(SPLIT_QUOTE));
    }

    private static double pick(Double value, Double legacy, double fallback) {
        if (value != null) {
            return value;
        }
        return legacy != null ? legacy : fallback;
    }

    private static void recordFallback(List<RepairRecord> repairs, GraphEdge edge, String field,
                                       Double value, Double legacy) {
        if (value != null) {
            return;
        }
        Object written = fieldValue(edge, field);
        if (legacy != null) {
            repairs.add(RepairRecord.forEdge(edge, field, RepairAction.NORMALISED)
                    .fromValue(legacy)
                    .toValue(written)
                    .reason("Carried over from legacy field during factor→goal split")
                    .build());
        } else {
            repairs.add(defaulted(edge, field, written));
        }
    }

    private static Object fieldValue(GraphEdge edge, String field) {
        switch (field) {
            case RepairRecord.FIELD_STRENGTH_MEAN: return edge.getStrengthMean();
            case RepairRecord.FIELD_STRENGTH_STD:  return edge.getStrengthStd();
            default:                               return edge.getBeliefExists();
        }
    }

    private static RepairRecord defaulted(GraphEdge edge, String field, Object value) {
        return RepairRecord.forEdge(edge, field, RepairAction.DEFAULTED)
                .toValue(value)
                .reason("Default for edge created by factor→goal split")
                .build();
    }
}
