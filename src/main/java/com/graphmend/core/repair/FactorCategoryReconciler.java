package com.graphmend.core.repair;

import com.graphmend.core.audit.FieldDeletionEvent;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.FactorCategory;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.graph.UniformPrior;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FactorCategoryReconciler — a factor no option controls is external.
 *
 * A factor is option-controlled when an option→factor edge targets it, or
 * when a factor→factor chain leads to it from such a factor. Every other
 * factor is reclassified to EXTERNAL and loses its controllable-only data
 * (value, factor_type, uncertainty_drivers). A numeric value is turned into a
 * uniform prior before it is dropped.
 *
 * Each stripped field yields one {@link FieldDeletionEvent}. Nodes are never
 * removed here.
 */
@Component
public class FactorCategoryReconciler {

    private static final Logger log = LoggerFactory.getLogger(FactorCategoryReconciler.class);

    private static final List<String> CONTROLLABLE_ONLY_FIELDS = List.of(
            GraphNode.DATA_VALUE,
            GraphNode.DATA_FACTOR_TYPE,
            GraphNode.DATA_UNCERTAINTY_DRIVERS);

    public StageOutcome reconcile(DecisionGraph graph) {
        Set<String> controlled = optionControlledFactors(graph);

        List<FieldDeletionEvent> deletions    = new ArrayList<>();
        List<String>             reclassified = new ArrayList<>();

        for (GraphNode factor : graph.nodesOfKind(NodeKind.FACTOR)) {
            if (controlled.contains(factor.getId())) {
                continue;
            }
            if (factor.getCategory() != FactorCategory.EXTERNAL) {
                reclassified.add(factor.getId());
            }
            factor.setCategory(FactorCategory.EXTERNAL);

            Object value = factor.getDataField(GraphNode.DATA_VALUE);
            if (value instanceof Number) {
                UniformPrior prior = UniformPrior.aroundBaseline(((Number) value).doubleValue());
                factor.setPrior(prior);
                log.info("[FactorReconciler] Synthesised prior {} for '{}' from baseline {}",
                        prior, factor.getId(), value);
            }

            deletions.addAll(stripControllableData(factor));
        }

        if (reclassified.isEmpty() && deletions.isEmpty()) {
            return StageOutcome.unchanged(RepairStages.UNREACHABLE_FACTORS, graph);
        }
        log.info("[FactorReconciler] Reclassified {} factor(s) to external {}, {} field(s) deleted",
                reclassified.size(), reclassified, deletions.size());
        return StageOutcome.of(RepairStages.UNREACHABLE_FACTORS, graph, List.of(), deletions, reclassified.size());
    }

    private List<FieldDeletionEvent> stripControllableData(GraphNode factor) {
        if (!factor.hasData()) {
            return List.of();
        }
        List<FieldDeletionEvent> events = new ArrayList<>();
        for (String field : CONTROLLABLE_ONLY_FIELDS) {
            if (factor.removeDataField(field)) {
                events.add(deletion(factor, "data." + field));
            }
        }
        boolean stillShaped = factor.hasDataField(GraphNode.DATA_INTERVENTIONS)
                || factor.hasDataField(GraphNode.DATA_OPERATOR)
                || factor.hasDataField(GraphNode.DATA_VALUE);
        if (!stillShaped) {
            factor.clearData();
            events.add(deletion(factor, "data"));
        }
        return events;
    }

    private FieldDeletionEvent deletion(GraphNode factor, String field) {
        return FieldDeletionEvent.of(RepairStages.UNREACHABLE_FACTORS, factor.getId(), field,
                FieldDeletionEvent.REASON_UNREACHABLE_FACTOR_RECLASSIFIED);
    }

    /** Factors targeted by an option, closed over factor→factor edges. */
    Set<String> optionControlledFactors(DecisionGraph graph) {
        Set<String>               controlled    = new HashSet<>();
        Map<String, List<String>> factorForward = new HashMap<>();

        for (GraphEdge edge : graph.getEdges()) {
            NodeKind from = graph.kindOf(edge.getFrom());
            NodeKind to   = graph.kindOf(edge.getTo());
            if (to != NodeKind.FACTOR) {
                continue;
            }
            if (from == NodeKind.OPTION) {
                controlled.add(edge.getTo());
            } else if (from == NodeKind.FACTOR) {
                factorForward.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
            }
        }

        Deque<String> queue = new ArrayDeque<>(controlled);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : factorForward.getOrDefault(current, List.of())) {
                if (controlled.add(next)) {
                    queue.add(next);
                }
            }
        }
        return controlled;
    }
}
