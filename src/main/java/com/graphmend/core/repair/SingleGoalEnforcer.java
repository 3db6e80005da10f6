package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * SingleGoalEnforcer — merges every goal into one compound goal.
 *
 * Steps:
 *   1. First goal (insertion order) becomes primary, relabelled
 *      "Compound Goal: {label1}, {label2}, ...".
 *   2. Non-primary goals are removed; edges touching them are redirected to
 *      the primary. A goal→goal edge collapses to a self-loop and is dropped.
 *   3. Edges now sharing (from, to) with the primary are deduplicated: the
 *      first one carrying provenance survives, else the first one.
 *   4. Every surviving edge leaving the primary gets belief = 1.0, with a
 *      belief record for each edge whose value actually changed.
 *   5. meta.roots = [primary].
 *
 * Parallel edges between pairs that do not involve the primary goal are not
 * touched; they are legitimate and get indexed ids at finalisation.
 */
@Component
public class SingleGoalEnforcer {

    private static final Logger log = LoggerFactory.getLogger(SingleGoalEnforcer.class);

    static final String COMPOUND_PREFIX = "Compound Goal: ";

    static final double GOAL_EDGE_BELIEF = 1.0;

    public SingleGoalResult enforce(DecisionGraph graph) {
        List<GraphNode> goals = graph.nodesOfKind(NodeKind.GOAL);
        if (goals.size() <= 1) {
            return SingleGoalResult.unchanged(graph, goals.size());
        }

        GraphNode primary   = goals.get(0);
        String    primaryId = primary.getId();

        StringJoiner labels        = new StringJoiner(", ", COMPOUND_PREFIX, "");
        List<String> mergedGoalIds = new ArrayList<>();
        Map<String, String> renames = new LinkedHashMap<>();

        for (GraphNode goal : goals) {
            labels.add(goal.getLabel() != null && !goal.getLabel().isBlank() ? goal.getLabel() : goal.getId());
            mergedGoalIds.add(goal.getId());
            if (!goal.getId().equals(primaryId)) {
                renames.put(goal.getId(), primaryId);
            }
        }

        primary.setLabel(labels.toString());
        for (String removedId : renames.keySet()) {
            graph.removeNode(removedId);
        }

        // Redirect
        int redirected = 0;
        for (GraphEdge edge : graph.getEdges()) {
            boolean touched = false;
            if (renames.containsKey(edge.getFrom())) {
                edge.setFrom(primaryId);
                touched = true;
            }
            if (renames.containsKey(edge.getTo())) {
                edge.setTo(primaryId);
                touched = true;
            }
            if (touched) redirected++;
        }
        int selfLoops = graph.removeEdgesIf(e -> e.getFrom().equals(primaryId) && e.getTo().equals(primaryId));

        int deduplicated = deduplicateAround(graph, primaryId);

        List<RepairRecord> repairs = new ArrayList<>();
        for (GraphEdge edge : graph.getEdges()) {
            if (!edge.getFrom().equals(primaryId)) {
                continue;
            }
            Double before = edge.getBelief();
            if (before != null && before == GOAL_EDGE_BELIEF) {
                continue;
            }
            edge.setBelief(GOAL_EDGE_BELIEF);
            repairs.add(RepairRecord.forEdge(edge, RepairRecord.FIELD_BELIEF, RepairAction.forPriorValue(before))
                    .fromValue(before)
                    .toValue(GOAL_EDGE_BELIEF)
                    .reason("Edge leaving the compound goal")
                    .build());
        }

        graph.getMeta().setRoots(List.of(primaryId));

        log.info("[SingleGoal] Merged {} goals into '{}' (redirected={}, deduplicated={}, selfLoopsDropped={})",
                goals.size(), primaryId, redirected, deduplicated, selfLoops);

        return new SingleGoalResult(graph, true, goals.size(), mergedGoalIds, renames, redirected, deduplicated,
                repairs);
    }

    /**
     * Collapse edges that share (from, to) where one endpoint is the primary
     * goal. The survivor keeps the position of the pair's first edge.
     *
     * @return number of edges removed
     */
    private int deduplicateAround(DecisionGraph graph, String primaryId) {
        Map<String, List<GraphEdge>> groups = new LinkedHashMap<>();
        List<Object> order = new ArrayList<>();   // GraphEdge, or the pair key standing in for its group

        for (GraphEdge edge : graph.getEdges()) {
            if (!edge.touches(primaryId)) {
                order.add(edge);
                continue;
            }
            String key = edge.pairKey();
            if (!groups.containsKey(key)) {
                order.add(key);
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(edge);
        }

        List<GraphEdge> kept    = new ArrayList<>();
        int             removed = 0;
        for (Object entry : order) {
            if (entry instanceof GraphEdge) {
                kept.add((GraphEdge) entry);
                continue;
            }
            List<GraphEdge> group = groups.get((String) entry);
            kept.add(chooseSurvivor(group));
            removed += group.size() - 1;
        }

        if (removed > 0) {
            graph.replaceEdges(kept);
        }
        return removed;
    }

    private GraphEdge chooseSurvivor(List<GraphEdge> group) {
        for (GraphEdge edge : group) {
            if (edge.hasProvenance()) {
                return edge;
            }
        }
        return group.get(0);
    }
}
