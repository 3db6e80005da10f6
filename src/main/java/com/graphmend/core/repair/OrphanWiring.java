package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairAction;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.FactorCategory;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.params.EdgeParameterTable;
import com.graphmend.core.params.EdgeTemplate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * OrphanWiring — connects outcome and risk nodes that the draft left dangling.
 *
 * Two passes, run to-goal first:
 *   wireToGoal           outcome/risk → goal, when the node has no goal edge
 *   wireFromCausalChain  factor → outcome/risk, when the node has no factor inbound
 *
 * Parameters come from {@link EdgeParameterTable}; only outcome and risk have
 * templates on both sides. Both passes only add edges. Existing edge values
 * are never overwritten, so reachability can only grow.
 */
@Component
public class OrphanWiring {

    private static final Logger log = LoggerFactory.getLogger(OrphanWiring.class);

    static final String TO_GOAL_QUOTE    = "Wired outcome to goal (synthetic edge)";
    static final String FROM_CHAIN_QUOTE = "Wired factor into outcome (synthetic edge)";

    // =========================================================================
    // Outcome/risk → goal
    // =========================================================================

    public StageOutcome wireToGoal(DecisionGraph graph) {
        List<String> goalIds = graph.idsOfKind(NodeKind.GOAL);
        if (goalIds.isEmpty()) {
            return StageOutcome.unchanged(RepairStages.WIRE_TO_GOAL, graph);
        }
        String goalId = goalIds.get(0);

        List<RepairRecord> repairs = new ArrayList<>();
        int added = 0;

        for (GraphNode node : graph.getNodes()) {
            EdgeTemplate template = EdgeParameterTable.lookup(node.getKind(), NodeKind.GOAL).orElse(null);
            if (template == null || hasEdgeToAnyGoal(graph, node.getId())) {
                continue;
            }
            GraphEdge edge = template.newEdge(node.getId(), goalId, TO_GOAL_QUOTE);
            graph.addEdge(edge);
            repairs.addAll(defaultedRecords(edge, "Orphan " + node.getKind().wireName() + " wired to goal"));
            added++;
            log.debug("[OrphanWiring] {} '{}' → goal '{}'", node.getKind().wireName(), node.getId(), goalId);
        }

        if (added == 0) {
            return StageOutcome.unchanged(RepairStages.WIRE_TO_GOAL, graph);
        }
        log.info("[OrphanWiring] Added {} edge(s) to goal '{}'", added, goalId);
        return StageOutcome.of(RepairStages.WIRE_TO_GOAL, graph, repairs, List.of(), added);
    }

    // =========================================================================
    // Factor → outcome/risk
    // =========================================================================

    public StageOutcome wireFromCausalChain(DecisionGraph graph) {
        GraphNode source = chooseSourceFactor(graph);
        if (source == null) {
            return StageOutcome.unchanged(RepairStages.WIRE_FROM_CAUSAL_CHAIN, graph);
        }

        List<RepairRecord> repairs = new ArrayList<>();
        int added = 0;

        for (GraphNode node : graph.getNodes()) {
            EdgeTemplate template = EdgeParameterTable.lookup(NodeKind.FACTOR, node.getKind()).orElse(null);
            if (template == null || hasFactorInbound(graph, node.getId())) {
                continue;
            }
            GraphEdge edge = template.newEdge(source.getId(), node.getId(), FROM_CHAIN_QUOTE);
            graph.addEdge(edge);
            repairs.addAll(defaultedRecords(edge, "Orphan " + node.getKind().wireName() + " wired from factor"));
            added++;
        }

        if (added == 0) {
            return StageOutcome.unchanged(RepairStages.WIRE_FROM_CAUSAL_CHAIN, graph);
        }
        log.info("[OrphanWiring] Added {} edge(s) from factor '{}'", added, source.getId());
        return StageOutcome.of(RepairStages.WIRE_FROM_CAUSAL_CHAIN, graph, repairs, List.of(), added);
    }

    /** First controllable factor, else first factor, else null. */
    GraphNode chooseSourceFactor(DecisionGraph graph) {
        List<GraphNode> factors = graph.nodesOfKind(NodeKind.FACTOR);
        for (GraphNode factor : factors) {
            if (factor.getCategory() == FactorCategory.CONTROLLABLE) {
                return factor;
            }
        }
        return factors.isEmpty() ? null : factors.get(0);
    }

    private boolean hasEdgeToAnyGoal(DecisionGraph graph, String nodeId) {
        for (GraphEdge edge : graph.outgoing(nodeId)) {
            if (graph.kindOf(edge.getTo()) == NodeKind.GOAL) {
                return true;
            }
        }
        return false;
    }

    private boolean hasFactorInbound(DecisionGraph graph, String nodeId) {
        for (GraphEdge edge : graph.incoming(nodeId)) {
            if (graph.kindOf(edge.getFrom()) == NodeKind.FACTOR) {
                return true;
            }
        }
        return false;
    }

    private List<RepairRecord> defaultedRecords(GraphEdge edge, String reason) {
        return List.of(
                RepairRecord.forEdge(edge, RepairRecord.FIELD_STRENGTH_MEAN, RepairAction.DEFAULTED)
                        .toValue(edge.getStrengthMean()).reason(reason).build(),
                RepairRecord.forEdge(edge, RepairRecord.FIELD_STRENGTH_STD, RepairAction.DEFAULTED)
                        .toValue(edge.getStrengthStd()).reason(reason).build(),
                RepairRecord.forEdge(edge, RepairRecord.FIELD_BELIEF_EXISTS, RepairAction.DEFAULTED)
                        .toValue(edge.getBeliefExists()).reason(reason).build(),
                RepairRecord.forEdge(edge, RepairRecord.FIELD_EFFECT_DIRECTION, RepairAction.DEFAULTED)
                        .toValue(edge.getEffectDirection().wireName()).reason(reason).build()
        );
    }
}
