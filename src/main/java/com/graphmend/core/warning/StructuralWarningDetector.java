package com.graphmend.core.warning;

import com.graphmend.core.cycle.CycleHandler;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.graph.StructuralMeta;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * StructuralWarningDetector — read-only scan for residual issues.
 *
 * Runs before and after repair; its output feeds reporting and confidence
 * scoring, never correction.
 *
 *   no_outcome_node        zero outcome nodes                         medium
 *   orphan_node            node with no incident edge                 medium if a goal/decision/option
 *                                                                     is orphaned, else low
 *   cycle_detected         from supplied structural metadata          high
 *   decision_after_outcome outcome → decision/option                  medium
 *                          (outcome → goal is valid: goals aggregate outcomes)
 */
@Component
public class StructuralWarningDetector {

    private static final Logger log = LoggerFactory.getLogger(StructuralWarningDetector.class);

    private static final Set<NodeKind> CORE_KINDS =
            EnumSet.of(NodeKind.GOAL, NodeKind.DECISION, NodeKind.OPTION);

    private static final Set<NodeKind> UPSTREAM_OF_OUTCOME =
            EnumSet.of(NodeKind.DECISION, NodeKind.OPTION);

    private final CycleHandler cycleHandler;

    public StructuralWarningDetector(CycleHandler cycleHandler) {
        this.cycleHandler = cycleHandler;
    }

    public StructuralWarningReport detect(DecisionGraph graph, StructuralMeta meta) {
        if (graph == null) {
            return StructuralWarningReport.empty();
        }

        List<StructuralWarning> warnings = new ArrayList<>();

        detectNoOutcome(graph, warnings);
        detectOrphans(graph, warnings);
        cycleHandler.classify(meta).ifPresent(warnings::add);
        detectDecisionAfterOutcome(graph, warnings);

        StructuralWarningReport report = new StructuralWarningReport(warnings);
        if (!report.isEmpty()) {
            log.info("[Warnings] {} structural warning(s), {} uncertain node(s)",
                    report.getWarnings().size(), report.getUncertainNodeIds().size());
        }
        return report;
    }

    private void detectNoOutcome(DecisionGraph graph, List<StructuralWarning> warnings) {
        if (!graph.nodesOfKind(NodeKind.OUTCOME).isEmpty()) {
            return;
        }
        warnings.add(new StructuralWarning(
                StructuralWarningType.NO_OUTCOME_NODE,
                WarningSeverity.MEDIUM,
                List.of(),
                List.of(),
                "Graph has no outcome nodes describing what success looks like"
        ));
    }

    private void detectOrphans(DecisionGraph graph, List<StructuralWarning> warnings) {
        Set<String> connected = new HashSet<>();
        for (GraphEdge edge : graph.getEdges()) {
            connected.add(edge.getFrom());
            connected.add(edge.getTo());
        }

        List<String> orphanIds     = new ArrayList<>();
        boolean      coreOrphaned  = false;
        for (GraphNode node : graph.getNodes()) {
            if (!connected.contains(node.getId())) {
                orphanIds.add(node.getId());
                coreOrphaned |= CORE_KINDS.contains(node.getKind());
            }
        }
        if (orphanIds.isEmpty()) {
            return;
        }

        warnings.add(new StructuralWarning(
                StructuralWarningType.ORPHAN_NODE,
                coreOrphaned ? WarningSeverity.MEDIUM : WarningSeverity.LOW,
                orphanIds,
                List.of(),
                orphanIds.size() + " node(s) are not connected to the graph"
        ));
    }

    private void detectDecisionAfterOutcome(DecisionGraph graph, List<StructuralWarning> warnings) {
        Set<String>  nodeIds = new LinkedHashSet<>();
        List<String> edgeIds = new ArrayList<>();

        for (GraphEdge edge : graph.getEdges()) {
            if (graph.kindOf(edge.getFrom()) != NodeKind.OUTCOME) {
                continue;
            }
            if (!UPSTREAM_OF_OUTCOME.contains(graph.kindOf(edge.getTo()))) {
                continue;
            }
            nodeIds.add(edge.getFrom());
            nodeIds.add(edge.getTo());
            edgeIds.add(edgeRef(edge));
        }
        if (edgeIds.isEmpty()) {
            return;
        }

        warnings.add(new StructuralWarning(
                StructuralWarningType.DECISION_AFTER_OUTCOME,
                WarningSeverity.MEDIUM,
                new ArrayList<>(nodeIds),
                edgeIds,
                "Outcome nodes point back to decisions or options"
        ));
    }

    private static String edgeRef(GraphEdge edge) {
        return edge.getId() != null ? edge.getId() : edge.getFrom() + "::" + edge.getTo();
    }
}
