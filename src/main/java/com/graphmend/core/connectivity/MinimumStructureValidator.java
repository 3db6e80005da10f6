package com.graphmend.core.connectivity;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.NodeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gate run after repair: is the graph structurally usable at all?
 *
 * Check order (first failure wins):
 *   1. goal, decision, option each present       → CEE_GRAPH_INVALID
 *   2. at least one outcome or risk               → CEE_GRAPH_INVALID
 *   3. some decision reaches an option and a goal → CEE_GRAPH_CONNECTIVITY_FAILED
 */
@Component
public class MinimumStructureValidator {

    private static final Logger log = LoggerFactory.getLogger(MinimumStructureValidator.class);

    private static final List<NodeKind> REQUIRED_KINDS =
            List.of(NodeKind.GOAL, NodeKind.DECISION, NodeKind.OPTION);

    private final ConnectivityAnalyzer connectivityAnalyzer;

    public MinimumStructureValidator(ConnectivityAnalyzer connectivityAnalyzer) {
        this.connectivityAnalyzer = connectivityAnalyzer;
    }

    public MinimumStructureResult check(DecisionGraph graph) {
        Map<NodeKind, Integer> counts = graph.countByKind();

        List<NodeKind> missing = new ArrayList<>();
        for (NodeKind kind : REQUIRED_KINDS) {
            if (counts.getOrDefault(kind, 0) < 1) {
                missing.add(kind);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("[MinStructure] Missing required kinds: {}", missing);
            return MinimumStructureResult.missingKinds(missing, counts);
        }

        int outcomeOrRisk = counts.getOrDefault(NodeKind.OUTCOME, 0) + counts.getOrDefault(NodeKind.RISK, 0);
        if (outcomeOrRisk == 0) {
            log.warn("[MinStructure] Graph has no outcome or risk nodes");
            return MinimumStructureResult.missingOutcomeOrRisk(counts);
        }

        ConnectivityDiagnostic connectivity = connectivityAnalyzer.analyze(graph);
        if (!connectivity.isPassed()) {
            log.warn("[MinStructure] Connectivity failed: class={}, unreachable={}",
                    connectivity.getFailureClass().wireName(), connectivity.getUnreachableNodes());
            return MinimumStructureResult.disconnected(counts, connectivity);
        }

        return MinimumStructureResult.valid(counts, connectivity);
    }
}
