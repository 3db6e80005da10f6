package com.graphmend.core.repair;

import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drops edges whose endpoints do not exist, so later stages never resolve a
 * kind for an unknown id.
 */
@Component
public class DanglingEdgeFilter {

    private static final Logger log = LoggerFactory.getLogger(DanglingEdgeFilter.class);

    public StageOutcome apply(DecisionGraph graph) {
        int removed = graph.removeEdgesIf(e -> !graph.hasNode(e.getFrom()) || !graph.hasNode(e.getTo()));
        if (removed == 0) {
            return StageOutcome.unchanged(RepairStages.DANGLING_EDGES, graph);
        }
        log.info("[DanglingEdges] Removed {} edge(s) referencing unknown nodes", removed);
        return StageOutcome.of(RepairStages.DANGLING_EDGES, graph, List.of(), List.of(), removed);
    }
}
