package com.graphmend.orchestrator;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.repair.OrphanWiring;
import com.graphmend.core.repair.UnreachablePruner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Orphan wiring followed by pruning, as one call. Works on a copy; the
 * argument is left untouched.
 */
@Component
public class SimpleRepairService {

    private static final Logger log = LoggerFactory.getLogger(SimpleRepairService.class);

    private final OrphanWiring      orphanWiring;
    private final UnreachablePruner unreachablePruner;

    public SimpleRepairService(OrphanWiring orphanWiring, UnreachablePruner unreachablePruner) {
        this.orphanWiring      = orphanWiring;
        this.unreachablePruner = unreachablePruner;
    }

    public DecisionGraph simpleRepair(DecisionGraph graph) {
        DecisionGraph working = graph.copy();

        int mutations = orphanWiring.wireToGoal(working).getMutationCount()
                + orphanWiring.wireFromCausalChain(working).getMutationCount()
                + unreachablePruner.prune(working).getMutationCount();

        log.debug("[SimpleRepair] {} mutation(s) applied", mutations);
        return working;
    }
}
