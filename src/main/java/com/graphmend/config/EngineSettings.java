package com.graphmend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class EngineSettings {

    public static final int    DEFAULT_MAX_NODES = 50;
    public static final int    DEFAULT_MAX_EDGES = 200;

    private final int     maxNodes;
    private final int     maxEdges;
    private final double  defaultOutcomeBelief;
    private final boolean enforceSingleGoal;
    private final boolean fillOutcomeBeliefs;

    public EngineSettings(
        @Value("${graphmend.limits.max-nodes:50}") int maxNodes,
        @Value("${graphmend.limits.max-edges:200}") int maxEdges,
        @Value("${graphmend.repair.default-outcome-belief:0.5}") double defaultOutcomeBelief,
        @Value("${graphmend.repair.enforce-single-goal:true}") boolean enforceSingleGoal,
        @Value("${graphmend.repair.fill-outcome-beliefs:true}") boolean fillOutcomeBeliefs
    ) {
        if (maxNodes <= 0 || maxEdges <= 0) {
            throw new IllegalArgumentException(
                    "graphmend.limits must be positive (max-nodes=" + maxNodes + ", max-edges=" + maxEdges + ")");
        }
        if (defaultOutcomeBelief < 0 || defaultOutcomeBelief > 1) {
            throw new IllegalArgumentException(
                    "graphmend.repair.default-outcome-belief must be in [0, 1], got " + defaultOutcomeBelief);
        }
        this.maxNodes             = maxNodes;
        this.maxEdges             = maxEdges;
        this.defaultOutcomeBelief = defaultOutcomeBelief;
        this.enforceSingleGoal    = enforceSingleGoal;
        this.fillOutcomeBeliefs   = fillOutcomeBeliefs;
    }

    /** Built-in defaults, for code that runs outside a Spring context. */
    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_MAX_NODES, DEFAULT_MAX_EDGES, 0.5, true, true);
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public int getMaxEdges() {
        return maxEdges;
    }

    public double getDefaultOutcomeBelief() {
        return defaultOutcomeBelief;
    }

    public boolean isEnforceSingleGoal() {
        return enforceSingleGoal;
    }

    public boolean isFillOutcomeBeliefs() {
        return fillOutcomeBeliefs;
    }
}
