package com.graphmend.orchestrator;

import com.graphmend.config.EngineSettings;

/**
 * Per-call switches for {@link GraphValidationService#validateAndFixGraph}.
 * Seeded from {@link EngineSettings}; callers override what they need.
 */
public final class ValidationOptions {

    private final boolean checkSizeLimits;
    private final int     maxNodes;
    private final int     maxEdges;
    private final boolean enforceSingleGoal;
    private final boolean fillOutcomeBeliefs;
    private final double  defaultOutcomeBelief;

    private ValidationOptions(Builder b) {
        this.checkSizeLimits      = b.checkSizeLimits;
        this.maxNodes             = b.maxNodes;
        this.maxEdges             = b.maxEdges;
        this.enforceSingleGoal    = b.enforceSingleGoal;
        this.fillOutcomeBeliefs   = b.fillOutcomeBeliefs;
        this.defaultOutcomeBelief = b.defaultOutcomeBelief;
    }

    public static Builder builder(EngineSettings settings) {
        return new Builder(settings);
    }

    public static ValidationOptions from(EngineSettings settings) {
        return builder(settings).build();
    }

    public boolean isCheckSizeLimits()        { return checkSizeLimits; }
    public int     getMaxNodes()              { return maxNodes; }
    public int     getMaxEdges()              { return maxEdges; }
    public boolean isEnforceSingleGoal()      { return enforceSingleGoal; }
    public boolean isFillOutcomeBeliefs()     { return fillOutcomeBeliefs; }
    public double  getDefaultOutcomeBelief()  { return defaultOutcomeBelief; }

    public static final class Builder {
        private boolean checkSizeLimits = true;
        private int     maxNodes;
        private int     maxEdges;
        private boolean enforceSingleGoal;
        private boolean fillOutcomeBeliefs;
        private double  defaultOutcomeBelief;

        private Builder(EngineSettings settings) {
            this.maxNodes             = settings.getMaxNodes();
            this.maxEdges             = settings.getMaxEdges();
            this.enforceSingleGoal    = settings.isEnforceSingleGoal();
            this.fillOutcomeBeliefs   = settings.isFillOutcomeBeliefs();
            this.defaultOutcomeBelief = settings.getDefaultOutcomeBelief();
        }

        public Builder checkSizeLimits(boolean v)      { this.checkSizeLimits = v;      return this; }
        public Builder maxNodes(int v)                 { this.maxNodes = v;             return this; }
        public Builder maxEdges(int v)                 { this.maxEdges = v;             return this; }
        public Builder enforceSingleGoal(boolean v)    { this.enforceSingleGoal = v;    return this; }
        public Builder fillOutcomeBeliefs(boolean v)   { this.fillOutcomeBeliefs = v;   return this; }
        public Builder defaultOutcomeBelief(double v)  { this.defaultOutcomeBelief = v; return this; }

        public ValidationOptions build() {
            if (defaultOutcomeBelief < 0 || defaultOutcomeBelief > 1) {
                throw new IllegalArgumentException("defaultOutcomeBelief must be in [0, 1], got " + defaultOutcomeBelief);
            }
            return new ValidationOptions(this);
        }
    }

    @Override
    public String toString() {
        return String.format(
                "ValidationOptions{sizeLimits=%s (%d/%d), singleGoal=%s, fillOutcomeBeliefs=%s (%.2f)}",
                checkSizeLimits, maxNodes, maxEdges, enforceSingleGoal, fillOutcomeBeliefs, defaultOutcomeBelief);
    }
}
