package com.graphmend.core.event;

/**
 * Payload of {@link RepairEventType#STAGE_APPLIED}.
 */
public final class StageSummary {

    private final String stage;
    private final int    repairCount;
    private final int    mutationCount;

    public StageSummary(String stage, int repairCount, int mutationCount) {
        this.stage         = stage;
        this.repairCount   = repairCount;
        this.mutationCount = mutationCount;
    }

    public String getStage()         { return stage; }
    public int    getRepairCount()   { return repairCount; }
    public int    getMutationCount() { return mutationCount; }

    @Override
    public String toString() {
        return stage + " (repairs=" + repairCount + ", mutations=" + mutationCount + ")";
    }
}
