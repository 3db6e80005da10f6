package com.graphmend.orchestrator;

import com.graphmend.core.repair.SingleGoalResult;

import java.util.List;
import java.util.Map;

/**
 * Summary of the fixes a validation run applied.
 */
public final class AppliedFixes {

    private final boolean             singleGoalApplied;
    private final int                 outcomeBeliefsFilled;
    private final boolean             decisionBranchesNormalized;
    private final int                 originalGoalCount;
    private final List<String>        mergedGoalIds;
    private final Map<String, String> nodeRenames;

    AppliedFixes(SingleGoalResult singleGoal, int outcomeBeliefsFilled, boolean decisionBranchesNormalized) {
        this.singleGoalApplied          = singleGoal != null && singleGoal.hadMultipleGoals();
        this.outcomeBeliefsFilled       = outcomeBeliefsFilled;
        this.decisionBranchesNormalized = decisionBranchesNormalized;
        this.originalGoalCount          = singleGoal != null ? singleGoal.getOriginalGoalCount() : 0;
        this.mergedGoalIds              = singleGoal != null ? singleGoal.getMergedGoalIds() : List.of();
        this.nodeRenames                = singleGoal != null ? singleGoal.getNodeRenames() : Map.of();
    }

    static AppliedFixes none() {
        return new AppliedFixes(null, 0, false);
    }

    public boolean             isSingleGoalApplied()          { return singleGoalApplied; }
    public int                 getOutcomeBeliefsFilled()      { return outcomeBeliefsFilled; }
    public boolean             isDecisionBranchesNormalized() { return decisionBranchesNormalized; }
    public int                 getOriginalGoalCount()         { return originalGoalCount; }
    public List<String>        getMergedGoalIds()             { return mergedGoalIds; }
    public Map<String, String> getNodeRenames()               { return nodeRenames; }

    @Override
    public String toString() {
        return String.format("AppliedFixes{singleGoal=%s, outcomeBeliefsFilled=%d, branchesNormalized=%s}",
                singleGoalApplied, outcomeBeliefsFilled, decisionBranchesNormalized);
    }
}
