package com.graphmend.core.repair;

import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.graph.DecisionGraph;

import java.util.List;
import java.util.Map;

/**
 * Result of goal merging.
 *
 * mergedGoalIds lists every original goal id, primary first. nodeRenames maps
 * each removed goal id to the primary id. repairs holds the belief records
 * for edges leaving the merged goal.
 */
public final class SingleGoalResult {

    private final DecisionGraph       graph;
    private final boolean             hadMultipleGoals;
    private final int                 originalGoalCount;
    private final List<String>        mergedGoalIds;
    private final Map<String, String> nodeRenames;
    private final int                 edgesRedirected;
    private final int                 edgesDeduplicated;
    private final List<RepairRecord>  repairs;

    SingleGoalResult(DecisionGraph graph, boolean hadMultipleGoals, int originalGoalCount,
                     List<String> mergedGoalIds, Map<String, String> nodeRenames,
                     int edgesRedirected, int edgesDeduplicated, List<RepairRecord> repairs) {
        this.graph             = graph;
        this.hadMultipleGoals  = hadMultipleGoals;
        this.originalGoalCount = originalGoalCount;
        this.mergedGoalIds     = List.copyOf(mergedGoalIds);
        this.nodeRenames       = Map.copyOf(nodeRenames);
        this.edgesRedirected   = edgesRedirected;
        this.edgesDeduplicated = edgesDeduplicated;
        this.repairs           = List.copyOf(repairs);
    }

    static SingleGoalResult unchanged(DecisionGraph graph, int goalCount) {
        return new SingleGoalResult(graph, false, goalCount, List.of(), Map.of(), 0, 0, List.of());
    }

    public DecisionGraph       getGraph()             { return graph; }
    public boolean             hadMultipleGoals()     { return hadMultipleGoals; }
    public int                 getOriginalGoalCount() { return originalGoalCount; }
    public List<String>        getMergedGoalIds()     { return mergedGoalIds; }
    public Map<String, String> getNodeRenames()       { return nodeRenames; }
    public int                 getEdgesRedirected()   { return edgesRedirected; }
    public int                 getEdgesDeduplicated() { return edgesDeduplicated; }
    public List<RepairRecord>  getRepairs()           { return repairs; }

    /** Same result in the shape every other stage returns. */
    public StageOutcome toStageOutcome() {
        if (!hadMultipleGoals) {
            return StageOutcome.unchanged(RepairStages.SINGLE_GOAL, graph);
        }
        int mutations = (originalGoalCount - 1) + edgesRedirected + edgesDeduplicated;
        return StageOutcome.of(RepairStages.SINGLE_GOAL, graph, repairs, List.of(), mutations);
    }

    @Override
    public String toString() {
        return String.format("SingleGoalResult{merged=%s, originalGoals=%d, redirected=%d, deduplicated=%d}",
                hadMultipleGoals, originalGoalCount, edgesRedirected, edgesDeduplicated);
    }
}
