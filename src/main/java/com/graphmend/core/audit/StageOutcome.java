package com.graphmend.core.audit;

import com.graphmend.core.graph.DecisionGraph;

import java.util.List;

/**
 * What a mutating stage hands back: the (possibly same-reference) graph plus
 * the audit entries it produced. The orchestrator concatenates these.
 */
public final class StageOutcome {

    private final String                   stage;
    private final DecisionGraph            graph;
    private final List<RepairRecord>       repairs;
    private final List<FieldDeletionEvent> fieldDeletions;
    private final int                      mutationCount;

    private StageOutcome(String stage, DecisionGraph graph, List<RepairRecord> repairs,
                         List<FieldDeletionEvent> fieldDeletions, int mutationCount) {
        this.stage          = stage;
        this.graph          = graph;
        this.repairs        = repairs != null ? List.copyOf(repairs) : List.of();
        this.fieldDeletions = fieldDeletions != null ? List.copyOf(fieldDeletions) : List.of();
        this.mutationCount  = mutationCount;
    }

    /** Stage made no change. */
    public static StageOutcome unchanged(String stage, DecisionGraph graph) {
        return new StageOutcome(stage, graph, List.of(), List.of(), 0);
    }

    /**
     * @param mutationCount structural mutations (edges added/removed, nodes removed,
     *                      values rewritten) — may exceed repairs.size() for stages
     *                      whose mutations are not field-level
     */
    public static StageOutcome of(String stage, DecisionGraph graph, List<RepairRecord> repairs,
                                  List<FieldDeletionEvent> fieldDeletions, int mutationCount) {
        return new StageOutcome(stage, graph, repairs, fieldDeletions, mutationCount);
    }

    public String                   getStage()          { return stage; }
    public DecisionGraph            getGraph()          { return graph; }
    public List<RepairRecord>       getRepairs()        { return repairs; }
    public List<FieldDeletionEvent> getFieldDeletions() { return fieldDeletions; }
    public int                      getMutationCount()  { return mutationCount; }

    public boolean changed() {
        return mutationCount > 0 || !repairs.isEmpty() || !fieldDeletions.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("StageOutcome{stage=%s, mutations=%d, repairs=%d, deletions=%d}",
                stage, mutationCount, repairs.size(), fieldDeletions.size());
    }
}
