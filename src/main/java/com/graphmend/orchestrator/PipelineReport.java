package com.graphmend.orchestrator;

import com.graphmend.core.audit.FieldDeletionEvent;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.connectivity.ConnectivityDiagnostic;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.StructuralMeta;
import com.graphmend.core.repair.SingleGoalResult;
import com.graphmend.core.warning.StructuralWarning;
import com.graphmend.core.warning.StructuralWarningReport;

import java.util.List;
import java.util.Set;

/**
 * Everything one pipeline run produced, in stage order.
 */
public final class PipelineReport {

    private final DecisionGraph            graph;
    private final List<RepairRecord>       repairs;
    private final List<FieldDeletionEvent> fieldDeletions;
    private final List<String>             stagesApplied;
    private final StructuralWarningReport  warningReport;
    private final StructuralMeta           structuralMeta;
    private final ConnectivityDiagnostic   connectivityBefore;
    private final ConnectivityDiagnostic   connectivityAfter;
    private final SingleGoalResult         singleGoal;
    private final AppliedFixes             fixes;

    private PipelineReport(Builder b) {
        this.graph              = b.graph;
        this.repairs            = List.copyOf(b.repairs);
        this.fieldDeletions     = List.copyOf(b.fieldDeletions);
        this.stagesApplied      = List.copyOf(b.stagesApplied);
        this.warningReport      = b.warningReport != null ? b.warningReport : StructuralWarningReport.empty();
        this.structuralMeta     = b.structuralMeta != null ? b.structuralMeta : StructuralMeta.none();
        this.connectivityBefore = b.connectivityBefore;
        this.connectivityAfter  = b.connectivityAfter;
        this.singleGoal         = b.singleGoal;
        this.fixes              = new AppliedFixes(b.singleGoal, b.outcomeBeliefsFilled, b.decisionBranchesNormalized);
    }

    static Builder builder() {
        return new Builder();
    }

    public DecisionGraph            getGraph()              { return graph; }
    public List<RepairRecord>       getRepairs()            { return repairs; }
    public List<FieldDeletionEvent> getFieldDeletions()     { return fieldDeletions; }
    public List<String>             getStagesApplied()      { return stagesApplied; }
    public StructuralWarningReport  getWarningReport()      { return warningReport; }
    public List<StructuralWarning>  getWarnings()           { return warningReport.getWarnings(); }
    public Set<String>              getUncertainNodeIds()   { return warningReport.getUncertainNodeIds(); }
    public StructuralMeta           getStructuralMeta()     { return structuralMeta; }
    public ConnectivityDiagnostic   getConnectivityBefore() { return connectivityBefore; }
    public ConnectivityDiagnostic   getConnectivityAfter()  { return connectivityAfter; }
    public SingleGoalResult         getSingleGoal()         { return singleGoal; }
    public AppliedFixes             getFixes()              { return fixes; }

    static final class Builder {
        private DecisionGraph            graph;
        private List<RepairRecord>       repairs        = List.of();
        private List<FieldDeletionEvent> fieldDeletions = List.of();
        private List<String>             stagesApplied  = List.of();
        private StructuralWarningReport  warningReport;
        private StructuralMeta           structuralMeta;
        private ConnectivityDiagnostic   connectivityBefore;
        private ConnectivityDiagnostic   connectivityAfter;
        private SingleGoalResult         singleGoal;
        private int                      outcomeBeliefsFilled;
        private boolean                  decisionBranchesNormalized;

        Builder graph(DecisionGraph v)                     { this.graph = v;                      return this; }
        Builder repairs(List<RepairRecord> v)              { this.repairs = v;                    return this; }
        Builder fieldDeletions(List<FieldDeletionEvent> v) { this.fieldDeletions = v;             return this; }
        Builder stagesApplied(List<String> v)              { this.stagesApplied = v;              return this; }
        Builder warningReport(StructuralWarningReport v)   { this.warningReport = v;              return this; }
        Builder structuralMeta(StructuralMeta v)           { this.structuralMeta = v;             return this; }
        Builder connectivityBefore(ConnectivityDiagnostic v) { this.connectivityBefore = v;       return this; }
        Builder connectivityAfter(ConnectivityDiagnostic v)  { this.connectivityAfter = v;        return this; }
        Builder singleGoal(SingleGoalResult v)             { this.singleGoal = v;                 return this; }
        Builder outcomeBeliefsFilled(int v)                { this.outcomeBeliefsFilled = v;       return this; }
        Builder decisionBranchesNormalized(boolean v)      { this.decisionBranchesNormalized = v; return this; }

        PipelineReport build() {
            return new PipelineReport(this);
        }
    }

    @Override
    public String toString() {
        return String.format("PipelineReport{nodes=%d, edges=%d, repairs=%d, deletions=%d, warnings=%d, stages=%s}",
                graph.nodeCount(), graph.edgeCount(), repairs.size(), fieldDeletions.size(),
                warningReport.getWarnings().size(), stagesApplied);
    }
}
