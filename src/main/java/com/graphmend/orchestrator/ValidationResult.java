package com.graphmend.orchestrator;

import com.graphmend.core.GraphErrorCode;
import com.graphmend.core.audit.FieldDeletionEvent;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.connectivity.MinimumStructureResult;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.warning.StructuralWarning;

import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link GraphValidationService#validateAndFixGraph}.
 *
 * A rejected result (valid == false) carries error and errorCode and never a
 * graph. A repaired result carries the graph, fixes, warnings and the audit
 * trail, plus the minimum-structure verdict on the repaired graph.
 */
public final class ValidationResult {

    private final boolean                  valid;
    private final DecisionGraph            graph;
    private final AppliedFixes             fixes;
    private final List<StructuralWarning>  warnings;
    private final Set<String>              uncertainNodeIds;
    private final List<RepairRecord>       repairs;
    private final List<FieldDeletionEvent> fieldDeletions;
    private final MinimumStructureResult   structure;
    private final String                   error;
    private final GraphErrorCode           errorCode;

    private ValidationResult(boolean valid, DecisionGraph graph, AppliedFixes fixes,
                             List<StructuralWarning> warnings, Set<String> uncertainNodeIds,
                             List<RepairRecord> repairs, List<FieldDeletionEvent> fieldDeletions,
                             MinimumStructureResult structure, String error, GraphErrorCode errorCode) {
        this.valid            = valid;
        this.graph            = graph;
        this.fixes            = fixes;
        this.warnings         = warnings;
        this.uncertainNodeIds = uncertainNodeIds;
        this.repairs          = repairs;
        this.fieldDeletions   = fieldDeletions;
        this.structure        = structure;
        this.error            = error;
        this.errorCode        = errorCode;
    }

    static ValidationResult rejected(GraphErrorCode code, String error) {
        return new ValidationResult(false, null, AppliedFixes.none(), List.of(), Set.of(),
                List.of(), List.of(), null, error, code);
    }

    static ValidationResult repaired(PipelineReport report, MinimumStructureResult structure) {
        return new ValidationResult(true, report.getGraph(), report.getFixes(), report.getWarnings(),
                report.getUncertainNodeIds(), report.getRepairs(), report.getFieldDeletions(),
                structure, null, null);
    }

    public boolean                  isValid()             { return valid; }
    public boolean                  hasGraph()            { return graph != null; }
    /** Null when the graph was rejected. */
    public DecisionGraph            getGraph()            { return graph; }
    public AppliedFixes             getFixes()            { return fixes; }
    public List<StructuralWarning>  getWarnings()         { return warnings; }
    public Set<String>              getUncertainNodeIds() { return uncertainNodeIds; }
    public List<RepairRecord>       getRepairs()          { return repairs; }
    public List<FieldDeletionEvent> getFieldDeletions()   { return fieldDeletions; }
    /** Null when the graph was rejected. */
    public MinimumStructureResult   getStructure()        { return structure; }
    public String                   getError()            { return error; }
    public GraphErrorCode           getErrorCode()        { return errorCode; }

    @Override
    public String toString() {
        if (!valid) {
            return "ValidationResult{rejected " + errorCode + ": " + error + "}";
        }
        return "ValidationResult{valid, fixes=" + fixes + ", warnings=" + warnings.size()
                + ", repairs=" + repairs.size() + "}";
    }
}
