package com.graphmend.core.connectivity;

import com.graphmend.core.GraphErrorCode;
import com.graphmend.core.graph.NodeKind;

import java.util.List;
import java.util.Map;

/**
 * Outcome of the minimum-structure gate: required kinds present, at least one
 * outcome or risk, and decision → option/goal connectivity.
 */
public final class MinimumStructureResult {

    public static final String REASON_INCOMPLETE_STRUCTURE   = "incomplete_structure";
    public static final String REASON_MISSING_OUTCOME_OR_RISK = "missing_outcome_or_risk";
    public static final String REASON_CONNECTIVITY_FAILED    = "connectivity_failed";

    private final boolean                valid;
    private final List<NodeKind>         missingKinds;
    private final Map<NodeKind, Integer> counts;
    private final ConnectivityDiagnostic connectivity;   // null when kind counts failed
    private final GraphErrorCode         errorCode;      // null when valid
    private final String                 reason;         // null when valid
    private final String                 message;

    private MinimumStructureResult(boolean valid, List<NodeKind> missingKinds, Map<NodeKind, Integer> counts,
                                   ConnectivityDiagnostic connectivity, GraphErrorCode errorCode,
                                   String reason, String message) {
        this.valid        = valid;
        this.missingKinds = List.copyOf(missingKinds);
        this.counts       = Map.copyOf(counts);
        this.connectivity = connectivity;
        this.errorCode    = errorCode;
        this.reason       = reason;
        this.message      = message;
    }

    static MinimumStructureResult valid(Map<NodeKind, Integer> counts, ConnectivityDiagnostic connectivity) {
        return new MinimumStructureResult(true, List.of(), counts, connectivity, null, null,
                "Graph meets minimum structure requirements");
    }

    static MinimumStructureResult missingKinds(List<NodeKind> missing, Map<NodeKind, Integer> counts) {
        StringBuilder names = new StringBuilder();
        for (NodeKind kind : missing) {
            if (names.length() > 0) names.append(", ");
            names.append(kind.wireName());
        }
        return new MinimumStructureResult(false, missing, counts, null, GraphErrorCode.CEE_GRAPH_INVALID,
                REASON_INCOMPLETE_STRUCTURE, "Graph missing required elements: " + names);
    }

    static MinimumStructureResult missingOutcomeOrRisk(Map<NodeKind, Integer> counts) {
        return new MinimumStructureResult(false, List.of(), counts, null, GraphErrorCode.CEE_GRAPH_INVALID,
                REASON_MISSING_OUTCOME_OR_RISK,
                "Your model needs at least one outcome or risk to connect factors to your goal");
    }

    static MinimumStructureResult disconnected(Map<NodeKind, Integer> counts, ConnectivityDiagnostic connectivity) {
        return new MinimumStructureResult(false, List.of(), counts, connectivity,
                GraphErrorCode.CEE_GRAPH_CONNECTIVITY_FAILED, REASON_CONNECTIVITY_FAILED,
                "Graph has all required node types but they are not connected via edges");
    }

    public boolean                isValid()         { return valid; }
    public List<NodeKind>         getMissingKinds() { return missingKinds; }
    public Map<NodeKind, Integer> getCounts()       { return counts; }
    public ConnectivityDiagnostic getConnectivity() { return connectivity; }
    public GraphErrorCode         getErrorCode()    { return errorCode; }
    public String                 getReason()       { return reason; }
    public String                 getMessage()      { return message; }

    public boolean isConnectivityFailure() {
        return errorCode == GraphErrorCode.CEE_GRAPH_CONNECTIVITY_FAILED;
    }

    /** Hint from the connectivity failure class, or null when connectivity was not the problem. */
    public String getConditionalHint() {
        return isConnectivityFailure() ? connectivity.getConditionalHint() : null;
    }

    @Override
    public String toString() {
        return valid
                ? "MinimumStructureResult{valid}"
                : "MinimumStructureResult{" + errorCode + ", reason=" + reason + "}";
    }
}
