package com.graphmend.core.connectivity;

import java.util.List;

/**
 * Result of the decision → option/goal reachability check.
 *
 * reachableOptions / reachableGoals are the union over every decision's
 * traversal. unreachableNodes lists only options and goals, the targets that
 * matter for analysis.
 */
public final class ConnectivityDiagnostic {

    private final boolean      passed;
    private final List<String> decisionIds;
    private final List<String> reachableOptions;
    private final List<String> reachableGoals;
    private final List<String> unreachableNodes;
    private final List<String> allOptionIds;
    private final List<String> allGoalIds;

    public ConnectivityDiagnostic(
            boolean      passed,
            List<String> decisionIds,
            List<String> reachableOptions,
            List<String> reachableGoals,
            List<String> unreachableNodes,
            List<String> allOptionIds,
            List<String> allGoalIds
    ) {
        this.passed           = passed;
        this.decisionIds      = List.copyOf(decisionIds);
        this.reachableOptions = List.copyOf(reachableOptions);
        this.reachableGoals   = List.copyOf(reachableGoals);
        this.unreachableNodes = List.copyOf(unreachableNodes);
        this.allOptionIds     = List.copyOf(allOptionIds);
        this.allGoalIds       = List.copyOf(allGoalIds);
    }

    public static ConnectivityDiagnostic empty() {
        return new ConnectivityDiagnostic(false, List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public boolean      isPassed()            { return passed; }
    public List<String> getDecisionIds()      { return decisionIds; }
    public List<String> getReachableOptions() { return reachableOptions; }
    public List<String> getReachableGoals()   { return reachableGoals; }
    public List<String> getUnreachableNodes() { return unreachableNodes; }
    public List<String> getAllOptionIds()     { return allOptionIds; }
    public List<String> getAllGoalIds()       { return allGoalIds; }

    public ConnectivityFailureClass getFailureClass() {
        return ConnectivityFailureClass.classify(passed, reachableOptions.size(), reachableGoals.size());
    }

    public String getConditionalHint() {
        return getFailureClass().getHint();
    }

    @Override
    public String toString() {
        return String.format("ConnectivityDiagnostic{passed=%s, decisions=%d, options=%d/%d, goals=%d/%d, class=%s}",
                passed, decisionIds.size(),
                reachableOptions.size(), allOptionIds.size(),
                reachableGoals.size(), allGoalIds.size(),
                getFailureClass().wireName());
    }
}
