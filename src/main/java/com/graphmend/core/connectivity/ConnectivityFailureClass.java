package com.graphmend.core.connectivity;

/**
 * Classification of a connectivity failure.
 *
 * Precedence is fixed (first match wins, no ties):
 *   NEITHER_REACHABLE  — no option and no goal reachable from any decision
 *   NO_PATH_TO_OPTIONS — no option reachable
 *   NO_PATH_TO_GOAL    — no goal reachable
 *   PARTIAL            — both reachable but the graph still failed
 *   NONE               — connectivity passed
 */
public enum ConnectivityFailureClass {
    NEITHER_REACHABLE,
    NO_PATH_TO_OPTIONS,
    NO_PATH_TO_GOAL,
    PARTIAL,
    NONE;

    public String wireName() {
        return name().toLowerCase();
    }

    public static ConnectivityFailureClass classify(boolean passed, int reachableOptions, int reachableGoals) {
        if (passed) {
            return NONE;
        }
        if (reachableOptions == 0 && reachableGoals == 0) {
            return NEITHER_REACHABLE;
        }
        if (reachableOptions == 0) {
            return NO_PATH_TO_OPTIONS;
        }
        if (reachableGoals == 0) {
            return NO_PATH_TO_GOAL;
        }
        return PARTIAL;
    }

    /**
     * Human-readable hint for the caller, one per class.
     */
    public String getHint() {
        return switch (this) {
            case NEITHER_REACHABLE ->
                "Neither options nor goal are reachable from decision via edges";
            case NO_PATH_TO_OPTIONS ->
                "No option is reachable from decision via edges";
            case NO_PATH_TO_GOAL ->
                "Options are reachable but goal is not connected to the causal chain";
            case PARTIAL ->
                "Graph has partial connectivity — some nodes are unreachable";
            case NONE ->
                "Graph is connected";
        };
    }
}
