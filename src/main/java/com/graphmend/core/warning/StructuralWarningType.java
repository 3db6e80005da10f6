package com.graphmend.core.warning;

public enum StructuralWarningType {
    NO_OUTCOME_NODE,
    ORPHAN_NODE,
    CYCLE_DETECTED,
    DECISION_AFTER_OUTCOME;

    /** Wire id, e.g. "no_outcome_node". */
    public String wireName() {
        return name().toLowerCase();
    }
}
