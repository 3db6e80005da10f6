package com.graphmend.core.event;

public enum RepairEventType {
    GRAPH_REJECTED,
    STAGE_APPLIED,
    FIELD_DELETED,
    GRAPH_REPAIRED
}
