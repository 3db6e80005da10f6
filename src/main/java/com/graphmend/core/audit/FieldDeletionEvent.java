package com.graphmend.core.audit;

/**
 * A repair stage stripped a field from a node's data.
 */
public final class FieldDeletionEvent {

    public static final String REASON_UNREACHABLE_FACTOR_RECLASSIFIED = "UNREACHABLE_FACTOR_RECLASSIFIED";

    private final String stage;
    private final String nodeId;
    private final String field;
    private final String reason;

    private FieldDeletionEvent(String stage, String nodeId, String field, String reason) {
        this.stage  = stage;
        this.nodeId = nodeId;
        this.field  = field;
        this.reason = reason;
    }

    public static FieldDeletionEvent of(String stage, String nodeId, String field, String reason) {
        return new FieldDeletionEvent(stage, nodeId, field, reason);
    }

    public String getStage()  { return stage; }
    public String getNodeId() { return nodeId; }
    public String getField()  { return field; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return String.format("FieldDeletion{stage=%s, node=%s, field=%s, reason=%s}",
                stage, nodeId, field, reason);
    }
}
