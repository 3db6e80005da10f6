package com.graphmend.core.audit;

import com.graphmend.core.graph.GraphEdge;

import java.util.Objects;

/**
 * Immutable audit entry for one field actually changed on one edge, or on
 * one node's data.
 *
 * field is a dotted path ("strength.mean", "belief_exists", "belief",
 * "data.value"). Edge records carry edgeFrom/edgeTo, node records nodeId.
 * fromValue is null when the field was absent. A no-op change never produces
 * a record.
 */
public final class RepairRecord {

    public static final String FIELD_STRENGTH_MEAN    = "strength.mean";
    public static final String FIELD_STRENGTH_STD     = "strength.std";
    public static final String FIELD_BELIEF_EXISTS    = "belief_exists";
    public static final String FIELD_EFFECT_DIRECTION = "effect_direction";
    public static final String FIELD_BELIEF           = "belief";
    public static final String FIELD_DATA_VALUE       = "data.value";

    private final String       field;
    private final RepairAction action;
    private final Object       fromValue;
    private final Object       toValue;
    private final String       reason;
    private final String       edgeId;
    private final String       edgeFrom;
    private final String       edgeTo;
    private final String       nodeId;

    private RepairRecord(Builder b) {
        this.field     = b.field;
        this.action    = b.action;
        this.fromValue = b.fromValue;
        this.toValue   = b.toValue;
        this.reason    = b.reason;
        this.edgeId    = b.edgeId;
        this.edgeFrom  = b.edgeFrom;
        this.edgeTo    = b.edgeTo;
        this.nodeId    = b.nodeId;
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public String       getField()     { return field; }
    public RepairAction getAction()    { return action; }
    public Object       getFromValue() { return fromValue; }
    public Object       getToValue()   { return toValue; }
    public String       getReason()    { return reason; }
    public String       getEdgeId()    { return edgeId; }
    public String       getEdgeFrom()  { return edgeFrom; }
    public String       getEdgeTo()    { return edgeTo; }
    public String       getNodeId()    { return nodeId; }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    /** Builder pre-filled with the edge coordinates. */
    public static Builder forEdge(GraphEdge edge, String field, RepairAction action) {
        return new Builder(field, action)
                .edgeId(edge.getId())
                .edgeFrom(edge.getFrom())
                .edgeTo(edge.getTo());
    }

    /** Builder for a change to a node's data. */
    public static Builder forNode(String nodeId, String field, RepairAction action) {
        Builder builder = new Builder(field, action);
        builder.nodeId = nodeId;
        return builder;
    }

    public static final class Builder {
        private final String       field;
        private final RepairAction action;
        private Object fromValue = null;
        private Object toValue   = null;
        private String reason    = "";
        private String edgeId    = null;
        private String edgeFrom  = null;
        private String edgeTo    = null;
        private String nodeId    = null;

        private Builder(String field, RepairAction action) {
            this.field  = Objects.requireNonNull(field, "field");
            this.action = Objects.requireNonNull(action, "action");
        }

        public Builder fromValue(Object v) { this.fromValue = v; return this; }
        public Builder toValue(Object v)   { this.toValue = v;   return this; }
        public Builder reason(String v)    { this.reason = v;    return this; }
        public Builder edgeId(String v)    { this.edgeId = v;    return this; }
        public Builder edgeFrom(String v)  { this.edgeFrom = v;  return this; }
        public Builder edgeTo(String v)    { this.edgeTo = v;    return this; }

        public RepairRecord build() {
            if (toValue == null) {
                throw new IllegalStateException("RepairRecord.toValue is required (field=" + field + ")");
            }
            return new RepairRecord(this);
        }
    }

    @Override
    public String toString() {
        String target = nodeId != null ? nodeId : edgeFrom + "->" + edgeTo;
        return "RepairRecord{" + target + " " + field + ": "
                + fromValue + " -> " + toValue + " (" + action.wireName() + ")}";
    }
}
