package com.graphmend.core.graph;

/**
 * Kind of a node in a decision graph.
 *
 * Every kind except FACTOR is protected: reachability-based pruning
 * never removes it.
 */
public enum NodeKind {
    GOAL,
    DECISION,
    OPTION,
    OUTCOME,
    RISK,
    ACTION,
    FACTOR;

    /** Lower-case name used on the wire ("goal", "decision", ...). */
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isProtected() {
        return this != FACTOR;
    }

    /**
     * Resolve a wire name. Returns null for null/blank/unknown input so the
     * codec can decide how to report it.
     */
    public static NodeKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (NodeKind kind : values()) {
            if (kind.wireName().equals(value.trim().toLowerCase())) {
                return kind;
            }
        }
        return null;
    }
}
