package com.graphmend.core.graph;

import java.util.List;

/**
 * Cycle information reported by the DAG stabiliser that runs before the engine.
 */
public final class StructuralMeta {

    private static final StructuralMeta NONE = new StructuralMeta(false, List.of());

    private final boolean      hadCycles;
    private final List<String> cycleNodeIds;

    public StructuralMeta(boolean hadCycles, List<String> cycleNodeIds) {
        this.hadCycles    = hadCycles;
        this.cycleNodeIds = cycleNodeIds != null ? List.copyOf(cycleNodeIds) : List.of();
    }

    public static StructuralMeta none() {
        return NONE;
    }

    public static StructuralMeta cycles(List<String> cycleNodeIds) {
        return new StructuralMeta(true, cycleNodeIds);
    }

    public boolean      hadCycles()       { return hadCycles; }
    public List<String> getCycleNodeIds() { return cycleNodeIds; }

    @Override
    public String toString() {
        return "StructuralMeta{hadCycles=" + hadCycles + ", cycleNodes=" + cycleNodeIds.size() + "}";
    }
}
