package com.graphmend.core.warning;

import java.util.Comparator;
import java.util.List;

/**
 * A residual structural issue, reported and never corrected.
 */
public final class StructuralWarning {

    /** Most severe first, then by wire id. */
    public static final Comparator<StructuralWarning> BY_SEVERITY =
            Comparator.comparingInt((StructuralWarning w) -> -w.getSeverity().rank())
                    .thenComparing(w -> w.getType().wireName());

    private final StructuralWarningType type;
    private final WarningSeverity       severity;
    private final List<String>          nodeIds;
    private final List<String>          edgeIds;
    private final String                explanation;

    public StructuralWarning(StructuralWarningType type, WarningSeverity severity,
                             List<String> nodeIds, List<String> edgeIds, String explanation) {
        this.type        = type;
        this.severity    = severity;
        this.nodeIds     = nodeIds != null ? List.copyOf(nodeIds) : List.of();
        this.edgeIds     = edgeIds != null ? List.copyOf(edgeIds) : List.of();
        this.explanation = explanation != null ? explanation : "";
    }

    /** Wire id of the warning ("orphan_node", ...). */
    public String                getId()          { return type.wireName(); }
    public StructuralWarningType getType()        { return type; }
    public WarningSeverity       getSeverity()    { return severity; }
    public List<String>          getNodeIds()     { return nodeIds; }
    public List<String>          getEdgeIds()     { return edgeIds; }
    public String                getExplanation() { return explanation; }

    @Override
    public String toString() {
        return String.format("StructuralWarning{%s, severity=%s, nodes=%s}",
                getId(), severity.wireName(), nodeIds);
    }
}
