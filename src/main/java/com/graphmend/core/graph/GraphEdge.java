package com.graphmend.core.graph;

/**
 * A directed edge of a decision graph.
 *
 * Numeric parameters are boxed: null means "absent", which the repair stages
 * treat differently from any concrete value (a filled-in absent field is
 * "defaulted", a changed present one is "normalised").
 *
 * Two numeric systems live side by side on purpose:
 *   belief / weight                       — legacy decision-branch representation
 *   strength_mean / strength_std /
 *   belief_exists / effect_direction      — causal-effect representation
 * Neither is migrated into the other.
 */
public class GraphEdge {

    public static final String ORIGIN_DEFAULT = "default";
    public static final String ORIGIN_REPAIR  = "repair";

    private String from;
    private String to;
    private String id;

    private Double          strengthMean;
    private Double          strengthStd;
    private Double          beliefExists;
    private EffectDirection effectDirection;
    private Double          belief;
    private Double          weight;
    private Provenance      provenance;
    private String          origin;

    public GraphEdge(String from, String to) {
        if (from == null || from.isBlank() || to == null || to.isBlank()) {
            throw new IllegalArgumentException("Edge endpoints cannot be empty: " + from + " -> " + to);
        }
        this.from = from;
        this.to   = to;
    }

    public static GraphEdge of(String from, String to) {
        return new GraphEdge(from, to);
    }

    // Fluent setters used by tests and by the wiring stages
    public GraphEdge withId(String v)                       { this.id = v;              return this; }
    public GraphEdge withStrengthMean(Double v)             { this.strengthMean = v;    return this; }
    public GraphEdge withStrengthStd(Double v)              { this.strengthStd = v;     return this; }
    public GraphEdge withBeliefExists(Double v)             { this.beliefExists = v;    return this; }
    public GraphEdge withEffectDirection(EffectDirection v) { this.effectDirection = v; return this; }
    public GraphEdge withBelief(Double v)                   { this.belief = v;          return this; }
    public GraphEdge withWeight(Double v)                   { this.weight = v;          return this; }
    public GraphEdge withProvenance(Provenance v)           { this.provenance = v;      return this; }
    public GraphEdge withOrigin(String v)                   { this.origin = v;          return this; }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String          getFrom()            { return from; }
    public String          getTo()              { return to; }
    public String          getId()              { return id; }
    public Double          getStrengthMean()    { return strengthMean; }
    public Double          getStrengthStd()     { return strengthStd; }
    public Double          getBeliefExists()    { return beliefExists; }
    public EffectDirection getEffectDirection() { return effectDirection; }
    public Double          getBelief()          { return belief; }
    public Double          getWeight()          { return weight; }
    public Provenance      getProvenance()      { return provenance; }
    public String          getOrigin()          { return origin; }

    public boolean hasProvenance() {
        return provenance != null;
    }

    public void setFrom(String from)                       { this.from = from; }
    public void setTo(String to)                           { this.to = to; }
    public void setId(String id)                           { this.id = id; }
    public void setStrengthMean(Double v)                  { this.strengthMean = v; }
    public void setStrengthStd(Double v)                   { this.strengthStd = v; }
    public void setBeliefExists(Double v)                  { this.beliefExists = v; }
    public void setEffectDirection(EffectDirection v)      { this.effectDirection = v; }
    public void setBelief(Double v)                        { this.belief = v; }
    public void setWeight(Double v)                        { this.weight = v; }
    public void setProvenance(Provenance provenance)       { this.provenance = provenance; }
    public void setOrigin(String origin)                   { this.origin = origin; }

    /** "from->to" key used for parallel-edge grouping. */
    public String pairKey() {
        return from + "->" + to;
    }

    public boolean touches(String nodeId) {
        return from.equals(nodeId) || to.equals(nodeId);
    }

    public GraphEdge copy() {
        GraphEdge copy = new GraphEdge(from, to);
        copy.id              = id;
        copy.strengthMean    = strengthMean;
        copy.strengthStd     = strengthStd;
        copy.beliefExists    = beliefExists;
        copy.effectDirection = effectDirection;
        copy.belief          = belief;
        copy.weight          = weight;
        copy.provenance      = provenance;
        copy.origin          = origin;
        return copy;
    }

    @Override
    public String toString() {
        return "GraphEdge{" + from + " -> " + to + (id != null ? ", id='" + id + "'" : "") + "}";
    }
}
