package com.graphmend.core.params;

import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.Provenance;

/**
 * Fixed parameter set for one (sourceKind, targetKind) pair.
 */
public final class EdgeTemplate {

    private final double          strengthMean;
    private final double          strengthStd;
    private final double          beliefExists;
    private final EffectDirection effectDirection;

    public EdgeTemplate(double strengthMean, double strengthStd, double beliefExists,
                        EffectDirection effectDirection) {
        this.strengthMean    = strengthMean;
        this.strengthStd     = strengthStd;
        this.beliefExists    = beliefExists;
        this.effectDirection = effectDirection;
    }

    public double          getStrengthMean()    { return strengthMean; }
    public double          getStrengthStd()     { return strengthStd; }
    public double          getBeliefExists()    { return beliefExists; }
    public EffectDirection getEffectDirection() { return effectDirection; }

    /**
     * New synthetic edge carrying this template's parameters.
     */
    public GraphEdge newEdge(String from, String to, String provenanceQuote) {
        return GraphEdge.of(from, to)
                .withStrengthMean(strengthMean)
                .withStrengthStd(strengthStd)
                .withBeliefExists(beliefExists)
                .withEffectDirection(effectDirection)
                .withOrigin(GraphEdge.ORIGIN_DEFAULT)
                .withProvenance(Provenance.synthetic(provenanceQuote));
    }

    @Override
    public String toString() {
        return String.format("EdgeTemplate{mean=%.2f, std=%.2f, exists=%.2f, dir=%s}",
                strengthMean, strengthStd, beliefExists, effectDirection.wireName());
    }
}
