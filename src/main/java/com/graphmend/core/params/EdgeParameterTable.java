package com.graphmend.core.params;

import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.NodeKind;

import java.util.Map;
import java.util.Optional;

/**
 * Canonical and default edge parameters keyed by (sourceKind, targetKind).
 *
 * Consumed by both orphan wiring (defaults for synthesised edges) and the
 * canonical edge enforcer (values forced onto option→factor edges), so the two
 * never drift apart.
 *
 *   option  → factor   1.0 / 0.01 / 1.0  / positive   canonical structural link
 *   outcome → goal     0.7 / 0.15 / 0.9  / positive
 *   risk    → goal    -0.5 / 0.15 / 0.9  / negative
 *   factor  → outcome  0.5 / 0.2  / 0.75 / positive
 *   factor  → risk     0.3 / 0.2  / 0.75 / positive
 *
 * Factor→goal splitting is not a kind pair of its own: it uses
 * {@link #SPLIT_DEFAULTS} for the new outcome→goal edge and for any field the
 * original factor→goal edge lacked.
 */
public final class EdgeParameterTable {

    /** Belief given to option→outcome edges that carry none. */
    public static final double DEFAULT_OUTCOME_BELIEF = 0.5;

    private static final EdgeTemplate OPTION_TO_FACTOR =
            new EdgeTemplate(1.0, 0.01, 1.0, EffectDirection.POSITIVE);
    private static final EdgeTemplate OUTCOME_TO_GOAL =
            new EdgeTemplate(0.7, 0.15, 0.9, EffectDirection.POSITIVE);
    private static final EdgeTemplate RISK_TO_GOAL =
            new EdgeTemplate(-0.5, 0.15, 0.9, EffectDirection.NEGATIVE);
    private static final EdgeTemplate FACTOR_TO_OUTCOME =
            new EdgeTemplate(0.5, 0.2, 0.75, EffectDirection.POSITIVE);
    private static final EdgeTemplate FACTOR_TO_RISK =
            new EdgeTemplate(0.3, 0.2, 0.75, EffectDirection.POSITIVE);

    public static final EdgeTemplate SPLIT_DEFAULTS =
            new EdgeTemplate(0.5, 0.15, 0.9, EffectDirection.POSITIVE);

    private static final Map<String, EdgeTemplate> TABLE = Map.of(
            key(NodeKind.OPTION,  NodeKind.FACTOR),  OPTION_TO_FACTOR,
            key(NodeKind.OUTCOME, NodeKind.GOAL),    OUTCOME_TO_GOAL,
            key(NodeKind.RISK,    NodeKind.GOAL),    RISK_TO_GOAL,
            key(NodeKind.FACTOR,  NodeKind.OUTCOME), FACTOR_TO_OUTCOME,
            key(NodeKind.FACTOR,  NodeKind.RISK),    FACTOR_TO_RISK
    );

    private EdgeParameterTable() {
    }

    public static Optional<EdgeTemplate> lookup(NodeKind sourceKind, NodeKind targetKind) {
        if (sourceKind == null || targetKind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TABLE.get(key(sourceKind, targetKind)));
    }

    public static EdgeTemplate require(NodeKind sourceKind, NodeKind targetKind) {
        return lookup(sourceKind, targetKind).orElseThrow(() -> new IllegalArgumentException(
                "No edge template for " + sourceKind + " -> " + targetKind));
    }

    private static String key(NodeKind sourceKind, NodeKind targetKind) {
        return sourceKind.name() + "->" + targetKind.name();
    }
}
