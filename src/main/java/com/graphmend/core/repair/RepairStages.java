package com.graphmend.core.repair;

/**
 * Stage names used in audit records, field-deletion events and logs.
 */
public final class RepairStages {

    public static final String DANGLING_EDGES         = "dangling-edges";
    public static final String NAN_VALUES             = "nan-values";
    public static final String SIGN_MISMATCH          = "sign-mismatch";
    public static final String SINGLE_GOAL            = "single-goal";
    public static final String FACTOR_GOAL_SPLIT      = "factor-goal-split";
    public static final String BELIEF_NORMALISATION   = "belief-normalisation";
    public static final String OUTCOME_BELIEFS        = "outcome-beliefs";
    public static final String WIRE_TO_GOAL           = "wire-to-goal";
    public static final String WIRE_FROM_CAUSAL_CHAIN = "wire-from-causal-chain";
    public static final String UNREACHABLE_PRUNER     = "unreachable-pruner";
    public static final String UNREACHABLE_FACTORS    = "unreachable-factors";
    public static final String CANONICAL_EDGES        = "canonical-edges";
    public static final String DETERMINISM            = "determinism";

    private RepairStages() {
    }
}
