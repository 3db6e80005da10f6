package com.graphmend.core.audit;

/**
 * What a repair did to a single field.
 *
 * CLAMPED    — value was outside its valid range and was pulled to the bound
 * DEFAULTED  — field was absent (or null) and received a default
 * NORMALISED — field was present but non-canonical and was overwritten
 */
public enum RepairAction {
    CLAMPED,
    DEFAULTED,
    NORMALISED;

    public String wireName() {
        return name().toLowerCase();
    }

    /** DEFAULTED when there was no prior value, NORMALISED otherwise. */
    public static RepairAction forPriorValue(Object priorValue) {
        return priorValue == null ? DEFAULTED : NORMALISED;
    }
}
