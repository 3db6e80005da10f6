package com.graphmend.core.warning;

/**
 * Severity of a structural warning. Rank order: BLOCKER > HIGH > MEDIUM > LOW.
 */
public enum WarningSeverity {
    LOW(0),
    MEDIUM(1),
    HIGH(2),
    BLOCKER(3);

    private final int rank;

    WarningSeverity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
