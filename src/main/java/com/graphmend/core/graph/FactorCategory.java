package com.graphmend.core.graph;

/**
 * Category of a factor node. Only meaningful when kind == FACTOR.
 */
public enum FactorCategory {
    CONTROLLABLE,
    EXTERNAL,
    OBSERVABLE;

    public String wireName() {
        return name().toLowerCase();
    }

    public static FactorCategory fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (FactorCategory category : values()) {
            if (category.wireName().equals(value.trim().toLowerCase())) {
                return category;
            }
        }
        return null;
    }
}
