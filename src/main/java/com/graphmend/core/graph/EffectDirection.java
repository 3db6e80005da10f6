package com.graphmend.core.graph;

public enum EffectDirection {
    POSITIVE,
    NEGATIVE;

    public String wireName() {
        return name().toLowerCase();
    }

    public static EffectDirection fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (EffectDirection direction : values()) {
            if (direction.wireName().equals(value.trim().toLowerCase())) {
                return direction;
            }
        }
        return null;
    }
}
