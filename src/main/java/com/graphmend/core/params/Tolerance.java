package com.graphmend.core.params;

/**
 * Single floating-point tolerance shared by every stage that decides whether a
 * value is "already" canonical or normalised. Keeping one constant keeps audit
 * record emission consistent across stages.
 */
public final class Tolerance {

    public static final double EPSILON = 1e-6;

    private Tolerance() {
    }

    public static boolean approxEquals(double a, double b) {
        return Math.abs(a - b) <= EPSILON;
    }

    /** Null-safe: an absent value never equals a concrete one. */
    public static boolean approxEquals(Double a, double b) {
        return a != null && approxEquals(a.doubleValue(), b);
    }
}
