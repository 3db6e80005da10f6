package com.graphmend.core.graph;

/**
 * Uniform prior over [rangeMin, rangeMax] on the normalised [0, 1] scale.
 */
public final class UniformPrior {

    public static final String DISTRIBUTION = "uniform";

    private final double rangeMin;
    private final double rangeMax;

    public UniformPrior(double rangeMin, double rangeMax) {
        if (rangeMin > rangeMax) {
            throw new IllegalArgumentException("Inverted prior range [" + rangeMin + ", " + rangeMax + "]");
        }
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
    }

    /**
     * Prior synthesised around a known baseline value.
     *
     * Binary or out-of-domain baselines (<= 0 or >= 1) give full uncertainty
     * [0, 1]. Otherwise margin = max(0.1, value * 0.5), clamped to [0, 1].
     */
    public static UniformPrior aroundBaseline(double value) {
        if (value <= 0 || value >= 1) {
            return new UniformPrior(0.0, 1.0);
        }
        double margin = Math.max(0.1, value * 0.5);
        return new UniformPrior(Math.max(0, value - margin), Math.min(1, value + margin));
    }

    public String getDistribution() { return DISTRIBUTION; }
    public double getRangeMin()     { return rangeMin; }
    public double getRangeMax()     { return rangeMax; }

    @Override
    public String toString() {
        return "uniform[" + rangeMin + ", " + rangeMax + "]";
    }
}
