package com.hiring.refnet.fn;

/**
 * Stock monotone {@link AdoptionProbability} curves.
 */
public final class AdoptionCurves {
    private AdoptionCurves() {
    }

    /** The same probability regardless of bonus. */
    public static AdoptionProbability constant(double p) {
        requireProbability(p, "p");
        return bonus -> p;
    }

    /**
     * {@code base + slope * bonus}, capped at {@code ceiling}.
     */
    public static AdoptionProbability linear(double base, double slope, double ceiling) {
        requireProbability(base, "base");
        requireProbability(ceiling, "ceiling");
        if (slope < 0)
            throw new IllegalArgumentException("slope must be non-negative: " + slope);
        if (ceiling < base)
            throw new IllegalArgumentException("ceiling must be >= base");
        return bonus -> Math.min(ceiling, base + slope * bonus);
    }

    /**
     * Logistic curve centred on {@code midpoint} with the given steepness.
     * Returns 0.5 at the midpoint.
     */
    public static AdoptionProbability logistic(double midpoint, double steepness) {
        if (steepness <= 0)
            throw new IllegalArgumentException("steepness must be positive: " + steepness);
        return bonus -> 1.0 / (1.0 + Math.exp(-steepness * (bonus - midpoint)));
    }

    /** {@code low} below {@code threshold}, {@code high} at or above it. */
    public static AdoptionProbability step(int threshold, double low, double high) {
        requireProbability(low, "low");
        requireProbability(high, "high");
        if (high < low)
            throw new IllegalArgumentException("high must be >= low");
        return bonus -> bonus >= threshold ? high : low;
    }

    private static void requireProbability(double p, String name) {
        if (!(p >= 0.0 && p <= 1.0))
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + p);
    }
}
