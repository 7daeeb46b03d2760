package com.hiring.refnet.fn;

/**
 * Maps a referral bonus to the daily probability that a referrer makes a
 * successful referral.
 *
 * <p>
 * Used by
 * {@link com.hiring.refnet.sim.BonusOptimizer#minBonusForTarget(int, int, AdoptionProbability, double)}.
 * Implementations are expected to be monotonically non-decreasing in the bonus
 * and to return values in {@code [0, 1]}. Monotonicity is assumed, not checked;
 * the range is checked on every call the optimizer makes.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code bonus -> Math.min(1.0, bonus / 1000.0)}</li>
 * <li>{@code AdoptionCurves.logistic(500, 0.01)}</li>
 * </ul>
 */
@FunctionalInterface
public interface AdoptionProbability {
    /**
     * @param bonus Bonus amount in whole currency units.
     * @return Daily referral probability.
     */
    double probabilityOf(int bonus);
}
