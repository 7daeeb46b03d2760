package com.hiring.refnet.sim;

import com.hiring.refnet.api.RefNetException;
import com.hiring.refnet.api.ReferralError;
import com.hiring.refnet.api.Result;
import com.hiring.refnet.fn.AdoptionProbability;
import com.hiring.refnet.io.RefNetConfig;

import java.util.OptionalInt;

import lombok.extern.log4j.Log4j2;

/**
 * Finds the smallest referral bonus that meets a hiring target.
 *
 * Algorithm:
 * 1. Probe the adoption curve at bonus 0 to check that it can be called and
 * returns a probability.
 * 2. Feasibility: run the expected simulation at {@code maxBonus}. If even that
 * misses the target, report "impossible" without searching.
 * 3. Binary search over {@code [0, maxBonus]}. Every probe is rounded down to a
 * multiple of {@code increment} before the curve and the simulation see it.
 * 4. Re-check the final candidate, which guards the rounding at the boundary.
 *
 * The search assumes the curve is non-decreasing in the bonus. That is not
 * verified; a non-monotone curve yields some bonus that meets the target, not
 * necessarily the smallest.
 */
@Log4j2
public final class BonusOptimizer {
    private final GrowthSimulator simulator;
    private final int increment;
    private final int maxBonus;

    public BonusOptimizer() {
        this(new RefNetConfig());
    }

    public BonusOptimizer(RefNetConfig config) {
        this(new GrowthSimulator(config.validate().getSimulation()), config.getBonus());
    }

    public BonusOptimizer(GrowthSimulator simulator, RefNetConfig.Bonus bonus) {
        if (bonus.getIncrement() <= 0 || bonus.getMaxBonus() < bonus.getIncrement())
            throw new IllegalArgumentException("Invalid bonus config: " + bonus);
        this.simulator = simulator;
        this.increment = bonus.getIncrement();
        this.maxBonus = bonus.getMaxBonus() / increment * increment;
    }

    public int increment() {
        return increment;
    }

    public int maxBonus() {
        return maxBonus;
    }

    /**
     * @param days         Days available for hiring.
     * @param targetHires  Expected hires to reach.
     * @param adoptionProb Bonus to daily referral probability.
     * @param eps          Tolerance; must be positive.
     * @return the minimum bonus (a multiple of {@link #increment()}), empty when
     *         the target is impossible, or a failure of kind
     *         {@link ReferralError#INVALID_SIGNATURE},
     *         {@link ReferralError#INVALID_TOLERANCE} or
     *         {@link ReferralError#INVALID_PROBABILITY_FUNCTION}
     */
    public Result<OptionalInt> minBonusForTarget(int days, int targetHires, AdoptionProbability adoptionProb,
            double eps) {
        if (days <= 0 || targetHires <= 0)
            return Result.ok(OptionalInt.empty());
        if (adoptionProb == null)
            return Result.fail(ReferralError.INVALID_SIGNATURE, "Adoption curve must accept a bonus amount");
        if (!(eps > 0.0))
            return Result.fail(ReferralError.INVALID_TOLERANCE, "Tolerance must be positive: " + eps);

        try {
            checkCallable(adoptionProb);

            if (!meetsTarget(adoptionProb, maxBonus, days, targetHires)) {
                log.debug("Target {} in {} days unreachable even at bonus {}", targetHires, days, maxBonus);
                return Result.ok(OptionalInt.empty());
            }

            int left = 0, right = maxBonus;
            while (left < right) {
                int mid = ((left + right) >>> 1) / increment * increment;
                if (meetsTarget(adoptionProb, mid, days, targetHires))
                    right = mid;
                else
                    left = mid + increment;
            }

            if (left <= maxBonus && meetsTarget(adoptionProb, left, days, targetHires)) {
                log.debug("minBonusForTarget(days={}, target={}) = {}", days, targetHires, left);
                return Result.ok(OptionalInt.of(left));
            }
            return Result.ok(OptionalInt.empty());
        } catch (RefNetException e) {
            return Result.fail(e.error(), e.getMessage());
        }
    }

    /**
     * Cost summary around {@link #minBonusForTarget}. Failures pass through
     * unchanged.
     */
    public Result<BonusAnalysis> analyzeBonusEffectiveness(int days, int targetHires,
            AdoptionProbability adoptionProb, double eps) {
        return minBonusForTarget(days, targetHires, adoptionProb, eps)
                .map(bonus -> BonusAnalysis.of(days, targetHires, bonus.isPresent() ? bonus.getAsInt() : null));
    }

    private void checkCallable(AdoptionProbability adoptionProb) {
        double p;
        try {
            p = adoptionProb.probabilityOf(0);
        } catch (RuntimeException e) {
            throw new RefNetException(ReferralError.INVALID_SIGNATURE,
                    "Adoption curve must accept a bonus amount: " + e.getMessage(), e);
        }
        requireProbability(p, 0);
    }

    private boolean meetsTarget(AdoptionProbability adoptionProb, int bonus, int days, int targetHires) {
        double p = adoptionProb.probabilityOf(bonus);
        requireProbability(p, bonus);
        return simulator.expectedTotal(p, days) >= targetHires;
    }

    private static void requireProbability(double p, int bonus) {
        if (!(p >= 0.0 && p <= 1.0))
            throw new RefNetException(ReferralError.INVALID_PROBABILITY_FUNCTION,
                    "Adoption curve returned " + p + " for bonus " + bonus);
    }
}
