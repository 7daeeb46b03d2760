package com.hiring.refnet.sim;

import com.hiring.refnet.api.ReferralError;
import com.hiring.refnet.api.Result;
import com.hiring.refnet.io.RefNetConfig;

import java.util.OptionalInt;
import java.util.Random;

import lombok.extern.log4j.Log4j2;

/**
 * Day-stepped growth model of a capacity-limited referrer population.
 *
 * Model:
 * The population starts with {@code initialReferrers} active slots, each with a
 * referral count of zero. Every day each active slot makes one attempt. A slot
 * whose count reaches {@code capacity} leaves the active set at the end of that
 * day. With nothing left active the cumulative total is saturated at
 * {@code initialReferrers * capacity}.
 *
 * Variants:
 * - {@link #simulate(double, int)}: each attempt is a Bernoulli trial with
 * success probability p.
 * - {@link #simulateExpected(double, int)}: each attempt contributes exactly p.
 * This is the deterministic proxy used by the searches in
 * {@link #daysToTarget(double, int)} and {@link BonusOptimizer}.
 *
 * Both variants run the same transition rule (Population.step()); only
 * the per-attempt contribution differs. Population state is local to one call.
 *
 * The stochastic variant draws from the simulator's own {@link Random}, so a
 * simulator built with a seed replays the same sequence of runs.
 */
@Log4j2
public final class GrowthSimulator {
    private final int initialReferrers;
    private final int capacity;
    private final int maxDays;
    private final Random random;

    public GrowthSimulator() {
        this(new RefNetConfig.Simulation());
    }

    public GrowthSimulator(RefNetConfig.Simulation config) {
        this(config, config.getSeed() == null ? new Random() : new Random(config.getSeed()));
    }

    public GrowthSimulator(RefNetConfig.Simulation config, Random random) {
        if (config.getInitialReferrers() <= 0 || config.getCapacity() <= 0 || config.getMaxDays() <= 0)
            throw new IllegalArgumentException("Invalid simulation config: " + config);
        this.initialReferrers = config.getInitialReferrers();
        this.capacity = config.getCapacity();
        this.maxDays = config.getMaxDays();
        this.random = random;
    }

    public int initialReferrers() {
        return initialReferrers;
    }

    public int capacity() {
        return capacity;
    }

    public int maxDays() {
        return maxDays;
    }

    /** Upper bound on any cumulative total. */
    public int maxTotal() {
        return initialReferrers * capacity;
    }

    /**
     * Stochastic run.
     *
     * @return cumulative successful referrals at the end of each day, or
     *         {@link ReferralError#INVALID_PROBABILITY} /
     *         {@link ReferralError#INVALID_DURATION}
     */
    public Result<int[]> simulate(double p, int days) {
        Result<int[]> invalid = checkArgs(p, days);
        if (invalid != null)
            return invalid;
        Population population = new Population() {
            @Override
            double attempt() {
                return random.nextDouble() < p ? 1.0 : 0.0;
            }
        };
        int[] cumulative = new int[days];
        int total = 0;
        for (int day = 0; day < days; day++) {
            total += (int) population.step();
            cumulative[day] = total;
        }
        return Result.ok(cumulative);
    }

    /**
     * Expectation run: the deterministic counterpart of
     * {@link #simulate(double, int)}.
     *
     * @return cumulative expected referrals at the end of each day
     */
    public Result<double[]> simulateExpected(double p, int days) {
        Result<double[]> invalid = checkArgs(p, days);
        if (invalid != null)
            return invalid;
        Population population = expectedPopulation(p);
        double[] cumulative = new double[days];
        double total = 0.0;
        for (int day = 0; day < days; day++) {
            total += population.step();
            cumulative[day] = total;
        }
        return Result.ok(cumulative);
    }

    /**
     * Minimum number of days for the expected cumulative total to reach
     * {@code targetTotal}.
     *
     * Binary search over {@code [0, maxDays]}. The expected total is
     * non-decreasing in days for a fixed p, which is what makes the search valid.
     *
     * @return the day count, empty if the target cannot be reached within
     *         {@code maxDays}, or {@link ReferralError#INVALID_PROBABILITY}
     */
    public Result<OptionalInt> daysToTarget(double p, int targetTotal) {
        if (targetTotal <= 0)
            return Result.ok(OptionalInt.of(0));
        if (p <= 0.0)
            return Result.ok(OptionalInt.empty());
        if (!(p <= 1.0))
            return Result.fail(ReferralError.INVALID_PROBABILITY, "Probability must be in [0, 1]: " + p);

        int left = 0, right = maxDays;
        while (left < right) {
            int mid = (left + right) >>> 1;
            if (expectedTotal(p, mid) >= targetTotal)
                right = mid;
            else
                left = mid + 1;
        }
        if (expectedTotal(p, left) >= targetTotal) {
            log.debug("daysToTarget(p={}, target={}) = {}", p, targetTotal, left);
            return Result.ok(OptionalInt.of(left));
        }
        return Result.ok(OptionalInt.empty());
    }

    /**
     * Final value of {@link #simulateExpected(double, int)} without materialising
     * the per-day array. Zero for {@code days <= 0}. Arguments are not checked.
     */
    double expectedTotal(double p, int days) {
        Population population = expectedPopulation(p);
        double total = 0.0;
        for (int day = 0; day < days && population.hasActive(); day++)
            total += population.step();
        return total;
    }

    private Population expectedPopulation(double p) {
        return new Population() {
            @Override
            double attempt() {
                return p;
            }
        };
    }

    private static <T> Result<T> checkArgs(double p, int days) {
        if (!(p >= 0.0 && p <= 1.0))
            return Result.fail(ReferralError.INVALID_PROBABILITY, "Probability must be in [0, 1]: " + p);
        if (days < 0)
            return Result.fail(ReferralError.INVALID_DURATION, "Days must be non-negative: " + days);
        return null;
    }

    /**
     * Slot counts plus a compacted list of active slot ids.
     */
    private abstract class Population {
        private final double[] counts = new double[initialReferrers];
        private final int[] active = new int[initialReferrers];
        private int activeCount = initialReferrers;

        Population() {
            for (int i = 0; i < initialReferrers; i++)
                active[i] = i;
        }

        /** Contribution of one attempt by one active slot. */
        abstract double attempt();

        boolean hasActive() {
            return activeCount > 0;
        }

        /** Advances one day and returns that day's tally. */
        double step() {
            double tally = 0.0;
            int kept = 0;
            for (int i = 0; i < activeCount; i++) {
                int slot = active[i];
                double made = attempt();
                counts[slot] += made;
                tally += made;
                if (counts[slot] < capacity)
                    active[kept++] = slot;
            }
            activeCount = kept;
            return tally;
        }
    }
}
