package com.hiring.refnet;

import com.hiring.refnet.engine.ReferralGraph;
import com.hiring.refnet.engine.ReferralRanking;
import com.hiring.refnet.io.ConfigLoader;
import com.hiring.refnet.io.RefNetConfig;
import com.hiring.refnet.sim.BonusOptimizer;
import com.hiring.refnet.sim.GrowthSimulator;

/**
 * RefNet -- referral network analytics and hiring growth optimization.
 *
 * <h2>Engines</h2>
 * <ul>
 * <li><b>Referral graph:</b> {@link ReferralGraph} stores who referred whom and
 * rejects self-referrals, second referrers and cycles on insertion. Reach
 * queries live in {@link com.hiring.refnet.engine.Reachability}; influence
 * rankings in {@link ReferralRanking}.</li>
 * <li><b>Growth:</b> {@link GrowthSimulator} steps a capacity-limited referrer
 * population day by day and answers "how many days to reach N".</li>
 * <li><b>Bonus:</b> {@link BonusOptimizer} answers "what is the smallest bonus
 * that reaches N hires in D days" for a caller-supplied adoption curve.</li>
 * </ul>
 *
 * <p>
 * Every engine instance owns its state; there are no singletons. Operations that
 * can fail return a {@link com.hiring.refnet.api.Result}.
 */
public final class RefNet {

    private RefNet() {
        // Prevent instantiation of utility class
    }

    /** A new, empty referral graph. */
    public static ReferralGraph network() {
        return new ReferralGraph();
    }

    /** Rankings over {@code graph}. */
    public static ReferralRanking ranking(ReferralGraph graph) {
        return new ReferralRanking(graph);
    }

    /** A growth simulator using the shipped defaults. */
    public static GrowthSimulator simulator() {
        return simulator(ConfigLoader.defaults());
    }

    public static GrowthSimulator simulator(RefNetConfig config) {
        return new GrowthSimulator(config.validate().getSimulation());
    }

    /** A bonus optimizer using the shipped defaults. */
    public static BonusOptimizer optimizer() {
        return optimizer(ConfigLoader.defaults());
    }

    public static BonusOptimizer optimizer(RefNetConfig config) {
        return new BonusOptimizer(config);
    }
}
