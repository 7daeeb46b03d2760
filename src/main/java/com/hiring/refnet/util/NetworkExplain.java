package com.hiring.refnet.util;

import com.hiring.refnet.engine.Reachability;
import com.hiring.refnet.engine.ReferralGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Diagnostic utility for inspecting a referral graph.
 *
 * <p>
 * Generates human-readable text for a single user and for the whole referral
 * forest. Intended for debugging sessions and error logs; it walks the graph on
 * every call.
 */
public final class NetworkExplain {
    private final ReferralGraph graph;
    private final Reachability reachability;

    public NetworkExplain(ReferralGraph graph) {
        this.graph = graph;
        this.reachability = graph.reachability();
    }

    /**
     * Dumps what the graph knows about one user.
     */
    public String explainUser(String user) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("User: ").append(user).append('\n');
        if (!graph.contains(user))
            return sb.append("  (unknown)\n").toString();
        Optional<String> referrer = graph.referrerOf(user);
        sb.append("  Referred by: ").append(referrer.orElse("-")).append('\n')
                .append("  Depth: ").append(depth(user)).append('\n')
                .append("  Total reach: ").append(reachability.totalReach(user)).append('\n');
        var direct = graph.directReferrals(user);
        sb.append("  Direct referrals (").append(direct.size()).append("): ")
                .append(String.join(", ", direct));
        return sb.append('\n').toString();
    }

    /** Number of referrer links between {@code user} and the root of its tree. */
    public int depth(String user) {
        int depth = 0;
        Optional<String> up = graph.referrerOf(user);
        while (up.isPresent()) {
            depth++;
            up = graph.referrerOf(up.get());
        }
        return depth;
    }

    /** Users without a referrer, in first-seen order. */
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (String user : graph.users())
            if (graph.referrerOf(user).isEmpty())
                roots.add(user);
        return roots;
    }

    /**
     * Dumps the referral forest as an indented outline, one tree per root.
     */
    public String dumpForest() {
        StringBuilder sb = new StringBuilder(1024);
        var stats = graph.stats();
        sb.append("Referral network (").append(stats.totalUsers()).append(" users, ")
                .append(stats.totalReferrals()).append(" referrals):\n");
        for (String root : roots())
            appendTree(sb, root, 1);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, String user, int indent) {
        sb.append("  ".repeat(indent)).append(user);
        int reach = reachability.totalReach(user);
        if (reach > 0)
            sb.append(" (reach ").append(reach).append(')');
        sb.append('\n');
        for (String child : graph.directReferrals(user))
            appendTree(sb, child, indent + 1);
    }
}
