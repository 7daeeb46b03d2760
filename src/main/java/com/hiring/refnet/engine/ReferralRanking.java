package com.hiring.refnet.engine;

import com.hiring.refnet.api.RankedUser;

import java.util.*;

/**
 * Influence analytics over a {@link ReferralGraph}.
 *
 * <p>
 * All three rankings are read-side computations: they derive everything from
 * the graph's state at call time and never mutate it. Repeated calls without an
 * intervening insertion return identical lists.
 *
 * <p>
 * <b>Ties:</b> users with equal scores come out in an unspecified order. Do not
 * rely on the relative position of tied users.
 */
public final class ReferralRanking {
    private static final Comparator<RankedUser> BY_SCORE_DESC = Comparator.comparingInt(RankedUser::score)
            .reversed();

    private final ReferralGraph graph;
    private final Reachability reachability;

    public ReferralRanking(ReferralGraph graph) {
        this.graph = graph;
        this.reachability = graph.reachability();
    }

    /**
     * The {@code k} users with the largest total reach. Users with no reach are
     * never listed; {@code k <= 0} yields an empty list.
     */
    public List<RankedUser> topReferrers(int k) {
        if (k <= 0)
            return List.of();
        List<RankedUser> ranked = new ArrayList<>();
        for (String user : graph.users()) {
            int reach = reachability.totalReach(user);
            if (reach > 0)
                ranked.add(new RankedUser(user, reach));
        }
        ranked.sort(BY_SCORE_DESC);
        return ranked.size() <= k ? ranked : new ArrayList<>(ranked.subList(0, k));
    }

    /**
     * Greedy set cover over reachable sets.
     *
     * <p>
     * Repeatedly picks the user whose reachable set covers the most users not yet
     * covered, and records that incremental coverage. Stops when nothing is left
     * to cover or the best pick adds nothing. The result is sorted by coverage
     * descending for presentation, so tied picks may appear in a different order
     * than they were selected.
     *
     * <p>
     * This is the usual ln(n)-approximate greedy cover, not a minimum cover.
     */
    public List<RankedUser> uniqueReachExpansion() {
        Map<String, Set<String>> reachSets = new LinkedHashMap<>();
        for (String user : graph.users()) {
            Set<String> reached = reachability.reachableSet(user);
            if (!reached.isEmpty())
                reachSets.put(user, reached);
        }

        Set<String> uncovered = new HashSet<>();
        for (Set<String> reached : reachSets.values())
            uncovered.addAll(reached);

        List<RankedUser> selected = new ArrayList<>();
        while (!uncovered.isEmpty() && !reachSets.isEmpty()) {
            String best = null;
            int bestGain = 0;
            for (var entry : reachSets.entrySet()) {
                int gain = overlap(entry.getValue(), uncovered);
                if (gain > bestGain) {
                    bestGain = gain;
                    best = entry.getKey();
                }
            }
            if (best == null)
                break;
            selected.add(new RankedUser(best, bestGain));
            uncovered.removeAll(reachSets.remove(best));
        }

        selected.sort(BY_SCORE_DESC);
        return selected;
    }

    private static int overlap(Set<String> reached, Set<String> uncovered) {
        int n = 0;
        for (String user : reached)
            if (uncovered.contains(user))
                n++;
        return n;
    }

    /**
     * Shortest-path betweenness ("flow centrality").
     *
     * <p>
     * For every ordered pair (s, t) with t reachable from s, each other user v
     * scores one point if it lies on some shortest s-t path, i.e.
     * {@code d(s,v) + d(v,t) == d(s,t)}. Distance maps are computed once per
     * source, then the triple loop is O(V^3).
     *
     * @return every user with its score, highest first; empty when the graph has
     *         fewer than 3 users
     */
    public List<RankedUser> flowCentrality() {
        if (graph.userCount() < 3)
            return List.of();

        List<String> users = new ArrayList<>(graph.users());
        Map<String, Map<String, Integer>> distances = new HashMap<>(users.size() * 2);
        for (String user : users)
            distances.put(user, reachability.shortestPaths(user));

        Map<String, Integer> scores = new LinkedHashMap<>();
        for (String user : users)
            scores.put(user, 0);

        for (String s : users) {
            Map<String, Integer> fromS = distances.get(s);
            for (String t : users) {
                if (s.equals(t))
                    continue;
                Integer st = fromS.get(t);
                if (st == null)
                    continue;
                for (String v : users) {
                    if (v.equals(s) || v.equals(t))
                        continue;
                    Integer sv = fromS.get(v);
                    if (sv == null)
                        continue;
                    Integer vt = distances.get(v).get(t);
                    if (vt != null && sv + vt == st)
                        scores.merge(v, 1, Integer::sum);
                }
            }
        }

        List<RankedUser> ranked = new ArrayList<>(scores.size());
        scores.forEach((user, score) -> ranked.add(new RankedUser(user, score)));
        ranked.sort(BY_SCORE_DESC);
        return ranked;
    }
}
