package com.hiring.refnet.engine;

import com.hiring.refnet.api.*;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * The Graph Store -- a mutation-checked directed referral graph.
 *
 * Data layout:
 * - referrerOf: primary index, candidate -> referrer. A candidate has at most
 * one referrer, so this map is a forest of in-trees.
 * - referralsOf: secondary index, referrer -> candidates (fan-out). All
 * traversals in {@link Reachability} walk this index.
 * - users: every endpoint of an accepted referral, in first-seen order.
 *
 * Invariants checked on every insertion, in this order:
 * 1. Both identifiers are non-empty.
 * 2. No self-referral.
 * 3. The candidate has no referrer yet.
 * 4. The referrer is not already reachable from the candidate (acyclicity).
 *
 * A rejected insertion leaves all three structures untouched. There is no
 * delete operation, so the graph only grows and derived analytics never need
 * invalidation.
 *
 * Thread Safety:
 * Not thread-safe. The checks and the update are not isolated from other
 * writers. Concurrent producers must go through a single writer such as
 * {@link com.hiring.refnet.disruptor.ReferralIngestor}.
 */
@Log4j2
public final class ReferralGraph {
    private final Map<String, String> referrerOf = new HashMap<>();
    private final Map<String, Set<String>> referralsOf = new HashMap<>();
    private final Set<String> users = new LinkedHashSet<>();

    private final Reachability reachability = new Reachability(this);
    private ReferralListener listener;

    public void setListener(ReferralListener listener) {
        this.listener = listener;
    }

    /**
     * Records that {@code referrer} referred {@code candidate}.
     *
     * @return the accepted edge, or a failure of kind
     *         {@link ReferralError#INVALID_INPUT},
     *         {@link ReferralError#DUPLICATE_REFERRER} or
     *         {@link ReferralError#CYCLE_DETECTED}
     */
    public Result<Referral> addReferral(String referrer, String candidate) {
        if (referrer == null || referrer.isEmpty() || candidate == null || candidate.isEmpty())
            return reject(referrer, candidate, ReferralError.INVALID_INPUT,
                    "Referrer and candidate must be non-empty");
        if (referrer.equals(candidate))
            return reject(referrer, candidate, ReferralError.INVALID_INPUT,
                    "Self-referral not allowed: " + referrer);
        String existing = referrerOf.get(candidate);
        if (existing != null)
            return reject(referrer, candidate, ReferralError.DUPLICATE_REFERRER,
                    "Candidate " + candidate + " already referred by " + existing);
        if (wouldCreateCycle(referrer, candidate))
            return reject(referrer, candidate, ReferralError.CYCLE_DETECTED,
                    "Referral " + referrer + " -> " + candidate + " would create a cycle");

        referrerOf.put(candidate, referrer);
        referralsOf.computeIfAbsent(referrer, k -> new LinkedHashSet<>()).add(candidate);
        users.add(referrer);
        users.add(candidate);

        Referral referral = new Referral(referrer, candidate);
        log.debug("Accepted referral {} -> {} ({} edges)", referrer, candidate, referrerOf.size());
        if (listener != null)
            listener.onReferralAccepted(referral, referrerOf.size());
        return Result.ok(referral);
    }

    private Result<Referral> reject(String referrer, String candidate, ReferralError error, String message) {
        if (listener != null)
            listener.onReferralRejected(referrer, candidate, error, message);
        return Result.fail(error, message);
    }

    /**
     * Searches the fan-out index from the candidate for the referrer. Finding it
     * means the new edge would close a cycle. The existing graph is acyclic, so a
     * plain DFS with a visited set terminates.
     */
    private boolean wouldCreateCycle(String referrer, String candidate) {
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(candidate);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(referrer))
                return true;
            if (!visited.add(current))
                continue;
            for (String next : referralsOf.getOrDefault(current, Set.of()))
                if (!visited.contains(next))
                    stack.push(next);
        }
        return false;
    }

    /** Candidates referred directly by {@code user}; empty if unknown or childless. */
    public Set<String> directReferrals(String user) {
        Set<String> direct = referralsOf.get(user);
        return direct == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(direct));
    }

    public Optional<String> referrerOf(String user) {
        return Optional.ofNullable(referrerOf.get(user));
    }

    public boolean contains(String user) {
        return users.contains(user);
    }

    /** Read-only view of all users, in first-seen order. */
    public Set<String> users() {
        return Collections.unmodifiableSet(users);
    }

    public int userCount() {
        return users.size();
    }

    public int referralCount() {
        return referrerOf.size();
    }

    public NetworkStats stats() {
        int active = 0;
        for (String user : users)
            if (reachability.totalReach(user) > 0)
                active++;
        return new NetworkStats(users.size(), referrerOf.size(), active);
    }

    public Reachability reachability() {
        return reachability;
    }

    /** Fan-out lookup used by traversals. Never null. */
    Set<String> fanOut(String user) {
        return referralsOf.getOrDefault(user, Set.of());
    }
}
