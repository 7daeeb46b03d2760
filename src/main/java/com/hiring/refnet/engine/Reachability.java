package com.hiring.refnet.engine;

import java.util.*;

/**
 * Breadth-first traversals over the fan-out index of a {@link ReferralGraph}.
 *
 * Every query walks the current state of the graph; nothing is cached between
 * calls. The graph is an in-forest, so each BFS visits a node at most once, but
 * a visited set still guards every traversal.
 */
public final class Reachability {
    private final ReferralGraph graph;

    Reachability(ReferralGraph graph) {
        this.graph = graph;
    }

    /**
     * Number of users reachable from {@code user} through direct and indirect
     * referrals, excluding {@code user} itself. Zero for an unknown user.
     */
    public int totalReach(String user) {
        if (!graph.contains(user))
            return 0;
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(user);
        queue.add(user);
        int count = 0;
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String candidate : graph.fanOut(current)) {
                if (visited.add(candidate)) {
                    queue.add(candidate);
                    count++;
                }
            }
        }
        return count;
    }

    /** The users counted by {@link #totalReach(String)}, in BFS order. */
    public Set<String> reachableSet(String user) {
        if (!graph.contains(user))
            return Set.of();
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(user);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String candidate : graph.fanOut(current)) {
                if (!candidate.equals(user) && reached.add(candidate))
                    queue.add(candidate);
            }
        }
        return reached;
    }

    /**
     * BFS distances from {@code start} along referrals. {@code start} maps to 0;
     * users that cannot be reached are absent.
     */
    public Map<String, Integer> shortestPaths(String start) {
        Objects.requireNonNull(start, "start");
        Map<String, Integer> distances = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distances.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = distances.get(current) + 1;
            for (String candidate : graph.fanOut(current)) {
                if (!distances.containsKey(candidate)) {
                    distances.put(candidate, next);
                    queue.add(candidate);
                }
            }
        }
        return distances;
    }
}
