package com.hiring.refnet.engine;

import com.hiring.refnet.api.RankedUser;
import org.junit.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.*;

public class ReferralRankingTest {

    private static ReferralGraph graph(String... edges) {
        ReferralGraph g = new ReferralGraph();
        for (String edge : edges) {
            String[] parts = edge.split("->");
            assertTrue(edge, g.addReferral(parts[0], parts[1]).isOk());
        }
        return g;
    }

    private static Map<String, Integer> asMap(List<RankedUser> ranked) {
        Map<String, Integer> m = new HashMap<>();
        for (RankedUser r : ranked)
            m.put(r.user(), r.score());
        return m;
    }

    private static void assertDescending(List<RankedUser> ranked) {
        for (int i = 1; i < ranked.size(); i++)
            assertTrue(ranked.get(i - 1).score() >= ranked.get(i).score());
    }

    private static final String[] TREE = { "alice->bob", "alice->charlie", "bob->david", "bob->eve",
            "charlie->frank" };

    @Test
    public void testTopReferrers() {
        var ranking = new ReferralRanking(graph(TREE));

        List<RankedUser> top = ranking.topReferrers(2);

        assertEquals(List.of(new RankedUser("alice", 5), new RankedUser("bob", 2)), top);
    }

    @Test
    public void testTopReferrersBounds() {
        var ranking = new ReferralRanking(graph(TREE));

        assertTrue(ranking.topReferrers(0).isEmpty());
        assertTrue(ranking.topReferrers(-3).isEmpty());
        // only users with reach > 0 are listed
        assertEquals(3, ranking.topReferrers(100).size());
        assertTrue(new ReferralRanking(new ReferralGraph()).topReferrers(5).isEmpty());
    }

    @Test
    public void testRankingsAreIdempotent() {
        var ranking = new ReferralRanking(graph(TREE));

        assertEquals(ranking.topReferrers(10), ranking.topReferrers(10));
        assertEquals(ranking.uniqueReachExpansion(), ranking.uniqueReachExpansion());
        assertEquals(ranking.flowCentrality(), ranking.flowCentrality());
    }

    @Test
    public void testUniqueReachExpansionSingleTree() {
        var ranking = new ReferralRanking(graph(TREE));

        // alice's subtree covers everyone, nothing is left for bob or charlie
        assertEquals(List.of(new RankedUser("alice", 5)), ranking.uniqueReachExpansion());
    }

    @Test
    public void testUniqueReachExpansionDisjointTrees() {
        var ranking = new ReferralRanking(graph("a->b", "a->c", "b->d", "x->y"));

        assertEquals(List.of(new RankedUser("a", 3), new RankedUser("x", 1)), ranking.uniqueReachExpansion());
    }

    @Test
    public void testUniqueReachExpansionEmpty() {
        assertTrue(new ReferralRanking(new ReferralGraph()).uniqueReachExpansion().isEmpty());
    }

    @Test
    public void testUniqueReachExpansionCoversUnion() {
        ReferralGraph g = new ReferralGraph();
        Random rng = new Random(3);
        for (int i = 0; i < 400; i++)
            g.addReferral("u" + rng.nextInt(120), "u" + rng.nextInt(120));
        var ranking = new ReferralRanking(g);
        Reachability reach = g.reachability();

        Set<String> union = new HashSet<>();
        for (String user : g.users())
            union.addAll(reach.reachableSet(user));

        List<RankedUser> picks = ranking.uniqueReachExpansion();
        Set<String> covered = new HashSet<>();
        int total = 0;
        for (RankedUser pick : picks) {
            assertTrue(pick.score() > 0);
            assertTrue(pick.score() <= reach.totalReach(pick.user()));
            covered.addAll(reach.reachableSet(pick.user()));
            total += pick.score();
        }
        assertEquals(union, covered);
        assertEquals(union.size(), total);
        assertDescending(picks);
    }

    @Test
    public void testFlowCentralityChain() {
        var ranking = new ReferralRanking(graph("A->B", "B->C"));

        List<RankedUser> scores = ranking.flowCentrality();

        assertEquals(3, scores.size());
        assertEquals(new RankedUser("B", 1), scores.get(0));
        Map<String, Integer> m = asMap(scores);
        assertEquals(Integer.valueOf(0), m.get("A"));
        assertEquals(Integer.valueOf(0), m.get("C"));
    }

    @Test
    public void testFlowCentralityLongerChain() {
        var ranking = new ReferralRanking(graph("A->B", "B->C", "C->D"));

        Map<String, Integer> m = asMap(ranking.flowCentrality());

        assertEquals(Integer.valueOf(0), m.get("A"));
        assertEquals(Integer.valueOf(2), m.get("B")); // A->C, A->D
        assertEquals(Integer.valueOf(2), m.get("C")); // A->D, B->D
        assertEquals(Integer.valueOf(0), m.get("D"));
    }

    @Test
    public void testFlowCentralityTree() {
        var ranking = new ReferralRanking(graph(TREE));

        List<RankedUser> scores = ranking.flowCentrality();
        Map<String, Integer> m = asMap(scores);

        assertEquals(6, scores.size());
        assertEquals(Integer.valueOf(2), m.get("bob"));
        assertEquals(Integer.valueOf(1), m.get("charlie"));
        assertEquals(Integer.valueOf(0), m.get("alice"));
        assertEquals(Integer.valueOf(0), m.get("eve"));
        assertDescending(scores);
    }

    @Test
    public void testFlowCentralityStarHasNoBrokers() {
        var ranking = new ReferralRanking(graph("hub->x", "hub->y", "hub->z"));

        for (RankedUser r : ranking.flowCentrality())
            assertEquals(0, r.score());
    }

    @Test
    public void testFlowCentralityNeedsThreeUsers() {
        assertTrue(new ReferralRanking(new ReferralGraph()).flowCentrality().isEmpty());
        assertTrue(new ReferralRanking(graph("A->B")).flowCentrality().isEmpty());
    }
}
