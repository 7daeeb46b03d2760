package com.hiring.refnet;

import com.hiring.refnet.api.RankedUser;
import com.hiring.refnet.engine.ReferralGraph;
import com.hiring.refnet.fn.AdoptionCurves;
import org.junit.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.Assert.*;

public class RefNetTest {

    @Test
    public void testEndToEnd() {
        ReferralGraph graph = RefNet.network();
        graph.addReferral("alice", "bob").orElseThrow();
        graph.addReferral("bob", "charlie").orElseThrow();

        List<RankedUser> top = RefNet.ranking(graph).topReferrers(1);
        assertEquals(List.of(new RankedUser("alice", 2)), top);

        var simulator = RefNet.simulator();
        assertEquals(OptionalInt.of(10), simulator.daysToTarget(1.0, 1000).value());

        var optimizer = RefNet.optimizer();
        assertTrue(optimizer.analyzeBonusEffectiveness(10, 200, AdoptionCurves.linear(0.0, 0.0005, 0.8), 0.01)
                .value().achievable());
    }

    @Test
    public void testEnginesDoNotShareState() {
        ReferralGraph a = RefNet.network();
        ReferralGraph b = RefNet.network();
        a.addReferral("alice", "bob");

        assertEquals(0, b.userCount());
        assertTrue(b.addReferral("bob", "alice").isOk());
    }
}
