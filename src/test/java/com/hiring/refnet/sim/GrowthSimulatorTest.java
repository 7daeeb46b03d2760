package com.hiring.refnet.sim;

import com.hiring.refnet.api.ReferralError;
import com.hiring.refnet.api.Result;
import com.hiring.refnet.io.RefNetConfig;
import org.junit.Before;
import org.junit.Test;

import java.util.OptionalInt;
import java.util.Random;

import static org.junit.Assert.*;

public class GrowthSimulatorTest {

    private GrowthSimulator simulator;

    @Before
    public void setUp() {
        simulator = new GrowthSimulator(new RefNetConfig.Simulation(), new Random(42));
    }

    private static RefNetConfig.Simulation config(int referrers, int capacity, int maxDays) {
        RefNetConfig.Simulation c = new RefNetConfig.Simulation();
        c.setInitialReferrers(referrers);
        c.setCapacity(capacity);
        c.setMaxDays(maxDays);
        return c;
    }

    @Test
    public void testDefaults() {
        assertEquals(100, simulator.initialReferrers());
        assertEquals(10, simulator.capacity());
        assertEquals(1000, simulator.maxDays());
        assertEquals(1000, simulator.maxTotal());
    }

    @Test
    public void testZeroDays() {
        assertEquals(0, simulator.simulate(0.5, 0).value().length);
        assertEquals(0, simulator.simulateExpected(0.5, 0).value().length);
    }

    @Test
    public void testZeroProbability() {
        assertArrayEquals(new int[10], simulator.simulate(0.0, 10).value());
        assertArrayEquals(new double[10], simulator.simulateExpected(0.0, 10).value(), 0.0);
    }

    @Test
    public void testCertainReferralsSaturateAtCapacity() {
        int[] totals = simulator.simulate(1.0, 15).value();

        assertEquals(100, totals[0]);
        assertEquals(200, totals[1]);
        assertEquals(1000, totals[9]);
        assertEquals(1000, totals[10]);
        assertEquals(1000, totals[14]);
    }

    @Test
    public void testStochasticRunIsMonotoneAndBounded() {
        int[] totals = simulator.simulate(0.5, 30).value();

        assertEquals(30, totals.length);
        assertTrue(totals[0] > 0 && totals[0] < 100);
        for (int i = 1; i < totals.length; i++)
            assertTrue(totals[i] >= totals[i - 1]);
        assertTrue(totals[29] <= 1000);
    }

    @Test
    public void testSeededRunsAreReproducible() {
        var a = new GrowthSimulator(new RefNetConfig.Simulation(), new Random(123));
        var b = new GrowthSimulator(new RefNetConfig.Simulation(), new Random(123));

        assertArrayEquals(a.simulate(0.3, 20).value(), b.simulate(0.3, 20).value());
    }

    @Test
    public void testSeedFromConfig() {
        RefNetConfig.Simulation c = new RefNetConfig.Simulation();
        c.setSeed(99L);

        assertArrayEquals(new GrowthSimulator(c).simulate(0.4, 12).value(),
                new GrowthSimulator(c).simulate(0.4, 12).value());
    }

    @Test
    public void testExpectedValues() {
        double[] totals = simulator.simulateExpected(0.5, 10).value();

        assertEquals(50.0, totals[0], 0.0);
        assertEquals(100.0, totals[1], 0.0);
        assertEquals(500.0, totals[9], 1e-9);
    }

    @Test
    public void testExpectedFullProbability() {
        assertArrayEquals(new double[] { 100.0 }, simulator.simulateExpected(1.0, 1).value(), 0.0);

        double[] atCapacity = simulator.simulateExpected(1.0, 10).value();
        double[] pastCapacity = simulator.simulateExpected(1.0, 11).value();
        assertEquals(1000.0, atCapacity[9], 0.0);
        assertEquals(atCapacity[9], pastCapacity[10], 0.0);
    }

    @Test
    public void testExpectedSlotsDeactivateAtCapacity() {
        var small = new GrowthSimulator(config(4, 2, 50));

        // 4 slots x 0.5 per day: capacity 2 is reached at the end of day 4
        double[] totals = small.simulateExpected(0.5, 6).value();
        assertEquals(8.0, totals[3], 0.0);
        assertEquals(8.0, totals[5], 0.0);
    }

    @Test
    public void testInvalidProbability() {
        assertEquals(ReferralError.INVALID_PROBABILITY, simulator.simulate(-0.1, 5).error());
        assertEquals(ReferralError.INVALID_PROBABILITY, simulator.simulate(1.1, 5).error());
        assertEquals(ReferralError.INVALID_PROBABILITY, simulator.simulateExpected(Double.NaN, 5).error());
    }

    @Test
    public void testInvalidDuration() {
        Result<int[]> r = simulator.simulate(0.5, -1);
        assertEquals(ReferralError.INVALID_DURATION, r.error());
        assertEquals(ReferralError.INVALID_DURATION, simulator.simulateExpected(0.5, -1).error());
    }

    @Test
    public void testDaysToTargetTrivialCases() {
        assertEquals(OptionalInt.of(0), simulator.daysToTarget(0.5, 0).value());
        assertEquals(OptionalInt.of(0), simulator.daysToTarget(0.0, -5).value());
        assertEquals(OptionalInt.empty(), simulator.daysToTarget(0.0, 10).value());
    }

    @Test
    public void testDaysToTarget() {
        assertEquals(OptionalInt.of(1), simulator.daysToTarget(1.0, 100).value());
        assertEquals(OptionalInt.of(10), simulator.daysToTarget(1.0, 1000).value());
        assertEquals(OptionalInt.of(2), simulator.daysToTarget(0.5, 100).value());
        assertEquals(OptionalInt.of(3), simulator.daysToTarget(0.5, 101).value());
    }

    @Test
    public void testDaysToTargetIsMinimal() {
        int days = simulator.daysToTarget(0.3, 250).value().getAsInt();

        double[] totals = simulator.simulateExpected(0.3, days).value();
        assertTrue(totals[days - 1] >= 250);
        assertTrue(totals[days - 2] < 250);
    }

    @Test
    public void testDaysToTargetBeyondSaturation() {
        assertEquals(OptionalInt.empty(), simulator.daysToTarget(1.0, 1001).value());
    }

    @Test
    public void testDaysToTargetInvalidProbability() {
        assertEquals(ReferralError.INVALID_PROBABILITY, simulator.daysToTarget(2.0, 10).error());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidConfig() {
        new GrowthSimulator(config(0, 10, 100));
    }
}
