package com.alterante.speedtest.meter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LatencyStatsTest {

    @Test
    void dropsWarmupAndTrimsExtremes() {
        // Two warm-up samples, then ten: the lowest (10) and highest (1000) are trimmed.
        List<Double> samples = List.of(300.0, 250.0, 10.0, 20.0, 30.0, 40.0, 50.0, 60.0, 70.0, 80.0, 90.0, 1000.0);
        LatencyResult r = LatencyStats.summarize(samples);
        assertEquals(8, r.samples());
        assertEquals(55.0, r.pingMs(), 1e-9);
        assertEquals(10.0, r.jitterMs(), 1e-9);
    }

    @Test
    void jitterFollowsArrivalOrder() {
        List<Double> samples = List.of(1.0, 1.0, 20.0, 40.0, 20.0, 40.0);
        LatencyResult r = LatencyStats.summarize(samples);
        // Four samples, nothing trimmed (floor(0.4) = 0); diffs 20, 20, 20
        assertEquals(4, r.samples());
        assertEquals(30.0, r.pingMs(), 1e-9);
        assertEquals(20.0, r.jitterMs(), 1e-9);
    }

    @Test
    void singleSampleHasZeroJitter() {
        LatencyResult r = LatencyStats.summarize(List.of(42.0));
        assertEquals(42.0, r.pingMs(), 1e-9);
        assertEquals(0.0, r.jitterMs(), 1e-9);
    }

    @Test
    void emptyInputIsNone() {
        assertTrue(LatencyStats.summarize(List.of()).isEmpty());
    }
}
