package com.alterante.speedtest.engine;

import java.time.Duration;

/**
 * Run-level timing, shared by every engine.
 *
 * @param phaseDuration   hard deadline of each download/upload phase
 * @param tickInterval    cadence of live result emission
 * @param latencyPause    pause after the latency step
 * @param interPhasePause pause between download and upload
 */
public record RunSettings(Duration phaseDuration, Duration tickInterval,
                          Duration latencyPause, Duration interPhasePause) {

    public static final Duration DEFAULT_PHASE_DURATION = Duration.ofSeconds(15);
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(200);
    public static final Duration DEFAULT_LATENCY_PAUSE = Duration.ofMillis(400);
    public static final Duration DEFAULT_INTER_PHASE_PAUSE = Duration.ofMillis(500);

    public RunSettings {
        requirePositive(phaseDuration, "phaseDuration");
        requirePositive(tickInterval, "tickInterval");
        if (latencyPause.isNegative() || interPhasePause.isNegative()) {
            throw new IllegalArgumentException("pauses must not be negative");
        }
    }

    public static RunSettings defaults() {
        return new RunSettings(DEFAULT_PHASE_DURATION, DEFAULT_TICK_INTERVAL,
                DEFAULT_LATENCY_PAUSE, DEFAULT_INTER_PHASE_PAUSE);
    }

    public RunSettings withPhaseDuration(Duration d) {
        return new RunSettings(d, tickInterval, latencyPause, interPhasePause);
    }

    public RunSettings withTickInterval(Duration d) {
        return new RunSettings(phaseDuration, d, latencyPause, interPhasePause);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
