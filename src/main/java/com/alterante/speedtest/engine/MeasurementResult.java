package com.alterante.speedtest.engine;

import java.util.Map;

/**
 * One snapshot of a run, emitted repeatedly while it progresses and exactly
 * once as a terminal record ({@code done} or {@code error} set).
 * Produced only by the {@link Orchestrator}.
 *
 * @param pingMs   null until latency has been measured
 * @param jitterMs null until latency has been measured
 * @param error    human-readable failure, null unless the run failed
 * @param metadata discovery metadata merged with run annotations
 */
public record MeasurementResult(double downloadMbps, double uploadMbps, Double pingMs, Double jitterMs,
                                boolean done, String error, String status, RunState state,
                                Map<String, Object> metadata) {

    public MeasurementResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isTerminal() {
        return done || error != null;
    }

    public static MeasurementResult failure(String error, RunState state, Map<String, Object> metadata) {
        return new MeasurementResult(0, 0, null, null, false, error, "Error", state, metadata);
    }
}
