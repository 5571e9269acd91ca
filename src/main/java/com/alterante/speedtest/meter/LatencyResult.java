package com.alterante.speedtest.meter;

/**
 * Round-trip summary of a latency probe series.
 *
 * @param pingMs   trimmed mean round-trip time
 * @param jitterMs mean absolute difference between consecutive kept samples
 * @param samples  number of samples that contributed
 */
public record LatencyResult(double pingMs, double jitterMs, int samples) {

    public static final LatencyResult NONE = new LatencyResult(0, 0, 0);

    public boolean isEmpty() {
        return samples == 0;
    }
}
