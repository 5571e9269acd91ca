package com.alterante.speedtest.meter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reduces raw round-trip samples to ping and jitter.
 *
 * <pre>
 *   drop the first WARMUP samples (connection setup, cold caches)
 *   remove the lowest and highest TRIM_FRACTION of what remains
 *   ping   = mean(kept)
 *   jitter = mean(|kept[i] - kept[i-1]|), kept in arrival order
 * </pre>
 */
public final class LatencyStats {

    public static final int WARMUP = 2;
    public static final double TRIM_FRACTION = 0.10;

    private LatencyStats() {}

    public static LatencyResult summarize(List<Double> samplesMs) {
        List<Double> warm = samplesMs.size() > WARMUP
                ? samplesMs.subList(WARMUP, samplesMs.size())
                : samplesMs;
        if (warm.isEmpty()) return LatencyResult.NONE;

        int n = warm.size();
        int trim = (int) Math.floor(n * TRIM_FRACTION);

        // Rank indices by value, then drop the extremes while keeping arrival order.
        List<Integer> byValue = new ArrayList<>();
        for (int i = 0; i < n; i++) byValue.add(i);
        byValue.sort(Comparator.comparingDouble(warm::get));
        boolean[] dropped = new boolean[n];
        for (int i = 0; i < trim; i++) {
            dropped[byValue.get(i)] = true;
            dropped[byValue.get(n - 1 - i)] = true;
        }

        List<Double> kept = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (!dropped[i]) kept.add(warm.get(i));
        }

        double sum = 0;
        for (double v : kept) sum += v;
        double ping = sum / kept.size();

        double jitter = 0;
        if (kept.size() > 1) {
            double diffs = 0;
            for (int i = 1; i < kept.size(); i++) {
                diffs += Math.abs(kept.get(i) - kept.get(i - 1));
            }
            jitter = diffs / (kept.size() - 1);
        }
        return new LatencyResult(ping, jitter, kept.size());
    }
}
