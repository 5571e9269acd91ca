package com.alterante.speedtest.transport;

/**
 * Decides when to add parallel streams during a download phase.
 *
 * <pre>
 * Every ramp interval, with the bytes moved during that interval:
 *   previous interval empty:          add STEP workers
 *   gain = (bytes - prev) / prev
 *   gain &lt; minGain:                   saturated, never add again
 *   otherwise:                        add min(STEP, max - active) workers
 * </pre>
 *
 * Intervals must be of equal length for the byte counts to be comparable.
 */
public class WorkerRamp {

    public static final int DEFAULT_INITIAL = 4;
    public static final int DEFAULT_STEP = 2;
    public static final int DEFAULT_MAX = 12;
    public static final double DEFAULT_MIN_GAIN = 0.05;

    private final int initial;
    private final int step;
    private final int max;
    private final double minGain;

    private int active;
    private long previousBytes = -1;
    private boolean saturated;

    public WorkerRamp() {
        this(DEFAULT_INITIAL, DEFAULT_STEP, DEFAULT_MAX, DEFAULT_MIN_GAIN);
    }

    public WorkerRamp(int initial, int step, int max, double minGain) {
        if (initial < 1 || initial > max || step < 1) {
            throw new IllegalArgumentException("require 1 <= initial <= max and step >= 1");
        }
        this.initial = initial;
        this.step = step;
        this.max = max;
        this.minGain = minGain;
        this.active = initial;
    }

    public int initialWorkers() {
        return initial;
    }

    /**
     * Feed the bytes counted during the interval that just ended.
     *
     * @return number of workers to launch now (0 when saturated or at the cap)
     */
    public int onInterval(long bytesInInterval) {
        if (saturated || active >= max) {
            previousBytes = bytesInInterval;
            return 0;
        }
        if (previousBytes > 0) {
            double gain = (bytesInInterval - previousBytes) / (double) previousBytes;
            if (gain < minGain) {
                saturated = true;
                previousBytes = bytesInInterval;
                return 0;
            }
        }
        previousBytes = bytesInInterval;
        int add = Math.min(step, max - active);
        active += add;
        return add;
    }

    public int activeWorkers() {
        return active;
    }

    public boolean isSaturated() {
        return saturated;
    }
}
