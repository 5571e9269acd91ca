package com.alterante.speedtest.meter;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Turns a stream of byte counts into a smoothed live rate and an exact final average.
 *
 * <pre>
 * addBytes(n):   total += n   (first call stamps first-data time)
 *
 * tick():        ring[head] = (now, total)
 *                lookback   = min(head, WINDOW_TICKS)
 *                raw        = (total - ring[head-lookback].bytes) * 8 / (now - ring[head-lookback].time)
 *                progress   = min(1, (now - firstData) / expectedDuration)
 *                steady     = (raw >= display ? RISE : FALL) * (1 - progress * DECAY_FACTOR)
 *                alpha      = lookback < WINDOW_TICKS
 *                               ? COLD + (lookback / WINDOW_TICKS) * (steady - COLD)
 *                               : steady
 *                display   += alpha * (raw - display)     (floored to 0 below 0.01)
 *
 * finish():      stop clock, return total * 8 / (now - firstData)
 * </pre>
 *
 * Rates are in Mbps: one byte per microsecond is 8 Mbps. {@link #addBytes} is
 * safe to call from many workers at once; {@link #tick} and {@link #finish}
 * are serialized against each other.
 */
public class ThroughputMeter {

    public static final int RING_SIZE = 64;
    private static final int RING_MASK = RING_SIZE - 1;
    public static final int DEFAULT_WINDOW_TICKS = 15;

    private static final double RISE_ALPHA = 0.15;
    private static final double FALL_ALPHA = 0.08;
    private static final double COLD_ALPHA = 0.30;
    private static final double DECAY_FACTOR = 0.7;
    private static final double DISPLAY_FLOOR_MBPS = 0.01;

    private final double expectedSeconds;
    private final int windowTicks;
    private final LongSupplier nanoClock;

    private final AtomicLong totalBytes = new AtomicLong();
    private final AtomicLong firstDataMicros = new AtomicLong(-1);
    private volatile long startNanos;
    private volatile long stoppedAtMicros = -1;

    private final long[] ringMicros = new long[RING_SIZE];
    private final long[] ringBytes = new long[RING_SIZE];
    private int head;
    private double displayMbps;
    private double windowedMbps;

    public ThroughputMeter(Duration expectedDuration) {
        this(expectedDuration, DEFAULT_WINDOW_TICKS, System::nanoTime);
    }

    public ThroughputMeter(Duration expectedDuration, int windowTicks, LongSupplier nanoClock) {
        if (windowTicks < 1 || windowTicks >= RING_SIZE) {
            throw new IllegalArgumentException("windowTicks must be in [1, " + (RING_SIZE - 1) + "]");
        }
        if (expectedDuration.isZero() || expectedDuration.isNegative()) {
            throw new IllegalArgumentException("expectedDuration must be positive");
        }
        this.expectedSeconds = expectedDuration.toNanos() / 1_000_000_000.0;
        this.windowTicks = windowTicks;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
    }

    /** Reset all state and start the clock. */
    public synchronized void start() {
        totalBytes.set(0);
        firstDataMicros.set(-1);
        stoppedAtMicros = -1;
        head = 0;
        displayMbps = 0;
        windowedMbps = 0;
        Arrays.fill(ringMicros, 0);
        Arrays.fill(ringBytes, 0);
        startNanos = nanoClock.getAsLong();
    }

    /**
     * Record bytes received (download) or confirmed flushed (upload).
     * The only data input; callable from any thread.
     */
    public void addBytes(long n) {
        if (n < 0) throw new IllegalArgumentException("negative byte count: " + n);
        if (n == 0) return;
        if (firstDataMicros.get() < 0) {
            firstDataMicros.compareAndSet(-1, elapsedMicros());
        }
        totalBytes.addAndGet(n);
    }

    /**
     * Take one sample and return the smoothed rate in Mbps. Meant to be called
     * on a fixed cadence (typically 200 ms). Returns 0 until data has arrived.
     */
    public synchronized double tick() {
        long first = firstDataMicros.get();
        if (first < 0) return 0.0;

        long nowUs = elapsedMicros();
        long bytes = totalBytes.get();

        ringMicros[head & RING_MASK] = nowUs;
        ringBytes[head & RING_MASK] = bytes;

        int lookback = Math.min(head, windowTicks);
        double raw = 0.0;
        if (lookback > 0) {
            int tail = (head - lookback) & RING_MASK;
            long dBytes = bytes - ringBytes[tail];
            long dUs = nowUs - ringMicros[tail];
            if (dUs > 0) raw = (dBytes * 8.0) / dUs;
        }
        head++;
        windowedMbps = raw;

        double progress = Math.min(1.0, ((nowUs - first) / 1_000_000.0) / expectedSeconds);
        double decay = 1.0 - progress * DECAY_FACTOR;
        double steady = (raw >= displayMbps ? RISE_ALPHA : FALL_ALPHA) * decay;

        double alpha;
        if (lookback < windowTicks) {
            double warmth = (double) lookback / windowTicks;
            alpha = COLD_ALPHA + warmth * (steady - COLD_ALPHA);
        } else {
            alpha = steady;
        }

        displayMbps += alpha * (raw - displayMbps);
        if (displayMbps < DISPLAY_FLOOR_MBPS) displayMbps = 0.0;
        return displayMbps;
    }

    /** Stop the clock and return the exact average from first byte to now. */
    public synchronized double finish() {
        if (stoppedAtMicros < 0) {
            stoppedAtMicros = elapsedMicros();
        }
        return overallMbps();
    }

    /** Exact average in Mbps since the first byte. Uses the stop time once finished. */
    public double overallMbps() {
        long first = firstDataMicros.get();
        long bytes = totalBytes.get();
        if (first < 0 || bytes <= 0) return 0.0;
        long elapsed = elapsedMicros() - first;
        return elapsed > 0 ? (bytes * 8.0) / elapsed : 0.0;
    }

    public long totalBytes() { return totalBytes.get(); }
    public boolean hasData() { return firstDataMicros.get() >= 0; }
    public synchronized double displayMbps() { return displayMbps; }

    /** Unsmoothed rate over the sliding window as of the last tick. */
    public synchronized double windowedMbps() { return windowedMbps; }

    private long elapsedMicros() {
        long stopped = stoppedAtMicros;
        if (stopped >= 0) return stopped;
        return (nanoClock.getAsLong() - startNanos) / 1_000;
    }
}
