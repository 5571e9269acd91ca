package com.alterante.speedtest.transport;

/**
 * Per-worker range request sizing, driven by how long each request took.
 *
 * <pre>
 * On each completed request:
 *   elapsed &lt; fastThreshold:  chunk = min(chunk * 2, max)
 *   elapsed &gt; slowThreshold:  chunk = max(chunk / 2, min)
 *   otherwise:                unchanged
 *
 * On 416 Range Not Satisfiable:
 *   chunk = initial
 * </pre>
 *
 * Not thread-safe: each worker owns its own sizer.
 */
public class AdaptiveChunkSizer {

    public static final int DEFAULT_INITIAL = 256 * 1024;
    public static final int DEFAULT_MAX = 16 * 1024 * 1024;
    public static final long DEFAULT_FAST_MS = 300;
    public static final long DEFAULT_SLOW_MS = 8_000;

    private final int initial;
    private final int min;
    private final int max;
    private final long fastThresholdMs;
    private final long slowThresholdMs;

    private int chunkSize;

    public AdaptiveChunkSizer() {
        this(DEFAULT_INITIAL, DEFAULT_INITIAL, DEFAULT_MAX, DEFAULT_FAST_MS, DEFAULT_SLOW_MS);
    }

    public AdaptiveChunkSizer(int initial, int min, int max, long fastThresholdMs, long slowThresholdMs) {
        if (min <= 0 || min > initial || initial > max) {
            throw new IllegalArgumentException("require 0 < min <= initial <= max");
        }
        this.initial = initial;
        this.min = min;
        this.max = max;
        this.fastThresholdMs = fastThresholdMs;
        this.slowThresholdMs = slowThresholdMs;
        this.chunkSize = initial;
    }

    /**
     * Feed the duration of a completed request.
     *
     * @return the chunk size to use for the next request
     */
    public int onRequestComplete(long elapsedMs) {
        if (elapsedMs < fastThresholdMs) {
            chunkSize = (int) Math.min((long) chunkSize * 2, max);
        } else if (elapsedMs > slowThresholdMs) {
            chunkSize = Math.max(chunkSize / 2, min);
        }
        return chunkSize;
    }

    /** Server rejected the range: start over from the initial size. */
    public void reset() {
        chunkSize = initial;
    }

    /** Current chunk size in bytes. */
    public int chunkSize() {
        return chunkSize;
    }
}
