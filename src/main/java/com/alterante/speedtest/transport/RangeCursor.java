package com.alterante.speedtest.transport;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out successive ranges of a remote object to concurrent workers,
 * wrapping around when the end is reached.
 *
 * <pre>
 *   index = next++              (shared, monotonic)
 *   start = (index * chunk) mod contentLength
 *   end   = min(start + chunk - 1, contentLength - 1)
 * </pre>
 */
public class RangeCursor {

    private final long contentLength;
    private final AtomicLong next = new AtomicLong();

    public RangeCursor(long contentLength) {
        if (contentLength <= 0) throw new IllegalArgumentException("contentLength must be positive");
        this.contentLength = contentLength;
    }

    public ByteRange next(int chunkSize) {
        long index = next.getAndIncrement();
        long start = Math.floorMod(index * chunkSize, contentLength);
        long end = Math.min(start + chunkSize - 1, contentLength - 1);
        return new ByteRange(start, end);
    }

    public long contentLength() {
        return contentLength;
    }

    /** Number of ranges handed out so far. */
    public long issued() {
        return next.get();
    }
}
