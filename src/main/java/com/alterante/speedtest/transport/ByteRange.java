package com.alterante.speedtest.transport;

/**
 * Inclusive byte range, as used in an HTTP {@code Range} header.
 */
public record ByteRange(long start, long end) {

    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range " + start + "-" + end);
        }
    }

    public long length() {
        return end - start + 1;
    }

    /** Header value, e.g. {@code bytes=0-262143}. */
    public String headerValue() {
        return "bytes=" + start + "-" + end;
    }
}
