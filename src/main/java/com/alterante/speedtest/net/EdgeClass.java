package com.alterante.speedtest.net;

/**
 * Rough placement of a discovered edge, judged by probe round-trip time.
 */
public enum EdgeClass {
    NEAR_CACHE("near-cache"),
    EDGE("edge"),
    DISTANT("distant");

    private static final long NEAR_CACHE_MAX_MS = 20;
    private static final long EDGE_MAX_MS = 50;

    private final String label;

    EdgeClass(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EdgeClass classify(long rttMs) {
        if (rttMs < NEAR_CACHE_MAX_MS) return NEAR_CACHE;
        if (rttMs < EDGE_MAX_MS) return EDGE;
        return DISTANT;
    }
}
