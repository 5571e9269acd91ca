package com.alterante.speedtest.net;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.meter.LatencyResult;
import com.alterante.speedtest.meter.LatencyStats;
import com.alterante.speedtest.protocol.ParsedResponse;
import com.alterante.speedtest.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Measures request round-trip time over one persistent connection.
 *
 * Sends {@code samples} tiny requests {@code intervalMs} apart and reduces the
 * timings with {@link LatencyStats}. A dropped connection is reopened and the
 * lost sample skipped; a failed reopen costs one attempt, not the series.
 */
public class LatencyProbe {

    private static final Logger log = LoggerFactory.getLogger(LatencyProbe.class);

    public static final int DEFAULT_SAMPLES = 12;
    public static final long DEFAULT_INTERVAL_MS = 50;

    private final SocketConnector connector;
    private final int samples;
    private final long intervalMs;

    public LatencyProbe(SocketConnector connector) {
        this(connector, DEFAULT_SAMPLES, DEFAULT_INTERVAL_MS);
    }

    public LatencyProbe(SocketConnector connector, int samples, long intervalMs) {
        this.connector = connector;
        this.samples = samples;
        this.intervalMs = intervalMs;
    }

    /**
     * @param method {@link HttpProbe.Method#HEAD} or {@link HttpProbe.Method#RANGE_GET}
     * @throws IOException if no sample at all could be taken
     */
    public LatencyResult measure(ResourceLifecycle lifecycle, URI uri, HttpProbe.Method method)
            throws IOException, InterruptedException {
        List<Double> timings = new ArrayList<>();
        HttpConnection conn = null;
        IOException lastFailure = null;
        int attempts = 0;
        try {
            while (timings.size() < samples && attempts < samples * 2 && !lifecycle.shouldStop()) {
                attempts++;
                if (conn == null || conn.isClosed()) {
                    try {
                        conn = connector.open(lifecycle, uri, null);
                    } catch (IOException e) {
                        if (lifecycle.shouldStop()) break;
                        log.debug("Latency probe connect to {} failed: {}", uri.getHost(), e.toString());
                        lastFailure = e;
                        conn = null;
                        if (!lifecycle.pause(intervalMs)) break;
                        continue;
                    }
                }
                long t0 = System.nanoTime();
                ParsedResponse response;
                try {
                    response = conn.sendRequest(HttpProbe.request(uri, method));
                } catch (ProtocolException e) {
                    log.warn("Latency probe to {}: {}", uri.getHost(), e.getMessage());
                    conn = null;
                    continue;
                }
                double ms = (System.nanoTime() - t0) / 1_000_000.0;
                if (response.isClosed()) {
                    log.debug("Latency probe connection closed, reopening");
                    conn = null;
                    continue;
                }
                timings.add(ms);
                if (!lifecycle.pause(intervalMs)) break;
            }
        } finally {
            if (conn != null) conn.close();
        }
        if (timings.isEmpty()) {
            throw new IOException("No latency samples from " + uri.getHost(), lastFailure);
        }
        LatencyResult result = LatencyStats.summarize(timings);
        log.info("Latency to {}: ping {} ms, jitter {} ms ({} samples)", uri.getHost(),
                String.format("%.1f", result.pingMs()), String.format("%.1f", result.jitterMs()), result.samples());
        return result;
    }
}
