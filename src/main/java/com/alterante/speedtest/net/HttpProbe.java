package com.alterante.speedtest.net;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.protocol.HttpRequest;
import com.alterante.speedtest.protocol.ParsedResponse;
import com.alterante.speedtest.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * Probes one candidate URL: connects, issues a single request, follows up to
 * {@link #MAX_REDIRECTS} redirects and reports what the final server said.
 *
 * Each hop uses a fresh lifecycle-tracked connection that is closed before the
 * probe returns. Failures are reported in the result, never thrown.
 */
public class HttpProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpProbe.class);

    public static final int MAX_REDIRECTS = 3;

    public enum Method {
        /** HEAD request: headers only. */
        HEAD,
        /** GET with {@code Range: bytes=0-0}: one body byte. */
        RANGE_GET,
        /** Plain GET: the whole body is read and counted. */
        GET
    }

    private final SocketConnector connector;

    public HttpProbe(SocketConnector connector) {
        this.connector = connector;
    }

    public ProbeResult probe(ResourceLifecycle lifecycle, URI uri, Method method) {
        URI current = uri;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            if (lifecycle.shouldStop()) {
                return ProbeResult.failed(current, "stopped", 0);
            }
            HttpConnection conn = null;
            long startNanos = System.nanoTime();
            try {
                conn = connector.open(lifecycle, current, null);
                String edgeIp = conn.remoteIp();
                long requestNanos = System.nanoTime();
                ParsedResponse response = conn.sendRequest(request(current, method));
                long rttMs = (System.nanoTime() - requestNanos) / 1_000_000;

                if (response.isClosed()) {
                    return ProbeResult.failed(current, "connection closed before response", rttMs);
                }
                if (response.isRedirect()) {
                    URI next = current.resolve(response.header("location"));
                    log.debug("Probe {} redirected ({}) to {}", current, response.statusCode(), next);
                    current = next;
                    continue;
                }
                return ProbeResult.succeeded(current, response.statusCode(), response.headers(),
                        response.bodyBytes(), rttMs, edgeIp);
            } catch (IOException | ProtocolException | IllegalArgumentException e) {
                long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
                return ProbeResult.failed(current, e.getClass().getSimpleName() + ": " + e.getMessage(), elapsedMs);
            } finally {
                if (conn != null) conn.close();
            }
        }
        return ProbeResult.failed(current, "more than " + MAX_REDIRECTS + " redirects", 0);
    }

    /**
     * Check a probe against the requirements of range-chunked downloading.
     *
     * @return null if acceptable, otherwise the reason for rejection
     */
    public static String rangeTargetProblem(ProbeResult probe, long minBytes) {
        if (!probe.success()) return probe.failure();
        int status = probe.statusCode();
        if (status != 200 && status != 206) return "status " + status;
        if (!probe.acceptsRanges()) return "no byte-range support";
        if (probe.contentType().startsWith("text/html")) return "content type " + probe.contentType();
        long length = probe.contentLength();
        if (length < 0) return "unknown content length";
        if (length < minBytes) return "too small (" + length + " bytes)";
        return null;
    }

    static HttpRequest request(URI uri, Method method) {
        return switch (method) {
            case HEAD -> HttpRequest.head(uri);
            case RANGE_GET -> HttpRequest.get(uri).range(0, 0);
            case GET -> HttpRequest.get(uri);
        };
    }
}
