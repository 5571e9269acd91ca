package com.alterante.speedtest.engine.cdn;

import com.alterante.speedtest.engine.EngineOptions;
import com.alterante.speedtest.engine.MeasurementEngine;
import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.net.HttpConnection;
import com.alterante.speedtest.net.SocketConnector;
import com.alterante.speedtest.protocol.HttpRequest;
import com.alterante.speedtest.protocol.ParsedResponse;
import com.alterante.speedtest.protocol.ProtocolException;
import com.alterante.speedtest.transport.WorkerRamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongConsumer;

/**
 * Worker loops shared by the HTTP engines. Each loop owns its connection and
 * runs until the lifecycle says stop. A lost connection, a framing error or an
 * unexpected status drops the connection; the worker backs off briefly and
 * opens a fresh one.
 */
public abstract class HttpEngineSupport implements MeasurementEngine {

    private static final Logger log = LoggerFactory.getLogger(HttpEngineSupport.class);

    protected static final long RETRY_BACKOFF_MS = 250;

    public static final String ANNOTATION_STREAMS = "streams";

    private static final String[] EDGE_HEADERS = {
            "x-served-by", "x-fb-edge-debug", "x-cache", "cf-ray", "x-amz-cf-pop", "server"
    };

    protected final EngineOptions options;
    protected final SocketConnector connector;

    protected HttpEngineSupport(EngineOptions options, SocketConnector connector) {
        this.options = options;
        this.connector = connector;
    }

    /** Body of one indexed worker. */
    @FunctionalInterface
    protected interface IndexedWorker {
        void run(int index) throws Exception;
    }

    /**
     * Launch {@code count} workers numbered from {@code firstIndex}, worker i
     * delayed by {@code i * staggerMs} so connection setup is spread out.
     */
    protected List<Future<?>> launch(ResourceLifecycle lifecycle, String prefix, int firstIndex, int count,
                                     long staggerMs, IndexedWorker body) {
        List<Future<?>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int index = firstIndex + i;
            long delay = i * staggerMs;
            futures.add(lifecycle.launchWorker(prefix + "-" + index, () -> {
                if (delay > 0 && !lifecycle.pause(delay)) return;
                body.run(index);
            }));
        }
        return futures;
    }

    /**
     * Launch the ramp's initial workers, then every {@code intervalMs} feed it the
     * bytes counted since the last step and launch whatever it asks for. Returns
     * once the phase stops, with the futures of every worker launched.
     *
     * @param annotation key under which the active worker count is published
     */
    protected List<Future<?>> rampUp(ResourceLifecycle lifecycle, String prefix, WorkerRamp ramp, long intervalMs,
                                     long staggerMs, LongAdder intervalBytes, String annotation,
                                     IndexedWorker body) throws InterruptedException {
        List<Future<?>> workers = new ArrayList<>(launch(lifecycle, prefix, 0, ramp.initialWorkers(), staggerMs, body));
        lifecycle.annotate(annotation, ramp.activeWorkers());
        while (lifecycle.pause(intervalMs)) {
            int add = ramp.onInterval(intervalBytes.sumThenReset());
            if (add > 0) {
                workers.addAll(launch(lifecycle, prefix, ramp.activeWorkers() - add, add, 0, body));
                lifecycle.annotate(annotation, ramp.activeWorkers());
                log.debug("{} ramp: {} workers", prefix, ramp.activeWorkers());
            }
        }
        return workers;
    }

    /**
     * Open a connection, or back off and return null if that fails.
     */
    protected HttpConnection connect(ResourceLifecycle lifecycle, URI uri, LongConsumer inbound)
            throws InterruptedException {
        try {
            return connector.open(lifecycle, uri, inbound);
        } catch (IOException e) {
            if (!lifecycle.shouldStop()) {
                log.debug("Connect to {} failed: {}", uri.getHost(), e.toString());
                lifecycle.pause(RETRY_BACKOFF_MS);
            }
            return null;
        }
    }

    /**
     * Repeatedly GET one object over a persistent connection. Every byte read,
     * headers included, is reported through {@code onBytes} as it arrives.
     */
    protected void downloadLoop(ResourceLifecycle lifecycle, URI uri, LongConsumer onBytes)
            throws InterruptedException {
        HttpConnection conn = null;
        try {
            while (!lifecycle.shouldStop()) {
                if (conn == null || conn.isClosed()) {
                    conn = connect(lifecycle, uri, onBytes);
                    if (conn == null) continue;
                }
                ParsedResponse response;
                try {
                    response = conn.sendRequest(HttpRequest.get(uri));
                } catch (ProtocolException e) {
                    if (lifecycle.shouldStop()) return;
                    log.warn("Dropping connection to {}: {}", uri.getHost(), e.getMessage());
                    conn = null;
                    lifecycle.pause(RETRY_BACKOFF_MS);
                    continue;
                }
                if (response.isClosed()) {
                    conn = null;
                    if (lifecycle.shouldStop()) return;
                    log.debug("Connection to {} lost, reconnecting", uri.getHost());
                    lifecycle.pause(RETRY_BACKOFF_MS);
                    continue;
                }
                if (!response.isSuccess()) {
                    log.debug("GET {} answered {}, reconnecting", uri.getHost(), response.statusCode());
                    conn = drop(conn);
                    lifecycle.pause(RETRY_BACKOFF_MS);
                }
            }
        } finally {
            if (conn != null) conn.close();
        }
    }

    /**
     * Repeatedly POST {@code body} through the active upload tier, flushing it
     * in {@code sliceSize} slices. Only flushed slices are reported.
     */
    protected void uploadLoop(ResourceLifecycle lifecycle, TieredUploader uploader, byte[] body, int sliceSize,
                              LongConsumer onBytes) throws InterruptedException {
        HttpConnection conn = null;
        UploadTier connTier = null;
        try {
            while (!lifecycle.shouldStop()) {
                UploadTier tier = uploader.current();
                if (conn != null && (conn.isClosed() || tier != connTier)) {
                    conn.close();
                    conn = null;
                }
                if (conn == null) {
                    try {
                        conn = connector.open(lifecycle, tier.uri(), null);
                        connTier = tier;
                    } catch (IOException e) {
                        if (lifecycle.shouldStop()) return;
                        uploader.onFailure(tier, e.toString());
                        lifecycle.pause(RETRY_BACKOFF_MS);
                        continue;
                    }
                }

                byte[] header = HttpRequest.post(tier.uri(), body.length).encode();
                ParsedResponse response;
                try {
                    response = conn.sendRequestChunked(header, body, sliceSize, onBytes);
                } catch (ProtocolException e) {
                    if (lifecycle.shouldStop()) return;
                    uploader.onFailure(tier, e.getMessage());
                    conn = null;
                    lifecycle.pause(RETRY_BACKOFF_MS);
                    continue;
                }
                if (response.isClosed()) {
                    if (lifecycle.shouldStop()) return;
                    uploader.onFailure(tier, "connection closed");
                    conn = null;
                    lifecycle.pause(RETRY_BACKOFF_MS);
                    continue;
                }
                if (response.statusCode() >= 400) {
                    uploader.onFailure(tier, "status " + response.statusCode());
                    conn = drop(conn);
                    lifecycle.pause(RETRY_BACKOFF_MS);
                    continue;
                }
                uploader.onSuccess(tier);
                if (!tier.persistent()) {
                    conn = drop(conn);
                }
            }
        } finally {
            if (conn != null) conn.close();
        }
    }

    /** Close a connection after an unexpected answer; always returns null. */
    protected static HttpConnection drop(HttpConnection conn) {
        conn.close();
        return null;
    }

    /** Upload tiers: each primary endpoint, then the shared fallback. */
    protected List<UploadTier> tiersWithFallback(List<UploadTier> primary) {
        List<UploadTier> tiers = new ArrayList<>(primary);
        tiers.add(new UploadTier("shared", options.sharedUploadUrlOr(FallbackTargets.SHARED_UPLOAD), true));
        return tiers;
    }

    /** First header that identifies the serving edge, or null. */
    protected static String edgeIdentifier(Map<String, String> headers) {
        for (String name : EDGE_HEADERS) {
            String v = headers.get(name);
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
