package com.alterante.speedtest.engine.cdn;

import com.alterante.speedtest.engine.EngineOptions;
import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.meter.LatencyResult;
import com.alterante.speedtest.net.DiscoveryCascade;
import com.alterante.speedtest.net.HttpConnection;
import com.alterante.speedtest.net.HttpProbe;
import com.alterante.speedtest.net.LatencyProbe;
import com.alterante.speedtest.net.ProbeResult;
import com.alterante.speedtest.net.SocketConnector;
import com.alterante.speedtest.net.TargetDescriptor;
import com.alterante.speedtest.protocol.HttpRequest;
import com.alterante.speedtest.protocol.ParsedResponse;
import com.alterante.speedtest.protocol.ProtocolException;
import com.alterante.speedtest.transport.AdaptiveChunkSizer;
import com.alterante.speedtest.transport.ByteRange;
import com.alterante.speedtest.transport.RangeCursor;
import com.alterante.speedtest.transport.WorkerRamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongConsumer;

/**
 * Discovers a range-capable object on a CDN edge and downloads it in adaptive
 * byte ranges from a growing pool of workers.
 *
 * <pre>
 * discover:  HEAD each candidate (redirects followed) until one is 200/206,
 *            advertises Accept-Ranges: bytes, is not HTML and is at least MIN_CONTENT_BYTES
 * latency:   HEAD round trips to the chosen target
 * download:  shared RangeCursor, per-worker AdaptiveChunkSizer,
 *            WorkerRamp evaluated every RAMP_INTERVAL_MS
 * upload:    primary endpoints -&gt; persistent socket endpoint -&gt; shared fallback
 * </pre>
 */
public class RangeChunkEngine extends HttpEngineSupport {

    private static final Logger log = LoggerFactory.getLogger(RangeChunkEngine.class);

    static final long MIN_CONTENT_BYTES = 1024 * 1024;
    static final long RAMP_INTERVAL_MS = 2_000;
    static final long WORKER_STAGGER_MS = 150;
    static final long RATE_LIMIT_BACKOFF_MS = 2_000;
    static final int UPLOAD_WORKERS = 4;
    static final int UPLOAD_BODY_BYTES = 1024 * 1024;
    static final int UPLOAD_SLICE_BYTES = 64 * 1024;

    private final HttpProbe probe;
    private final LatencyProbe latencyProbe;

    public RangeChunkEngine(EngineOptions options) {
        this(options, new SocketConnector());
    }

    RangeChunkEngine(EngineOptions options, SocketConnector connector) {
        super(options, connector);
        this.probe = new HttpProbe(connector);
        this.latencyProbe = new LatencyProbe(connector);
    }

    @Override
    public String name() {
        return "range";
    }

    @Override
    public boolean hasDiscovery() {
        return true;
    }

    @Override
    public boolean hasLatencyTest() {
        return true;
    }

    @Override
    public Map<String, Object> discover(ResourceLifecycle lifecycle) {
        DiscoveryCascade cascade = new DiscoveryCascade(options.targetsOr(FallbackTargets.RANGE_CANDIDATES),
                candidate -> {
                    ProbeResult result = probe.probe(lifecycle, candidate, HttpProbe.Method.HEAD);
                    String problem = HttpProbe.rangeTargetProblem(result, MIN_CONTENT_BYTES);
                    if (problem != null) {
                        log.debug("Candidate {}: {}", candidate, problem);
                        return null;
                    }
                    return TargetDescriptor.fromProbe(result, edgeIdentifier(result.headers()));
                });
        TargetDescriptor target = cascade.discover(lifecycle);
        return target != null ? target.toMetadata() : null;
    }

    @Override
    public LatencyResult measureLatency(ResourceLifecycle lifecycle, Map<String, Object> metadata)
            throws IOException, InterruptedException {
        return latencyProbe.measure(lifecycle, TargetDescriptor.uriOf(metadata), HttpProbe.Method.HEAD);
    }

    @Override
    public void runDownload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws IOException, InterruptedException {
        URI uri = TargetDescriptor.uriOf(metadata);
        long contentLength = TargetDescriptor.contentLengthOf(metadata);
        if (contentLength <= 0) {
            throw new IOException("Target " + uri + " has no known content length");
        }
        RangeCursor cursor = new RangeCursor(contentLength);
        LongAdder intervalBytes = new LongAdder();
        LongConsumer counted = n -> {
            onBytes.accept(n);
            intervalBytes.add(n);
        };

        WorkerRamp ramp = new WorkerRamp();
        AtomicInteger largestChunk = new AtomicInteger(AdaptiveChunkSizer.DEFAULT_INITIAL);
        List<Future<?>> workers = rampUp(lifecycle, "range-dl", ramp, RAMP_INTERVAL_MS, WORKER_STAGGER_MS,
                intervalBytes, ANNOTATION_STREAMS, i -> rangeWorker(lifecycle, uri, cursor, counted, largestChunk));
        lifecycle.annotate("chunkSize", largestChunk.get());
        lifecycle.awaitWorkers(workers);
        log.debug("Range download issued {} ranges, saturated={}", cursor.issued(), ramp.isSaturated());
    }

    private void rangeWorker(ResourceLifecycle lifecycle, URI uri, RangeCursor cursor, LongConsumer counted,
                             AtomicInteger largestChunk) throws InterruptedException {
        AdaptiveChunkSizer sizer = new AdaptiveChunkSizer();
        HttpConnection conn = null;
        try {
            while (!lifecycle.shouldStop()) {
                if (conn == null || conn.isClosed()) {
                    conn = connect(lifecycle, uri, counted);
                    if (conn == null) continue;
                }
                ByteRange range = cursor.next(sizer.chunkSize());
                long t0 = System.nanoTime();
                ParsedResponse response;
                try {
                    response = conn.sendRequest(HttpRequest.get(uri).range(range));
                } catch (ProtocolException e) {
                    if (lifecycle.shouldStop()) return;
                    log.warn("Dropping connection to {}: {}", uri.getHost(), e.getMessage());
                    conn = null;
                    lifecycle.pause(RETRY_BACKOFF_MS);
                    continue;
                }
                long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
                if (response.isClosed()) {
                    conn = null;
                    if (lifecycle.shouldStop()) return;
                    log.debug("Connection to {} lost after {} ms, reconnecting", uri.getHost(), elapsedMs);
                    lifecycle.pause(RETRY_BACKOFF_MS);
                    continue;
                }
                switch (response.statusCode()) {
                    case 200, 206 -> {
                        int before = sizer.chunkSize();
                        int next = sizer.onRequestComplete(elapsedMs);
                        if (next != before) {
                            log.debug("Chunk {} -> {} bytes after {} ms", before, next, elapsedMs);
                            largestChunk.accumulateAndGet(next, Math::max);
                        }
                    }
                    case 416 -> sizer.reset();
                    case 429 -> lifecycle.pause(RATE_LIMIT_BACKOFF_MS);
                    default -> {
                        log.debug("Range GET {} answered {}, reconnecting", uri.getHost(), response.statusCode());
                        conn = drop(conn);
                        lifecycle.pause(RETRY_BACKOFF_MS);
                    }
                }
            }
        } finally {
            if (conn != null) conn.close();
        }
    }

    @Override
    public void runUpload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws InterruptedException {
        List<UploadTier> primary = new ArrayList<>();
        for (URI uri : options.uploadTargets()) {
            primary.add(new UploadTier("primary", uri, false));
        }
        if (!options.uploadTargets().isEmpty()) {
            primary.add(new UploadTier("socket", options.uploadTargets().get(0), true));
        }
        TieredUploader uploader = new TieredUploader(tiersWithFallback(primary), lifecycle);
        byte[] body = Payloads.incompressible(UPLOAD_BODY_BYTES);
        List<Future<?>> workers = launch(lifecycle, "range-ul", 0, UPLOAD_WORKERS, WORKER_STAGGER_MS,
                i -> uploadLoop(lifecycle, uploader, body, UPLOAD_SLICE_BYTES, onBytes));
        lifecycle.awaitWorkers(workers);
    }
}
