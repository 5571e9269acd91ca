package com.alterante.speedtest.engine.cdn;

import com.alterante.speedtest.engine.EngineOptions;
import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.net.DiscoveryCascade;
import com.alterante.speedtest.net.HttpProbe;
import com.alterante.speedtest.net.ProbeResult;
import com.alterante.speedtest.net.SocketConnector;
import com.alterante.speedtest.net.TargetDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.function.LongConsumer;

/**
 * Measures an edge that serves a moderately sized static object by keeping a
 * few raw persistent connections busy with the same GET.
 *
 * Discovery fetches each candidate in full and accepts the first that returns
 * at least {@link #MIN_PROBE_BYTES} of body, recording the edge header it saw.
 * Uploads write a 1 MB body in 16 KB slices, each counted only after its flush.
 */
public class PersistentSocketEngine extends HttpEngineSupport {

    private static final Logger log = LoggerFactory.getLogger(PersistentSocketEngine.class);

    static final long MIN_PROBE_BYTES = 10_000;
    static final int DOWNLOAD_WORKERS = 4;
    static final int UPLOAD_WORKERS = 3;
    static final long WORKER_STAGGER_MS = 50;
    static final int UPLOAD_BODY_BYTES = 1024 * 1024;
    static final int UPLOAD_SLICE_BYTES = 16 * 1024;

    private final HttpProbe probe;

    public PersistentSocketEngine(EngineOptions options) {
        this(options, new SocketConnector());
    }

    PersistentSocketEngine(EngineOptions options, SocketConnector connector) {
        super(options, connector);
        this.probe = new HttpProbe(connector);
    }

    @Override
    public String name() {
        return "socket";
    }

    @Override
    public boolean hasDiscovery() {
        return true;
    }

    @Override
    public Map<String, Object> discover(ResourceLifecycle lifecycle) {
        DiscoveryCascade cascade = new DiscoveryCascade(options.targetsOr(FallbackTargets.SOCKET_CANDIDATES),
                candidate -> {
                    ProbeResult result = probe.probe(lifecycle, candidate, HttpProbe.Method.GET);
                    if (!result.success()) {
                        log.debug("Candidate {}: {}", candidate, result.failure());
                        return null;
                    }
                    if (result.statusCode() != 200 || result.bodyBytes() < MIN_PROBE_BYTES) {
                        log.debug("Candidate {}: status {}, {} bytes", candidate, result.statusCode(), result.bodyBytes());
                        return null;
                    }
                    return TargetDescriptor.fromProbe(result, edgeIdentifier(result.headers()));
                });
        TargetDescriptor target = cascade.discover(lifecycle);
        return target != null ? target.toMetadata() : null;
    }

    @Override
    public void runDownload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws InterruptedException {
        URI uri = TargetDescriptor.uriOf(metadata);
        List<Future<?>> workers = launch(lifecycle, "socket-dl", 0, DOWNLOAD_WORKERS, WORKER_STAGGER_MS,
                i -> downloadLoop(lifecycle, uri, onBytes));
        lifecycle.awaitWorkers(workers);
    }

    @Override
    public void runUpload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws InterruptedException {
        List<UploadTier> primary = new ArrayList<>();
        for (URI uri : options.uploadTargets()) {
            primary.add(new UploadTier("socket", uri, true));
        }
        TieredUploader uploader = new TieredUploader(tiersWithFallback(primary), lifecycle);
        byte[] body = Payloads.incompressible(UPLOAD_BODY_BYTES);
        List<Future<?>> workers = launch(lifecycle, "socket-ul", 0, UPLOAD_WORKERS, WORKER_STAGGER_MS,
                i -> uploadLoop(lifecycle, uploader, body, UPLOAD_SLICE_BYTES, onBytes));
        lifecycle.awaitWorkers(workers);
    }
}
