package com.alterante.speedtest.engine.cdn;

import com.alterante.speedtest.engine.EngineOptions;
import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.net.SocketConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.function.LongConsumer;

/**
 * Saturates the link with many parallel persistent connections, each fetching
 * the same large object over and over. No discovery, no latency step.
 */
public class BulkHttpEngine extends HttpEngineSupport {

    private static final Logger log = LoggerFactory.getLogger(BulkHttpEngine.class);

    static final int DOWNLOAD_WORKERS = 16;
    static final int UPLOAD_WORKERS = 16;
    static final int UPLOAD_BODY_BYTES = 1024 * 1024;
    static final int UPLOAD_SLICE_BYTES = 512 * 1024;

    private final int downloadWorkers;
    private final int uploadWorkers;

    public BulkHttpEngine(EngineOptions options) {
        this(options, new SocketConnector(), DOWNLOAD_WORKERS, UPLOAD_WORKERS);
    }

    BulkHttpEngine(EngineOptions options, SocketConnector connector, int downloadWorkers, int uploadWorkers) {
        super(options, connector);
        this.downloadWorkers = downloadWorkers;
        this.uploadWorkers = uploadWorkers;
    }

    @Override
    public String name() {
        return "bulk";
    }

    @Override
    public void runDownload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws InterruptedException {
        URI uri = options.targetsOr(List.of(FallbackTargets.BULK_DOWNLOAD)).get(0);
        log.info("Bulk download from {} with {} connections", uri.getHost(), downloadWorkers);
        List<Future<?>> workers = launch(lifecycle, "bulk-dl", 0, downloadWorkers, 0,
                i -> downloadLoop(lifecycle, uri, onBytes));
        lifecycle.awaitWorkers(workers);
    }

    @Override
    public void runUpload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws InterruptedException {
        List<UploadTier> primary = new ArrayList<>();
        for (URI uri : options.uploadTargets()) {
            primary.add(new UploadTier("primary", uri, true));
        }
        TieredUploader uploader = new TieredUploader(tiersWithFallback(primary), lifecycle);
        byte[] body = Payloads.incompressible(UPLOAD_BODY_BYTES);
        log.info("Bulk upload via {} with {} connections", uploader.current().uri().getHost(), uploadWorkers);
        List<Future<?>> workers = launch(lifecycle, "bulk-ul", 0, uploadWorkers, 0,
                i -> uploadLoop(lifecycle, uploader, body, UPLOAD_SLICE_BYTES, onBytes));
        lifecycle.awaitWorkers(workers);
    }
}
