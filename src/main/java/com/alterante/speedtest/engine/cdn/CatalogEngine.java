package com.alterante.speedtest.engine.cdn;

import com.alterante.speedtest.engine.EngineOptions;
import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.meter.LatencyResult;
import com.alterante.speedtest.net.HttpConnection;
import com.alterante.speedtest.net.HttpProbe;
import com.alterante.speedtest.net.LatencyProbe;
import com.alterante.speedtest.net.ProbeResult;
import com.alterante.speedtest.net.SocketConnector;
import com.alterante.speedtest.protocol.HttpRequest;
import com.alterante.speedtest.protocol.ParsedResponse;
import com.alterante.speedtest.protocol.ProtocolException;
import com.alterante.speedtest.transport.WorkerRamp;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongConsumer;

/**
 * Fetches a JSON catalog of download targets and spreads streams across them.
 *
 * <pre>
 * catalog:   {"targets": [{"url": "https://..."}, ...]}
 * ranking:   the first RANKED_TARGETS entries are probed once and ordered by
 *            round trip; unreachable ones go last, unprobed ones keep catalog order
 * latency:   Range: bytes=0-0 round trips to the best target;
 *            ping &gt; HIGH_LATENCY_MS selects SLOW_LINK_STREAMS, otherwise MAX_STREAMS
 * download:  stream i fetches target i mod n
 * upload:    each target's /speedtest/upload path, then the shared fallback;
 *            starts with the download stream count and ramps by UPLOAD_RAMP_STEP
 *            every UPLOAD_RAMP_INTERVAL_MS up to MAX_UPLOAD_WORKERS
 * </pre>
 */
public class CatalogEngine extends HttpEngineSupport {

    private static final Logger log = LoggerFactory.getLogger(CatalogEngine.class);

    static final int MAX_STREAMS = 5;
    static final int SLOW_LINK_STREAMS = 2;
    static final double HIGH_LATENCY_MS = 500;
    static final int CATALOG_CAPTURE_BYTES = 1024 * 1024;
    static final int UPLOAD_BODY_BYTES = 2 * 1024 * 1024;
    static final int UPLOAD_SLICE_BYTES = 256 * 1024;
    static final String UPLOAD_PATH = "/speedtest/upload";
    static final int RANKED_TARGETS = 10;
    static final int MAX_UPLOAD_WORKERS = 16;
    static final int UPLOAD_RAMP_STEP = 2;
    static final long UPLOAD_RAMP_INTERVAL_MS = 2_000;

    public static final String KEY_URLS = "urls";
    public static final String KEY_CATALOG = "catalog";
    public static final String KEY_PROBE_RTT_MS = "probeRttMs";
    public static final String ANNOTATION_UPLOAD_STREAMS = "uploadStreams";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpProbe probe;
    private final LatencyProbe latencyProbe;
    private volatile int streams = MAX_STREAMS;

    public CatalogEngine(EngineOptions options) {
        this(options, new SocketConnector());
    }

    CatalogEngine(EngineOptions options, SocketConnector connector) {
        super(options, connector);
        this.probe = new HttpProbe(connector);
        this.latencyProbe = new LatencyProbe(connector);
    }

    @Override
    public String name() {
        return "catalog";
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
    public Map<String, Object> discover(ResourceLifecycle lifecycle) throws IOException {
        URI catalog = options.catalogUrlOr(FallbackTargets.CATALOG);
        ParsedResponse response;
        HttpConnection conn = connector.open(lifecycle, catalog, null);
        try {
            response = conn.sendRequest(HttpRequest.get(catalog).header("Accept", "application/json"),
                    CATALOG_CAPTURE_BYTES);
        } catch (ProtocolException e) {
            throw new IOException("Catalog response malformed: " + e.getMessage(), e);
        } finally {
            conn.close();
        }
        if (!response.isSuccess()) {
            log.warn("Catalog {} answered {}", catalog.getHost(), response.statusCode());
            return null;
        }

        List<String> urls = parseTargets(response.bodyText());
        if (urls.isEmpty()) {
            log.warn("Catalog {} listed no targets", catalog.getHost());
            return null;
        }
        log.info("Catalog listed {} targets", urls.size());
        List<Ranked> ranked = rank(lifecycle, urls);
        Ranked best = ranked.get(0);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("url", best.url());
        List<String> ordered = new ArrayList<>(ranked.size());
        for (Ranked r : ranked) ordered.add(r.url());
        metadata.put(KEY_URLS, List.copyOf(ordered));
        metadata.put(KEY_CATALOG, catalog.toString());
        if (best.rttMs() >= 0) metadata.put(KEY_PROBE_RTT_MS, best.rttMs());
        return metadata;
    }

    /** A catalog entry with its probe round trip, -1 if unreachable or not probed. */
    record Ranked(String url, long rttMs) {
    }

    /**
     * Probe the leading targets and order them fastest first. Unreachable
     * targets follow the reachable ones; targets past {@link #RANKED_TARGETS}
     * keep their catalog order at the end.
     */
    List<Ranked> rank(ResourceLifecycle lifecycle, List<String> urls) {
        List<Ranked> probed = new ArrayList<>();
        List<Ranked> rest = new ArrayList<>();
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            if (i >= RANKED_TARGETS || lifecycle.shouldStop()) {
                rest.add(new Ranked(url, -1));
                continue;
            }
            ProbeResult result = probe.probe(lifecycle, URI.create(url), HttpProbe.Method.RANGE_GET);
            if (result.success() && result.statusCode() < 400) {
                probed.add(new Ranked(url, result.rttMs()));
            } else {
                log.debug("Catalog target {} unreachable: {}", url,
                        result.success() ? "status " + result.statusCode() : result.failure());
                rest.add(new Ranked(url, -1));
            }
        }
        probed.sort(Comparator.comparingLong(Ranked::rttMs));
        List<Ranked> ordered = new ArrayList<>(probed);
        ordered.addAll(rest);
        if (!probed.isEmpty()) {
            log.info("Best catalog target {} ({} ms)", probed.get(0).url(), probed.get(0).rttMs());
        }
        return ordered;
    }

    List<String> parseTargets(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        List<String> urls = new ArrayList<>();
        for (JsonNode target : root.path("targets")) {
            String url = target.path("url").asText(null);
            if (url != null && !url.isBlank()) urls.add(url);
        }
        return urls;
    }

    @Override
    public LatencyResult measureLatency(ResourceLifecycle lifecycle, Map<String, Object> metadata)
            throws IOException, InterruptedException {
        URI best = URI.create(urls(metadata).get(0));
        LatencyResult latency = latencyProbe.measure(lifecycle, best, HttpProbe.Method.RANGE_GET);
        streams = latency.pingMs() > HIGH_LATENCY_MS ? SLOW_LINK_STREAMS : MAX_STREAMS;
        if (streams == SLOW_LINK_STREAMS) {
            log.info("High latency ({} ms), using {} streams", String.format("%.0f", latency.pingMs()), streams);
        }
        return latency;
    }

    @Override
    public void runDownload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws InterruptedException {
        List<String> urls = urls(metadata);
        int n = Math.min(streams, urls.size());
        lifecycle.annotate(ANNOTATION_STREAMS, n);
        List<Future<?>> workers = launch(lifecycle, "catalog-dl", 0, n, 0,
                i -> downloadLoop(lifecycle, URI.create(urls.get(i % urls.size())), onBytes));
        lifecycle.awaitWorkers(workers);
    }

    @Override
    public void runUpload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws InterruptedException {
        List<String> urls = urls(metadata);
        List<UploadTier> primary = new ArrayList<>();
        if (options.uploadTargets().isEmpty()) {
            for (String url : urls) {
                primary.add(new UploadTier("catalog", uploadUri(URI.create(url)), true));
            }
        } else {
            for (URI uri : options.uploadTargets()) {
                primary.add(new UploadTier("catalog", uri, true));
            }
        }
        TieredUploader uploader = new TieredUploader(tiersWithFallback(primary), lifecycle);
        byte[] body = Payloads.incompressible(UPLOAD_BODY_BYTES);
        LongAdder intervalBytes = new LongAdder();
        LongConsumer counted = b -> {
            onBytes.accept(b);
            intervalBytes.add(b);
        };
        WorkerRamp ramp = new WorkerRamp(Math.min(streams, urls.size()), UPLOAD_RAMP_STEP, MAX_UPLOAD_WORKERS,
                WorkerRamp.DEFAULT_MIN_GAIN);
        List<Future<?>> workers = rampUp(lifecycle, "catalog-ul", ramp, UPLOAD_RAMP_INTERVAL_MS, 0, intervalBytes,
                ANNOTATION_UPLOAD_STREAMS, i -> uploadLoop(lifecycle, uploader, body, UPLOAD_SLICE_BYTES, counted));
        lifecycle.awaitWorkers(workers);
    }

    /** Same host and query, upload path. */
    static URI uploadUri(URI download) {
        String query = download.getRawQuery();
        return URI.create(download.getScheme() + "://" + download.getRawAuthority() + UPLOAD_PATH
                + (query != null ? "?" + query : ""));
    }

    private static List<String> urls(Map<String, Object> metadata) {
        Object urls = metadata.get(KEY_URLS);
        if (!(urls instanceof List) || ((List<?>) urls).isEmpty()) {
            throw new IllegalArgumentException("metadata has no " + KEY_URLS);
        }
        List<String> out = new ArrayList<>();
        for (Object o : (List<?>) urls) out.add(o.toString());
        return out;
    }
}
