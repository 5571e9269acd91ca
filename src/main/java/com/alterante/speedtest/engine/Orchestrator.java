package com.alterante.speedtest.engine;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.meter.LatencyResult;
import com.alterante.speedtest.meter.ThroughputMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Drives any {@link MeasurementEngine} through the same phase sequence:
 *
 * <pre>
 * IDLE -&gt; DISCOVERING -&gt; MEASURING_LATENCY -&gt; DOWNLOADING -&gt; UPLOADING -&gt; DONE
 *            (skipped unless the engine advertises the capability)
 *
 * any state -&gt; ERROR      discovery failed or an unexpected exception
 * any state -&gt; CANCELLED  cancel() was called
 * </pre>
 *
 * For each of DOWNLOADING/UPLOADING the orchestrator owns a fresh
 * {@link ThroughputMeter}, a kill timer at the phase deadline and a ticker that
 * emits live results. The engine runs as a tracked worker; the phase ends when
 * the engine returns or the deadline fires, whichever is first. The phase's
 * reported number is always {@link ThroughputMeter#finish()}.
 *
 * One run at a time per orchestrator.
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final RunSettings settings;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService scheduler;
    private final ResourceLifecycle lifecycle;
    private final AtomicBoolean running = new AtomicBoolean();
    private final Object emitLock = new Object();

    private volatile RunState state = RunState.IDLE;
    private Consumer<RunState> stateListener;

    public Orchestrator() {
        this(RunSettings.defaults());
    }

    public Orchestrator(RunSettings settings) {
        this.settings = settings;
        this.workerPool = Executors.newCachedThreadPool(daemonThreads("speedtest-worker"));
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("speedtest-timer"));
        this.lifecycle = new ResourceLifecycle(workerPool, scheduler);
    }

    /** Set a listener that is called on every state transition. */
    public void setStateListener(Consumer<RunState> listener) {
        this.stateListener = listener;
    }

    public RunState state() { return state; }
    public RunSettings settings() { return settings; }
    public ResourceLifecycle lifecycle() { return lifecycle; }

    /**
     * Start a run on its own thread. Every result, live and terminal, goes to
     * {@code listener}; the returned future completes with the terminal one.
     */
    public CompletableFuture<MeasurementResult> start(MeasurementEngine engine, Consumer<MeasurementResult> listener) {
        claim();
        CompletableFuture<MeasurementResult> future = new CompletableFuture<>();
        Thread t = new Thread(() -> {
            try {
                future.complete(runClaimed(engine, listener));
            } catch (RuntimeException | Error e) {
                future.completeExceptionally(e);
            }
        }, "orchestrator-" + engine.name());
        t.setDaemon(true);
        t.start();
        return future;
    }

    /** Blocking form of {@link #start}. */
    public MeasurementResult run(MeasurementEngine engine, Consumer<MeasurementResult> listener) {
        claim();
        return runClaimed(engine, listener);
    }

    /** Cancel the current run. Safe from any thread; no-op when idle. */
    public void cancel() {
        if (running.get()) {
            lifecycle.cancel();
        }
    }

    /** Cancel any run and stop the thread pools. */
    @Override
    public void close() {
        cancel();
        scheduler.shutdownNow();
        workerPool.shutdownNow();
    }

    // --- Run ---

    private void claim() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A measurement is already running");
        }
        lifecycle.reset();
        state = RunState.IDLE;
    }

    private MeasurementResult runClaimed(MeasurementEngine engine, Consumer<MeasurementResult> listener) {
        try {
            return execute(engine, listener == null ? r -> { } : listener);
        } finally {
            running.set(false);
        }
    }

    private MeasurementResult execute(MeasurementEngine engine, Consumer<MeasurementResult> listener) {
        String name = engine.name();
        Map<String, Object> metadata = Map.of();
        Double ping = null;
        Double jitter = null;
        double downloadMbps = 0;
        double uploadMbps = 0;

        log.info("Starting {} measurement", name);
        try {
            if (engine.hasDiscovery()) {
                transition(RunState.DISCOVERING);
                emit(listener, live(0, 0, null, null, "Discovering " + name + " endpoints...", metadata));
                Map<String, Object> found = engine.discover(lifecycle);
                if (lifecycle.isUserCancelled()) {
                    return cancelled(listener, 0, 0, null, null, metadata);
                }
                if (found == null || found.isEmpty()) {
                    throw new DiscoveryException(name + " discovery failed.");
                }
                metadata = Map.copyOf(found);
                log.info("Discovered target: {}", metadata);
            }

            if (engine.hasLatencyTest()) {
                transition(RunState.MEASURING_LATENCY);
                emit(listener, live(0, 0, null, null, "Measuring latency...", metadata));
                LatencyResult latency = engine.measureLatency(lifecycle, metadata);
                if (lifecycle.isUserCancelled()) {
                    return cancelled(listener, 0, 0, null, null, metadata);
                }
                ping = latency.pingMs();
                jitter = latency.jitterMs();
                emit(listener, live(0, 0, ping, jitter, String.format("Ping: %.1f ms", ping), metadata));
                if (lifecycle.awaitCancellation(settings.latencyPause().toMillis())) {
                    return cancelled(listener, 0, 0, ping, jitter, metadata);
                }
            }

            downloadMbps = runPhase(engine, listener, metadata, true, 0, ping, jitter);
            log.info("{} download: {} Mbps", name, String.format("%.2f", downloadMbps));
            if (lifecycle.isUserCancelled()) {
                return cancelled(listener, downloadMbps, 0, ping, jitter, metadata);
            }

            if (engine.hasUpload()) {
                if (lifecycle.awaitCancellation(settings.interPhasePause().toMillis())) {
                    return cancelled(listener, downloadMbps, 0, ping, jitter, metadata);
                }
                uploadMbps = runPhase(engine, listener, metadata, false, downloadMbps, ping, jitter);
                log.info("{} upload: {} Mbps", name, String.format("%.2f", uploadMbps));
                if (lifecycle.isUserCancelled()) {
                    return cancelled(listener, downloadMbps, uploadMbps, ping, jitter, metadata);
                }
            }

            transition(RunState.DONE);
            MeasurementResult done = new MeasurementResult(downloadMbps, uploadMbps, ping, jitter,
                    true, null, "Complete", RunState.DONE, merged(metadata));
            emit(listener, done);
            return done;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lifecycle.cancel();
            return cancelled(listener, downloadMbps, uploadMbps, ping, jitter, metadata);
        } catch (Exception e) {
            if (lifecycle.isUserCancelled()) {
                return cancelled(listener, downloadMbps, uploadMbps, ping, jitter, metadata);
            }
            String message = e instanceof DiscoveryException ? e.getMessage() : e.toString();
            log.error("{} measurement failed: {}", name, message);
            transition(RunState.ERROR);
            MeasurementResult failure = MeasurementResult.failure(message, RunState.ERROR, merged(metadata));
            emit(listener, failure);
            return failure;
        }
    }

    /**
     * One timed phase. Returns the meter's exact average, also when the
     * deadline or a cancellation cut the phase short.
     */
    private double runPhase(MeasurementEngine engine, Consumer<MeasurementResult> listener,
                            Map<String, Object> metadata, boolean download, double downloadMbps,
                            Double ping, Double jitter) throws InterruptedException {
        RunState phaseState = download ? RunState.DOWNLOADING : RunState.UPLOADING;
        String phase = download ? "download" : "upload";
        transition(phaseState);
        emit(listener, new MeasurementResult(downloadMbps, 0, ping, jitter, false, null,
                download ? "Testing download..." : "Testing upload...", phaseState, merged(metadata)));

        Duration duration = settings.phaseDuration();
        ThroughputMeter meter = new ThroughputMeter(duration);
        AtomicBoolean open = new AtomicBoolean(true);
        meter.start();
        lifecycle.beginPhase();

        ScheduledFuture<?> killTimer = lifecycle.schedule(phase + "-deadline", () -> {
            log.debug("{} deadline reached", phase);
            lifecycle.timeoutPhase();
        }, duration);

        ScheduledFuture<?> ticker = lifecycle.scheduleAtFixedRate(phase + "-ticker", () -> {
            if (lifecycle.shouldStop()) return;
            double mbps = meter.tick();
            MeasurementResult live = new MeasurementResult(download ? mbps : downloadMbps, download ? 0 : mbps,
                    ping, jitter, false, null, download ? "Downloading" : "Uploading", phaseState, merged(metadata));
            synchronized (emitLock) {
                if (open.get()) emit(listener, live);
            }
        }, settings.tickInterval());

        lifecycle.launchWorker(phase + "-engine", () -> {
            try {
                if (download) {
                    engine.runDownload(lifecycle, meter::addBytes, metadata);
                } else {
                    engine.runUpload(lifecycle, meter::addBytes, metadata);
                }
            } finally {
                lifecycle.completePhase();
            }
        });

        lifecycle.awaitPhaseComplete();
        lifecycle.awaitAllWorkers();
        synchronized (emitLock) {
            open.set(false);
        }
        lifecycle.cancelTimer(ticker);
        lifecycle.cancelTimer(killTimer);

        double mbps = meter.finish();
        log.debug("{} phase finished: {} bytes, timedOut={}, cancelled={}", phase, meter.totalBytes(),
                lifecycle.isTimedOut(), lifecycle.isUserCancelled());
        return mbps;
    }

    // --- Results ---

    private MeasurementResult live(double dl, double ul, Double ping, Double jitter, String status,
                                   Map<String, Object> metadata) {
        return new MeasurementResult(dl, ul, ping, jitter, false, null, status, state, merged(metadata));
    }

    private MeasurementResult cancelled(Consumer<MeasurementResult> listener, double dl, double ul,
                                        Double ping, Double jitter, Map<String, Object> metadata) {
        log.info("Measurement cancelled");
        transition(RunState.CANCELLED);
        MeasurementResult result = new MeasurementResult(dl, ul, ping, jitter, true, null,
                "Cancelled", RunState.CANCELLED, merged(metadata));
        emit(listener, result);
        return result;
    }

    private Map<String, Object> merged(Map<String, Object> metadata) {
        Map<String, Object> m = new LinkedHashMap<>(metadata);
        m.putAll(lifecycle.annotations());
        return m;
    }

    private void emit(Consumer<MeasurementResult> listener, MeasurementResult result) {
        synchronized (emitLock) {
            try {
                listener.accept(result);
            } catch (RuntimeException e) {
                log.warn("Result listener failed: {}", e.toString());
            }
        }
    }

    private void transition(RunState newState) {
        this.state = newState;
        Consumer<RunState> l = stateListener;
        if (l != null) l.accept(newState);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
