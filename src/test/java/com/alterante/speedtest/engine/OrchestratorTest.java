package com.alterante.speedtest.engine;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.meter.LatencyResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongConsumer;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorTest {

    private static final RunSettings FAST = new RunSettings(Duration.ofMillis(500), Duration.ofMillis(50),
            Duration.ZERO, Duration.ZERO);

    /** Moves 10 KB every 10 ms until told to stop. */
    private static class FakeEngine implements MeasurementEngine {
        final AtomicBoolean downloadCalled = new AtomicBoolean();
        final CountDownLatch downloading = new CountDownLatch(1);

        @Override
        public String name() {
            return "fake";
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
            return Map.of("url", "http://fake.example/file");
        }

        @Override
        public LatencyResult measureLatency(ResourceLifecycle lifecycle, Map<String, Object> metadata) {
            return new LatencyResult(12.5, 1.5, 10);
        }

        @Override
        public void runDownload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
                throws IOException, InterruptedException {
            downloadCalled.set(true);
            downloading.countDown();
            pump(lifecycle, onBytes);
        }

        @Override
        public void runUpload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
                throws InterruptedException {
            lifecycle.annotate("uploadTier", "primary");
            pump(lifecycle, onBytes);
        }

        static void pump(ResourceLifecycle lifecycle, LongConsumer onBytes) throws InterruptedException {
            while (lifecycle.pause(10)) {
                onBytes.accept(10_000);
            }
        }
    }

    @Test
    void runsFullPhaseSequence() {
        List<RunState> states = new CopyOnWriteArrayList<>();
        List<MeasurementResult> results = new CopyOnWriteArrayList<>();
        MeasurementResult result;
        try (Orchestrator orchestrator = new Orchestrator(FAST)) {
            orchestrator.setStateListener(states::add);
            result = orchestrator.run(new FakeEngine(), results::add);
            assertEquals(RunState.DONE, orchestrator.state());
        }

        assertEquals(List.of(RunState.DISCOVERING, RunState.MEASURING_LATENCY, RunState.DOWNLOADING,
                RunState.UPLOADING, RunState.DONE), states);
        assertTrue(result.done());
        assertNull(result.error());
        assertEquals("Complete", result.status());
        assertTrue(result.downloadMbps() > 0);
        assertTrue(result.uploadMbps() > 0);
        assertEquals(12.5, result.pingMs());
        assertEquals(1.5, result.jitterMs());
        assertEquals("http://fake.example/file", result.metadata().get("url"));
        assertEquals("primary", result.metadata().get("uploadTier"));

        // Exactly one terminal result, and it is the last one.
        assertEquals(result, results.get(results.size() - 1));
        assertEquals(1, results.stream().filter(MeasurementResult::isTerminal).count());
        assertTrue(results.stream().anyMatch(r -> r.state() == RunState.DOWNLOADING && r.status().equals("Downloading")));
    }

    @Test
    void skipsOptionalStepsEngineDoesNotSupport() {
        MeasurementEngine downloadOnly = new MeasurementEngine() {
            @Override
            public String name() {
                return "download-only";
            }

            @Override
            public boolean hasUpload() {
                return false;
            }

            @Override
            public void runDownload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
                    throws InterruptedException {
                FakeEngine.pump(lifecycle, onBytes);
            }
        };
        List<RunState> states = new CopyOnWriteArrayList<>();
        MeasurementResult result;
        try (Orchestrator orchestrator = new Orchestrator(FAST)) {
            orchestrator.setStateListener(states::add);
            result = orchestrator.run(downloadOnly, null);
        }
        assertEquals(List.of(RunState.DOWNLOADING, RunState.DONE), states);
        assertTrue(result.downloadMbps() > 0);
        assertEquals(0.0, result.uploadMbps());
        assertNull(result.pingMs());
    }

    @Test
    void failedDiscoveryEndsInErrorWithZeroSpeeds() {
        FakeEngine engine = new FakeEngine() {
            @Override
            public Map<String, Object> discover(ResourceLifecycle lifecycle) {
                return null;
            }
        };
        MeasurementResult result;
        try (Orchestrator orchestrator = new Orchestrator(FAST)) {
            result = orchestrator.run(engine, null);
            assertEquals(RunState.ERROR, orchestrator.state());
        }
        assertEquals("fake discovery failed.", result.error());
        assertEquals(RunState.ERROR, result.state());
        assertFalse(result.done());
        assertEquals(0.0, result.downloadMbps());
        assertEquals(0.0, result.uploadMbps());
        assertFalse(engine.downloadCalled.get());
    }

    @Test
    void unexpectedExceptionEndsInError() {
        FakeEngine engine = new FakeEngine() {
            @Override
            public LatencyResult measureLatency(ResourceLifecycle lifecycle, Map<String, Object> metadata) {
                throw new IllegalStateException("probe exploded");
            }
        };
        try (Orchestrator orchestrator = new Orchestrator(FAST)) {
            MeasurementResult result = orchestrator.run(engine, null);
            assertEquals(RunState.ERROR, result.state());
            assertTrue(result.error().contains("probe exploded"));
        }
    }

    @Test
    void cancelDuringDownloadEndsPromptly() throws Exception {
        RunSettings slow = FAST.withPhaseDuration(Duration.ofSeconds(30));
        FakeEngine engine = new FakeEngine();
        try (Orchestrator orchestrator = new Orchestrator(slow)) {
            CompletableFuture<MeasurementResult> future = orchestrator.start(engine, null);
            assertTrue(engine.downloading.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);

            long start = System.nanoTime();
            orchestrator.cancel();
            MeasurementResult result = future.get(5, TimeUnit.SECONDS);

            assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(3));
            assertEquals(RunState.CANCELLED, result.state());
            assertEquals("Cancelled", result.status());
            assertTrue(result.done());
            assertEquals(0.0, result.uploadMbps());
            assertEquals(0, orchestrator.lifecycle().timerCount());
        }
    }

    @Test
    void engineReturningEarlyEndsPhaseBeforeDeadline() {
        MeasurementEngine burst = new MeasurementEngine() {
            @Override
            public String name() {
                return "burst";
            }

            @Override
            public boolean hasUpload() {
                return false;
            }

            @Override
            public void runDownload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
                    throws InterruptedException {
                onBytes.accept(1_000_000);
                Thread.sleep(100);
            }
        };
        long start = System.nanoTime();
        try (Orchestrator orchestrator = new Orchestrator(FAST.withPhaseDuration(Duration.ofSeconds(30)))) {
            MeasurementResult result = orchestrator.run(burst, null);
            assertEquals(RunState.DONE, result.state());
            assertTrue(result.downloadMbps() > 0);
        }
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(10));
    }

    @Test
    void refusesConcurrentRun() throws Exception {
        FakeEngine engine = new FakeEngine();
        try (Orchestrator orchestrator = new Orchestrator(FAST.withPhaseDuration(Duration.ofSeconds(30)))) {
            orchestrator.start(engine, null);
            assertTrue(engine.downloading.await(5, TimeUnit.SECONDS));
            assertThrows(IllegalStateException.class, () -> orchestrator.run(new FakeEngine(), null));
        }
    }

    @Test
    void listenerFailureDoesNotAbortRun() {
        try (Orchestrator orchestrator = new Orchestrator(FAST)) {
            MeasurementResult result = orchestrator.run(new FakeEngine(), r -> {
                throw new IllegalStateException("listener broke");
            });
            assertEquals(RunState.DONE, result.state());
        }
    }
}
