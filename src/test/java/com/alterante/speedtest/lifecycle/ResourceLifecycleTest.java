package com.alterante.speedtest.lifecycle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Closeable;
import java.net.Socket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResourceLifecycleTest {

    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private ResourceLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        lifecycle = new ResourceLifecycle(workers, scheduler);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        scheduler.shutdownNow();
    }

    /** Closeable that counts how often it was closed. */
    private static final class CountingClient implements Closeable {
        final AtomicInteger closes = new AtomicInteger();

        @Override
        public void close() {
            closes.incrementAndGet();
        }
    }

    @Test
    void cancelClosesEveryHandleExactlyOnce() {
        CountingClient a = new CountingClient();
        CountingClient b = new CountingClient();
        Socket socket = new Socket();
        lifecycle.registerClient(a);
        lifecycle.registerClient(b);
        lifecycle.registerSocket(socket);
        ScheduledFuture<?> timer = lifecycle.schedule("never", () -> { }, Duration.ofMinutes(5));

        lifecycle.closeClient(a);
        lifecycle.cancel();
        lifecycle.cancel();
        lifecycle.closeClient(b);

        assertEquals(1, a.closes.get());
        assertEquals(1, b.closes.get());
        assertTrue(socket.isClosed());
        assertTrue(timer.isCancelled());
        assertEquals(0, lifecycle.clientCount());
        assertEquals(0, lifecycle.socketCount());
        assertEquals(0, lifecycle.timerCount());
        assertTrue(lifecycle.isUserCancelled());
        assertTrue(lifecycle.isPhaseComplete());
    }

    @Test
    void registrationAfterStopDestroysImmediately() {
        lifecycle.cancel();
        CountingClient late = new CountingClient();
        Socket socket = new Socket();

        lifecycle.registerClient(late);
        lifecycle.registerSocket(socket);

        assertEquals(1, late.closes.get());
        assertTrue(socket.isClosed());
        assertEquals(0, lifecycle.clientCount());
        assertEquals(0, lifecycle.socketCount());
    }

    @Test
    void timeoutReleasesPhaseAndIsIdempotent() {
        CountingClient client = new CountingClient();
        lifecycle.beginPhase();
        lifecycle.registerClient(client);
        assertFalse(lifecycle.isPhaseComplete());

        lifecycle.timeoutPhase();
        lifecycle.timeoutPhase();

        assertTrue(lifecycle.isTimedOut());
        assertFalse(lifecycle.isUserCancelled());
        assertTrue(lifecycle.shouldStop());
        assertTrue(lifecycle.isPhaseComplete());
        assertEquals(1, client.closes.get());
    }

    @Test
    void cancelAfterTimeoutOnlySetsFlag() {
        lifecycle.beginPhase();
        lifecycle.timeoutPhase();
        lifecycle.cancel();
        assertTrue(lifecycle.isUserCancelled());
        assertTrue(lifecycle.isTimedOut());
    }

    @Test
    void beginPhaseClearsTimeoutButNotCancellation() {
        lifecycle.beginPhase();
        lifecycle.timeoutPhase();
        lifecycle.beginPhase();
        assertFalse(lifecycle.isTimedOut());
        assertFalse(lifecycle.shouldStop());
        assertFalse(lifecycle.isPhaseComplete());

        lifecycle.cancel();
        lifecycle.beginPhase();
        assertTrue(lifecycle.isUserCancelled());
        assertTrue(lifecycle.shouldStop());
    }

    @Test
    void resetForgetsStopSignals() {
        lifecycle.annotate("k", "v");
        lifecycle.cancel();
        lifecycle.reset();
        assertFalse(lifecycle.shouldStop());
        assertTrue(lifecycle.annotations().isEmpty());
    }

    @Test
    void launchWorkerSwallowsFailures() throws Exception {
        AtomicInteger ran = new AtomicInteger();
        lifecycle.launchWorker("broken", () -> {
            ran.incrementAndGet();
            throw new IllegalStateException("boom");
        });
        lifecycle.launchWorker("fine", ran::incrementAndGet);

        lifecycle.awaitAllWorkers();
        assertEquals(2, ran.get());
        assertEquals(0, lifecycle.workerCount());
    }

    @Test
    void pauseWakesOnCancel() throws Exception {
        Future<Boolean> sleeper = workers.submit(() -> lifecycle.pause(10_000));
        Thread.sleep(100);
        long start = System.nanoTime();
        lifecycle.cancel();
        assertFalse(sleeper.get(2, TimeUnit.SECONDS));
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(2));
    }

    @Test
    void pauseElapsesWithoutStopSignal() throws Exception {
        assertTrue(lifecycle.pause(20));
    }

    @Test
    void awaitCancellationIgnoresPhaseTimeout() throws Exception {
        lifecycle.beginPhase();
        lifecycle.timeoutPhase();
        long start = System.nanoTime();
        assertFalse(lifecycle.awaitCancellation(100));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));

        lifecycle.cancel();
        assertTrue(lifecycle.awaitCancellation(10_000));
    }

    @Test
    void scheduledTimerRuns() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        lifecycle.schedule("once", fired::countDown, Duration.ofMillis(10));
        assertTrue(fired.await(2, TimeUnit.SECONDS));
    }

    @Test
    void annotationsAreCopiedAndRemovable() {
        lifecycle.annotate("uploadTier", "primary");
        lifecycle.annotate("streams", 4);
        Map<String, Object> snapshot = lifecycle.annotations();
        lifecycle.annotate("uploadTier", null);

        assertEquals("primary", snapshot.get("uploadTier"));
        assertFalse(lifecycle.annotations().containsKey("uploadTier"));
        assertEquals(4, lifecycle.annotations().get("streams"));
    }
}
