package com.alterante.speedtest.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns every connection, socket, timer and worker created during a run and
 * can destroy all of them at once.
 *
 * Two stop signals exist: {@code userCancelled} (sticky for the whole run) and
 * {@code timedOut} (scoped to the current phase, cleared by {@link #beginPhase}).
 * Registration and teardown share one lock, so a handle registered after a stop
 * signal is destroyed immediately instead of being tracked.
 *
 * <pre>
 * teardown order:
 *   1. cancel timers
 *   2. destroy sockets (SO_LINGER 0, then close)
 *   3. force-close clients
 *   4. release the phase barrier
 * </pre>
 */
public class ResourceLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ResourceLifecycle.class);

    private final ExecutorService workerPool;
    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();

    private final Set<Closeable> clients = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Socket> sockets = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Future<?>> timers = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<Future<?>> workers = new ArrayList<>();
    private final Map<String, Object> annotations = new LinkedHashMap<>();

    private volatile boolean userCancelled;
    private volatile boolean timedOut;
    private volatile CountDownLatch phase = new CountDownLatch(0);

    public ResourceLifecycle(ExecutorService workerPool, ScheduledExecutorService scheduler) {
        this.workerPool = workerPool;
        this.scheduler = scheduler;
    }

    public boolean isUserCancelled() { return userCancelled; }
    public boolean isTimedOut() { return timedOut; }
    public boolean shouldStop() { return userCancelled || timedOut; }

    // --- Registration ---

    /** Track a closeable client. Destroyed immediately if a stop signal is already set. */
    public void registerClient(Closeable client) {
        synchronized (lock) {
            if (!shouldStop()) {
                clients.add(client);
                return;
            }
        }
        forceClose(client);
    }

    /** Track a socket, normally before it is connected so a stalled connect can be aborted. */
    public void registerSocket(Socket socket) {
        synchronized (lock) {
            if (!shouldStop()) {
                sockets.add(socket);
                return;
            }
        }
        destroy(socket);
    }

    /** Track a timer. Cancelled immediately if a stop signal is already set. */
    public void registerTimer(Future<?> timer) {
        synchronized (lock) {
            if (!shouldStop()) {
                timers.add(timer);
                return;
            }
        }
        timer.cancel(false);
    }

    /**
     * Close a client registered earlier. Does nothing if teardown already
     * claimed it, so every client is closed exactly once.
     */
    public void closeClient(Closeable client) {
        boolean owned;
        synchronized (lock) {
            owned = clients.remove(client);
        }
        if (owned) forceClose(client);
    }

    /** Destroy a socket registered earlier. Exactly-once, like {@link #closeClient}. */
    public void closeSocket(Socket socket) {
        boolean owned;
        synchronized (lock) {
            owned = sockets.remove(socket);
        }
        if (owned) destroy(socket);
    }

    /** Cancel a timer registered earlier. */
    public void cancelTimer(Future<?> timer) {
        boolean owned;
        synchronized (lock) {
            owned = timers.remove(timer);
        }
        if (owned) timer.cancel(false);
    }

    /** Schedule a one-shot task and track it as a timer. */
    public ScheduledFuture<?> schedule(String name, Runnable task, Duration delay) {
        ScheduledFuture<?> timer = scheduler.schedule(guarded(name, task),
                delay.toNanos(), TimeUnit.NANOSECONDS);
        registerTimer(timer);
        return timer;
    }

    /** Schedule a periodic task and track it as a timer. */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, Duration period) {
        long nanos = period.toNanos();
        ScheduledFuture<?> timer = scheduler.scheduleAtFixedRate(guarded(name, task),
                nanos, nanos, TimeUnit.NANOSECONDS);
        registerTimer(timer);
        return timer;
    }

    // --- Workers ---

    /**
     * Run a worker on the pool. Failures are logged and swallowed: one broken
     * connection must not abort a measurement phase.
     */
    public Future<?> launchWorker(String name, Worker body) {
        Future<?> future = workerPool.submit(() -> {
            try {
                body.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Worker {} interrupted", name);
            } catch (Exception e) {
                if (shouldStop()) {
                    log.debug("Worker {} ended during teardown: {}", name, e.toString());
                } else {
                    log.warn("Worker {} failed: {}", name, e.toString());
                }
            }
        });
        synchronized (lock) {
            workers.add(future);
        }
        return future;
    }

    /** Wait for the given workers to finish. */
    public void awaitWorkers(Collection<? extends Future<?>> pending) throws InterruptedException {
        for (Future<?> f : pending) {
            try {
                f.get();
            } catch (ExecutionException e) {
                log.debug("Worker completed exceptionally: {}", e.getCause().toString());
            } catch (CancellationException e) {
                log.debug("Worker was cancelled");
            }
        }
    }

    /**
     * Wait for every launched worker, including workers launched while waiting,
     * then forget them.
     */
    public void awaitAllWorkers() throws InterruptedException {
        while (true) {
            List<Future<?>> pending;
            synchronized (lock) {
                if (workers.isEmpty()) return;
                pending = new ArrayList<>(workers);
                workers.clear();
            }
            awaitWorkers(pending);
        }
    }

    // --- Phase barrier ---

    /** Start a new measurement phase: clears the phase timeout and arms a fresh barrier. */
    public void beginPhase() {
        synchronized (lock) {
            timedOut = false;
            phase = new CountDownLatch(1);
        }
    }

    /** Release the phase barrier. Idempotent. */
    public void completePhase() {
        phase.countDown();
    }

    public boolean isPhaseComplete() {
        return phase.getCount() == 0;
    }

    /** Block until the phase completes naturally, times out, or is cancelled. */
    public void awaitPhaseComplete() throws InterruptedException {
        phase.await();
    }

    /** Phase deadline reached: stop everything and release the barrier. No-op if already stopping. */
    public void timeoutPhase() {
        Teardown teardown;
        synchronized (lock) {
            if (shouldStop()) return;
            timedOut = true;
            teardown = drain();
            lock.notifyAll();
        }
        teardown.run();
        completePhase();
    }

    /**
     * User cancellation: stop everything and release the barrier. Sticky for the
     * rest of the run. If the phase already timed out, the registries are empty
     * and only the flag changes.
     */
    public void cancel() {
        Teardown teardown;
        synchronized (lock) {
            if (userCancelled) return;
            boolean alreadyStopping = timedOut;
            userCancelled = true;
            teardown = alreadyStopping ? Teardown.EMPTY : drain();
            lock.notifyAll();
        }
        log.info("Cancellation requested");
        teardown.run();
        completePhase();
    }

    /** Forget all state for a new run. */
    public void reset() {
        synchronized (lock) {
            userCancelled = false;
            timedOut = false;
            clients.clear();
            sockets.clear();
            timers.clear();
            workers.clear();
            annotations.clear();
            phase = new CountDownLatch(0);
        }
    }

    // --- Stop-aware waiting ---

    /**
     * Sleep up to {@code millis}, waking early on any stop signal.
     *
     * @return true if the full delay elapsed without a stop signal
     */
    public boolean pause(long millis) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        synchronized (lock) {
            while (!shouldStop()) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) return true;
                lock.wait(remaining);
            }
        }
        return false;
    }

    /**
     * Sleep up to {@code millis}, waking early only on user cancellation.
     * Used between phases, where a phase timeout must not shorten the pause.
     *
     * @return true if the run was cancelled
     */
    public boolean awaitCancellation(long millis) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        synchronized (lock) {
            while (!userCancelled) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) return false;
                lock.wait(remaining);
            }
        }
        return true;
    }

    // --- Annotations ---

    /** Attach a value to the run's result metadata (e.g. the upload tier in use). */
    public void annotate(String key, Object value) {
        synchronized (lock) {
            if (value == null) {
                annotations.remove(key);
            } else {
                annotations.put(key, value);
            }
        }
    }

    public Map<String, Object> annotations() {
        synchronized (lock) {
            return new LinkedHashMap<>(annotations);
        }
    }

    // --- Introspection ---

    public int clientCount() { synchronized (lock) { return clients.size(); } }
    public int socketCount() { synchronized (lock) { return sockets.size(); } }
    public int timerCount() { synchronized (lock) { return timers.size(); } }
    public int workerCount() { synchronized (lock) { return workers.size(); } }

    // --- Internals ---

    private Teardown drain() {
        Teardown t = new Teardown(new ArrayList<>(timers), new ArrayList<>(sockets), new ArrayList<>(clients));
        timers.clear();
        sockets.clear();
        clients.clear();
        return t;
    }

    private Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Timer {} failed: {}", name, e.toString());
            }
        };
    }

    static void destroy(Socket socket) {
        try {
            if (!socket.isClosed()) {
                socket.setSoLinger(true, 0);
            }
        } catch (IOException e) {
            log.debug("SO_LINGER not applied: {}", e.getMessage());
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Socket close failed: {}", e.getMessage());
        }
    }

    static void forceClose(Closeable client) {
        try {
            client.close();
        } catch (IOException e) {
            log.debug("Client close failed: {}", e.getMessage());
        }
    }

    private record Teardown(List<Future<?>> timers, List<Socket> sockets, List<Closeable> clients) {
        static final Teardown EMPTY = new Teardown(List.of(), List.of(), List.of());

        void run() {
            for (Future<?> t : timers) t.cancel(false);
            for (Socket s : sockets) destroy(s);
            for (Closeable c : clients) forceClose(c);
            if (!timers.isEmpty() || !sockets.isEmpty() || !clients.isEmpty()) {
                log.debug("Teardown: {} timers, {} sockets, {} clients",
                        timers.size(), sockets.size(), clients.size());
            }
        }
    }
}
