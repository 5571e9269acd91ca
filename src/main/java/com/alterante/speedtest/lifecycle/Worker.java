package com.alterante.speedtest.lifecycle;

/**
 * Body of a worker launched through {@link ResourceLifecycle#launchWorker}.
 */
@FunctionalInterface
public interface Worker {
    void run() throws Exception;
}
