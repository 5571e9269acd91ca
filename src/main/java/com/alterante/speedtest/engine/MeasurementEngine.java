package com.alterante.speedtest.engine;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.meter.LatencyResult;

import java.io.IOException;
import java.util.Map;
import java.util.function.LongConsumer;

/**
 * A measurement strategy. Engines discover a target and move bytes; they never
 * see the meter, the timers or the result stream. Every connection, socket and
 * worker an engine creates goes through the {@link ResourceLifecycle} it is given.
 *
 * Download and upload loops are expected to run until
 * {@link ResourceLifecycle#shouldStop()} turns true; returning earlier ends the
 * phase early.
 */
public interface MeasurementEngine {

    /** Short identifier, e.g. {@code range}. */
    String name();

    default boolean hasDiscovery() { return false; }
    default boolean hasLatencyTest() { return false; }
    default boolean hasUpload() { return true; }

    /**
     * Find a target for this run.
     *
     * @return immutable metadata handed unchanged to both phases, or null if no target validated
     */
    default Map<String, Object> discover(ResourceLifecycle lifecycle)
            throws DiscoveryException, IOException, InterruptedException {
        return Map.of();
    }

    default LatencyResult measureLatency(ResourceLifecycle lifecycle, Map<String, Object> metadata)
            throws IOException, InterruptedException {
        return LatencyResult.NONE;
    }

    /**
     * Download until stopped, reporting every byte received through {@code onBytes}.
     */
    void runDownload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws IOException, InterruptedException;

    /**
     * Upload until stopped, reporting bytes through {@code onBytes} only once they are flushed.
     */
    default void runUpload(ResourceLifecycle lifecycle, LongConsumer onBytes, Map<String, Object> metadata)
            throws IOException, InterruptedException {
        throw new UnsupportedOperationException(name() + " does not measure upload");
    }
}
