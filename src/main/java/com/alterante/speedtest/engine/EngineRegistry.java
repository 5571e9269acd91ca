package com.alterante.speedtest.engine;

import com.alterante.speedtest.engine.cdn.BulkHttpEngine;
import com.alterante.speedtest.engine.cdn.CatalogEngine;
import com.alterante.speedtest.engine.cdn.PersistentSocketEngine;
import com.alterante.speedtest.engine.cdn.RangeChunkEngine;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * The engines available to the command line, by name.
 */
public final class EngineRegistry {

    /** One selectable engine. A new instance is created for every run. */
    public record Entry(String name, String description, Function<EngineOptions, MeasurementEngine> factory) {

        public MeasurementEngine create(EngineOptions options) {
            return factory.apply(options);
        }
    }

    private static final List<Entry> ENTRIES = List.of(
            new Entry("bulk", "Parallel persistent GETs of one large object, no discovery",
                    BulkHttpEngine::new),
            new Entry("range", "Edge discovery, latency probe, adaptive range-chunked download with ramp-up",
                    RangeChunkEngine::new),
            new Entry("socket", "Edge discovery by full GET, raw persistent sockets, sliced uploads",
                    PersistentSocketEngine::new),
            new Entry("catalog", "JSON target catalog, latency-dependent stream count",
                    CatalogEngine::new));

    private EngineRegistry() {}

    public static List<Entry> entries() {
        return ENTRIES;
    }

    public static Optional<Entry> byName(String name) {
        return ENTRIES.stream().filter(e -> e.name().equalsIgnoreCase(name)).findFirst();
    }

    public static List<String> names() {
        return ENTRIES.stream().map(Entry::name).toList();
    }
}
