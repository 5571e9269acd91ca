package com.alterante.speedtest.net;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TargetDescriptorTest {

    @Test
    void classifiesByRoundTrip() {
        assertEquals(EdgeClass.NEAR_CACHE, EdgeClass.classify(5));
        assertEquals(EdgeClass.EDGE, EdgeClass.classify(20));
        assertEquals(EdgeClass.EDGE, EdgeClass.classify(49));
        assertEquals(EdgeClass.DISTANT, EdgeClass.classify(50));
        assertEquals("near-cache", EdgeClass.NEAR_CACHE.label());
    }

    @Test
    void builtFromProbe() {
        URI uri = URI.create("http://cdn.example.net/big.bin");
        ProbeResult probe = ProbeResult.succeeded(uri, 206,
                Map.of("content-range", "bytes 0-0/7340032", "content-length", "1"), 1, 12, "10.1.2.3");

        TargetDescriptor target = TargetDescriptor.fromProbe(probe, "cache-ams1");

        assertEquals(7_340_032, target.contentLength());
        assertEquals(EdgeClass.NEAR_CACHE, target.classification());
        Map<String, Object> metadata = target.toMetadata();
        assertEquals(uri, TargetDescriptor.uriOf(metadata));
        assertEquals(7_340_032, TargetDescriptor.contentLengthOf(metadata));
        assertEquals("cache-ams1", metadata.get(TargetDescriptor.KEY_EDGE_ID));
        assertEquals("near-cache", metadata.get(TargetDescriptor.KEY_CLASSIFICATION));
        assertEquals("10.1.2.3", metadata.get(TargetDescriptor.KEY_EDGE_IP));
    }

    @Test
    void unknownValuesAreOmitted() {
        TargetDescriptor target = new TargetDescriptor(URI.create("http://h/x"), null, -1, null, null, 80);
        Map<String, Object> metadata = target.toMetadata();
        assertFalse(metadata.containsKey(TargetDescriptor.KEY_EDGE_ID));
        assertEquals(-1, TargetDescriptor.contentLengthOf(metadata));
        assertThrows(IllegalArgumentException.class, () -> TargetDescriptor.uriOf(Map.of()));
    }
}
