package com.alterante.speedtest.net;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The target a run settled on during discovery. Immutable; travels to the
 * download and upload workers as a metadata map.
 *
 * @param edgeId        server-reported edge identifier, or null
 * @param contentLength size of the object in bytes, or -1 if unknown
 */
public record TargetDescriptor(URI uri, String edgeId, long contentLength, EdgeClass classification,
                               String edgeIp, long probeRttMs) {

    public static final String KEY_URL = "url";
    public static final String KEY_EDGE_ID = "edgeId";
    public static final String KEY_CONTENT_LENGTH = "contentLength";
    public static final String KEY_CLASSIFICATION = "classification";
    public static final String KEY_EDGE_IP = "edgeIp";
    public static final String KEY_PROBE_RTT_MS = "probeRttMs";

    public static TargetDescriptor fromProbe(ProbeResult probe, String edgeId) {
        return new TargetDescriptor(probe.finalUri(), edgeId, probe.contentLength(),
                EdgeClass.classify(probe.rttMs()), probe.edgeIp(), probe.rttMs());
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_URL, uri.toString());
        if (edgeId != null) m.put(KEY_EDGE_ID, edgeId);
        if (contentLength >= 0) m.put(KEY_CONTENT_LENGTH, contentLength);
        if (classification != null) m.put(KEY_CLASSIFICATION, classification.label());
        if (edgeIp != null) m.put(KEY_EDGE_IP, edgeIp);
        m.put(KEY_PROBE_RTT_MS, probeRttMs);
        return Collections.unmodifiableMap(m);
    }

    /** URL from a metadata map produced by {@link #toMetadata()}. */
    public static URI uriOf(Map<String, Object> metadata) {
        Object url = metadata.get(KEY_URL);
        if (url == null) throw new IllegalArgumentException("metadata has no " + KEY_URL);
        return URI.create(url.toString());
    }

    /** Content length from a metadata map, or -1. */
    public static long contentLengthOf(Map<String, Object> metadata) {
        Object v = metadata.get(KEY_CONTENT_LENGTH);
        return v instanceof Number ? ((Number) v).longValue() : -1;
    }
}
