package com.alterante.speedtest.net;

import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of probing one candidate URL, after redirects.
 *
 * @param finalUri  URI that produced the final response (redirects applied)
 * @param rttMs     duration of the final request/response exchange
 * @param edgeIp    address of the server that answered, if connected
 * @param failure   reason the probe failed, or null on success
 */
public record ProbeResult(boolean success, URI finalUri, int statusCode, Map<String, String> headers,
                          long bodyBytes, long rttMs, String edgeIp, String failure) {

    public static ProbeResult failed(URI uri, String reason, long rttMs) {
        return new ProbeResult(false, uri, 0, Map.of(), 0, rttMs, null, reason);
    }

    public static ProbeResult succeeded(URI finalUri, int statusCode, Map<String, String> headers,
                                        long bodyBytes, long rttMs, String edgeIp) {
        return new ProbeResult(true, finalUri, statusCode, headers, bodyBytes, rttMs, edgeIp, null);
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Total size of the resource: the total from {@code Content-Range} if present,
     * otherwise {@code Content-Length}, otherwise -1.
     */
    public long contentLength() {
        String range = header("content-range");
        if (range != null) {
            int slash = range.lastIndexOf('/');
            if (slash >= 0) {
                long total = parseLong(range.substring(slash + 1));
                if (total >= 0) return total;
            }
        }
        String length = header("content-length");
        return length != null ? parseLong(length) : -1;
    }

    public boolean acceptsRanges() {
        if (statusCode == 206) return true;
        String ranges = header("accept-ranges");
        return ranges != null && ranges.toLowerCase(Locale.ROOT).contains("bytes");
    }

    public String contentType() {
        String type = header("content-type");
        return type != null ? type.toLowerCase(Locale.ROOT) : "";
    }

    private static long parseLong(String s) {
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
