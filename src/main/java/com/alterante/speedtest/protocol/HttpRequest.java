package com.alterante.speedtest.protocol;

import com.alterante.speedtest.transport.ByteRange;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds raw HTTP/1.1 request bytes for {@code HttpConnection}.
 *
 * Every request disables compression and caching so that wire bytes equal
 * counted bytes and no zero-byte 304 can short-circuit a measurement.
 *
 * <pre>
 * GET /path?query HTTP/1.1
 * Host: example.net[:port]
 * User-Agent: alt-speedtest/0.1
 * Accept: *&#47;*
 * Accept-Encoding: identity
 * Cache-Control: no-store, no-cache
 * Pragma: no-cache
 * Connection: keep-alive
 * [Range: bytes=a-b]
 * [Content-Type / Content-Length]
 * </pre>
 */
public final class HttpRequest {

    public static final String USER_AGENT = "alt-speedtest/0.1";

    private final String method;
    private final URI uri;
    private final Map<String, String> headers = new LinkedHashMap<>();

    private HttpRequest(String method, URI uri) {
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("URI has no host: " + uri);
        }
        this.method = method;
        this.uri = uri;
        headers.put("Host", hostHeader(uri));
        headers.put("User-Agent", USER_AGENT);
        headers.put("Accept", "*/*");
        headers.put("Accept-Encoding", "identity");
        headers.put("Cache-Control", "no-store, no-cache");
        headers.put("Pragma", "no-cache");
        headers.put("Connection", "keep-alive");
    }

    public static HttpRequest get(URI uri) {
        return new HttpRequest("GET", uri);
    }

    public static HttpRequest head(URI uri) {
        return new HttpRequest("HEAD", uri);
    }

    /** POST with a body of {@code contentLength} bytes, sent separately by the caller. */
    public static HttpRequest post(URI uri, long contentLength) {
        HttpRequest r = new HttpRequest("POST", uri);
        r.headers.put("Content-Type", "application/octet-stream");
        r.headers.put("Content-Length", Long.toString(contentLength));
        return r;
    }

    /** Add or replace a header. */
    public HttpRequest header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public HttpRequest range(ByteRange range) {
        return header("Range", range.headerValue());
    }

    public HttpRequest range(long start, long end) {
        return range(new ByteRange(start, end));
    }

    public String method() { return method; }
    public URI uri() { return uri; }

    public boolean isHead() {
        return "HEAD".equals(method);
    }

    public byte[] encode() {
        StringBuilder sb = new StringBuilder(256);
        sb.append(method).append(' ').append(requestTarget(uri)).append(" HTTP/1.1\r\n");
        for (Map.Entry<String, String> h : headers.entrySet()) {
            sb.append(h.getKey()).append(": ").append(h.getValue()).append("\r\n");
        }
        sb.append("\r\n");
        return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    static String requestTarget(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        String query = uri.getRawQuery();
        return query == null ? path : path + "?" + query;
    }

    static String hostHeader(URI uri) {
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("https".equalsIgnoreCase(uri.getScheme()) && port == 443)
                || ("http".equalsIgnoreCase(uri.getScheme()) && port == 80);
        return defaultPort ? uri.getHost() : uri.getHost() + ":" + port;
    }

    /** Port for a URI, defaulting by scheme. */
    public static int port(URI uri) {
        if (uri.getPort() != -1) return uri.getPort();
        return isTls(uri) ? 443 : 80;
    }

    public static boolean isTls(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme());
    }
}
