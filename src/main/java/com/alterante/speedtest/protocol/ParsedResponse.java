package com.alterante.speedtest.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * One completed HTTP response.
 *
 * A status code of 0 is the sentinel for "connection closed or failed before
 * a response completed"; see {@link #closed()}.
 *
 * @param statusCode HTTP status, or 0 for the closed sentinel
 * @param bodyBytes  decoded body length (chunk framing excluded)
 * @param headers    header map with lower-case names
 * @param body       captured body prefix, empty unless capture was requested
 */
public record ParsedResponse(int statusCode, long bodyBytes, Map<String, String> headers, byte[] body) {

    private static final ParsedResponse CLOSED = new ParsedResponse(0, 0, Map.of(), new byte[0]);

    public static ParsedResponse closed() {
        return CLOSED;
    }

    public boolean isClosed() {
        return statusCode == 0;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isRedirect() {
        return (statusCode == 301 || statusCode == 302 || statusCode == 303
                || statusCode == 307 || statusCode == 308) && header("location") != null;
    }

    /** Header value by case-insensitive name, or null. */
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
