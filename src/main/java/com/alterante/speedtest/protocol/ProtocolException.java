package com.alterante.speedtest.protocol;

/**
 * Thrown when a response violates HTTP/1.1 framing: malformed status line,
 * oversized or malformed headers, bad chunk framing. The connection that
 * produced it cannot be reused.
 */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
