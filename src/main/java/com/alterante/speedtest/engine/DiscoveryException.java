package com.alterante.speedtest.engine;

/**
 * No discovery candidate validated. Terminal for the run; never retried.
 */
public class DiscoveryException extends Exception {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
