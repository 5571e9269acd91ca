package com.alterante.speedtest.engine;

/**
 * Measurement run states.
 */
public enum RunState {
    IDLE,
    DISCOVERING,
    MEASURING_LATENCY,
    DOWNLOADING,
    UPLOADING,
    DONE,
    CANCELLED,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == ERROR;
    }
}
