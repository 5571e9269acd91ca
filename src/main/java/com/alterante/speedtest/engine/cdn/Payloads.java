package com.alterante.speedtest.engine.cdn;

import java.util.Random;

/**
 * Upload bodies.
 */
final class Payloads {

    private Payloads() {}

    /** Pseudo-random bytes, so nothing on the path can compress them. */
    static byte[] incompressible(int size) {
        byte[] data = new byte[size];
        new Random(size).nextBytes(data);
        return data;
    }
}
