package com.alterante.speedtest.engine.cdn;

import java.net.URI;

/**
 * One upload transport alternative.
 *
 * @param persistent keep the connection open across requests; otherwise every POST gets a fresh connection
 */
public record UploadTier(String name, URI uri, boolean persistent) {
}
