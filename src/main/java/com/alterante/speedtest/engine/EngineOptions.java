package com.alterante.speedtest.engine;

import java.net.URI;
import java.util.List;

/**
 * Target overrides for an engine. Empty lists and null URLs mean
 * "use the engine's built-in defaults".
 *
 * @param targets         download targets or discovery candidates, in priority order
 * @param uploadTargets   primary upload endpoints, tried before the fallback tiers
 * @param catalogUrl      JSON target list for catalog-driven engines
 * @param sharedUploadUrl last-resort upload endpoint shared by every engine
 */
public record EngineOptions(List<URI> targets, List<URI> uploadTargets, URI catalogUrl, URI sharedUploadUrl) {

    public EngineOptions {
        targets = targets == null ? List.of() : List.copyOf(targets);
        uploadTargets = uploadTargets == null ? List.of() : List.copyOf(uploadTargets);
    }

    public EngineOptions(List<URI> targets, List<URI> uploadTargets, URI catalogUrl) {
        this(targets, uploadTargets, catalogUrl, null);
    }

    public static EngineOptions defaults() {
        return new EngineOptions(List.of(), List.of(), null, null);
    }

    public List<URI> targetsOr(List<URI> fallback) {
        return targets.isEmpty() ? fallback : targets;
    }

    public URI catalogUrlOr(URI fallback) {
        return catalogUrl != null ? catalogUrl : fallback;
    }

    public URI sharedUploadUrlOr(URI fallback) {
        return sharedUploadUrl != null ? sharedUploadUrl : fallback;
    }
}
