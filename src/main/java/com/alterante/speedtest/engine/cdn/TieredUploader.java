package com.alterante.speedtest.engine.cdn;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered upload tiers shared by all upload workers of a phase.
 *
 * <pre>
 * success on the active tier:   failures = 0
 * failure on the active tier:   failures++
 *                               failures &gt;= MAX_CONSECUTIVE_FAILURES and not last tier:
 *                                   advance to the next tier, failures = 0
 * outcome on an older tier:     ignored (another worker already moved on)
 * </pre>
 *
 * The active tier's name is published as the {@value #ANNOTATION} run annotation.
 * The last tier is never abandoned.
 */
public class TieredUploader {

    private static final Logger log = LoggerFactory.getLogger(TieredUploader.class);

    public static final int MAX_CONSECUTIVE_FAILURES = 3;
    public static final String ANNOTATION = "uploadTier";

    private final List<UploadTier> tiers;
    private final ResourceLifecycle lifecycle;
    private int index;
    private int failures;

    public TieredUploader(List<UploadTier> tiers, ResourceLifecycle lifecycle) {
        if (tiers.isEmpty()) throw new IllegalArgumentException("at least one upload tier required");
        this.tiers = List.copyOf(tiers);
        this.lifecycle = lifecycle;
        lifecycle.annotate(ANNOTATION, this.tiers.get(0).name());
    }

    public synchronized UploadTier current() {
        return tiers.get(index);
    }

    public synchronized void onSuccess(UploadTier tier) {
        if (tier == tiers.get(index)) failures = 0;
    }

    public synchronized void onFailure(UploadTier tier, String reason) {
        if (tier != tiers.get(index)) return;
        failures++;
        log.debug("Upload tier {} failure {}/{}: {}", tier.name(), failures, MAX_CONSECUTIVE_FAILURES, reason);
        if (failures >= MAX_CONSECUTIVE_FAILURES && index < tiers.size() - 1) {
            index++;
            failures = 0;
            UploadTier next = tiers.get(index);
            log.warn("Upload tier {} abandoned ({}), falling back to {} ({})",
                    tier.name(), reason, next.name(), next.uri().getHost());
            lifecycle.annotate(ANNOTATION, next.name());
        }
    }

    public synchronized boolean isOnLastTier() {
        return index == tiers.size() - 1;
    }

    public List<UploadTier> tiers() {
        return tiers;
    }
}
