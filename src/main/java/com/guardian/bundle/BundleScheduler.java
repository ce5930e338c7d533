package com.guardian.bundle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically bundles records appended since the previous snapshot.
 */
public class BundleScheduler {

    private static final Logger log = LoggerFactory.getLogger(BundleScheduler.class);

    private final BundleExporter exporter;
    private final AtomicLong lastExported;

    public BundleScheduler(BundleExporter exporter) {
        this.exporter = exporter;
        this.lastExported = new AtomicLong(exporter.lastBundledSequence());
    }

    @Scheduled(fixedDelayString = "${guardian.bundle.interval:PT1H}",
               initialDelayString = "${guardian.bundle.interval:PT1H}")
    public void snapshot() {
        exporter.exportSince(lastExported.get()).ifPresentOrElse(
            result -> lastExported.set(result.lastSequence()),
            () -> log.debug("No new ledger records since sequence {}, skipping bundle", lastExported.get()));
    }

    public long lastExportedSequence() {
        return lastExported.get();
    }
}
