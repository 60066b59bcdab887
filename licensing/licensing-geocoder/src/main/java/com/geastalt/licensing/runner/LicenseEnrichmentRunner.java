/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.runner;

import com.geastalt.licensing.config.RunProperties;
import com.geastalt.licensing.ingest.EnrichedLocationCsvWriter;
import com.geastalt.licensing.ingest.LicenseRecordCsvReader;
import com.geastalt.licensing.model.LicenseRecord;
import com.geastalt.licensing.routing.CancellationToken;
import com.geastalt.licensing.service.EnrichmentRun;
import com.geastalt.licensing.service.LocationEnrichmentService;
import com.geastalt.licensing.service.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one enrichment over {@code licensing.run.input} at startup.
 *
 * <p>Closing the application context cancels a run in progress and blocks until its in-flight
 * batches are checkpointed, up to the configured grace period. Lifecycle beans are stopped before
 * any singleton is destroyed, so the cache store's data source is still open while the run drains.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "licensing.run.input")
public class LicenseEnrichmentRunner implements ApplicationRunner, SmartLifecycle {

    private final RunProperties runProperties;
    private final LicenseRecordCsvReader reader;
    private final EnrichedLocationCsvWriter writer;
    private final LocationEnrichmentService enrichmentService;

    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();
    private volatile boolean running;

    private record ActiveRun(CancellationToken cancellation, CountDownLatch finished) {
    }

    @Override
    public void run(ApplicationArguments args) {
        if (runProperties.getInput() == null || runProperties.getInput().isBlank()) {
            log.info("No license record input configured, nothing to enrich");
            return;
        }
        List<LicenseRecord> records = reader.read(Path.of(runProperties.getInput()));

        ActiveRun active = new ActiveRun(CancellationToken.create(), new CountDownLatch(1));
        activeRun.set(active);
        EnrichmentRun run;
        try {
            run = enrichmentService.enrich(records, active.cancellation());
        } finally {
            activeRun.compareAndSet(active, null);
            active.finished().countDown();
        }

        logSummary(run.summary());
        if (runProperties.getOutput() != null && !runProperties.getOutput().isBlank()) {
            writer.write(run.locations(), Path.of(runProperties.getOutput()));
        }
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        ActiveRun active = activeRun.get();
        if (active == null) {
            return;
        }
        log.warn("Shutdown requested, cancelling enrichment run");
        active.cancellation().cancel();
        try {
            if (!active.finished().await(runProperties.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Enrichment run did not drain within {}", runProperties.getShutdownGrace());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private static void logSummary(RunSummary summary) {
        log.info("Records: {} read, {} accepted, rejected {}", summary.getRecordsRead(),
                summary.getRecordsAccepted(), summary.getRejections());
        log.info("Corrections applied: {}", summary.getCorrections());
        log.info("Locations: {} {}", summary.getLocations(), summary.getLocationsByType());
        log.info("Geocoding: {} cache hits, {} requested on lane {}, {} resolved, failed {}",
                summary.getCacheHits(), summary.getGeocodesRequested(), summary.getLane(),
                summary.getGeocodesResolved(), summary.getGeocodesFailed());
        if (summary.isCancelled()) {
            log.warn("Run was cancelled; {} batches were not dispatched", summary.getBatchesNotDispatched());
        }
        log.info("Run took {}", summary.getElapsed());
    }
}
