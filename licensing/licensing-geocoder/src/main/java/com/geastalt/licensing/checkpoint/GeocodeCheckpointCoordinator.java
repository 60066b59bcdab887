/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.checkpoint;

import com.geastalt.licensing.cache.FailureReason;
import com.geastalt.licensing.cache.GeocodeCacheEntry;
import com.geastalt.licensing.cache.GeocodeCacheStore;
import com.geastalt.licensing.provider.GeocodeRequest;
import com.geastalt.licensing.routing.BatchListener;
import com.geastalt.licensing.routing.BatchOutcome;
import com.geastalt.licensing.routing.GeocodeRequestBatch;
import com.geastalt.licensing.routing.GeocodeResolution;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Persists geocoding progress for one run. Keys are marked pending when their batch is
 * dispatched and each result is written as soon as its batch completes. Persistence errors
 * propagate to the router, which stops the run.
 */
@Slf4j
public class GeocodeCheckpointCoordinator implements BatchListener {

    private final GeocodeCacheStore cacheStore;
    private final Clock clock;

    private int batchesCheckpointed;
    private int addressesDispatched;
    private int resolved;
    private final Map<FailureReason, Integer> failedByReason = new EnumMap<>(FailureReason.class);

    public GeocodeCheckpointCoordinator(GeocodeCacheStore cacheStore, Clock clock) {
        this.cacheStore = cacheStore;
        this.clock = clock;
    }

    @Override
    public synchronized void onDispatch(GeocodeRequestBatch batch) {
        Instant now = Instant.now(clock);
        for (GeocodeRequest request : batch.requests()) {
            cacheStore.upsert(GeocodeCacheEntry.pending(request.addressKey(), batch.providerId(), now));
        }
        addressesDispatched += batch.size();
        log.debug("Dispatched batch {} with {} addresses", batch.batchId(), batch.size());
    }

    @Override
    public synchronized void onComplete(BatchOutcome outcome) {
        Instant now = Instant.now(clock);
        int batchResolved = 0;
        for (GeocodeResolution resolution : outcome.resolutions()) {
            cacheStore.upsert(resolution.toCacheEntry(now));
            if (resolution.isResolved()) {
                batchResolved++;
            } else {
                failedByReason.merge(resolution.failureReason(), 1, Integer::sum);
            }
        }
        resolved += batchResolved;
        batchesCheckpointed++;
        log.info("Checkpointed batch {}: {}/{} resolved in {} ms ({} provider calls)",
                outcome.batch().batchId(), batchResolved, outcome.resolutions().size(),
                outcome.elapsed().toMillis(), outcome.providerCalls());
    }

    public synchronized CheckpointStats stats() {
        return new CheckpointStats(batchesCheckpointed, addressesDispatched, resolved, failedByReason);
    }
}
