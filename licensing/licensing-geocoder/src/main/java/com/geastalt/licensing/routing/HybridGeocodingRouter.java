/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

import com.geastalt.licensing.config.GeocodingProperties;
import com.geastalt.licensing.provider.GeocodeRequest;
import com.geastalt.licensing.provider.GeocodingProvider;
import com.geastalt.licensing.provider.GeocodingProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Sends cache misses to the provider of the selected lane.
 *
 * <p>Batches run on a fixed pool sized to the lane's concurrency, and at most that many are in
 * flight. Every completed batch is handed to the listener before its slot is refilled, so an
 * interrupted run loses at most the batches still in flight.</p>
 */
@Slf4j
@Component
public class HybridGeocodingRouter {

    private final LaneSelector laneSelector;
    private final GeocodingProviderRegistry registry;
    private final GeocodingProperties properties;
    private final BoundingBoxValidator validator;
    private final Sleeper sleeper;

    @Autowired
    public HybridGeocodingRouter(LaneSelector laneSelector, GeocodingProviderRegistry registry,
                                 GeocodingProperties properties, BoundingBoxValidator validator) {
        this(laneSelector, registry, properties, validator, Sleeper.THREAD);
    }

    public HybridGeocodingRouter(LaneSelector laneSelector, GeocodingProviderRegistry registry,
                                 GeocodingProperties properties, BoundingBoxValidator validator,
                                 Sleeper sleeper) {
        this.laneSelector = laneSelector;
        this.registry = registry;
        this.properties = properties;
        this.validator = validator;
        this.sleeper = sleeper;
    }

    public RoutingReport route(List<GeocodeRequest> requests, CancellationToken cancellation,
                               BatchListener listener) {
        if (requests.isEmpty()) {
            log.info("No addresses to geocode");
            return RoutingReport.nothingToDo();
        }

        GeocodingLane lane = laneSelector.select(requests.size());
        GeocodingProvider provider = registry.getProvider(lane)
                .orElseThrow(() -> new IllegalStateException("No enabled geocoding provider for lane " + lane));
        GeocodingProperties.Lane settings = properties.lane(lane);
        int batchSize = Math.max(1, Math.min(settings.getBatchSize(), provider.maxBatchSize()));
        int concurrency = Math.max(1, settings.getConcurrency());
        RetryPolicy retryPolicy = RetryPolicy.from(properties.getRetry());

        List<GeocodeRequestBatch> batches = partition(requests, batchSize, lane, provider.getProviderId());
        log.info("Routing {} addresses to {} on the {} lane: {} batches of up to {}, {} in flight",
                requests.size(), provider.getDisplayName(), lane, batches.size(), batchSize, concurrency);

        ExecutorService pool = Executors.newFixedThreadPool(concurrency,
                new CustomizableThreadFactory("geocode-" + lane.name().toLowerCase(Locale.ROOT) + "-"));
        CompletionService<BatchOutcome> completions = new ExecutorCompletionService<>(pool);

        int next = 0;
        int inFlight = 0;
        int completed = 0;
        boolean cancelled = false;
        RuntimeException failure = null;

        try {
            while (true) {
                while (failure == null && !cancelled && inFlight < concurrency && next < batches.size()) {
                    if (cancellation.isCancelled()) {
                        cancelled = true;
                        log.warn("Cancellation requested, {} batches will not be dispatched", batches.size() - next);
                        break;
                    }
                    GeocodeRequestBatch batch = batches.get(next);
                    try {
                        listener.onDispatch(batch);
                    } catch (RuntimeException e) {
                        failure = e;
                        break;
                    }
                    completions.submit(new GeocodeBatchWorker(batch, provider, retryPolicy, validator, sleeper));
                    next++;
                    inFlight++;
                }
                if (inFlight == 0) {
                    break;
                }

                Future<BatchOutcome> done = completions.take();
                inFlight--;
                BatchOutcome outcome;
                try {
                    outcome = done.get();
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = new IllegalStateException("Geocoding worker failed", e.getCause());
                    }
                    continue;
                }
                if (failure != null) {
                    continue;
                }
                try {
                    listener.onComplete(outcome);
                    completed++;
                } catch (RuntimeException e) {
                    log.error("Checkpoint of batch {} failed, stopping dispatch", outcome.batch().batchId());
                    failure = e;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted with {} batches in flight; they stay pending", inFlight);
            pool.shutdownNow();
            return new RoutingReport(lane, provider.getProviderId(), batches.size(), next, completed, true);
        } finally {
            pool.shutdown();
        }

        if (failure != null) {
            throw failure;
        }
        return new RoutingReport(lane, provider.getProviderId(), batches.size(), next, completed, cancelled);
    }

    private static List<GeocodeRequestBatch> partition(List<GeocodeRequest> requests, int batchSize,
                                                       GeocodingLane lane, String providerId) {
        List<GeocodeRequestBatch> batches = new ArrayList<>();
        for (int from = 0, id = 1; from < requests.size(); from += batchSize, id++) {
            int to = Math.min(from + batchSize, requests.size());
            batches.add(new GeocodeRequestBatch(id, lane, providerId, requests.subList(from, to)));
        }
        return batches;
    }
}
