/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

import com.geastalt.licensing.cache.FailureReason;
import com.geastalt.licensing.provider.GeocodeRequest;
import com.geastalt.licensing.provider.GeocodingProvider;
import com.geastalt.licensing.provider.GeocodingProviderException;
import com.geastalt.licensing.provider.ProviderResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Geocodes one batch. Transient failures are retried for the affected addresses only;
 * matches are checked against the declared state's bounding box.
 */
@Slf4j
class GeocodeBatchWorker implements Callable<BatchOutcome> {

    private final GeocodeRequestBatch batch;
    private final GeocodingProvider provider;
    private final RetryPolicy retryPolicy;
    private final BoundingBoxValidator validator;
    private final Sleeper sleeper;

    GeocodeBatchWorker(GeocodeRequestBatch batch, GeocodingProvider provider, RetryPolicy retryPolicy,
                       BoundingBoxValidator validator, Sleeper sleeper) {
        this.batch = batch;
        this.provider = provider;
        this.retryPolicy = retryPolicy;
        this.validator = validator;
        this.sleeper = sleeper;
    }

    @Override
    public BatchOutcome call() {
        long started = System.nanoTime();
        Map<String, GeocodeResolution> resolutions = new HashMap<>();
        List<GeocodeRequest> pending = batch.requests();
        int attempt = 0;

        while (!pending.isEmpty() && attempt < retryPolicy.maxAttempts()) {
            attempt++;
            List<GeocodeRequest> retry = new ArrayList<>();
            try {
                Map<String, ProviderResult> results = provider.geocode(pending);
                for (GeocodeRequest request : pending) {
                    ProviderResult result = results.get(request.addressKey());
                    if (result == null || result.status() == ProviderResult.Status.TRANSIENT_ERROR) {
                        retry.add(request);
                    } else {
                        resolutions.put(request.addressKey(), resolve(request, result, attempt));
                    }
                }
            } catch (GeocodingProviderException e) {
                if (!e.isRetryable()) {
                    log.warn("Batch {} rejected by {}: {}", batch.batchId(), provider.getProviderId(), e.getMessage());
                    for (GeocodeRequest request : pending) {
                        resolutions.put(request.addressKey(), GeocodeResolution.failed(request.addressKey(),
                                FailureReason.PROVIDER_REJECTED, provider.getProviderId(), attempt));
                    }
                    pending = List.of();
                    break;
                }
                log.debug("Batch {} attempt {} failed: {}", batch.batchId(), attempt, e.getMessage());
                retry.addAll(pending);
            } catch (RuntimeException e) {
                log.warn("Batch {} attempt {} failed unexpectedly", batch.batchId(), attempt, e);
                retry.addAll(pending);
            }

            pending = retry;
            if (!pending.isEmpty() && attempt < retryPolicy.maxAttempts()) {
                Duration backoff = retryPolicy.backoffFor(attempt);
                log.debug("Retrying {} addresses of batch {} in {}", pending.size(), batch.batchId(), backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        for (GeocodeRequest request : pending) {
            resolutions.put(request.addressKey(), GeocodeResolution.failed(request.addressKey(),
                    FailureReason.RETRIES_EXHAUSTED, provider.getProviderId(), attempt));
        }

        List<GeocodeResolution> ordered = new ArrayList<>(batch.size());
        for (GeocodeRequest request : batch.requests()) {
            ordered.add(resolutions.get(request.addressKey()));
        }
        return new BatchOutcome(batch, ordered, attempt, Duration.ofNanos(System.nanoTime() - started));
    }

    private GeocodeResolution resolve(GeocodeRequest request, ProviderResult result, int attempt) {
        String providerId = provider.getProviderId();
        if (result.status() == ProviderResult.Status.NOT_FOUND) {
            return GeocodeResolution.failed(request.addressKey(), FailureReason.NOT_FOUND, providerId, attempt);
        }
        Optional<FailureReason> invalid = validator.validate(request.state(), result.latitude(), result.longitude());
        if (invalid.isPresent()) {
            log.debug("Discarding match for {} at ({}, {}): {}", request.addressKey(),
                    result.latitude(), result.longitude(), invalid.get());
            return GeocodeResolution.failed(request.addressKey(), invalid.get(), providerId, attempt);
        }
        return GeocodeResolution.resolved(request.addressKey(), result.latitude(), result.longitude(),
                providerId, attempt);
    }
}
