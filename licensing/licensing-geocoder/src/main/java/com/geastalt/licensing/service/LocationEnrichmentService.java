/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.service;

import com.geastalt.licensing.aggregate.AddressedLicense;
import com.geastalt.licensing.aggregate.AggregationResult;
import com.geastalt.licensing.aggregate.LicenseAggregator;
import com.geastalt.licensing.cache.CacheMissPolicy;
import com.geastalt.licensing.cache.GeocodeCacheEntry;
import com.geastalt.licensing.cache.GeocodeCacheStore;
import com.geastalt.licensing.checkpoint.CheckpointStats;
import com.geastalt.licensing.checkpoint.GeocodeCheckpointCoordinator;
import com.geastalt.licensing.classify.LocationClassifier;
import com.geastalt.licensing.model.AddressCorrection;
import com.geastalt.licensing.model.AddressType;
import com.geastalt.licensing.model.LicenseRecord;
import com.geastalt.licensing.model.LocationAggregate;
import com.geastalt.licensing.model.NormalizationResult;
import com.geastalt.licensing.model.RejectionReason;
import com.geastalt.licensing.normalize.AddressNormalizer;
import com.geastalt.licensing.provider.GeocodeRequest;
import com.geastalt.licensing.repository.LocationAggregateSink;
import com.geastalt.licensing.routing.CancellationToken;
import com.geastalt.licensing.routing.HybridGeocodingRouter;
import com.geastalt.licensing.routing.RoutingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw license records into classified, geocoded locations.
 *
 * <p>Normalization, aggregation and classification run on the calling thread. Only addresses
 * the cache cannot answer are sent to a provider, so rerunning unchanged input makes no
 * provider calls and returns the same locations.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationEnrichmentService {

    private final AddressNormalizer normalizer;
    private final LicenseAggregator aggregator;
    private final LocationClassifier classifier;
    private final LocationAggregateSink aggregateSink;
    private final GeocodeCacheStore cacheStore;
    private final HybridGeocodingRouter router;
    private final CacheMissPolicy missPolicy;
    private final Clock clock;

    public EnrichmentRun enrich(List<LicenseRecord> records, CancellationToken cancellation) {
        long started = System.nanoTime();
        RunSummary.RunSummaryBuilder summary = RunSummary.builder().recordsRead(records.size());

        List<AddressedLicense> accepted = normalize(records, summary);

        AggregationResult aggregation = aggregator.aggregate(accepted);
        List<LocationAggregate> locations = classifier.classifyAll(aggregation);
        Map<AddressType, Integer> byType = new EnumMap<>(AddressType.class);
        locations.forEach(location -> byType.merge(location.addressType(), 1, Integer::sum));
        summary.locations(locations.size()).locationsByType(byType);
        log.info("Normalized {} of {} records into {} locations {}",
                accepted.size(), records.size(), locations.size(), byType);

        try {
            aggregateSink.replace(locations);
        } catch (DataAccessException e) {
            throw new EnrichmentRunException("Failed to store location aggregates", summary.build(), e);
        }

        List<String> keys = aggregation.addressKeys();
        Map<String, GeocodeCacheEntry> cached = lookup(keys, summary);
        List<GeocodeRequest> misses = locations.stream()
                .filter(location -> missPolicy.isMiss(cached.get(location.addressKey())))
                .map(GeocodeRequest::from)
                .toList();
        summary.cacheHits(locations.size() - misses.size()).geocodesRequested(misses.size());
        log.info("Geocode cache answered {} of {} locations", locations.size() - misses.size(), locations.size());

        GeocodeCheckpointCoordinator checkpoint = new GeocodeCheckpointCoordinator(cacheStore, clock);
        RoutingReport report;
        try {
            report = router.route(misses, cancellation, checkpoint);
        } catch (RuntimeException e) {
            applyCheckpoint(summary, checkpoint.stats());
            throw new EnrichmentRunException("Geocoding aborted: " + e.getMessage(), summary.build(), e);
        }
        applyCheckpoint(summary, checkpoint.stats());
        summary.lane(report.lane())
                .batchesNotDispatched(report.batchesNotDispatched())
                .cancelled(report.cancelled());

        Map<String, GeocodeCacheEntry> entries = lookup(keys, summary);
        List<EnrichedLocation> enriched = locations.stream()
                .map(location -> EnrichedLocation.of(location, entries.get(location.addressKey())))
                .toList();

        RunSummary result = summary.elapsed(Duration.ofNanos(System.nanoTime() - started)).build();
        log.info("Enrichment run finished: {} locations, {} resolved, {} failed, cancelled={}",
                enriched.size(), enriched.stream().filter(EnrichedLocation::isResolved).count(),
                result.geocodesFailedTotal(), result.isCancelled());
        return new EnrichmentRun(enriched, result);
    }

    private List<AddressedLicense> normalize(List<LicenseRecord> records, RunSummary.RunSummaryBuilder summary) {
        Map<RejectionReason, Integer> rejections = new EnumMap<>(RejectionReason.class);
        Map<AddressCorrection, Integer> corrections = new EnumMap<>(AddressCorrection.class);
        List<AddressedLicense> accepted = new ArrayList<>(records.size());

        for (LicenseRecord record : records) {
            NormalizationResult result = normalizer.normalize(record.address());
            result.onAccepted(address -> {
                accepted.add(new AddressedLicense(address, record.category()));
                address.corrections().forEach(c -> corrections.merge(c, 1, Integer::sum));
            }).onRejected(rejected -> rejections.merge(rejected.reason(), 1, Integer::sum));
        }

        summary.recordsAccepted(accepted.size()).rejections(rejections).corrections(corrections);
        if (!rejections.isEmpty()) {
            log.info("Rejected addresses by reason: {}", rejections);
        }
        return accepted;
    }

    private Map<String, GeocodeCacheEntry> lookup(List<String> keys, RunSummary.RunSummaryBuilder summary) {
        try {
            return cacheStore.lookupAll(keys);
        } catch (DataAccessException e) {
            throw new EnrichmentRunException("Failed to read geocode cache", summary.build(), e);
        }
    }

    private static void applyCheckpoint(RunSummary.RunSummaryBuilder summary, CheckpointStats stats) {
        summary.geocodesResolved(stats.resolved()).geocodesFailed(stats.failedByReason());
    }
}
