/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.service;

import com.geastalt.licensing.cache.FailureReason;
import com.geastalt.licensing.model.AddressCorrection;
import com.geastalt.licensing.model.AddressType;
import com.geastalt.licensing.model.RejectionReason;
import com.geastalt.licensing.routing.GeocodingLane;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Counts describing one enrichment run.
 */
@Value
@Builder(toBuilder = true)
public class RunSummary {

    int recordsRead;
    int recordsAccepted;
    @Builder.Default
    Map<RejectionReason, Integer> rejections = Map.of();
    @Builder.Default
    Map<AddressCorrection, Integer> corrections = Map.of();

    int locations;
    @Builder.Default
    Map<AddressType, Integer> locationsByType = Map.of();

    int cacheHits;
    int geocodesRequested;
    int geocodesResolved;
    @Builder.Default
    Map<FailureReason, Integer> geocodesFailed = Map.of();

    /** Null when nothing needed geocoding. */
    GeocodingLane lane;
    int batchesNotDispatched;
    boolean cancelled;

    @Builder.Default
    Duration elapsed = Duration.ZERO;

    public int recordsRejected() {
        return rejections.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int geocodesFailedTotal() {
        return geocodesFailed.values().stream().mapToInt(Integer::intValue).sum();
    }
}
