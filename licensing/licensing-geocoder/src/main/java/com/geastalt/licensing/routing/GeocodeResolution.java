/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

import com.geastalt.licensing.cache.FailureReason;
import com.geastalt.licensing.cache.GeocodeCacheEntry;

import java.time.Instant;

/**
 * Final outcome for one address after retries and bounds validation.
 * Either coordinates or a failure reason is set.
 */
public record GeocodeResolution(
        String addressKey,
        Double latitude,
        Double longitude,
        FailureReason failureReason,
        String provider,
        int attempts
) {
    public static GeocodeResolution resolved(String addressKey, double latitude, double longitude,
                                             String provider, int attempts) {
        return new GeocodeResolution(addressKey, latitude, longitude, null, provider, attempts);
    }

    public static GeocodeResolution failed(String addressKey, FailureReason reason, String provider, int attempts) {
        return new GeocodeResolution(addressKey, null, null, reason, provider, attempts);
    }

    public boolean isResolved() {
        return failureReason == null;
    }

    public GeocodeCacheEntry toCacheEntry(Instant now) {
        return isResolved()
                ? GeocodeCacheEntry.resolved(addressKey, latitude, longitude, provider, now)
                : GeocodeCacheEntry.failed(addressKey, failureReason, provider, now);
    }
}
