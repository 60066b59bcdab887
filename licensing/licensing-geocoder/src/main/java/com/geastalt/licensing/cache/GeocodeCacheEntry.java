/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted geocoding outcome for one address key. Coordinates are present only when resolved.
 */
public record GeocodeCacheEntry(
        String addressKey,
        Double latitude,
        Double longitude,
        GeocodeStatus status,
        FailureReason failureReason,
        String provider,
        Instant lastUpdated
) {
    public GeocodeCacheEntry {
        Objects.requireNonNull(addressKey, "addressKey must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(lastUpdated, "lastUpdated must not be null");
        if (status == GeocodeStatus.RESOLVED && (latitude == null || longitude == null)) {
            throw new IllegalArgumentException("Resolved entry requires coordinates: " + addressKey);
        }
        if (status == GeocodeStatus.FAILED && failureReason == null) {
            throw new IllegalArgumentException("Failed entry requires a reason: " + addressKey);
        }
    }

    public static GeocodeCacheEntry resolved(String addressKey, double latitude, double longitude,
                                             String provider, Instant now) {
        return new GeocodeCacheEntry(addressKey, latitude, longitude, GeocodeStatus.RESOLVED, null, provider, now);
    }

    public static GeocodeCacheEntry failed(String addressKey, FailureReason reason, String provider, Instant now) {
        return new GeocodeCacheEntry(addressKey, null, null, GeocodeStatus.FAILED, reason, provider, now);
    }

    public static GeocodeCacheEntry pending(String addressKey, String provider, Instant now) {
        return new GeocodeCacheEntry(addressKey, null, null, GeocodeStatus.PENDING, null, provider, now);
    }

    public boolean isResolved() {
        return status == GeocodeStatus.RESOLVED;
    }

    /**
     * Whether this entry may overwrite the stored one. A resolved entry always may;
     * nothing else replaces a resolved entry.
     */
    public boolean canReplace(GeocodeCacheEntry existing) {
        return existing == null || isResolved() || !existing.isResolved();
    }
}
