/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.service;

import com.geastalt.licensing.cache.GeocodeCacheEntry;
import com.geastalt.licensing.cache.GeocodeStatus;
import com.geastalt.licensing.model.LocationAggregate;

/**
 * A classified location with its coordinates. Latitude and longitude are null unless the cache
 * holds a resolved entry; the status is null when the address was never geocoded.
 */
public record EnrichedLocation(LocationAggregate location, Double latitude, Double longitude,
                               GeocodeStatus geocodeStatus) {

    public static EnrichedLocation of(LocationAggregate location, GeocodeCacheEntry entry) {
        if (entry == null) {
            return new EnrichedLocation(location, null, null, null);
        }
        if (entry.isResolved()) {
            return new EnrichedLocation(location, entry.latitude(), entry.longitude(), GeocodeStatus.RESOLVED);
        }
        return new EnrichedLocation(location, null, null, entry.status());
    }

    public boolean isResolved() {
        return geocodeStatus == GeocodeStatus.RESOLVED;
    }
}
