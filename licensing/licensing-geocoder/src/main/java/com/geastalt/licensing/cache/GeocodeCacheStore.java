/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.cache;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Durable map from address key to geocoding outcome. Implementations are safe for concurrent callers.
 */
public interface GeocodeCacheStore {

    Optional<GeocodeCacheEntry> lookup(String addressKey);

    /**
     * Looks up many keys at once. Keys without an entry are absent from the result.
     */
    Map<String, GeocodeCacheEntry> lookupAll(Collection<String> addressKeys);

    /**
     * Inserts or replaces the entry for its key, except that a resolved entry is never replaced
     * by a pending or failed one.
     */
    UpsertOutcome upsert(GeocodeCacheEntry entry);
}
