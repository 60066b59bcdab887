/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory geocode cache, used for dry runs and tests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "licensing.cache.type", havingValue = "memory")
public class InMemoryGeocodeCacheStore implements GeocodeCacheStore {

    private final Map<String, GeocodeCacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<GeocodeCacheEntry> lookup(String addressKey) {
        return Optional.ofNullable(entries.get(addressKey));
    }

    @Override
    public Map<String, GeocodeCacheEntry> lookupAll(Collection<String> addressKeys) {
        Map<String, GeocodeCacheEntry> found = new HashMap<>();
        for (String key : addressKeys) {
            GeocodeCacheEntry entry = entries.get(key);
            if (entry != null) {
                found.put(key, entry);
            }
        }
        return found;
    }

    @Override
    public UpsertOutcome upsert(GeocodeCacheEntry entry) {
        var outcome = new UpsertOutcome[] { null };

        entries.compute(entry.addressKey(), (key, existing) -> {
            if (existing == null) {
                outcome[0] = UpsertOutcome.INSERTED;
                return entry;
            }
            if (entry.canReplace(existing)) {
                outcome[0] = UpsertOutcome.UPDATED;
                return entry;
            }
            outcome[0] = UpsertOutcome.SKIPPED;
            return existing;
        });

        log.trace("Upsert {} {}: {}", entry.addressKey(), entry.status(), outcome[0]);
        return outcome[0];
    }

    public int size() {
        return entries.size();
    }
}
