/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.aggregate;

import com.geastalt.licensing.model.LicenseCategory;
import com.geastalt.licensing.model.LocationAggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable set of location aggregates keyed and ordered by address key.
 */
public final class AggregationResult {

    private static final AggregationResult EMPTY = new AggregationResult(new TreeMap<>());

    private final SortedMap<String, LocationAggregate> byKey;

    AggregationResult(SortedMap<String, LocationAggregate> byKey) {
        this.byKey = Collections.unmodifiableSortedMap(new TreeMap<>(byKey));
    }

    public static AggregationResult empty() {
        return EMPTY;
    }

    public List<LocationAggregate> locations() {
        return List.copyOf(byKey.values());
    }

    public Optional<LocationAggregate> get(String addressKey) {
        return Optional.ofNullable(byKey.get(addressKey));
    }

    public List<String> addressKeys() {
        return new ArrayList<>(byKey.keySet());
    }

    public int size() {
        return byKey.size();
    }

    public boolean isEmpty() {
        return byKey.isEmpty();
    }

    public int totalLicenses() {
        return byKey.values().stream().mapToInt(LocationAggregate::totalLicenses).sum();
    }

    /**
     * Combines two partial results. Counts for a shared key are summed and the lexicographically
     * smallest address text is kept, so the outcome does not depend on argument order.
     */
    public static AggregationResult merge(AggregationResult a, AggregationResult b) {
        SortedMap<String, LocationAggregate> merged = new TreeMap<>(a.byKey);
        b.byKey.forEach((key, incoming) -> merged.merge(key, incoming, AggregationResult::combine));
        return new AggregationResult(merged);
    }

    public AggregationResult merge(AggregationResult other) {
        return merge(this, other);
    }

    private static LocationAggregate combine(LocationAggregate left, LocationAggregate right) {
        Map<LicenseCategory, Integer> counts = new EnumMap<>(LicenseCategory.class);
        for (LicenseCategory category : LicenseCategory.values()) {
            counts.put(category, left.count(category) + right.count(category));
        }
        LocationAggregate representative = representativeOrder(left, right) <= 0 ? left : right;
        return new LocationAggregate(
                representative.addressKey(),
                representative.addressClean(),
                representative.unit(),
                representative.cityClean(),
                representative.state(),
                representative.zip(),
                null,
                left.totalLicenses() + right.totalLicenses(),
                counts);
    }

    private static int representativeOrder(LocationAggregate left, LocationAggregate right) {
        int order = left.addressClean().compareTo(right.addressClean());
        return order != 0 ? order : left.cityClean().compareTo(right.cityClean());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AggregationResult other && byKey.equals(other.byKey);
    }

    @Override
    public int hashCode() {
        return byKey.hashCode();
    }

    @Override
    public String toString() {
        return "AggregationResult{locations=" + byKey.size() + ", licenses=" + totalLicenses() + "}";
    }
}
