/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One physical location with its license counts. Immutable; classification produces a copy
 * carrying the address type.
 */
public record LocationAggregate(
        String addressKey,
        String addressClean,
        String unit,
        String cityClean,
        String state,
        String zip,
        AddressType addressType,
        int totalLicenses,
        Map<LicenseCategory, Integer> countsByCategory
) {
    public LocationAggregate {
        Objects.requireNonNull(addressKey, "addressKey must not be null");
        Objects.requireNonNull(addressClean, "addressClean must not be null");
        Objects.requireNonNull(cityClean, "cityClean must not be null");
        Objects.requireNonNull(state, "state must not be null");
        unit = unit == null ? "" : unit;
        zip = zip == null ? "" : zip;
        if (totalLicenses < 0) {
            throw new IllegalArgumentException("totalLicenses must be non-negative");
        }
        EnumMap<LicenseCategory, Integer> counts = new EnumMap<>(LicenseCategory.class);
        for (LicenseCategory category : LicenseCategory.values()) {
            counts.put(category, 0);
        }
        if (countsByCategory != null) {
            counts.putAll(countsByCategory);
        }
        countsByCategory = Collections.unmodifiableMap(counts);
    }

    public int count(LicenseCategory category) {
        return countsByCategory.get(category);
    }

    public boolean isClassified() {
        return addressType != null;
    }

    public LocationAggregate withAddressType(AddressType type) {
        return new LocationAggregate(addressKey, addressClean, unit, cityClean, state, zip,
                type, totalLicenses, countsByCategory);
    }
}
