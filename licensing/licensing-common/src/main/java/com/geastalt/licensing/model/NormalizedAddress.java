/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

import java.util.Objects;
import java.util.Set;

/**
 * Canonical form of a physical address. The address key is the deduplication and geocode cache key.
 */
public record NormalizedAddress(
        String streetClean,
        String unit,
        String cityClean,
        String state,
        String zip,
        String addressKey,
        Set<AddressCorrection> corrections
) {
    public NormalizedAddress {
        Objects.requireNonNull(streetClean, "streetClean must not be null");
        Objects.requireNonNull(cityClean, "cityClean must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(zip, "zip must not be null");
        Objects.requireNonNull(addressKey, "addressKey must not be null");
        unit = unit == null ? "" : unit;
        corrections = corrections == null ? Set.of() : Set.copyOf(corrections);
    }

    /**
     * Street line with the unit appended, as used for display and keyword classification.
     */
    public String addressClean() {
        return unit.isEmpty() ? streetClean : streetClean + " " + unit;
    }

    public boolean hasUnit() {
        return !unit.isEmpty();
    }
}
