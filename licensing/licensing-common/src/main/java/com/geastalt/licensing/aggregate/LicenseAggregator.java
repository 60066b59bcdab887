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
import com.geastalt.licensing.model.NormalizedAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds licenses into one aggregate per physical location.
 * Input order does not affect the result.
 */
@Slf4j
@Component
public class LicenseAggregator {

    public AggregationResult aggregate(Iterable<AddressedLicense> licenses) {
        Map<String, Accumulator> accumulators = new HashMap<>();
        int count = 0;
        for (AddressedLicense license : licenses) {
            accumulators.computeIfAbsent(license.address().addressKey(), k -> new Accumulator())
                    .add(license);
            count++;
        }

        TreeMap<String, LocationAggregate> byKey = new TreeMap<>();
        accumulators.forEach((key, accumulator) -> byKey.put(key, accumulator.toAggregate()));
        log.debug("Aggregated {} licenses into {} locations", count, byKey.size());
        return new AggregationResult(byKey);
    }

    private static final class Accumulator {
        private NormalizedAddress representative;
        private int total;
        private final Map<LicenseCategory, Integer> counts = new EnumMap<>(LicenseCategory.class);

        void add(AddressedLicense license) {
            NormalizedAddress address = license.address();
            if (representative == null || precedes(address, representative)) {
                representative = address;
            }
            total++;
            if (license.category() != null) {
                counts.merge(license.category(), 1, Integer::sum);
            }
        }

        LocationAggregate toAggregate() {
            return new LocationAggregate(
                    representative.addressKey(),
                    representative.addressClean(),
                    representative.unit(),
                    representative.cityClean(),
                    representative.state(),
                    representative.zip(),
                    null,
                    total,
                    counts);
        }

        private static boolean precedes(NormalizedAddress a, NormalizedAddress b) {
            int order = a.addressClean().compareTo(b.addressClean());
            return order != 0 ? order < 0 : a.cityClean().compareTo(b.cityClean()) < 0;
        }
    }
}
