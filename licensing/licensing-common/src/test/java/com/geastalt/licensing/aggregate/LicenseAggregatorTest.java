/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.aggregate;

import com.geastalt.licensing.model.LicenseCategory;
import com.geastalt.licensing.model.NormalizedAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LicenseAggregatorTest {

    private LicenseAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new LicenseAggregator();
    }

    private static NormalizedAddress address(String street, String unit, String city) {
        String key = String.join("|", street, unit, city, "FL", "33101");
        return new NormalizedAddress(street, unit, city, "FL", "33101", key, Set.of());
    }

    private static List<AddressedLicense> sample() {
        var suite = address("123 MAIN STREET", "SUITE 400", "MIAMI");
        var house = address("9 PALM AVENUE", "", "MIAMI");
        return List.of(
                new AddressedLicense(suite, LicenseCategory.SALON),
                new AddressedLicense(suite, LicenseCategory.COSMETOLOGIST),
                new AddressedLicense(suite, LicenseCategory.COSMETOLOGIST),
                new AddressedLicense(house, LicenseCategory.BARBER),
                new AddressedLicense(house, null));
    }

    @Test
    @DisplayName("Licenses at the same key fold into one aggregate")
    void foldsByKey() {
        var result = aggregator.aggregate(sample());

        assertEquals(2, result.size());
        var suite = result.get("123 MAIN STREET|SUITE 400|MIAMI|FL|33101").orElseThrow();
        assertEquals(3, suite.totalLicenses());
        assertEquals(1, suite.count(LicenseCategory.SALON));
        assertEquals(2, suite.count(LicenseCategory.COSMETOLOGIST));
        assertEquals(0, suite.count(LicenseCategory.BARBER));
        assertEquals("123 MAIN STREET SUITE 400", suite.addressClean());
        assertFalse(suite.isClassified());
    }

    @Test
    @DisplayName("A license without a category counts toward the total only")
    void uncategorizedCountsTowardTotal() {
        var house = aggregator.aggregate(sample()).get("9 PALM AVENUE||MIAMI|FL|33101").orElseThrow();

        assertEquals(2, house.totalLicenses());
        assertEquals(1, house.count(LicenseCategory.BARBER));
        int categorized = house.countsByCategory().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(1, categorized);
    }

    @Test
    @DisplayName("Input order does not change the result")
    void orderIndependent() {
        var expected = aggregator.aggregate(sample());
        var shuffled = new ArrayList<>(sample());
        Collections.shuffle(shuffled, new Random(42));

        assertEquals(expected, aggregator.aggregate(shuffled));
    }

    @Test
    @DisplayName("Merging partial results equals aggregating the whole input")
    void mergeEqualsWholeAggregation() {
        var all = sample();
        var left = aggregator.aggregate(all.subList(0, 2));
        var right = aggregator.aggregate(all.subList(2, all.size()));
        var whole = aggregator.aggregate(all);

        assertEquals(whole, left.merge(right));
        assertEquals(whole, right.merge(left));
        assertEquals(whole, AggregationResult.merge(AggregationResult.empty(), whole));
    }

    @Test
    @DisplayName("Locations are ordered by address key")
    void sortedByKey() {
        var keys = aggregator.aggregate(sample()).addressKeys();

        assertEquals(List.of("123 MAIN STREET|SUITE 400|MIAMI|FL|33101", "9 PALM AVENUE||MIAMI|FL|33101"), keys);
    }

    @Test
    @DisplayName("Empty input gives an empty result")
    void emptyInput() {
        var result = aggregator.aggregate(List.of());

        assertTrue(result.isEmpty());
        assertEquals(0, result.totalLicenses());
    }
}
