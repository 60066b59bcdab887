/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

import com.geastalt.licensing.config.GeocodingProperties;
import com.geastalt.licensing.provider.FakeGeocodingProvider;
import com.geastalt.licensing.provider.GeocodingProviderRegistry;
import com.geastalt.licensing.provider.ProviderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LaneSelectorTest {

    private GeocodingProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GeocodingProperties();
        properties.setFastLaneMaxAddresses(3000);
    }

    private LaneSelector selector(boolean fastEnabled) {
        var fast = new FakeGeocodingProvider("mapbox", fastEnabled, r -> ProviderResult.notFound(null));
        var bulk = new FakeGeocodingProvider("census", true, r -> ProviderResult.notFound(null));
        return new LaneSelector(properties, new GeocodingProviderRegistry(List.of(fast, bulk), properties));
    }

    @Test
    void thresholdIsInclusive() {
        var selector = selector(true);

        assertEquals(GeocodingLane.FAST, selector.select(1));
        assertEquals(GeocodingLane.FAST, selector.select(3000));
        assertEquals(GeocodingLane.BULK, selector.select(3001));
    }

    @Test
    void disabledFastProviderMeansBulk() {
        assertEquals(GeocodingLane.BULK, selector(false).select(10));
    }

    @Test
    void sameInputSameLane() {
        var selector = selector(true);

        assertEquals(selector.select(2500), selector.select(2500));
    }
}
