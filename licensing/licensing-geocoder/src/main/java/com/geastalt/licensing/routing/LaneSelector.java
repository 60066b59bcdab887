/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

import com.geastalt.licensing.config.GeocodingProperties;
import com.geastalt.licensing.provider.GeocodingProviderRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Picks the lane for a run from the number of addresses to geocode and static configuration only.
 */
@Component
@RequiredArgsConstructor
public class LaneSelector {

    private final GeocodingProperties properties;
    private final GeocodingProviderRegistry registry;

    public GeocodingLane select(int addressCount) {
        if (addressCount <= properties.getFastLaneMaxAddresses() && registry.isAvailable(GeocodingLane.FAST)) {
            return GeocodingLane.FAST;
        }
        return GeocodingLane.BULK;
    }
}
