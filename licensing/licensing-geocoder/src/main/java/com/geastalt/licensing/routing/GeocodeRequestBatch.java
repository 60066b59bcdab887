/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

import com.geastalt.licensing.provider.GeocodeRequest;

import java.util.List;

public record GeocodeRequestBatch(int batchId, GeocodingLane lane, String providerId, List<GeocodeRequest> requests) {

    public GeocodeRequestBatch {
        requests = List.copyOf(requests);
    }

    public int size() {
        return requests.size();
    }
}
