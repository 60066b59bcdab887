/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

import java.time.Duration;
import java.util.List;

public record BatchOutcome(GeocodeRequestBatch batch, List<GeocodeResolution> resolutions,
                           int providerCalls, Duration elapsed) {

    public BatchOutcome {
        resolutions = List.copyOf(resolutions);
    }

    public long resolvedCount() {
        return resolutions.stream().filter(GeocodeResolution::isResolved).count();
    }
}
