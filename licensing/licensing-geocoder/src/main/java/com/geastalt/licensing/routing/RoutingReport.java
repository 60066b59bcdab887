/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

public record RoutingReport(
        GeocodingLane lane,
        String providerId,
        int batchesPlanned,
        int batchesDispatched,
        int batchesCompleted,
        boolean cancelled
) {
    public static RoutingReport nothingToDo() {
        return new RoutingReport(null, null, 0, 0, 0, false);
    }

    public int batchesNotDispatched() {
        return batchesPlanned - batchesDispatched;
    }
}
