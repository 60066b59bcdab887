/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

/**
 * Geographic extent of a state, inclusive on all edges.
 */
public record BoundingBox(
        double minLatitude,
        double maxLatitude,
        double minLongitude,
        double maxLongitude
) {
    public BoundingBox {
        if (minLatitude > maxLatitude) {
            throw new IllegalArgumentException("minLatitude must not exceed maxLatitude");
        }
        if (minLongitude > maxLongitude) {
            throw new IllegalArgumentException("minLongitude must not exceed maxLongitude");
        }
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= minLatitude && latitude <= maxLatitude
                && longitude >= minLongitude && longitude <= maxLongitude;
    }
}
