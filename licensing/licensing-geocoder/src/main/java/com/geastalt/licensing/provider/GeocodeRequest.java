/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider;

import com.geastalt.licensing.model.LocationAggregate;

import java.util.Objects;

/**
 * One address sent to a geocoding provider, identified by its address key.
 */
public record GeocodeRequest(
        String addressKey,
        String street,
        String city,
        String state,
        String zip
) {
    public GeocodeRequest {
        Objects.requireNonNull(addressKey, "addressKey must not be null");
        Objects.requireNonNull(street, "street must not be null");
    }

    public static GeocodeRequest from(LocationAggregate location) {
        return new GeocodeRequest(location.addressKey(), location.addressClean(),
                location.cityClean(), location.state(), location.zip());
    }

    /**
     * Single line form, e.g. {@code 123 MAIN STREET SUITE 400, MIAMI, FL 33101}.
     */
    public String singleLine() {
        return street + ", " + city + ", " + state + " " + zip;
    }
}
