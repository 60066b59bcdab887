/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

/**
 * Free-text address fields as sourced per record.
 * The street may carry a full one-line address, in which case city, state and zip are optional hints.
 */
public record RawAddress(
        String street,
        String unit,
        String city,
        String state,
        String zip
) {
    public static RawAddress ofLine(String line) {
        return new RawAddress(line, null, null, null, null);
    }
}
