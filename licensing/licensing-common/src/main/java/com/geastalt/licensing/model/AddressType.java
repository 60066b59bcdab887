/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

public enum AddressType {
    COMMERCIAL("Commercial"),
    RESIDENTIAL("Residential");

    private final String label;

    AddressType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
