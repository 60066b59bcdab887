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

import java.util.Objects;

/**
 * A license paired with its normalized location. The category is null when the source code
 * maps to no canonical bucket.
 */
public record AddressedLicense(NormalizedAddress address, LicenseCategory category) {
    public AddressedLicense {
        Objects.requireNonNull(address, "address must not be null");
    }
}
