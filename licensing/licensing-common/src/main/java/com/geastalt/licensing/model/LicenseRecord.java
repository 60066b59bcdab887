/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

import java.util.Objects;

/**
 * A single license as handed over by upstream extraction.
 * A null category means the board code matched no canonical bucket; the license still counts
 * toward the location total.
 */
public record LicenseRecord(
        String licenseId,
        RawAddress address,
        LicenseCategory category
) {
    public LicenseRecord {
        Objects.requireNonNull(address, "address must not be null");
    }
}
