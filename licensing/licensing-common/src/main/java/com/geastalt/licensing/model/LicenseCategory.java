/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Canonical license buckets. State-specific board codes are mapped onto these upstream.
 */
public enum LicenseCategory {
    BARBER,
    COSMETOLOGIST,
    SALON,
    BARBERSHOP,
    OWNER,
    SCHOOL;

    /**
     * Resolves a category from free text, case-insensitively.
     * Returns empty for blank or unknown values.
     */
    public static Optional<LicenseCategory> fromText(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        if (upper.equals("ESTABLISHMENT")) {
            return Optional.of(OWNER);
        }
        for (LicenseCategory category : values()) {
            if (category.name().equals(upper)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
