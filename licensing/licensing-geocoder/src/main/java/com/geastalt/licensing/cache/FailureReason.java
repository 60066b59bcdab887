/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.cache;

/**
 * Why a geocode failed. Permanent failures are not retried on later runs unless the configured
 * retry-after period has passed.
 */
public enum FailureReason {
    NOT_FOUND(true),
    OUT_OF_BOUNDS(true),
    UNKNOWN_REGION(true),
    RETRIES_EXHAUSTED(false),
    PROVIDER_REJECTED(false);

    private final boolean permanent;

    FailureReason(boolean permanent) {
        this.permanent = permanent;
    }

    public boolean isPermanent() {
        return permanent;
    }
}
