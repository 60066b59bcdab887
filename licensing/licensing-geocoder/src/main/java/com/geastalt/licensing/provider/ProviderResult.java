/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider;

/**
 * A provider's answer for one address.
 */
public record ProviderResult(Status status, Double latitude, Double longitude, String detail) {

    public enum Status {
        MATCHED,
        NOT_FOUND,
        /** Timeouts, throttling and server errors; the address may be retried. */
        TRANSIENT_ERROR
    }

    public static ProviderResult matched(double latitude, double longitude) {
        return new ProviderResult(Status.MATCHED, latitude, longitude, null);
    }

    public static ProviderResult notFound(String detail) {
        return new ProviderResult(Status.NOT_FOUND, null, null, detail);
    }

    public static ProviderResult transientError(String detail) {
        return new ProviderResult(Status.TRANSIENT_ERROR, null, null, detail);
    }
}
