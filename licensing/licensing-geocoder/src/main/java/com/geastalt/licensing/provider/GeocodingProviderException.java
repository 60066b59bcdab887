/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider;

/**
 * Failure of a whole provider call. Retryable failures are retried under the router's retry
 * policy; others fail every address in the call.
 */
public class GeocodingProviderException extends RuntimeException {

    private final boolean retryable;

    public GeocodingProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public GeocodingProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
