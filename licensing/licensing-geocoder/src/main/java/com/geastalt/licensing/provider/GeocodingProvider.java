/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider;

import java.util.List;
import java.util.Map;

public interface GeocodingProvider {

    String getProviderId();

    String getDisplayName();

    boolean isEnabled();

    /** Largest number of addresses accepted in one {@link #geocode} call. */
    int maxBatchSize();

    /**
     * Geocodes the given addresses. The result is keyed by address key; a key missing from the
     * result is treated as a transient error.
     *
     * @throws GeocodingProviderException when the call as a whole fails
     */
    Map<String, ProviderResult> geocode(List<GeocodeRequest> requests);
}
