/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider;

import com.geastalt.licensing.config.GeocodingProperties;
import com.geastalt.licensing.routing.GeocodingLane;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
public class GeocodingProviderRegistry {

    private final Map<String, GeocodingProvider> providersById;
    private final GeocodingProperties properties;

    public GeocodingProviderRegistry(List<GeocodingProvider> providers, GeocodingProperties properties) {
        this.providersById = providers.stream()
                .collect(Collectors.toMap(GeocodingProvider::getProviderId, Function.identity()));
        this.properties = properties;
        log.info("Registered {} geocoding providers: {}", providers.size(),
                providers.stream().map(p -> p.getProviderId() + (p.isEnabled() ? "" : " (disabled)")).toList());
    }

    /**
     * The enabled provider configured for a lane, if any.
     */
    public Optional<GeocodingProvider> getProvider(GeocodingLane lane) {
        String providerId = properties.lane(lane).getProvider();
        GeocodingProvider provider = providerId == null ? null : providersById.get(providerId);
        if (provider != null && provider.isEnabled()) {
            return Optional.of(provider);
        }
        return Optional.empty();
    }

    public boolean isAvailable(GeocodingLane lane) {
        return getProvider(lane).isPresent();
    }
}
