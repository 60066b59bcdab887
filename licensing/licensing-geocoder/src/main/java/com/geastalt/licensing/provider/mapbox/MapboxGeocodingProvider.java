/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider.mapbox;

import com.geastalt.licensing.config.GeocodingClientConfig;
import com.geastalt.licensing.provider.GeocodeRequest;
import com.geastalt.licensing.provider.GeocodingProvider;
import com.geastalt.licensing.provider.GeocodingProviderException;
import com.geastalt.licensing.provider.ProviderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapbox forward geocoding, one request per address. Used by the fast lane.
 */
@Slf4j
@Component
public class MapboxGeocodingProvider implements GeocodingProvider {

    private static final String PLACES_PATH = "/geocoding/v5/mapbox.places/{query}.json";

    private final RestClient restClient;
    private final MapboxConfig mapboxConfig;

    public MapboxGeocodingProvider(@Qualifier(GeocodingClientConfig.MAPBOX_CLIENT) RestClient restClient,
                                   MapboxConfig mapboxConfig) {
        this.restClient = restClient;
        this.mapboxConfig = mapboxConfig;
    }

    @Override
    public String getProviderId() {
        return "mapbox";
    }

    @Override
    public String getDisplayName() {
        return "Mapbox Geocoding API";
    }

    @Override
    public boolean isEnabled() {
        return mapboxConfig.getAccessToken() != null && !mapboxConfig.getAccessToken().isBlank();
    }

    @Override
    public int maxBatchSize() {
        return 100;
    }

    @Override
    public Map<String, ProviderResult> geocode(List<GeocodeRequest> requests) {
        Map<String, ProviderResult> results = new LinkedHashMap<>();
        for (GeocodeRequest request : requests) {
            results.put(request.addressKey(), geocodeOne(request));
        }
        return results;
    }

    private ProviderResult geocodeOne(GeocodeRequest request) {
        MapboxFeatureCollection response;
        try {
            response = restClient.get()
                    .uri(builder -> builder.path(PLACES_PATH)
                            .queryParam("access_token", mapboxConfig.getAccessToken())
                            .queryParam("country", mapboxConfig.getCountry())
                            .queryParam("limit", 1)
                            .build(request.singleLine()))
                    .retrieve()
                    .body(MapboxFeatureCollection.class);
        } catch (HttpClientErrorException e) {
            HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
            if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
                throw new GeocodingProviderException("Mapbox rejected the access token: " + e.getStatusCode(), false, e);
            }
            if (status == HttpStatus.TOO_MANY_REQUESTS) {
                return ProviderResult.transientError("throttled");
            }
            log.debug("Mapbox returned {} for {}", e.getStatusCode(), request.addressKey());
            return ProviderResult.notFound("HTTP " + e.getStatusCode().value());
        } catch (HttpServerErrorException e) {
            return ProviderResult.transientError("HTTP " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            return ProviderResult.transientError(e.getMessage());
        } catch (RestClientException e) {
            log.warn("Unreadable Mapbox response for {}: {}", request.addressKey(), e.getMessage());
            return ProviderResult.transientError(e.getMessage());
        }

        if (response == null || response.getFeatures() == null || response.getFeatures().isEmpty()) {
            return ProviderResult.notFound("no features");
        }
        List<Double> center = response.getFeatures().get(0).getCenter();
        if (center == null || center.size() < 2 || center.get(0) == null || center.get(1) == null) {
            return ProviderResult.notFound("feature without center");
        }
        return ProviderResult.matched(center.get(1), center.get(0));
    }
}
