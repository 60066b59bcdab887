/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.config;

import com.geastalt.licensing.cache.CacheMissPolicy;
import com.geastalt.licensing.provider.census.CensusConfig;
import com.geastalt.licensing.provider.mapbox.MapboxConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * HTTP clients for the geocoding providers. Each client's read timeout is the hard ceiling for
 * one provider request in the lane that uses it.
 */
@Configuration
public class GeocodingClientConfig {

    public static final String MAPBOX_CLIENT = "mapboxRestClient";
    public static final String CENSUS_CLIENT = "censusRestClient";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheMissPolicy cacheMissPolicy(GeocodingProperties properties, Clock clock) {
        return new CacheMissPolicy(properties.getPermanentFailureRetryAfter(), clock);
    }

    @Bean(MAPBOX_CLIENT)
    public RestClient mapboxRestClient(RestClient.Builder builder, MapboxConfig config,
                                       GeocodingProperties properties) {
        return builder
                .baseUrl(config.getBaseUrl())
                .requestFactory(requestFactory(properties.getConnectTimeout(), properties.readTimeoutFor("mapbox")))
                .build();
    }

    @Bean(CENSUS_CLIENT)
    public RestClient censusRestClient(RestClient.Builder builder, CensusConfig config,
                                       GeocodingProperties properties) {
        return builder
                .baseUrl(config.getBaseUrl())
                .requestFactory(requestFactory(properties.getConnectTimeout(), properties.readTimeoutFor("census")))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
