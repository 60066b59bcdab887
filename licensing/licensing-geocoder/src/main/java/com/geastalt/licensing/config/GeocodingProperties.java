/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.config;

import com.geastalt.licensing.routing.GeocodingLane;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.stream.Stream;

@Data
@Configuration
@ConfigurationProperties(prefix = "licensing.geocoding")
public class GeocodingProperties {

    /** Runs with at most this many addresses to geocode use the fast lane. */
    private int fastLaneMaxAddresses = 3000;

    private Lane fast = new Lane("mapbox", 50, 8, Duration.ofSeconds(10));
    private Lane bulk = new Lane("census", 5000, 4, Duration.ofSeconds(300));
    private Retry retry = new Retry();

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Permanent failures older than this are geocoded again. Unset means never. */
    private Duration permanentFailureRetryAfter;

    public Lane lane(GeocodingLane lane) {
        return lane == GeocodingLane.FAST ? fast : bulk;
    }

    /**
     * Read timeout of the lane served by the given provider, or the bulk timeout when no lane uses it.
     */
    public Duration readTimeoutFor(String providerId) {
        return Stream.of(fast, bulk)
                .filter(l -> providerId.equals(l.getProvider()))
                .map(Lane::getReadTimeout)
                .findFirst()
                .orElse(bulk.getReadTimeout());
    }

    @Data
    public static class Lane {
        private String provider;
        private int batchSize;
        private int concurrency;
        private Duration readTimeout;

        public Lane() {
        }

        public Lane(String provider, int batchSize, int concurrency, Duration readTimeout) {
            this.provider = provider;
            this.batchSize = batchSize;
            this.concurrency = concurrency;
            this.readTimeout = readTimeout;
        }
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(10);
    }
}
