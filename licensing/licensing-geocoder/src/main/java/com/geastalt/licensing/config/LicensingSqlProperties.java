/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "licensing.sql")
public class LicensingSqlProperties {

    private Cache cache = new Cache();
    private Aggregates aggregates = new Aggregates();

    @Data
    public static class Cache {
        private String findByKeys = """
                SELECT address_key, latitude, longitude, status, failure_reason, provider, last_updated
                FROM geocode_cache WHERE address_key IN (:keys)""";
        private String updateAny = """
                UPDATE geocode_cache SET latitude = :latitude, longitude = :longitude, status = :status,
                       failure_reason = :failureReason, provider = :provider, last_updated = :lastUpdated
                WHERE address_key = :addressKey""";
        private String updateUnresolved = """
                UPDATE geocode_cache SET latitude = :latitude, longitude = :longitude, status = :status,
                       failure_reason = :failureReason, provider = :provider, last_updated = :lastUpdated
                WHERE address_key = :addressKey AND status <> 'RESOLVED'""";
        private String insert = """
                INSERT INTO geocode_cache (address_key, latitude, longitude, status, failure_reason, provider, last_updated)
                VALUES (:addressKey, :latitude, :longitude, :status, :failureReason, :provider, :lastUpdated)""";
        private String exists = "SELECT COUNT(*) FROM geocode_cache WHERE address_key = :addressKey";
        private int lookupChunkSize = 500;
    }

    @Data
    public static class Aggregates {
        private String deleteByStates = "DELETE FROM location_aggregates WHERE state IN (:states)";
        private String insert = """
                INSERT INTO location_aggregates (address_key, address_clean, unit, city_clean, state, zip,
                       address_type, total_licenses, count_barber, count_cosmetologist, count_salon,
                       count_barbershop, count_owner, count_school)
                VALUES (:addressKey, :addressClean, :unit, :cityClean, :state, :zip, :addressType,
                       :totalLicenses, :countBarber, :countCosmetologist, :countSalon, :countBarbershop,
                       :countOwner, :countSchool)""";
    }
}
