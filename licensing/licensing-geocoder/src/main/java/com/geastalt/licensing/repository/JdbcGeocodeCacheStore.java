/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.repository;

import com.geastalt.licensing.cache.FailureReason;
import com.geastalt.licensing.cache.GeocodeCacheEntry;
import com.geastalt.licensing.cache.GeocodeCacheStore;
import com.geastalt.licensing.cache.GeocodeStatus;
import com.geastalt.licensing.cache.UpsertOutcome;
import com.geastalt.licensing.config.LicensingSqlProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Geocode cache backed by the {@code geocode_cache} table.
 *
 * <p>Writes from this process are serialized. A resolved row is protected by the update's
 * WHERE clause, and an insert that races with another process falls back to the update.</p>
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "licensing.cache.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcGeocodeCacheStore implements GeocodeCacheStore {

    private static final int MAX_WRITE_ATTEMPTS = 2;

    private final NamedParameterJdbcTemplate jdbc;
    private final LicensingSqlProperties sqlProperties;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcGeocodeCacheStore(NamedParameterJdbcTemplate jdbc, LicensingSqlProperties sqlProperties) {
        this.jdbc = jdbc;
        this.sqlProperties = sqlProperties;
    }

    @Override
    public Optional<GeocodeCacheEntry> lookup(String addressKey) {
        return Optional.ofNullable(lookupAll(List.of(addressKey)).get(addressKey));
    }

    @Override
    public Map<String, GeocodeCacheEntry> lookupAll(Collection<String> addressKeys) {
        Map<String, GeocodeCacheEntry> found = new HashMap<>();
        List<String> keys = new ArrayList<>(addressKeys);
        int chunkSize = Math.max(1, sqlProperties.getCache().getLookupChunkSize());
        for (int from = 0; from < keys.size(); from += chunkSize) {
            List<String> chunk = keys.subList(from, Math.min(from + chunkSize, keys.size()));
            MapSqlParameterSource params = new MapSqlParameterSource().addValue("keys", chunk);
            jdbc.query(sqlProperties.getCache().getFindByKeys(), params, this::mapRow)
                    .forEach(entry -> found.put(entry.addressKey(), entry));
        }
        return found;
    }

    @Override
    public UpsertOutcome upsert(GeocodeCacheEntry entry) {
        MapSqlParameterSource params = toParams(entry);
        String updateSql = entry.isResolved()
                ? sqlProperties.getCache().getUpdateAny()
                : sqlProperties.getCache().getUpdateUnresolved();

        writeLock.lock();
        try {
            for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
                if (jdbc.update(updateSql, params) > 0) {
                    return UpsertOutcome.UPDATED;
                }
                if (!entry.isResolved() && exists(entry.addressKey())) {
                    return UpsertOutcome.SKIPPED;
                }
                try {
                    jdbc.update(sqlProperties.getCache().getInsert(), params);
                    return UpsertOutcome.INSERTED;
                } catch (DuplicateKeyException e) {
                    log.debug("Concurrent insert of {}, retrying as update", entry.addressKey());
                }
            }
            return UpsertOutcome.SKIPPED;
        } finally {
            writeLock.unlock();
        }
    }

    private boolean exists(String addressKey) {
        Long count = jdbc.queryForObject(sqlProperties.getCache().getExists(),
                new MapSqlParameterSource("addressKey", addressKey), Long.class);
        return count != null && count > 0;
    }

    private MapSqlParameterSource toParams(GeocodeCacheEntry entry) {
        return new MapSqlParameterSource()
                .addValue("addressKey", entry.addressKey())
                .addValue("latitude", entry.latitude())
                .addValue("longitude", entry.longitude())
                .addValue("status", entry.status().name())
                .addValue("failureReason", entry.failureReason() != null ? entry.failureReason().name() : null)
                .addValue("provider", entry.provider())
                .addValue("lastUpdated", Timestamp.from(entry.lastUpdated()));
    }

    private GeocodeCacheEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        double latitude = rs.getDouble("latitude");
        Double lat = rs.wasNull() ? null : latitude;
        double longitude = rs.getDouble("longitude");
        Double lon = rs.wasNull() ? null : longitude;
        String failureReason = rs.getString("failure_reason");

        return new GeocodeCacheEntry(
                rs.getString("address_key"),
                lat,
                lon,
                GeocodeStatus.valueOf(rs.getString("status")),
                failureReason != null ? FailureReason.valueOf(failureReason) : null,
                rs.getString("provider"),
                rs.getTimestamp("last_updated").toInstant());
    }
}
