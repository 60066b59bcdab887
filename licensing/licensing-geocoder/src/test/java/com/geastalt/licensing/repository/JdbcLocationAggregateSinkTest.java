/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.repository;

import com.geastalt.licensing.config.LicensingSqlProperties;
import com.geastalt.licensing.model.AddressType;
import com.geastalt.licensing.model.LicenseCategory;
import com.geastalt.licensing.model.LocationAggregate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLocationAggregateSinkTest {

    private EmbeddedDatabase database;
    private NamedParameterJdbcTemplate jdbc;
    private JdbcLocationAggregateSink sink;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        jdbc = new NamedParameterJdbcTemplate(database);
        sink = new JdbcLocationAggregateSink(jdbc, new LicensingSqlProperties());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private static LocationAggregate location(String street, String state, int salons) {
        return new LocationAggregate(street + "||CITY|" + state + "|00000", street, "", "CITY", state, "00000",
                AddressType.COMMERCIAL, salons, Map.of(LicenseCategory.SALON, salons));
    }

    private int countForState(String state) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM location_aggregates WHERE state = :state",
                new MapSqlParameterSource("state", state), Integer.class);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Should write counts and the address type label")
    void shouldWriteAggregates() {
        sink.replace(List.of(location("1 MAIN STREET", "FL", 3)));

        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM location_aggregates", Map.of());
        assertEquals("Commercial", row.get("ADDRESS_TYPE"));
        assertEquals(3, ((Number) row.get("COUNT_SALON")).intValue());
        assertEquals(0, ((Number) row.get("COUNT_BARBER")).intValue());
    }

    @Test
    @DisplayName("Rerunning a state replaces its rows and leaves other states alone")
    void replacesOnlyRunStates() {
        sink.replace(List.of(location("1 MAIN STREET", "FL", 1), location("2 MAIN STREET", "FL", 1),
                location("3 MAIN STREET", "GA", 1)));

        sink.replace(List.of(location("9 OAK AVENUE", "FL", 2)));

        assertEquals(1, countForState("FL"));
        assertEquals(1, countForState("GA"));
    }

    @Test
    void emptyRunWritesNothing() {
        sink.replace(List.of(location("3 MAIN STREET", "GA", 1)));

        sink.replace(List.of());

        assertEquals(1, countForState("GA"));
    }
}
