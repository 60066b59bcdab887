/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.repository;

import com.geastalt.licensing.config.LicensingSqlProperties;
import com.geastalt.licensing.model.LicenseCategory;
import com.geastalt.licensing.model.LocationAggregate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcLocationAggregateSink implements LocationAggregateSink {

    private final NamedParameterJdbcTemplate jdbc;
    private final LicensingSqlProperties sqlProperties;

    @Override
    @Transactional
    public void replace(Collection<LocationAggregate> locations) {
        if (locations.isEmpty()) {
            return;
        }
        Set<String> states = new TreeSet<>();
        locations.forEach(location -> states.add(location.state()));

        int deleted = jdbc.update(sqlProperties.getAggregates().getDeleteByStates(),
                new MapSqlParameterSource("states", states));

        SqlParameterSource[] batch = locations.stream()
                .map(JdbcLocationAggregateSink::toParams)
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(sqlProperties.getAggregates().getInsert(), batch);

        log.info("Replaced {} location aggregates with {} for states {}", deleted, locations.size(), states);
    }

    private static SqlParameterSource toParams(LocationAggregate location) {
        return new MapSqlParameterSource()
                .addValue("addressKey", location.addressKey())
                .addValue("addressClean", location.addressClean())
                .addValue("unit", location.unit())
                .addValue("cityClean", location.cityClean())
                .addValue("state", location.state())
                .addValue("zip", location.zip())
                .addValue("addressType", location.isClassified() ? location.addressType().label() : null)
                .addValue("totalLicenses", location.totalLicenses())
                .addValue("countBarber", location.count(LicenseCategory.BARBER))
                .addValue("countCosmetologist", location.count(LicenseCategory.COSMETOLOGIST))
                .addValue("countSalon", location.count(LicenseCategory.SALON))
                .addValue("countBarbershop", location.count(LicenseCategory.BARBERSHOP))
                .addValue("countOwner", location.count(LicenseCategory.OWNER))
                .addValue("countSchool", location.count(LicenseCategory.SCHOOL));
    }
}
