/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.ingest;

import com.geastalt.licensing.model.LicenseCategory;
import com.geastalt.licensing.model.LocationAggregate;
import com.geastalt.licensing.service.EnrichedLocation;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes enriched locations as CSV for map rendering. Unresolved locations are written with
 * empty coordinates.
 */
@Slf4j
@Component
public class EnrichedLocationCsvWriter {

    public void write(List<EnrichedLocation> locations, Path path) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(locations, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write enriched locations to " + path, e);
        }
        log.info("Wrote {} locations to {}", locations.size(), path);
    }

    public void write(List<EnrichedLocation> locations, Writer target) throws IOException {
        CSVWriter csv = new CSVWriter(target);
        csv.writeNext(header(), false);
        for (EnrichedLocation enriched : locations) {
            csv.writeNext(row(enriched), false);
        }
        csv.flush();
    }

    private static String[] header() {
        List<String> columns = new ArrayList<>(List.of(
                "address_key", "address_clean", "city_clean", "state", "zip", "address_type", "total_licenses"));
        for (LicenseCategory category : LicenseCategory.values()) {
            columns.add("count_" + category.name().toLowerCase(Locale.ROOT));
        }
        columns.addAll(List.of("lat", "lon", "geocode_status"));
        return columns.toArray(String[]::new);
    }

    private static String[] row(EnrichedLocation enriched) {
        LocationAggregate location = enriched.location();
        List<String> values = new ArrayList<>(List.of(
                location.addressKey(),
                location.addressClean(),
                location.cityClean(),
                location.state(),
                location.zip(),
                location.isClassified() ? location.addressType().label() : "",
                String.valueOf(location.totalLicenses())));
        for (LicenseCategory category : LicenseCategory.values()) {
            values.add(String.valueOf(location.count(category)));
        }
        values.add(enriched.latitude() != null ? enriched.latitude().toString() : "");
        values.add(enriched.longitude() != null ? enriched.longitude().toString() : "");
        values.add(enriched.geocodeStatus() != null ? enriched.geocodeStatus().name() : "");
        return values.toArray(String[]::new);
    }
}
