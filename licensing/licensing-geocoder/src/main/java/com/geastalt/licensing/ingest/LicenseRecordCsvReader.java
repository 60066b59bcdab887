/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.ingest;

import com.geastalt.licensing.model.LicenseCategory;
import com.geastalt.licensing.model.LicenseRecord;
import com.geastalt.licensing.model.RawAddress;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads canonical license records from a headered CSV file with the columns
 * {@code license_id, street, unit, city, state, zip, category}. Column order is free and only
 * {@code street} is required; unknown category text becomes "no category".
 */
@Slf4j
@Component
public class LicenseRecordCsvReader {

    static final String LICENSE_ID = "license_id";
    static final String STREET = "street";
    static final String UNIT = "unit";
    static final String CITY = "city";
    static final String STATE = "state";
    static final String ZIP = "zip";
    static final String CATEGORY = "category";

    public List<LicenseRecord> read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<LicenseRecord> records = read(reader);
            log.info("Read {} license records from {}", records.size(), path);
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read license records from " + path, e);
        }
    }

    public List<LicenseRecord> read(Reader source) {
        List<LicenseRecord> records = new ArrayList<>();
        try (CSVReader csv = new CSVReaderBuilder(source).build()) {
            String[] header = csv.readNext();
            if (header == null) {
                return records;
            }
            Map<String, Integer> columns = indexColumns(header);
            if (!columns.containsKey(STREET)) {
                throw new IllegalArgumentException("License record CSV has no '" + STREET + "' column");
            }

            String[] row;
            int unknownCategories = 0;
            while ((row = csv.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) {
                    continue;
                }
                String categoryText = value(row, columns, CATEGORY);
                LicenseCategory category = LicenseCategory.fromText(categoryText).orElse(null);
                if (category == null && categoryText != null) {
                    unknownCategories++;
                }
                records.add(new LicenseRecord(
                        value(row, columns, LICENSE_ID),
                        new RawAddress(
                                value(row, columns, STREET),
                                value(row, columns, UNIT),
                                value(row, columns, CITY),
                                value(row, columns, STATE),
                                value(row, columns, ZIP)),
                        category));
            }
            if (unknownCategories > 0) {
                log.warn("{} records have an unrecognized category and count toward totals only", unknownCategories);
            }
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read license records", e);
        } catch (CsvValidationException e) {
            throw new IllegalArgumentException("Malformed license record CSV at line " + e.getLineNumber(), e);
        }
    }

    private static Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i].replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
            columns.putIfAbsent(name, i);
        }
        return columns;
    }

    private static String value(String[] row, Map<String, Integer> columns, String column) {
        Integer index = columns.get(column);
        if (index == null || index >= row.length) {
            return null;
        }
        String value = row[index].trim();
        return value.isEmpty() ? null : value;
    }
}
