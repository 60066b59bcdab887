/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.ingest;

import com.geastalt.licensing.model.LicenseCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LicenseRecordCsvReaderTest {

    private final LicenseRecordCsvReader reader = new LicenseRecordCsvReader();

    @Test
    void readsColumnsByHeaderName() {
        String csv = """
                category,street,city,state,zip,license_id
                Salon,"123 Main St, Suite 400",Miami,FL,33101,L1
                """;

        var records = reader.read(new StringReader(csv));

        assertEquals(1, records.size());
        var record = records.get(0);
        assertEquals("L1", record.licenseId());
        assertEquals("123 Main St, Suite 400", record.address().street());
        assertNull(record.address().unit());
        assertEquals("Miami", record.address().city());
        assertEquals("33101", record.address().zip());
        assertEquals(LicenseCategory.SALON, record.category());
    }

    @Test
    void unknownCategoryBecomesNull() {
        String csv = "street,category\n9 Palm Ave Miami FL 33101,Nail Tech\n10 Elm St Boston MA 02134,\n";

        var records = reader.read(new StringReader(csv));

        assertEquals(2, records.size());
        assertNull(records.get(0).category());
        assertNull(records.get(1).category());
    }

    @Test
    void skipsBlankLinesAndByteOrderMark() {
        String csv = "\uFEFFStreet,Category\n\n9 Palm Ave Miami FL 33101,barber\n";

        var records = reader.read(new StringReader(csv));

        assertEquals(1, records.size());
        assertEquals(LicenseCategory.BARBER, records.get(0).category());
    }

    @Test
    void missingStreetColumnIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(new StringReader("address,city\n1 Main St,Miami\n")));
    }

    @Test
    void emptyFileHasNoRecords() {
        assertTrue(reader.read(new StringReader("")).isEmpty());
    }

    @Test
    void readsFromPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("licenses.csv");
        Files.writeString(file, "street,category\n9 Palm Ave Miami FL 33101,owner\n", StandardCharsets.UTF_8);

        var records = reader.read(file);

        assertEquals(LicenseCategory.OWNER, records.get(0).category());
        assertThrows(UncheckedIOException.class, () -> reader.read(dir.resolve("missing.csv")));
    }
}
