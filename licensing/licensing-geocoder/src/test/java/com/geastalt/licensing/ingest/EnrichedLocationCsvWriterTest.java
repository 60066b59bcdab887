/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.ingest;

import com.geastalt.licensing.cache.GeocodeStatus;
import com.geastalt.licensing.model.AddressType;
import com.geastalt.licensing.model.LicenseCategory;
import com.geastalt.licensing.model.LocationAggregate;
import com.geastalt.licensing.service.EnrichedLocation;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnrichedLocationCsvWriterTest {

    private final EnrichedLocationCsvWriter writer = new EnrichedLocationCsvWriter();

    private static LocationAggregate suite() {
        return new LocationAggregate("123 MAIN STREET|SUITE 400|MIAMI|FL|33101", "123 MAIN STREET SUITE 400",
                "SUITE 400", "MIAMI", "FL", "33101", AddressType.COMMERCIAL, 2,
                Map.of(LicenseCategory.SALON, 1, LicenseCategory.COSMETOLOGIST, 1));
    }

    @Test
    void writesHeaderAndResolvedRow() throws Exception {
        var out = new StringWriter();

        writer.write(List.of(new EnrichedLocation(suite(), 25.7617, -80.1918, GeocodeStatus.RESOLVED)), out);

        String[] lines = out.toString().split("\n");
        assertEquals(2, lines.length);
        assertEquals("address_key,address_clean,city_clean,state,zip,address_type,total_licenses,"
                + "count_barber,count_cosmetologist,count_salon,count_barbershop,count_owner,count_school,"
                + "lat,lon,geocode_status", lines[0]);
        assertEquals("123 MAIN STREET|SUITE 400|MIAMI|FL|33101,123 MAIN STREET SUITE 400,MIAMI,FL,33101,"
                + "Commercial,2,0,1,1,0,0,0,25.7617,-80.1918,RESOLVED", lines[1]);
    }

    @Test
    void unresolvedLocationsHaveEmptyCoordinates() throws Exception {
        var out = new StringWriter();

        writer.write(List.of(EnrichedLocation.of(suite(), null)), out);

        assertTrue(out.toString().split("\n")[1].endsWith("0,0,0,,,"));
    }

    @Test
    void unclassifiedLocationsHaveEmptyAddressType() throws Exception {
        var out = new StringWriter();

        writer.write(List.of(EnrichedLocation.of(suite().withAddressType(null), null)), out);

        assertTrue(out.toString().split("\n")[1].contains(",33101,,2,"));
    }
}
