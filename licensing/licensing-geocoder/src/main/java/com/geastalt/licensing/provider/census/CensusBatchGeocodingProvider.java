/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider.census;

import com.geastalt.licensing.config.GeocodingClientConfig;
import com.geastalt.licensing.provider.GeocodeRequest;
import com.geastalt.licensing.provider.GeocodingProvider;
import com.geastalt.licensing.provider.GeocodingProviderException;
import com.geastalt.licensing.provider.ProviderResult;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * US Census Bureau batch geocoder. Addresses are uploaded as one CSV file per call and the
 * response CSV is matched back by row id. Used by the bulk lane.
 */
@Slf4j
@Component
public class CensusBatchGeocodingProvider implements GeocodingProvider {

    private static final String BATCH_PATH = "/geocoder/locations/addressbatch";

    private static final int COL_ID = 0;
    private static final int COL_MATCH = 2;
    private static final int COL_COORDINATES = 5;

    private final RestClient restClient;
    private final CensusConfig censusConfig;

    public CensusBatchGeocodingProvider(@Qualifier(GeocodingClientConfig.CENSUS_CLIENT) RestClient restClient,
                                        CensusConfig censusConfig) {
        this.restClient = restClient;
        this.censusConfig = censusConfig;
    }

    @Override
    public String getProviderId() {
        return "census";
    }

    @Override
    public String getDisplayName() {
        return "US Census Batch Geocoder";
    }

    @Override
    public boolean isEnabled() {
        return censusConfig.isEnabled();
    }

    @Override
    public int maxBatchSize() {
        return censusConfig.getMaxBatchSize();
    }

    @Override
    public Map<String, ProviderResult> geocode(List<GeocodeRequest> requests) {
        Map<String, String> keysById = new HashMap<>();
        for (int i = 0; i < requests.size(); i++) {
            keysById.put(String.valueOf(i + 1), requests.get(i).addressKey());
        }

        String response = upload(toCsv(requests));
        return parseResponse(response, keysById);
    }

    private String upload(byte[] csv) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("addressFile", new ByteArrayResource(csv))
                .filename("addresses.csv")
                .contentType(MediaType.TEXT_PLAIN);
        body.part("benchmark", censusConfig.getBenchmark());

        try {
            return restClient.post()
                    .uri(BATCH_PATH)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(body.build())
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        throw new GeocodingProviderException("Census rejected batch: " + res.getStatusCode(), false);
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        throw new GeocodingProviderException("Census server error: " + res.getStatusCode(), true);
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw new GeocodingProviderException("Census request failed: " + e.getMessage(), true, e);
        }
    }

    static byte[] toCsv(List<GeocodeRequest> requests) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            for (int i = 0; i < requests.size(); i++) {
                GeocodeRequest request = requests.get(i);
                writer.writeNext(new String[] {
                        String.valueOf(i + 1),
                        request.street(),
                        request.city(),
                        request.state(),
                        request.zip()
                }, false);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write census batch", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    static Map<String, ProviderResult> parseResponse(String response, Map<String, String> keysById) {
        Map<String, ProviderResult> results = new HashMap<>();
        if (response == null || response.isBlank()) {
            return results;
        }
        List<String[]> rows;
        try (CSVReader reader = new CSVReader(new StringReader(response))) {
            rows = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new GeocodingProviderException("Unreadable census response: " + e.getMessage(), true, e);
        }

        for (String[] row : rows) {
            if (row.length <= COL_MATCH) {
                continue;
            }
            String key = keysById.get(row[COL_ID].trim());
            if (key == null) {
                log.debug("Census returned unknown row id {}", row[COL_ID]);
                continue;
            }
            results.put(key, toResult(row));
        }
        return results;
    }

    private static ProviderResult toResult(String[] row) {
        String match = row[COL_MATCH].trim();
        if ("Match".equalsIgnoreCase(match)) {
            if (row.length <= COL_COORDINATES) {
                return ProviderResult.notFound("match without coordinates");
            }
            String[] lonLat = row[COL_COORDINATES].split(",");
            try {
                double longitude = Double.parseDouble(lonLat[0].trim());
                double latitude = Double.parseDouble(lonLat[1].trim());
                return ProviderResult.matched(latitude, longitude);
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                return ProviderResult.notFound("bad coordinates: " + row[COL_COORDINATES]);
            }
        }
        if ("No_Match".equalsIgnoreCase(match) || "Tie".equalsIgnoreCase(match)) {
            return ProviderResult.notFound(match);
        }
        return ProviderResult.transientError("unexpected match status: " + match);
    }
}
