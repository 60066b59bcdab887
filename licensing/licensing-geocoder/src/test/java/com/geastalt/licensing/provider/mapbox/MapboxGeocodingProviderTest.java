/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider.mapbox;

import com.geastalt.licensing.provider.GeocodeRequest;
import com.geastalt.licensing.provider.GeocodingProviderException;
import com.geastalt.licensing.provider.ProviderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

class MapboxGeocodingProviderTest {

    private static final GeocodeRequest MIAMI =
            new GeocodeRequest("k1", "123 MAIN STREET SUITE 400", "MIAMI", "FL", "33101");
    private static final String MATCH_BODY = """
            {"type":"FeatureCollection","features":[
              {"id":"address.1","place_name":"123 Main St, Miami, Florida 33101","relevance":0.98,
               "center":[-80.1918,25.7617]}
            ]}""";

    private MockRestServiceServer server;
    private MapboxConfig config;
    private MapboxGeocodingProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.mapbox.com");
        server = MockRestServiceServer.bindTo(builder).build();
        config = new MapboxConfig();
        config.setAccessToken("test-token");
        provider = new MapboxGeocodingProvider(builder.build(), config);
    }

    @Test
    @DisplayName("Should read latitude and longitude from the first feature's center")
    void shouldGeocodeAddress() {
        server.expect(requestTo(containsString("/geocoding/v5/mapbox.places/")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("access_token", "test-token"))
                .andExpect(queryParam("country", "us"))
                .andExpect(queryParam("limit", "1"))
                .andRespond(withSuccess(MATCH_BODY, MediaType.APPLICATION_JSON));

        var result = provider.geocode(List.of(MIAMI)).get("k1");

        assertEquals(ProviderResult.Status.MATCHED, result.status());
        assertEquals(25.7617, result.latitude());
        assertEquals(-80.1918, result.longitude());
        server.verify();
    }

    @Test
    void emptyFeaturesIsNotFound() {
        server.expect(requestTo(containsString("mapbox.places")))
                .andRespond(withSuccess("{\"type\":\"FeatureCollection\",\"features\":[]}", MediaType.APPLICATION_JSON));

        assertEquals(ProviderResult.Status.NOT_FOUND, provider.geocode(List.of(MIAMI)).get("k1").status());
    }

    @Test
    @DisplayName("Throttling and server errors are transient")
    void throttlingIsTransient() {
        var second = new GeocodeRequest("k2", "9 PALM AVENUE", "MIAMI", "FL", "33101");
        server.expect(requestTo(containsString("mapbox.places")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(containsString("mapbox.places")))
                .andRespond(withServerError());

        var results = provider.geocode(List.of(MIAMI, second));

        assertEquals(ProviderResult.Status.TRANSIENT_ERROR, results.get("k1").status());
        assertEquals(ProviderResult.Status.TRANSIENT_ERROR, results.get("k2").status());
    }

    @Test
    void otherClientErrorIsNotFound() {
        server.expect(requestTo(containsString("mapbox.places"))).andRespond(withResourceNotFound());

        assertEquals(ProviderResult.Status.NOT_FOUND, provider.geocode(List.of(MIAMI)).get("k1").status());
    }

    @Test
    void unreadableBodyIsTransient() {
        server.expect(requestTo(containsString("mapbox.places")))
                .andRespond(withSuccess("not json", MediaType.APPLICATION_JSON));

        assertEquals(ProviderResult.Status.TRANSIENT_ERROR, provider.geocode(List.of(MIAMI)).get("k1").status());
    }

    @Test
    @DisplayName("A rejected token fails the whole call without retry")
    void unauthorizedIsNotRetryable() {
        server.expect(requestTo(containsString("mapbox.places"))).andRespond(withUnauthorizedRequest());

        var thrown = assertThrows(GeocodingProviderException.class, () -> provider.geocode(List.of(MIAMI)));

        assertFalse(thrown.isRetryable());
    }

    @Test
    void disabledWithoutToken() {
        assertTrue(provider.isEnabled());

        config.setAccessToken(" ");

        assertFalse(provider.isEnabled());
    }
}
