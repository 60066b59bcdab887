/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.runner;

import com.geastalt.licensing.aggregate.LicenseAggregator;
import com.geastalt.licensing.cache.CacheMissPolicy;
import com.geastalt.licensing.cache.GeocodeCacheStore;
import com.geastalt.licensing.cache.InMemoryGeocodeCacheStore;
import com.geastalt.licensing.classify.LocationClassifier;
import com.geastalt.licensing.config.ClassificationProperties;
import com.geastalt.licensing.config.GeocodingProperties;
import com.geastalt.licensing.config.LicensingSqlProperties;
import com.geastalt.licensing.config.RunProperties;
import com.geastalt.licensing.ingest.EnrichedLocationCsvWriter;
import com.geastalt.licensing.ingest.LicenseRecordCsvReader;
import com.geastalt.licensing.normalize.AddressNormalizer;
import com.geastalt.licensing.provider.FakeGeocodingProvider;
import com.geastalt.licensing.provider.GeocodingProviderRegistry;
import com.geastalt.licensing.repository.JdbcGeocodeCacheStore;
import com.geastalt.licensing.routing.BoundingBoxValidator;
import com.geastalt.licensing.routing.HybridGeocodingRouter;
import com.geastalt.licensing.routing.LaneSelector;
import com.geastalt.licensing.service.LocationEnrichmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.support.GenericApplicationContext;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class LicenseEnrichmentRunnerTest {

    @TempDir
    Path dir;

    private RunProperties runProperties;
    private InMemoryGeocodeCacheStore cacheStore;
    private LicenseEnrichmentRunner runner;

    @BeforeEach
    void setUp() {
        runProperties = new RunProperties();
        cacheStore = new InMemoryGeocodeCacheStore();
        runner = new LicenseEnrichmentRunner(runProperties, new LicenseRecordCsvReader(),
                new EnrichedLocationCsvWriter(), service(cacheStore, new GeocodingProperties(),
                        FakeGeocodingProvider.matchingAt("mapbox", 25.7617, -80.1918)));
    }

    private static LocationEnrichmentService service(GeocodeCacheStore store, GeocodingProperties properties,
                                                     FakeGeocodingProvider fast) {
        var registry = new GeocodingProviderRegistry(List.of(fast,
                FakeGeocodingProvider.matchingAt("census", 25.7617, -80.1918)), properties);
        var router = new HybridGeocodingRouter(new LaneSelector(properties, registry), registry, properties,
                new BoundingBoxValidator(), duration -> { });
        return new LocationEnrichmentService(new AddressNormalizer(), new LicenseAggregator(),
                new LocationClassifier(new ClassificationProperties()), locations -> { }, store, router,
                new CacheMissPolicy(null, Clock.systemUTC()), Clock.systemUTC());
    }

    @Test
    @DisplayName("Should enrich the input file and write the output file")
    void shouldEnrichInputToOutput() throws Exception {
        Path input = dir.resolve("licenses.csv");
        Path output = dir.resolve("locations.csv");
        Files.writeString(input, """
                license_id,street,city,state,zip,category
                L1,123 Main St Ste 400,Miami,FL,33101,salon
                L2,PO Box 552,Tampa,FL,33601,barber
                """, StandardCharsets.UTF_8);
        runProperties.setInput(input.toString());
        runProperties.setOutput(output.toString());

        runner.run(new DefaultApplicationArguments());

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(1).startsWith("123 MAIN STREET|SUITE 400|MIAMI|FL|33101,"));
        assertTrue(lines.get(1).endsWith(",25.7617,-80.1918,RESOLVED"));
        assertEquals(1, cacheStore.size());
    }

    @Test
    void blankInputDoesNothing() throws Exception {
        runProperties.setInput(" ");

        runner.run(new DefaultApplicationArguments());

        assertEquals(0, cacheStore.size());
    }

    @Test
    @DisplayName("Closing the context drains the in-flight batch before the database shuts down")
    void closingContextCheckpointsInFlightBatch() throws Exception {
        Path input = dir.resolve("licenses.csv");
        Path output = dir.resolve("locations.csv");
        Files.writeString(input, """
                license_id,street,city,state,zip,category
                L1,100 Biscayne Blvd,Miami,FL,33132,salon
                L2,200 Biscayne Blvd,Miami,FL,33132,barber
                L3,300 Biscayne Blvd,Miami,FL,33132,salon
                """, StandardCharsets.UTF_8);
        runProperties.setInput(input.toString());
        runProperties.setOutput(output.toString());

        var properties = new GeocodingProperties();
        properties.getFast().setBatchSize(1);
        properties.getFast().setConcurrency(1);
        var fast = FakeGeocodingProvider.matchingAt("mapbox", 25.7617, -80.1918);
        fast.delayEachCall(300);

        var context = new GenericApplicationContext();
        context.registerBean(EmbeddedDatabase.class, () -> new EmbeddedDatabaseBuilder()
                        .setType(EmbeddedDatabaseType.H2)
                        .generateUniqueName(true)
                        .addScript("classpath:schema.sql")
                        .build(),
                definition -> definition.setDestroyMethodName("shutdown"));
        context.registerBean(LicenseEnrichmentRunner.class, () -> new LicenseEnrichmentRunner(runProperties,
                new LicenseRecordCsvReader(), new EnrichedLocationCsvWriter(),
                service(new JdbcGeocodeCacheStore(new NamedParameterJdbcTemplate(context.getBean(EmbeddedDatabase.class)),
                        new LicensingSqlProperties()), properties, fast)));
        context.refresh();

        var contextRunner = context.getBean(LicenseEnrichmentRunner.class);
        assertTrue(contextRunner.isRunning());
        var failure = new AtomicReference<Throwable>();
        var runThread = new Thread(() -> {
            try {
                contextRunner.run(new DefaultApplicationArguments());
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "enrichment-run");
        runThread.start();

        assertTrue(fast.awaitFirstCall(5, TimeUnit.SECONDS));
        context.close();
        runThread.join(5000);

        assertFalse(runThread.isAlive());
        assertNull(failure.get());
        assertFalse(contextRunner.isRunning());
        assertEquals(1, fast.calls());
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertEquals(1, lines.stream().filter(line -> line.endsWith(",25.7617,-80.1918,RESOLVED")).count());
    }

    @Test
    @DisplayName("Stopping with no run in progress returns at once")
    void stopWithoutRun() {
        runner.start();

        runner.stop();

        assertFalse(runner.isRunning());
        assertEquals(0, cacheStore.size());
    }
}
