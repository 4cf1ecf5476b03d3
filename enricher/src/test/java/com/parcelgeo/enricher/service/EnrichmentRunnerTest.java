/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.service;

import com.parcelgeo.enricher.config.EnricherProperties;
import com.parcelgeo.enricher.csv.CsvRowSink;
import com.parcelgeo.enricher.row.EnrichmentColumns;
import com.parcelgeo.enricher.row.EnrichmentRow;
import com.parcelgeo.enricher.row.LocationRowMapper;
import com.parcelgeo.resolver.config.ResolverProperties;
import com.parcelgeo.resolver.exception.ExternalServiceException;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.model.Envelope;
import com.parcelgeo.resolver.model.GeocodeResult;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.model.ResolutionStatus;
import com.parcelgeo.resolver.provider.GeocodingProvider;
import com.parcelgeo.resolver.provider.GeographyFeature;
import com.parcelgeo.resolver.provider.GeographyLayer;
import com.parcelgeo.resolver.provider.GeographyLookup;
import com.parcelgeo.resolver.provider.GeographyProvider;
import com.parcelgeo.resolver.provider.ParcelRegistryProvider;
import com.parcelgeo.resolver.service.AdministrativeHierarchyResolver;
import com.parcelgeo.resolver.service.CandidateDisambiguator;
import com.parcelgeo.resolver.service.JurisdictionScope;
import com.parcelgeo.resolver.service.ResolutionOrchestrator;
import com.parcelgeo.resolver.service.SpatialCandidateFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EnrichmentRunner over an orchestrator wired to counting providers.
 */
class EnrichmentRunnerTest {

    private static final String FULL_ADDRESS = "2260 Calle Frescota, La Jolla, CA 92037";
    private static final Coordinate POINT = Coordinate.of(32.8456, -117.275);

    private static final String INPUT = """
            id,address,city,state,zipcode,county_geoid
            1,2260 Calle Frescota,La Jolla,CA,92037,06073
            2,500 Main St,Santa Ana,CA,92701,06059
            3,2260 Calle Frescota,La Jolla,CA,92037,
            """;

    @TempDir
    Path dir;

    private CountingGeocoder geocoder;
    private CountingRegistry registry;
    private CountingGeography geography;
    private EnricherProperties enricherProperties;
    private EnrichmentRunner runner;

    @BeforeEach
    void setUp() {
        geocoder = new CountingGeocoder();
        registry = new CountingRegistry();
        geography = new CountingGeography();

        var resolverProperties = new ResolverProperties();
        resolverProperties.getJurisdiction().setCountyGeoids(List.of("06073"));
        var scope = new JurisdictionScope(resolverProperties);
        var orchestrator = new ResolutionOrchestrator(
                geocoder,
                new SpatialCandidateFetcher(registry, resolverProperties),
                new CandidateDisambiguator(resolverProperties),
                new AdministrativeHierarchyResolver(geography),
                scope);

        enricherProperties = new EnricherProperties();
        enricherProperties.getRetry().setInitialBackoff(Duration.ZERO);
        enricherProperties.getRetry().setMaxBackoff(Duration.ZERO);
        runner = new EnrichmentRunner(orchestrator, new LocationRowMapper(enricherProperties), scope,
                enricherProperties);
    }

    private static EnrichmentRow row(String key, int position, String... keyValues) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("id", key);
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put(keyValues[i], keyValues[i + 1]);
        }
        return new EnrichmentRow(key, position, values);
    }

    private static EnrichmentRow addressRow(String key, int position) {
        return row(key, position, "address", "2260 Calle Frescota", "city", "La Jolla", "state", "CA",
                "zipcode", "92037");
    }

    private int totalCalls() {
        return geocoder.calls + registry.calls + geography.calls;
    }

    @Test
    @DisplayName("Should resolve a row and merge the parcel and hierarchy into it")
    void shouldResolveRow() {
        List<EnrichmentRow> out = runner.enrich(List.of(addressRow("1", 1)), row -> false, row -> false);

        EnrichmentRow enriched = out.get(0);
        assertEquals("RESOLVED", enriched.get(EnrichmentColumns.RESOLUTION_STATUS));
        assertEquals("3461620800", enriched.get(EnrichmentColumns.PARCEL_APN));
        assertEquals("San Diego city", enriched.get(EnrichmentColumns.CENSUS_PLACE_NAME));
        assertEquals("32.8456", enriched.get("latitude"));
        assertEquals("2260 Calle Frescota", enriched.get("address"));
    }

    @Test
    @DisplayName("Should pass an already resolved row through unchanged without any provider call")
    void shouldPassThroughResolvedRow() {
        var resolved = row("1", 1, "address", "2260 Calle Frescota", "parcel_apn", "999");

        List<EnrichmentRow> out = runner.enrich(List.of(resolved), r -> r.has("parcel_apn"), r -> false);

        assertEquals(List.of(resolved), out);
        assertEquals(0, totalCalls());
    }

    @Test
    @DisplayName("Should mark an out-of-scope row without any provider call")
    void shouldFilterOutOfScopeRow() {
        Predicate<EnrichmentRow> outOfScope = r -> "06059".equals(r.get("county_geoid"));
        var foreign = row("2", 1, "address", "500 Main St", "county_geoid", "06059");

        List<EnrichmentRow> out = runner.enrich(List.of(foreign), r -> false, outOfScope);

        assertEquals("OUT_OF_SCOPE", out.get(0).get(EnrichmentColumns.RESOLUTION_STATUS));
        assertEquals("", out.get(0).get(EnrichmentColumns.PARCEL_APN));
        assertEquals(0, totalCalls());
    }

    @Test
    @DisplayName("Should produce exactly one row per input row in order")
    void shouldKeepOneRowPerInput() {
        var rows = List.of(
                addressRow("1", 1),
                row("2", 2, "address", " "),
                row("3", 3, "address", "nowhere"),
                row("4", 4, "parcel_apn", "111"));

        List<EnrichmentRow> out = runner.enrich(rows, r -> r.has("parcel_apn"), runner.jurisdictionFilter());

        assertEquals(List.of("1", "2", "3", "4"), out.stream().map(EnrichmentRow::getKey).toList());
        assertEquals("RESOLVED", out.get(0).get(EnrichmentColumns.RESOLUTION_STATUS));
        assertEquals("INVALID_INPUT", out.get(1).get(EnrichmentColumns.RESOLUTION_STATUS));
        assertEquals("NO_GEOCODE", out.get(2).get(EnrichmentColumns.RESOLUTION_STATUS));
        assertEquals(rows.get(3), out.get(3));
    }

    @Test
    @DisplayName("Should retry a failed resolution and succeed once the provider recovers")
    void shouldRetryTransientFailure() {
        registry.failuresRemaining = 2;

        List<EnrichmentRow> out = runner.enrich(List.of(addressRow("1", 1)), r -> false, r -> false);

        assertEquals("RESOLVED", out.get(0).get(EnrichmentColumns.RESOLUTION_STATUS));
        assertEquals(3, registry.calls);
    }

    @Test
    @DisplayName("Should mark ERROR with the failed stage once retries are exhausted")
    void shouldGiveUpAfterMaxAttempts() {
        registry.failuresRemaining = Integer.MAX_VALUE;

        List<EnrichmentRow> out = runner.enrich(List.of(addressRow("1", 1), addressRow("2", 2)),
                r -> false, r -> false);

        assertEquals(2, out.size());
        assertEquals("ERROR", out.get(0).get(EnrichmentColumns.RESOLUTION_STATUS));
        assertEquals("SPATIAL_QUERY", out.get(0).get(EnrichmentColumns.RESOLUTION_FAILED_STAGE));
        assertEquals("32.8456", out.get(0).get("latitude"));
        assertEquals(6, registry.calls);
        assertEquals(0, geography.calls);
    }

    @Test
    @DisplayName("Should report counts per status for a file run")
    void shouldReportStatusCounts() throws IOException {
        Path input = dir.resolve("listings.csv");
        Files.writeString(input, INPUT);

        EnrichmentReport report = runner.enrichFile(input, dir.resolve("out.csv"), 0);

        assertEquals(3, report.read());
        assertEquals(3, report.written());
        assertEquals(2, report.count(ResolutionStatus.RESOLVED));
        assertEquals(1, report.count(ResolutionStatus.OUT_OF_SCOPE));
        assertEquals(0, report.count(ResolutionStatus.ERROR));
    }

    @Test
    @DisplayName("Should leave an enriched file byte-identical and make no calls when run again")
    void shouldBeIdempotent() throws IOException {
        Path input = dir.resolve("listings.csv");
        Path first = dir.resolve("first.csv");
        Path second = dir.resolve("second.csv");
        Files.writeString(input, INPUT);

        runner.enrichFile(input, first, 0);
        int callsAfterFirstRun = totalCalls();
        EnrichmentReport report = runner.enrichFile(first, second, 0);

        assertEquals(Files.readString(first), Files.readString(second));
        assertEquals(callsAfterFirstRun, totalCalls());
        assertEquals(2, report.passedThrough());
    }

    @Test
    @DisplayName("Should resume after a limited run and end with the same output as one full run")
    void shouldResumeAfterLimitedRun() throws IOException {
        Path input = dir.resolve("listings.csv");
        Path resumed = dir.resolve("resumed.csv");
        Path full = dir.resolve("full.csv");
        Files.writeString(input, INPUT);

        EnrichmentReport partial = runner.enrichFile(input, resumed, 1);
        assertTrue(partial.limitReached());
        assertEquals(1, geocoder.calls);

        EnrichmentReport rest = runner.enrichFile(input, resumed, 0);
        assertEquals(1, rest.resumed());
        assertEquals(2, rest.written());
        assertEquals(2, geocoder.calls);

        runner.enrichFile(input, full, 0);
        assertEquals(Files.readString(full), Files.readString(resumed));
    }

    @Test
    @DisplayName("Should resume rows that share an id without losing any")
    void shouldResumeDuplicateIds() throws IOException {
        Path input = dir.resolve("listings.csv");
        Path resumed = dir.resolve("resumed.csv");
        Path full = dir.resolve("full.csv");
        Files.writeString(input, """
                id,address,city,state,zipcode,county_geoid
                7,2260 Calle Frescota,La Jolla,CA,92037,06073
                7,2260 Calle Frescota,La Jolla,CA,92037,06073
                """);

        runner.enrichFile(input, resumed, 1);
        assertEquals(1, CsvRowSink.writtenRowCount(resumed));

        EnrichmentReport rest = runner.enrichFile(input, resumed, 0);
        assertEquals(1, rest.resumed());
        assertEquals(1, rest.written());
        assertEquals(2, CsvRowSink.writtenRowCount(resumed));
        assertEquals(2, geocoder.calls);

        runner.enrichFile(input, full, 0);
        assertEquals(Files.readString(full), Files.readString(resumed));
    }

    @Test
    @DisplayName("Should classify rows in a dry run without calls or output")
    void shouldDryRun() throws IOException {
        Path input = dir.resolve("listings.csv");
        Path output = dir.resolve("out.csv");
        Files.writeString(input, INPUT + "4,,,,,\n5,1 Done Rd,,,,\n");

        DryRunReport report = runner.dryRun(input, output);

        assertEquals(5, report.read());
        assertEquals(3, report.toResolve());
        assertEquals(1, report.outOfScope());
        assertEquals(1, report.invalid());
        assertEquals(List.of("1", "3", "5"), report.sample().stream().map(EnrichmentRow::getKey).toList());
        assertEquals(0, totalCalls());
        assertFalse(Files.exists(output));
    }

    @Test
    @DisplayName("Should resolve rows in order with several workers")
    void shouldKeepOrderWithWorkers() {
        enricherProperties.setWorkers(3);
        var rows = List.of(addressRow("1", 1), addressRow("2", 2), addressRow("3", 3), addressRow("4", 4));

        List<EnrichmentRow> out = runner.enrich(rows, r -> false, r -> false);

        assertEquals(List.of("1", "2", "3", "4"), out.stream().map(EnrichmentRow::getKey).toList());
        assertTrue(out.stream().allMatch(r -> "RESOLVED".equals(r.get(EnrichmentColumns.RESOLUTION_STATUS))));
    }

    @Test
    @DisplayName("Should refuse to write over its own input")
    void shouldRejectSameInputAndOutput() throws IOException {
        Path input = dir.resolve("listings.csv");
        Files.writeString(input, INPUT);

        assertThrows(IllegalArgumentException.class, () -> runner.enrichFile(input, input, 0));
    }

    private static class CountingGeocoder implements GeocodingProvider {

        int calls;

        @Override
        public String getProviderId() {
            return "test-geocoder";
        }

        @Override
        public synchronized GeocodeResult geocode(String address) {
            calls++;
            return FULL_ADDRESS.equals(address) ? GeocodeResult.exact(POINT) : GeocodeResult.noMatch();
        }
    }

    private static class CountingRegistry implements ParcelRegistryProvider {

        int calls;
        int failuresRemaining;

        @Override
        public String getProviderId() {
            return "test-parcels";
        }

        @Override
        public synchronized List<ParcelCandidate> findIntersecting(Envelope envelope) {
            calls++;
            if (failuresRemaining > 0) {
                failuresRemaining--;
                throw new ExternalServiceException(getProviderId(), "503 Service Unavailable");
            }
            return List.of(ParcelCandidate.builder()
                    .parcelId("3461620800")
                    .ownerName("SMITH FAMILY TRUST")
                    .situsHouseNumber("2260")
                    .situsStreetName("CALLE FRESCOTA")
                    .assessedTotalValue(1_250_000L)
                    .build());
        }
    }

    private static class CountingGeography implements GeographyProvider {

        int calls;

        @Override
        public String getProviderId() {
            return "test-geography";
        }

        @Override
        public synchronized GeographyLookup lookup(Coordinate coordinate) {
            calls++;
            return new GeographyLookup(Map.of(
                    GeographyLayer.COUNTY, List.of(new GeographyFeature("06073", "073", "San Diego County", "H1")),
                    GeographyLayer.INCORPORATED_PLACE, List.of(new GeographyFeature("0666000", "", "San Diego city", "C1"))));
        }
    }
}
