/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.arcgis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parcelgeo.resolver.exception.ExternalServiceException;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.model.Envelope;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.provider.ProviderThrottle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Tests for ArcGisParcelRegistryProvider against a mocked feature service.
 */
class ArcGisParcelRegistryProviderTest {

    private static final String QUERY_URL =
            "https://gis-public.sandiegocounty.gov/arcgis/rest/services/sdep_warehouse/PARCELS_ALL/FeatureServer/0/query";

    private static final Envelope ENVELOPE = Envelope.around(Coordinate.of(32.8456, -117.2750), 0.0003);

    private MockRestServiceServer server;
    private ArcGisParcelRegistryProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new ArcGisParcelRegistryProvider(new ArcGisParcelConfig(), ProviderThrottle.unlimited(),
                builder, new ObjectMapper());
    }

    private void respond(String body) {
        server.expect(requestTo(startsWith(QUERY_URL)))
                .andExpect(queryParam("geometryType", "esriGeometryEnvelope"))
                .andExpect(queryParam("spatialRel", "esriSpatialRelIntersects"))
                .andExpect(queryParam("returnGeometry", "false"))
                .andExpect(queryParam("f", "json"))
                .andRespond(withSuccess(body, MediaType.TEXT_PLAIN));
    }

    @Test
    @DisplayName("Should map intersecting features to candidates in service order")
    void shouldMapFeatures() {
        respond("""
                {"features": [
                  {"attributes": {"APN": "3461620800", "APN_8": "34616208", "OWN_NAME1": "SMITH FAMILY TRUST",
                    "SITUS_ADDRESS": 2260.0, "SITUS_STREET": "CALLE FRESCOTA", "SITUS_COMMUNITY": "LA JOLLA",
                    "SITUS_ZIP": "92037-4401", "ASR_TOTAL": 1250000, "ASR_LAND": 900000, "ASR_IMPR": 350000,
                    "TOTAL_LVG_AREA": 2450, "USABLE_SQ_FEET": 8100, "ACREAGE": 0.19, "BEDROOMS": "4", "BATHS": "030"}},
                  {"attributes": {"APN": "3461620900", "SITUS_ADDRESS": 2262, "SITUS_STREET": "CALLE FRESCOTA"}}
                ]}
                """);

        List<ParcelCandidate> candidates = provider.findIntersecting(ENVELOPE);

        assertEquals(2, candidates.size());
        ParcelCandidate first = candidates.get(0);
        assertEquals("3461620800", first.getParcelId());
        assertEquals("34616208", first.getParcelId8());
        assertEquals("2260", first.getSitusHouseNumber());
        assertEquals("2260 CALLE FRESCOTA", first.situsLine());
        assertEquals("92037", first.getSitusZip());
        assertEquals(1_250_000L, first.getAssessedTotalValue());
        assertEquals(8100L, first.getUsableLotSqft());
        assertEquals(0.19, first.getLotAcreage());
        assertEquals("030", first.getBaths());
        assertEquals("3461620900", candidates.get(1).getParcelId());
        server.verify();
    }

    @Test
    @DisplayName("Should drop features without a parcel id")
    void shouldDropFeaturesWithoutParcelId() {
        respond("""
                {"features": [{"attributes": {"APN": null, "SITUS_STREET": "CALLE FRESCOTA"}},
                              {"attributes": {"APN": "3461620800"}}]}
                """);

        List<ParcelCandidate> candidates = provider.findIntersecting(ENVELOPE);

        assertEquals(1, candidates.size());
        assertEquals("3461620800", candidates.get(0).getParcelId());
    }

    @Test
    @DisplayName("Should keep a feature whose numeric attribute overflows")
    void shouldKeepFeatureWithOverflowingNumber() {
        respond("""
                {"features": [{"attributes": {"APN": "1", "SITUS_ADDRESS": 1e400, "ACREAGE": -1e400}}]}
                """);

        List<ParcelCandidate> candidates = provider.findIntersecting(ENVELOPE);

        assertEquals(1, candidates.size());
        assertEquals("1", candidates.get(0).getParcelId());
        assertNull(candidates.get(0).getSitusHouseNumber());
        assertNull(candidates.get(0).getLotAcreage());
    }

    @Test
    @DisplayName("Should return no candidates for an empty feature list")
    void shouldReturnEmptyForNoFeatures() {
        respond("""
                {"features": []}
                """);

        assertTrue(provider.findIntersecting(ENVELOPE).isEmpty());
    }

    @Test
    @DisplayName("Should fail on an error object returned with HTTP 200")
    void shouldFailOnErrorPayload() {
        respond("""
                {"error": {"code": 400, "message": "Unable to complete operation.", "details": []}}
                """);

        var e = assertThrows(ExternalServiceException.class, () -> provider.findIntersecting(ENVELOPE));
        assertEquals(ArcGisParcelRegistryProvider.PROVIDER_ID, e.getProviderId());
        assertTrue(e.getMessage().contains("400"));
    }

    @Test
    @DisplayName("Should fail on a malformed body")
    void shouldFailOnMalformedBody() {
        respond("<html>Service Unavailable</html>");

        assertThrows(ExternalServiceException.class, () -> provider.findIntersecting(ENVELOPE));
    }

    @Test
    @DisplayName("Should fail on a server error")
    void shouldFailOnServerError() {
        server.expect(requestTo(startsWith(QUERY_URL))).andRespond(withServerError());

        assertThrows(ExternalServiceException.class, () -> provider.findIntersecting(ENVELOPE));
    }
}
