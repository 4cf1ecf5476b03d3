/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.arcgis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parcelgeo.resolver.exception.ExternalServiceException;
import com.parcelgeo.resolver.model.Envelope;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.provider.ParcelRegistryProvider;
import com.parcelgeo.resolver.provider.ProviderThrottle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Envelope intersects query against an ArcGIS feature-service parcel layer.
 */
@Slf4j
@Component
public class ArcGisParcelRegistryProvider implements ParcelRegistryProvider {

    public static final String PROVIDER_ID = "arcgis-parcels";

    private final ArcGisParcelConfig config;
    private final ProviderThrottle throttle;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final ParcelAttributeMapper attributeMapper;

    public ArcGisParcelRegistryProvider(ArcGisParcelConfig config,
                                        ProviderThrottle throttle,
                                        RestClient.Builder restClientBuilder,
                                        ObjectMapper objectMapper) {
        this.config = config;
        this.throttle = throttle;
        this.restClient = restClientBuilder
                .baseUrl(config.getBaseUrl())
                .build();
        this.objectMapper = objectMapper;
        this.attributeMapper = new ParcelAttributeMapper(config.getFields());
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public List<ParcelCandidate> findIntersecting(Envelope envelope) {
        ArcGisQueryResponse response = parse(callQueryApi(envelope));

        if (response.getError() != null) {
            ArcGisQueryResponse.Error error = response.getError();
            throw new ExternalServiceException(PROVIDER_ID,
                    "query error " + error.getCode() + ": " + error.getMessage());
        }
        if (response.getFeatures() == null) {
            throw new ExternalServiceException(PROVIDER_ID, "response had neither features nor error");
        }

        List<ParcelCandidate> candidates = new ArrayList<>();
        for (ArcGisQueryResponse.Feature feature : response.getFeatures()) {
            Optional<ParcelCandidate> candidate = attributeMapper.map(feature.getAttributes());
            if (candidate.isPresent()) {
                candidates.add(candidate.get());
            } else {
                log.warn("Dropping parcel record without {} in envelope {}",
                        config.getFields().getParcelId(), envelope.toQueryString());
            }
        }
        log.debug("Envelope {} intersects {} parcels", envelope.toQueryString(), candidates.size());
        return candidates;
    }

    private String callQueryApi(Envelope envelope) {
        throttle.acquire(PROVIDER_ID);
        try {
            // ArcGIS serves f=json as text/plain, so read the raw body and parse it here
            return restClient.get()
                    .uri(builder -> buildQueryUri(builder, envelope))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException(PROVIDER_ID, "parcel query failed: " + e.getMessage(), e);
        }
    }

    private URI buildQueryUri(UriBuilder builder, Envelope envelope) {
        return builder.path(config.getQueryPath())
                .queryParam("geometry", "{geometry}")
                .queryParam("geometryType", "esriGeometryEnvelope")
                .queryParam("inSR", "{inSr}")
                .queryParam("spatialRel", "esriSpatialRelIntersects")
                .queryParam("outFields", "{outFields}")
                .queryParam("returnGeometry", "false")
                .queryParam("f", "json")
                .build(envelope.toQueryString(), config.getInSr(), config.getOutFields());
    }

    private ArcGisQueryResponse parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ExternalServiceException(PROVIDER_ID, "empty response body");
        }
        try {
            return objectMapper.readValue(body, ArcGisQueryResponse.class);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(PROVIDER_ID, "malformed response: " + e.getOriginalMessage(), e);
        }
    }
}
