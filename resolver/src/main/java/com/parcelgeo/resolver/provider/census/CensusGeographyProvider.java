/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.census;

import com.parcelgeo.resolver.exception.ExternalServiceException;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.provider.GeographyFeature;
import com.parcelgeo.resolver.provider.GeographyLayer;
import com.parcelgeo.resolver.provider.GeographyLookup;
import com.parcelgeo.resolver.provider.GeographyProvider;
import com.parcelgeo.resolver.provider.ProviderThrottle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reverse geography lookup against the Census Bureau geocoder.
 */
@Slf4j
@Component
public class CensusGeographyProvider implements GeographyProvider {

    public static final String PROVIDER_ID = "census-geography";

    private static final Map<GeographyLayer, String> LAYER_TITLES = Map.of(
            GeographyLayer.STATE, "States",
            GeographyLayer.COUNTY, "Counties",
            GeographyLayer.COUNTY_SUBDIVISION, "County Subdivisions",
            GeographyLayer.INCORPORATED_PLACE, "Incorporated Places",
            GeographyLayer.CENSUS_DESIGNATED_PLACE, "Census Designated Places",
            GeographyLayer.TRACT, "Census Tracts");

    private final CensusGeographyConfig config;
    private final ProviderThrottle throttle;
    private final RestClient restClient;

    public CensusGeographyProvider(CensusGeographyConfig config, ProviderThrottle throttle,
                                   RestClient.Builder restClientBuilder) {
        this.config = config;
        this.throttle = throttle;
        this.restClient = restClientBuilder
                .baseUrl(config.getBaseUrl())
                .build();
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public GeographyLookup lookup(Coordinate coordinate) {
        CensusGeographyResponse response = callGeographiesApi(coordinate);

        if (response == null) {
            throw new ExternalServiceException(PROVIDER_ID, "empty response body");
        }
        if (response.getErrors() != null && !response.getErrors().isEmpty()) {
            throw new ExternalServiceException(PROVIDER_ID, "errors: " + String.join("; ", response.getErrors()));
        }
        if (response.getResult() == null) {
            throw new ExternalServiceException(PROVIDER_ID, "response had no result");
        }

        Map<String, List<Map<String, Object>>> groups = response.getResult().getGeographies();
        if (groups == null) {
            return GeographyLookup.empty();
        }

        Map<GeographyLayer, List<GeographyFeature>> layers = new EnumMap<>(GeographyLayer.class);
        LAYER_TITLES.forEach((layer, title) -> {
            List<Map<String, Object>> features = groups.get(title);
            if (features != null) {
                layers.put(layer, features.stream()
                        .filter(Objects::nonNull)
                        .map(attributes -> toFeature(layer, attributes))
                        .toList());
            }
        });
        return new GeographyLookup(layers);
    }

    private CensusGeographyResponse callGeographiesApi(Coordinate coordinate) {
        throttle.acquire(PROVIDER_ID);
        log.debug("Census geographies for {}", coordinate);
        try {
            return restClient.get()
                    .uri(builder -> buildGeographiesUri(builder, coordinate))
                    .retrieve()
                    .body(CensusGeographyResponse.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException(PROVIDER_ID, "geographies request failed: " + e.getMessage(), e);
        }
    }

    private URI buildGeographiesUri(UriBuilder builder, Coordinate coordinate) {
        return builder.path(config.getPath())
                .queryParam("x", coordinate.lon())
                .queryParam("y", coordinate.lat())
                .queryParam("benchmark", "{benchmark}")
                .queryParam("vintage", "{vintage}")
                .queryParam("format", "json")
                .build(config.getBenchmark(), config.getVintage());
    }

    private static GeographyFeature toFeature(GeographyLayer layer, Map<String, Object> attributes) {
        String code = switch (layer) {
            case STATE -> string(attributes, "STATE");
            case COUNTY -> string(attributes, "COUNTY");
            default -> "";
        };
        return new GeographyFeature(
                string(attributes, "GEOID"),
                code,
                string(attributes, "NAME"),
                string(attributes, "CLASSFP"));
    }

    private static String string(Map<String, Object> attributes, String key) {
        Object value = attributes.get(key);
        return value == null ? "" : value.toString().trim();
    }
}
