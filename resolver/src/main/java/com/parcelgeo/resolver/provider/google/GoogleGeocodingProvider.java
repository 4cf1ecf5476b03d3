/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.google;

import com.parcelgeo.resolver.exception.ExternalServiceException;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.model.GeocodeResult;
import com.parcelgeo.resolver.provider.GeocodingProvider;
import com.parcelgeo.resolver.provider.ProviderThrottle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;

@Slf4j
@Component
public class GoogleGeocodingProvider implements GeocodingProvider {

    public static final String PROVIDER_ID = "google-geocoding";

    private static final String STATUS_OK = "OK";
    private static final String STATUS_ZERO_RESULTS = "ZERO_RESULTS";

    private final GoogleGeocodingConfig config;
    private final ProviderThrottle throttle;
    private final RestClient restClient;

    public GoogleGeocodingProvider(GoogleGeocodingConfig config, ProviderThrottle throttle,
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

    public boolean isEnabled() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public GeocodeResult geocode(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be empty");
        }
        if (!isEnabled()) {
            throw new ExternalServiceException(PROVIDER_ID, "no API key configured");
        }

        GoogleGeocodingResponse response = callGeocodingApi(address.trim());
        return mapFromResponse(address, response);
    }

    private GoogleGeocodingResponse callGeocodingApi(String address) {
        throttle.acquire(PROVIDER_ID);
        log.debug("Geocoding '{}'", address);
        try {
            return restClient.get()
                    .uri(builder -> buildGeocodeUri(builder, address))
                    .retrieve()
                    .body(GoogleGeocodingResponse.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException(PROVIDER_ID, "geocoding request failed: " + e.getMessage(), e);
        }
    }

    private URI buildGeocodeUri(UriBuilder builder, String address) {
        return builder.path(config.getPath())
                .queryParam("address", "{address}")
                .queryParam("key", "{key}")
                .build(address, config.getApiKey());
    }

    private GeocodeResult mapFromResponse(String address, GoogleGeocodingResponse response) {
        if (response == null || response.getStatus() == null) {
            throw new ExternalServiceException(PROVIDER_ID, "response had no status");
        }

        String status = response.getStatus();
        if (STATUS_ZERO_RESULTS.equals(status)) {
            log.debug("No geocode match for '{}'", address);
            return GeocodeResult.noMatch();
        }
        if (!STATUS_OK.equals(status)) {
            String detail = response.getErrorMessage() != null ? " (" + response.getErrorMessage() + ")" : "";
            throw new ExternalServiceException(PROVIDER_ID, "status " + status + detail);
        }
        if (response.getResults() == null || response.getResults().isEmpty()) {
            return GeocodeResult.noMatch();
        }

        GoogleGeocodingResponse.Result first = response.getResults().get(0);
        if (first.getGeometry() == null || first.getGeometry().getLocation() == null
                || first.getGeometry().getLocation().getLat() == null
                || first.getGeometry().getLocation().getLng() == null) {
            throw new ExternalServiceException(PROVIDER_ID, "first result has no location");
        }

        GoogleGeocodingResponse.Location location = first.getGeometry().getLocation();
        Coordinate coordinate;
        try {
            coordinate = Coordinate.of(location.getLat(), location.getLng());
        } catch (IllegalArgumentException e) {
            throw new ExternalServiceException(PROVIDER_ID, "invalid location: " + e.getMessage(), e);
        }

        log.debug("Geocoded '{}' to {} ({})", address, coordinate, first.getFormattedAddress());
        return first.isPartialMatch() ? GeocodeResult.approximate(coordinate) : GeocodeResult.exact(coordinate);
    }
}
