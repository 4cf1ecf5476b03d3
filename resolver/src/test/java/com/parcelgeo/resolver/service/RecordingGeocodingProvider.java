/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.service;

import com.parcelgeo.resolver.exception.ExternalServiceException;
import com.parcelgeo.resolver.model.GeocodeResult;
import com.parcelgeo.resolver.provider.GeocodingProvider;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Geocoder answering from a fixed table and recording every address it was asked for.
 */
class RecordingGeocodingProvider implements GeocodingProvider {

    final List<String> calls = new ArrayList<>();
    private final Map<String, GeocodeResult> answers = new HashMap<>();
    private String failure;

    RecordingGeocodingProvider answer(String address, GeocodeResult result) {
        answers.put(address, result);
        return this;
    }

    RecordingGeocodingProvider failWith(String message) {
        this.failure = message;
        return this;
    }

    @Override
    public String getProviderId() {
        return "test-geocoder";
    }

    @Override
    public GeocodeResult geocode(String address) {
        calls.add(address);
        if (failure != null) {
            throw new ExternalServiceException(getProviderId(), failure);
        }
        return answers.getOrDefault(address, GeocodeResult.noMatch());
    }
}
