/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.service;

import com.parcelgeo.resolver.exception.ExternalServiceException;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.model.Envelope;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.provider.ParcelRegistryProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * Parcel registry holding parcels as points, returning those inside the queried envelope in
 * insertion order.
 */
class RecordingParcelRegistry implements ParcelRegistryProvider {

    final List<Envelope> calls = new ArrayList<>();
    private final List<Coordinate> locations = new ArrayList<>();
    private final List<ParcelCandidate> parcels = new ArrayList<>();
    private String failure;

    RecordingParcelRegistry add(Coordinate location, ParcelCandidate parcel) {
        locations.add(location);
        parcels.add(parcel);
        return this;
    }

    RecordingParcelRegistry failWith(String message) {
        this.failure = message;
        return this;
    }

    @Override
    public String getProviderId() {
        return "test-parcels";
    }

    @Override
    public List<ParcelCandidate> findIntersecting(Envelope envelope) {
        calls.add(envelope);
        if (failure != null) {
            throw new ExternalServiceException(getProviderId(), failure);
        }
        List<ParcelCandidate> found = new ArrayList<>();
        for (int i = 0; i < parcels.size(); i++) {
            if (envelope.contains(locations.get(i))) {
                found.add(parcels.get(i));
            }
        }
        return found;
    }
}
