/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider;

import com.parcelgeo.resolver.model.Envelope;
import com.parcelgeo.resolver.model.ParcelCandidate;

import java.util.List;

/**
 * Parcel registry that can answer a spatial-intersects query against a bounding envelope.
 */
public interface ParcelRegistryProvider {

    String getProviderId();

    /**
     * @return parcels whose footprint intersects the envelope, in the registry's order
     * @throws com.parcelgeo.resolver.exception.ExternalServiceException on transport or provider failure
     */
    List<ParcelCandidate> findIntersecting(Envelope envelope);
}
