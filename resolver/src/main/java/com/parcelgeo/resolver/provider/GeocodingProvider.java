/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider;

import com.parcelgeo.resolver.model.GeocodeResult;

/**
 * Free-text address to coordinate. Implementations do not cache.
 */
public interface GeocodingProvider {

    String getProviderId();

    /**
     * @param address non-empty address text
     * @return the first match, or a {@code NONE} result when the provider found nothing
     * @throws com.parcelgeo.resolver.exception.ExternalServiceException on transport or provider failure
     */
    GeocodeResult geocode(String address);
}
