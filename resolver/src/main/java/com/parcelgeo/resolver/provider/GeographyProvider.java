/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider;

import com.parcelgeo.resolver.model.Coordinate;

/**
 * Reverse lookup of the administrative geographies containing a point.
 */
public interface GeographyProvider {

    String getProviderId();

    /**
     * @throws com.parcelgeo.resolver.exception.ExternalServiceException on transport or provider failure
     */
    GeographyLookup lookup(Coordinate coordinate);
}
