/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider;

public enum GeographyLayer {
    STATE,
    COUNTY,
    COUNTY_SUBDIVISION,
    INCORPORATED_PLACE,
    CENSUS_DESIGNATED_PLACE,
    TRACT
}
