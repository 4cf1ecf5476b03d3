/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider;

import java.util.Objects;

/**
 * One geography returned for a point.
 *
 * @param geoid   full GEOID (concatenated FIPS codes)
 * @param code    the layer's own FIPS component (state or county code); empty for other layers
 * @param name    display name
 * @param classFp census class code, e.g. {@code C1} for an active incorporated place
 */
public record GeographyFeature(String geoid, String code, String name, String classFp) {

    public GeographyFeature {
        geoid = Objects.requireNonNullElse(geoid, "");
        code = Objects.requireNonNullElse(code, "");
        name = Objects.requireNonNullElse(name, "");
        classFp = Objects.requireNonNullElse(classFp, "");
    }
}
