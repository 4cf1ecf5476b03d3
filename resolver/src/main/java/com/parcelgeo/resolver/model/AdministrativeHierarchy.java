/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.model;

import lombok.Builder;
import lombok.Value;

/**
 * State, county, county subdivision, place and tract containing a point. Each level is
 * independent: a level the geography service did not return is left as empty strings.
 */
@Value
@Builder(toBuilder = true)
public class AdministrativeHierarchy {

    public static final AdministrativeHierarchy EMPTY = AdministrativeHierarchy.builder().build();

    @Builder.Default String stateFips = "";
    @Builder.Default String stateName = "";
    @Builder.Default String countyFips = "";
    @Builder.Default String countyGeoid = "";
    @Builder.Default String countyName = "";
    @Builder.Default String subdivisionGeoid = "";
    @Builder.Default String subdivisionName = "";
    @Builder.Default String placeGeoid = "";
    @Builder.Default String placeName = "";
    @Builder.Default PlaceClass placeClass = PlaceClass.NONE;
    @Builder.Default String placeClassFp = "";
    @Builder.Default String tractGeoid = "";

    public boolean isEmpty() {
        return equals(EMPTY);
    }
}
