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

import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One parcel record returned by the spatial registry, translated to canonical field names.
 * Everything except {@code parcelId} may be null when the registry left it blank.
 */
@Value
@Builder
public class ParcelCandidate {

    String parcelId;
    String parcelId8;
    String ownerName;

    String situsHouseNumber;
    String situsPreDirection;
    String situsStreetName;
    String situsStreetSuffix;
    String situsCommunity;
    String situsZip;

    Long assessedTotalValue;
    Long assessedLandValue;
    Long assessedImprovementValue;
    Long livingAreaSqft;
    Long usableLotSqft;
    Double lotAcreage;
    String beds;
    String baths;

    /**
     * Street line of the situs address, e.g. {@code 2260 CALLE FRESCOTA}.
     */
    public String situsLine() {
        return Stream.of(situsHouseNumber, situsPreDirection, situsStreetName, situsStreetSuffix)
                .filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .collect(Collectors.joining(" "));
    }
}
