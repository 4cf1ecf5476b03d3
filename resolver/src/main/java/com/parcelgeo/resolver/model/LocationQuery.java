/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.model;

import com.parcelgeo.resolver.exception.InvalidQueryException;

import java.util.Objects;
import java.util.Optional;

/**
 * One location to resolve. At least one of address or coordinate must be present; blank
 * strings count as absent.
 */
public record LocationQuery(
        Optional<String> rawAddress,
        Optional<Coordinate> coordinate,
        Optional<String> jurisdictionHint
) {
    public LocationQuery {
        Objects.requireNonNull(rawAddress, "rawAddress optional must not be null");
        Objects.requireNonNull(coordinate, "coordinate optional must not be null");
        Objects.requireNonNull(jurisdictionHint, "jurisdictionHint optional must not be null");

        rawAddress = rawAddress.map(String::trim).filter(s -> !s.isEmpty());
        jurisdictionHint = jurisdictionHint.map(String::trim).filter(s -> !s.isEmpty());

        if (rawAddress.isEmpty() && coordinate.isEmpty()) {
            throw new InvalidQueryException("Location query needs an address or a coordinate");
        }
    }

    /**
     * Creates a query from nullable parts.
     */
    public static LocationQuery of(String rawAddress, Coordinate coordinate, String jurisdictionHint) {
        return new LocationQuery(
                Optional.ofNullable(rawAddress),
                Optional.ofNullable(coordinate),
                Optional.ofNullable(jurisdictionHint));
    }

    public static LocationQuery ofAddress(String rawAddress) {
        return of(rawAddress, null, null);
    }

    public static LocationQuery ofCoordinate(Coordinate coordinate) {
        return of(null, coordinate, null);
    }

    public String addressOrEmpty() {
        return rawAddress.orElse("");
    }
}
