/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one geocoding call. A provider that answered with zero results yields
 * {@link GeocodeConfidence#NONE} and no coordinate.
 */
public record GeocodeResult(Optional<Coordinate> coordinate, GeocodeConfidence confidence) {

    public GeocodeResult {
        Objects.requireNonNull(coordinate, "coordinate optional must not be null");
        Objects.requireNonNull(confidence, "confidence must not be null");
        if (coordinate.isPresent() == (confidence == GeocodeConfidence.NONE)) {
            throw new IllegalArgumentException("coordinate must be present exactly when confidence is not NONE");
        }
    }

    public static GeocodeResult exact(Coordinate coordinate) {
        return new GeocodeResult(Optional.of(coordinate), GeocodeConfidence.EXACT);
    }

    public static GeocodeResult approximate(Coordinate coordinate) {
        return new GeocodeResult(Optional.of(coordinate), GeocodeConfidence.APPROXIMATE);
    }

    public static GeocodeResult noMatch() {
        return new GeocodeResult(Optional.empty(), GeocodeConfidence.NONE);
    }

    public boolean isMatch() {
        return confidence != GeocodeConfidence.NONE;
    }
}
