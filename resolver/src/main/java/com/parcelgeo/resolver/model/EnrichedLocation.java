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
 * Result of resolving one {@link LocationQuery}. Immutable; an {@code ERROR} result keeps
 * whatever was gathered before the failing stage.
 *
 * @param geocodeConfidence present only when the coordinate came from the geocoder
 */
public record EnrichedLocation(
        ResolutionStatus status,
        Optional<Coordinate> coordinate,
        Optional<GeocodeConfidence> geocodeConfidence,
        Optional<ScoredCandidate> bestMatch,
        int candidateCount,
        AdministrativeHierarchy hierarchy,
        Optional<ResolutionStage> failedStage,
        Optional<String> errorMessage
) {
    public EnrichedLocation {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(coordinate, "coordinate optional must not be null");
        Objects.requireNonNull(geocodeConfidence, "geocodeConfidence optional must not be null");
        Objects.requireNonNull(bestMatch, "bestMatch optional must not be null");
        Objects.requireNonNull(hierarchy, "hierarchy must not be null");
        Objects.requireNonNull(failedStage, "failedStage optional must not be null");
        Objects.requireNonNull(errorMessage, "errorMessage optional must not be null");

        if (candidateCount < 0) {
            throw new IllegalArgumentException("candidateCount must be non-negative");
        }
        if (status == ResolutionStatus.RESOLVED && bestMatch.isEmpty()) {
            throw new IllegalArgumentException("RESOLVED requires a best match");
        }
        if (status == ResolutionStatus.ERROR && failedStage.isEmpty()) {
            throw new IllegalArgumentException("ERROR requires the failed stage");
        }
    }

    public Optional<ParcelCandidate> bestParcel() {
        return bestMatch.map(ScoredCandidate::candidate);
    }

    public boolean wasGeocoded() {
        return geocodeConfidence.isPresent();
    }

    /**
     * Location that never reached a provider (filtered out or unusable input).
     */
    public static EnrichedLocation withoutLookup(ResolutionStatus status, Optional<Coordinate> coordinate) {
        return new EnrichedLocation(status, coordinate, Optional.empty(), Optional.empty(), 0,
                AdministrativeHierarchy.EMPTY, Optional.empty(), Optional.empty());
    }

    public static EnrichedLocation noGeocode() {
        return withoutLookup(ResolutionStatus.NO_GEOCODE, Optional.empty());
    }

    /**
     * Failed resolution that still reports the coordinate (and its geocode confidence) when
     * one had been established.
     */
    public static EnrichedLocation failed(ResolutionStage stage, String message,
                                          Optional<Coordinate> coordinate,
                                          Optional<GeocodeConfidence> geocodeConfidence) {
        return new EnrichedLocation(ResolutionStatus.ERROR, coordinate, geocodeConfidence, Optional.empty(), 0,
                AdministrativeHierarchy.EMPTY, Optional.of(stage), Optional.ofNullable(message));
    }
}
