/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.service;

import com.parcelgeo.resolver.exception.ExternalServiceException;
import com.parcelgeo.resolver.model.AdministrativeHierarchy;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.model.PlaceClass;
import com.parcelgeo.resolver.provider.GeographyFeature;
import com.parcelgeo.resolver.provider.GeographyLayer;
import com.parcelgeo.resolver.provider.GeographyLookup;
import com.parcelgeo.resolver.provider.GeographyProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Builds the state / county / subdivision / place / tract hierarchy for a point. Every
 * level is best effort; an unavailable geography service yields an empty hierarchy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdministrativeHierarchyResolver {

    private final GeographyProvider geographyProvider;

    public AdministrativeHierarchy resolveHierarchy(Coordinate coordinate) {
        GeographyLookup lookup;
        try {
            lookup = geographyProvider.lookup(coordinate);
        } catch (ExternalServiceException e) {
            log.warn("Geography lookup failed for {}, continuing without hierarchy: {}", coordinate, e.getMessage());
            return AdministrativeHierarchy.EMPTY;
        }
        return extract(lookup);
    }

    AdministrativeHierarchy extract(GeographyLookup lookup) {
        AdministrativeHierarchy.AdministrativeHierarchyBuilder builder = AdministrativeHierarchy.builder();

        lookup.first(GeographyLayer.STATE).ifPresent(state -> builder
                .stateFips(state.code())
                .stateName(state.name()));

        lookup.first(GeographyLayer.COUNTY).ifPresent(county -> builder
                .countyFips(county.code())
                .countyGeoid(county.geoid())
                .countyName(county.name()));

        lookup.first(GeographyLayer.COUNTY_SUBDIVISION).ifPresent(subdivision -> builder
                .subdivisionGeoid(subdivision.geoid())
                .subdivisionName(subdivision.name()));

        // incorporated places win over census designated places
        Optional<GeographyFeature> incorporated = lookup.first(GeographyLayer.INCORPORATED_PLACE);
        Optional<GeographyFeature> place = incorporated.or(() -> lookup.first(GeographyLayer.CENSUS_DESIGNATED_PLACE));
        place.ifPresent(p -> builder
                .placeGeoid(p.geoid())
                .placeName(p.name())
                .placeClass(incorporated.isPresent() ? PlaceClass.INCORPORATED : PlaceClass.CDP)
                .placeClassFp(p.classFp()));

        lookup.first(GeographyLayer.TRACT).ifPresent(tract -> builder.tractGeoid(tract.geoid()));

        return builder.build();
    }
}
