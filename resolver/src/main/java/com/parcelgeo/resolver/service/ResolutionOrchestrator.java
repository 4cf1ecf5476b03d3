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
import com.parcelgeo.resolver.model.EnrichedLocation;
import com.parcelgeo.resolver.model.GeocodeConfidence;
import com.parcelgeo.resolver.model.GeocodeResult;
import com.parcelgeo.resolver.model.LocationQuery;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.model.ResolutionStage;
import com.parcelgeo.resolver.model.ResolutionStatus;
import com.parcelgeo.resolver.model.ScoredCandidate;
import com.parcelgeo.resolver.provider.GeocodingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves one location query to a parcel and its census hierarchy.
 *
 * <p>A query with a coordinate goes straight to the spatial lookup; an address-only query
 * is geocoded first. The parcel lookup is followed by the hierarchy lookup whether or not
 * a parcel matched. Provider failures end the resolution with {@code ERROR} and whatever
 * was gathered up to that point. Nothing is retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResolutionOrchestrator {

    private final GeocodingProvider geocodingProvider;
    private final SpatialCandidateFetcher candidateFetcher;
    private final CandidateDisambiguator disambiguator;
    private final AdministrativeHierarchyResolver hierarchyResolver;
    private final JurisdictionScope jurisdictionScope;

    public EnrichedLocation resolve(LocationQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        Optional<String> hint = query.jurisdictionHint();
        if (hint.isPresent() && !jurisdictionScope.isCountyInScope(hint.get())) {
            log.debug("Jurisdiction {} out of scope, skipping lookup", hint.get());
            return EnrichedLocation.withoutLookup(ResolutionStatus.OUT_OF_SCOPE, query.coordinate());
        }

        Coordinate coordinate;
        Optional<GeocodeConfidence> confidence;
        if (query.coordinate().isPresent()) {
            coordinate = query.coordinate().get();
            confidence = Optional.empty();
        } else {
            String address = query.rawAddress().orElseThrow();
            GeocodeResult geocode;
            try {
                geocode = geocodingProvider.geocode(address);
            } catch (ExternalServiceException e) {
                log.warn("Geocoding failed for '{}': {}", address, e.getMessage());
                return EnrichedLocation.failed(ResolutionStage.GEOCODE, e.getMessage(),
                        Optional.empty(), Optional.empty());
            }
            if (!geocode.isMatch()) {
                log.debug("No geocode for '{}'", address);
                return EnrichedLocation.noGeocode();
            }
            coordinate = geocode.coordinate().orElseThrow();
            confidence = Optional.of(geocode.confidence());
        }

        List<ParcelCandidate> candidates;
        try {
            candidates = candidateFetcher.findCandidates(coordinate);
        } catch (ExternalServiceException e) {
            log.warn("Parcel lookup failed at {}: {}", coordinate, e.getMessage());
            return EnrichedLocation.failed(ResolutionStage.SPATIAL_QUERY, e.getMessage(),
                    Optional.of(coordinate), confidence);
        }

        Optional<ScoredCandidate> best = disambiguator.selectBest(candidates, query.addressOrEmpty());
        AdministrativeHierarchy hierarchy = hierarchyResolver.resolveHierarchy(coordinate);

        ResolutionStatus status = best.isPresent() ? ResolutionStatus.RESOLVED : ResolutionStatus.NO_PARCEL;
        best.ifPresent(match -> log.debug("Matched parcel {} ({}) with score {} among {} candidates",
                match.candidate().getParcelId(), match.candidate().situsLine(), match.score(), candidates.size()));

        return new EnrichedLocation(status, Optional.of(coordinate), confidence, best, candidates.size(),
                hierarchy, Optional.empty(), Optional.empty());
    }
}
