/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.service;

import com.parcelgeo.resolver.config.ResolverProperties;
import com.parcelgeo.resolver.model.Coordinate;
import com.parcelgeo.resolver.model.Envelope;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.provider.ParcelRegistryProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the parcels around a point with one envelope query instead of a point-in-polygon
 * test. The buffer has to be wide enough to reach the parcel under a rooftop geocode and
 * narrow enough to leave out most neighbours.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpatialCandidateFetcher {

    private final ParcelRegistryProvider parcelRegistry;
    private final ResolverProperties properties;

    public List<ParcelCandidate> findCandidates(Coordinate coordinate) {
        return findCandidates(coordinate, properties.getSpatialBufferDegrees());
    }

    /**
     * @return candidates in registry order, one per parcel id
     */
    public List<ParcelCandidate> findCandidates(Coordinate coordinate, double bufferDegrees) {
        Envelope envelope = Envelope.around(coordinate, bufferDegrees);
        List<ParcelCandidate> raw = parcelRegistry.findIntersecting(envelope);

        Set<String> seen = new HashSet<>();
        List<ParcelCandidate> candidates = new ArrayList<>(raw.size());
        for (ParcelCandidate candidate : raw) {
            if (seen.add(candidate.getParcelId())) {
                candidates.add(candidate);
            }
        }
        if (candidates.size() < raw.size()) {
            log.debug("Collapsed {} duplicate parcel records near {}", raw.size() - candidates.size(), coordinate);
        }
        log.debug("{} parcel candidates within {} degrees of {}", candidates.size(), bufferDegrees, coordinate);
        return candidates;
    }
}
