/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.service;

import com.parcelgeo.resolver.config.ResolverProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cheap scope checks on what is already known about a location, used to skip provider
 * calls for places the parcel registry cannot cover. An unknown value is never out of scope.
 */
@Slf4j
@Component
public class JurisdictionScope {

    private static final int ZIP5_LENGTH = 5;

    private final Set<String> countyGeoids;
    private final Set<String> zipCodes;

    public JurisdictionScope(ResolverProperties properties) {
        this.countyGeoids = normalized(properties.getJurisdiction().getCountyGeoids());
        this.zipCodes = normalized(properties.getJurisdiction().getZipCodes());
        log.info("Jurisdiction scope: counties={}, zips={}",
                countyGeoids.isEmpty() ? "any" : countyGeoids,
                zipCodes.isEmpty() ? "any" : zipCodes);
    }

    public boolean isCountyInScope(String countyGeoid) {
        if (countyGeoids.isEmpty() || countyGeoid == null || countyGeoid.isBlank()) {
            return true;
        }
        return countyGeoids.contains(countyGeoid.trim());
    }

    public boolean isZipInScope(String zip) {
        if (zipCodes.isEmpty() || zip == null || zip.isBlank()) {
            return true;
        }
        String trimmed = zip.trim();
        String zip5 = trimmed.length() > ZIP5_LENGTH ? trimmed.substring(0, ZIP5_LENGTH) : trimmed;
        return zipCodes.contains(zip5);
    }

    private static Set<String> normalized(List<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
    }
}
