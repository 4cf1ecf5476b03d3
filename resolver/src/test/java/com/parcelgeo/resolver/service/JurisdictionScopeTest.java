/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.service;

import com.parcelgeo.resolver.config.ResolverProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JurisdictionScope.
 */
class JurisdictionScopeTest {

    @Test
    @DisplayName("Should accept everything when no jurisdiction is configured")
    void shouldAcceptAllWhenUnconfigured() {
        var scope = new JurisdictionScope(new ResolverProperties());

        assertTrue(scope.isCountyInScope("06059"));
        assertTrue(scope.isZipInScope("92618"));
    }

    @Test
    @DisplayName("Should match configured counties and treat unknown counties as in scope")
    void shouldMatchCounties() {
        var properties = new ResolverProperties();
        properties.getJurisdiction().setCountyGeoids(List.of("06073", " "));
        var scope = new JurisdictionScope(properties);

        assertTrue(scope.isCountyInScope("06073"));
        assertTrue(scope.isCountyInScope(" 06073 "));
        assertFalse(scope.isCountyInScope("06059"));
        assertTrue(scope.isCountyInScope(""));
        assertTrue(scope.isCountyInScope(null));
    }

    @Test
    @DisplayName("Should compare ZIP+4 codes on their first five digits")
    void shouldMatchZip5() {
        var properties = new ResolverProperties();
        properties.getJurisdiction().setZipCodes(List.of("92037", "92109"));
        var scope = new JurisdictionScope(properties);

        assertTrue(scope.isZipInScope("92037-1234"));
        assertTrue(scope.isZipInScope("92109"));
        assertFalse(scope.isZipInScope("92618"));
        assertTrue(scope.isZipInScope(""));
    }
}
