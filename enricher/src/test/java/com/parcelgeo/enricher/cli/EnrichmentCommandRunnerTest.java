/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.cli;

import com.parcelgeo.enricher.config.EnricherProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EnrichmentCommandRunnerTest {

    private final EnrichmentCommandRunner commandRunner =
            new EnrichmentCommandRunner(null, null, new EnricherProperties());

    @Test
    @DisplayName("Should derive the output file name from the input")
    void shouldDeriveDefaultOutput() {
        assertEquals(Path.of("data", "listings_with_parcels.csv"),
                commandRunner.defaultOutput(Path.of("data", "listings.csv")));
        assertEquals(Path.of("listings_with_parcels.csv"), commandRunner.defaultOutput(Path.of("listings")));
    }

    @Test
    @DisplayName("Should do nothing without options")
    void shouldIgnoreEmptyArguments() {
        assertDoesNotThrow(() -> commandRunner.run(new DefaultApplicationArguments()));
        assertDoesNotThrow(() -> commandRunner.run(new DefaultApplicationArguments("--verbose")));
    }
}
