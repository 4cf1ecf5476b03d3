/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tuning for one resolver instance. The scoring weights and the spatial buffer were tuned
 * against a dense single-family parcel fabric; other areas may need different values.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "resolver")
public class ResolverProperties {

    private double spatialBufferDegrees = 0.0003;
    private Scoring scoring = new Scoring();
    private Jurisdiction jurisdiction = new Jurisdiction();
    private Http http = new Http();
    private Throttle throttle = new Throttle();

    @Data
    public static class Scoring {
        private int houseNumber = 10;
        private int streetWord = 5;
        private int streetSuffix = 2;
    }

    @Data
    public static class Jurisdiction {
        /** County GEOIDs (state + county FIPS) in scope; empty means every county. */
        private List<String> countyGeoids = new ArrayList<>();
        /** Five-digit ZIP codes in scope; empty means every ZIP. */
        private List<String> zipCodes = new ArrayList<>();
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Throttle {
        /** Minimum spacing between two requests to the same provider, keyed by provider id. */
        private Map<String, Duration> intervals = new LinkedHashMap<>(Map.of(
                "google-geocoding", Duration.ofMillis(50),
                "arcgis-parcels", Duration.ofMillis(300),
                "census-geography", Duration.ofMillis(300)));
    }
}
