/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "enricher")
public class EnricherProperties {

    private Columns columns = new Columns();

    /** Rows resolved in parallel; 1 keeps the run strictly sequential. */
    private int workers = 1;

    /** Rows each worker may have in flight ahead of the writer. */
    private int windowSize = 4;

    /** Skip rows whose key is already in an existing output file and append after them. */
    private boolean resume = true;

    private String outputSuffix = "_with_parcels";

    private Retry retry = new Retry();

    /**
     * Input column names.
     */
    @Data
    public static class Columns {
        private String id = "id";
        private String address = "address";
        private String city = "city";
        private String state = "state";
        private String zip = "zipcode";
        private String latitude = "latitude";
        private String longitude = "longitude";
        private String countyGeoid = "county_geoid";
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(5);
    }
}
