/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.census;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "census.geography")
public class CensusGeographyConfig {

    private String baseUrl = "https://geocoding.geo.census.gov";
    private String path = "/geocoder/geographies/coordinates";
    private String benchmark = "Public_AR_Current";
    private String vintage = "Current_Current";
}
