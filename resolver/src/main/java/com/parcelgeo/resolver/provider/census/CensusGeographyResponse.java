/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.census;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code /geocoder/geographies/coordinates}. Geography groups are keyed by layer
 * title ("States", "Counties", ...) and each holds a possibly empty list of features.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CensusGeographyResponse {

    private Result result;
    private List<String> errors;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {
        private Map<String, List<Map<String, Object>>> geographies;
    }
}
