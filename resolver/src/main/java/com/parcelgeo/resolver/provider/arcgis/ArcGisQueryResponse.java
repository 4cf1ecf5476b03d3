/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider.arcgis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Body of a feature-service {@code query} call with {@code f=json}. A failed query still
 * answers HTTP 200 and fills {@code error} instead of {@code features}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArcGisQueryResponse {

    private List<Feature> features;
    private Error error;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Feature {
        private Map<String, Object> attributes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Error {
        private Integer code;
        private String message;
        private List<String> details;
    }
}
