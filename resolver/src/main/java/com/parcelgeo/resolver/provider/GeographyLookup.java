/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Geographies returned for one point, grouped by layer. A layer the service left out or
 * returned empty has no entry.
 */
public record GeographyLookup(Map<GeographyLayer, List<GeographyFeature>> layers) {

    public GeographyLookup {
        EnumMap<GeographyLayer, List<GeographyFeature>> copy = new EnumMap<>(GeographyLayer.class);
        if (layers != null) {
            layers.forEach((layer, features) -> {
                if (features != null && !features.isEmpty()) {
                    copy.put(layer, List.copyOf(features));
                }
            });
        }
        layers = Collections.unmodifiableMap(copy);
    }

    public static GeographyLookup empty() {
        return new GeographyLookup(Map.of());
    }

    public Optional<GeographyFeature> first(GeographyLayer layer) {
        List<GeographyFeature> features = layers.get(layer);
        return features == null ? Optional.empty() : Optional.of(features.get(0));
    }
}
