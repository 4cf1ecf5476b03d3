/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.model;

import java.util.Locale;

/**
 * A WGS84 latitude/longitude pair in decimal degrees.
 */
public record Coordinate(double lat, double lon) {

    public Coordinate {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("latitude out of range: " + lat);
        }
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("longitude out of range: " + lon);
        }
    }

    public static Coordinate of(double lat, double lon) {
        return new Coordinate(lat, lon);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.6f,%.6f", lat, lon);
    }
}
