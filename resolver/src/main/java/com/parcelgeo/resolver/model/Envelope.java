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
 * Axis-aligned bounding box in decimal degrees.
 */
public record Envelope(double minLon, double minLat, double maxLon, double maxLat) {

    public Envelope {
        if (minLon > maxLon || minLat > maxLat) {
            throw new IllegalArgumentException("envelope minimum exceeds maximum");
        }
    }

    /**
     * Builds the box {@code [lon-buf, lat-buf, lon+buf, lat+buf]} around a point.
     */
    public static Envelope around(Coordinate center, double bufferDegrees) {
        if (bufferDegrees < 0 || Double.isNaN(bufferDegrees)) {
            throw new IllegalArgumentException("buffer must be non-negative: " + bufferDegrees);
        }
        return new Envelope(
                center.lon() - bufferDegrees,
                center.lat() - bufferDegrees,
                center.lon() + bufferDegrees,
                center.lat() + bufferDegrees);
    }

    public boolean contains(Coordinate point) {
        return point.lon() >= minLon && point.lon() <= maxLon
                && point.lat() >= minLat && point.lat() <= maxLat;
    }

    public boolean intersects(Envelope other) {
        return other.minLon <= maxLon && other.maxLon >= minLon
                && other.minLat <= maxLat && other.maxLat >= minLat;
    }

    /**
     * The {@code xmin,ymin,xmax,ymax} form ArcGIS expects for an envelope geometry.
     */
    public String toQueryString() {
        return String.format(Locale.ROOT, "%.7f,%.7f,%.7f,%.7f", minLon, minLat, maxLon, maxLat);
    }
}
