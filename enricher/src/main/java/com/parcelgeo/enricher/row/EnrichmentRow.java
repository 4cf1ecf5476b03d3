/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One input row: its key, its 1-based position in the input, and its column values in
 * input order. Immutable; {@link #with} returns a copy.
 */
public final class EnrichmentRow {

    private final String key;
    private final int position;
    private final Map<String, String> values;

    public EnrichmentRow(String key, int position, Map<String, String> values) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.position = position;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getKey() {
        return key;
    }

    public int getPosition() {
        return position;
    }

    public Map<String, String> getValues() {
        return values;
    }

    /**
     * Trimmed value of a column, or an empty string when absent.
     */
    public String get(String column) {
        String value = values.get(column);
        return value == null ? "" : value.trim();
    }

    public boolean has(String column) {
        return !get(column).isEmpty();
    }

    public EnrichmentRow with(Map<String, String> updates) {
        Map<String, String> merged = new LinkedHashMap<>(values);
        merged.putAll(updates);
        return new EnrichmentRow(key, position, merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnrichmentRow other)) return false;
        return position == other.position && key.equals(other.key) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, position, values);
    }

    @Override
    public String toString() {
        return "row " + key;
    }
}
