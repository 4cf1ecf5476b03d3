/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.service;

import com.parcelgeo.enricher.batch.BatchSummary;
import com.parcelgeo.resolver.model.ResolutionStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of one enrichment run: how many rows ended in each resolution status, plus the
 * rows that were skipped because an earlier run had written them or they were already
 * resolved.
 */
public record EnrichmentReport(
        Map<ResolutionStatus, Integer> statusCounts,
        int read,
        int resumed,
        int passedThrough,
        int written,
        boolean limitReached
) {

    public EnrichmentReport {
        EnumMap<ResolutionStatus, Integer> counts = new EnumMap<>(ResolutionStatus.class);
        counts.putAll(statusCounts);
        statusCounts = Collections.unmodifiableMap(counts);
    }

    static EnrichmentReport of(BatchSummary summary, Map<ResolutionStatus, Integer> statusCounts) {
        return new EnrichmentReport(statusCounts, summary.read(), summary.alreadyWritten(),
                summary.passedThrough(), summary.written(), summary.limitReached());
    }

    public int count(ResolutionStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }

    public String describe() {
        String statuses = statusCounts.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
        return String.format("read=%d resumed=%d passed_through=%d written=%d%s [%s]",
                read, resumed, passedThrough, written, limitReached ? " (limit reached)" : "", statuses);
    }
}
