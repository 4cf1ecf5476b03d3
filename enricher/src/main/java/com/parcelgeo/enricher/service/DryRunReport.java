/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.service;

import com.parcelgeo.enricher.row.EnrichmentRow;

import java.util.List;

/**
 * What an enrichment run would do with an input file, computed without any provider call.
 *
 * @param sample the first rows that would be resolved
 */
public record DryRunReport(
        int read,
        int resumed,
        int passedThrough,
        int outOfScope,
        int invalid,
        int toResolve,
        List<EnrichmentRow> sample
) {

    public DryRunReport {
        sample = List.copyOf(sample);
    }
}
