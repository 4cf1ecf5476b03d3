/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.batch;

/**
 * Counts for one driver run.
 *
 * @param alreadyWritten items skipped because an earlier run had written them
 * @param passedThrough  items written unchanged
 * @param failed         items whose processing threw
 * @param limitReached   the run stopped at its item limit with input left over
 */
public record BatchSummary(
        int read,
        int alreadyWritten,
        int passedThrough,
        int processed,
        int failed,
        int written,
        boolean limitReached
) {}
