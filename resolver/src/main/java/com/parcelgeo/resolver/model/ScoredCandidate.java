/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.model;

import java.util.Objects;

public record ScoredCandidate(ParcelCandidate candidate, int score) {

    public ScoredCandidate {
        Objects.requireNonNull(candidate, "candidate must not be null");
        if (score < 0) {
            throw new IllegalArgumentException("score must be non-negative");
        }
    }
}
