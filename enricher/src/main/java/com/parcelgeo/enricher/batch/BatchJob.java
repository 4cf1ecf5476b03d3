/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.batch;

/**
 * Per-item behaviour plugged into {@link ResumableBatchDriver}.
 */
public interface BatchJob<T> {

    /**
     * Item already durably written by an earlier run; it is neither processed nor written again.
     */
    default boolean isAlreadyWritten(T item) {
        return false;
    }

    /**
     * Item that needs no work; it is written through unchanged.
     */
    default boolean isComplete(T item) {
        return false;
    }

    T process(T item);

    /**
     * Item to write when {@link #process} threw.
     */
    T onFailure(T item, Exception failure);
}
