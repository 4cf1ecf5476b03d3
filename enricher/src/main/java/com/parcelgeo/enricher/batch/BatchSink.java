/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.batch;

import java.io.Closeable;
import java.io.IOException;

/**
 * Destination of batch results. Each {@link #write} must be durable when it returns.
 * Only the driver's calling thread writes.
 */
public interface BatchSink<T> extends Closeable {

    void write(T item) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
