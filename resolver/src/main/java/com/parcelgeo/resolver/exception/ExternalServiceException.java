/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.exception;

import lombok.Getter;

/**
 * A provider call that did not produce a usable answer: transport failure, timeout,
 * non-2xx status, an error payload or a body that could not be read.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String providerId;

    public ExternalServiceException(String providerId, String message) {
        super(providerId + ": " + message);
        this.providerId = providerId;
    }

    public ExternalServiceException(String providerId, String message, Throwable cause) {
        super(providerId + ": " + message, cause);
        this.providerId = providerId;
    }
}
