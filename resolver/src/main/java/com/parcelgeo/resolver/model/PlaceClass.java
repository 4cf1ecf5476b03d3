/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.model;

/**
 * Which census place layer a hierarchy's place came from.
 */
public enum PlaceClass {
    INCORPORATED,
    CDP,
    NONE
}
