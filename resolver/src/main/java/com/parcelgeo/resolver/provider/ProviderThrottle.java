/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.provider;

import com.parcelgeo.resolver.config.ResolverProperties;
import com.parcelgeo.resolver.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Spaces out requests to each provider by that provider's configured minimum interval.
 * Providers are tracked independently; callers on several threads queue up for slots in
 * the order they arrive.
 */
@Slf4j
@Component
public class ProviderThrottle {

    private final Map<String, Duration> intervals;
    private final Map<String, Long> nextSlotNanos = new HashMap<>();
    private final ReentrantLock slotLock = new ReentrantLock();

    @Autowired
    public ProviderThrottle(ResolverProperties properties) {
        this(properties.getThrottle().getIntervals());
    }

    public ProviderThrottle(Map<String, Duration> intervals) {
        this.intervals = Map.copyOf(intervals);
        log.info("Provider request intervals: {}", this.intervals);
    }

    public static ProviderThrottle unlimited() {
        return new ProviderThrottle(Map.of());
    }

    /**
     * Blocks until the provider may be called again.
     */
    public void acquire(String providerId) {
        Duration interval = intervals.getOrDefault(providerId, Duration.ZERO);
        if (interval.isZero() || interval.isNegative()) {
            return;
        }

        long waitNanos;
        slotLock.lock();
        try {
            long now = System.nanoTime();
            long slot = Math.max(now, nextSlotNanos.getOrDefault(providerId, now));
            nextSlotNanos.put(providerId, slot + interval.toNanos());
            waitNanos = slot - now;
        } finally {
            slotLock.unlock();
        }

        if (waitNanos > 0) {
            log.trace("Throttling {} for {} ms", providerId, TimeUnit.NANOSECONDS.toMillis(waitNanos));
            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExternalServiceException(providerId, "interrupted while waiting for request slot", e);
            }
        }
    }
}
