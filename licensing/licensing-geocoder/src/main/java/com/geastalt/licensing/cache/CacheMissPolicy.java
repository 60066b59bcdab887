/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides which cached keys still need a provider call.
 *
 * <p>A key is a miss when it has no entry, is pending from an interrupted run, failed for a
 * retryable reason, or failed permanently longer ago than the retry-after period. A null
 * retry-after period means permanent failures are never retried.</p>
 */
public class CacheMissPolicy {

    private final Duration permanentFailureRetryAfter;
    private final Clock clock;

    public CacheMissPolicy(Duration permanentFailureRetryAfter, Clock clock) {
        this.permanentFailureRetryAfter = permanentFailureRetryAfter;
        this.clock = clock;
    }

    public boolean isMiss(GeocodeCacheEntry entry) {
        if (entry == null) {
            return true;
        }
        return switch (entry.status()) {
            case RESOLVED -> false;
            case PENDING -> true;
            case FAILED -> !entry.failureReason().isPermanent() || isStale(entry.lastUpdated());
        };
    }

    private boolean isStale(Instant lastUpdated) {
        if (permanentFailureRetryAfter == null) {
            return false;
        }
        return lastUpdated.plus(permanentFailureRetryAfter).isBefore(Instant.now(clock));
    }
}
