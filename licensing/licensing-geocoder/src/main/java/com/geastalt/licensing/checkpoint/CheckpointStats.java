/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.checkpoint;

import com.geastalt.licensing.cache.FailureReason;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of what a run has persisted so far.
 */
public record CheckpointStats(
        int batchesCheckpointed,
        int addressesDispatched,
        int resolved,
        Map<FailureReason, Integer> failedByReason
) {
    public CheckpointStats {
        failedByReason = Collections.unmodifiableMap(failedByReason.isEmpty()
                ? new EnumMap<>(FailureReason.class)
                : new EnumMap<>(failedByReason));
    }

    public int failed() {
        return failedByReason.values().stream().mapToInt(Integer::intValue).sum();
    }
}
