/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.repository;

import com.geastalt.licensing.model.LocationAggregate;

import java.util.Collection;

/**
 * Destination for the finalized location aggregates of a run.
 */
@FunctionalInterface
public interface LocationAggregateSink {

    /**
     * Replaces all stored aggregates for the states present in {@code locations}.
     */
    void replace(Collection<LocationAggregate> locations);
}
