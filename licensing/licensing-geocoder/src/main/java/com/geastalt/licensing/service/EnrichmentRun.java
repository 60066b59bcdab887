/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.service;

import java.util.List;

public record EnrichmentRun(List<EnrichedLocation> locations, RunSummary summary) {

    public EnrichmentRun {
        locations = List.copyOf(locations);
    }
}
