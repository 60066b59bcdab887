/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.provider.census;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "census")
public class CensusConfig {

    private String baseUrl = "https://geocoding.geo.census.gov";
    private String benchmark = "Public_AR_Current";
    private boolean enabled = true;

    /** The batch endpoint accepts at most 10,000 rows per file. */
    private int maxBatchSize = 10000;
}
