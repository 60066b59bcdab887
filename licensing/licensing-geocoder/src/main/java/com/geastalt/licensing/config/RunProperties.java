/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "licensing.run")
@Getter
@Setter
public class RunProperties {

    /** License record CSV to enrich. The runner is inactive when unset. */
    private String input;

    /** Optional CSV destination for the enriched locations. */
    private String output;

    /** How long a shutdown waits for in-flight batches to be checkpointed. */
    private Duration shutdownGrace = Duration.ofSeconds(30);
}
