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

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "licensing.classification")
@Getter
@Setter
public class ClassificationProperties {

    /** Whole-token keywords that mark a location as commercial. */
    private List<String> commercialKeywords = new ArrayList<>(List.of("SUITE", "SALON", "MALL", "PLAZA", "SHOP", "SPA"));

    /** Unit designators that may indicate an apartment. */
    private List<String> residentialDesignators = new ArrayList<>(List.of("APT", "UNIT"));

    private String residentialUnitPattern = "\\d{3,4}";

    private int residentialMaxLicenses = 1;

    /** Locations with more licenses than this are commercial. */
    private int densityThreshold = 2;
}
