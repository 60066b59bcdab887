/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.classify;

import com.geastalt.licensing.aggregate.AggregationResult;
import com.geastalt.licensing.config.ClassificationProperties;
import com.geastalt.licensing.model.AddressType;
import com.geastalt.licensing.model.LocationAggregate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Labels each location Commercial or Residential. Rules are evaluated in order and the first
 * match wins: commercial keyword, residential unit, license density, then the residential default.
 */
@Slf4j
@Component
public class LocationClassifier {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Set<String> commercialKeywords;
    private final Set<String> residentialDesignators;
    private final Pattern residentialUnitPattern;
    private final int residentialMaxLicenses;
    private final int densityThreshold;

    public LocationClassifier(ClassificationProperties properties) {
        this.commercialKeywords = upperSet(properties.getCommercialKeywords());
        this.residentialDesignators = upperSet(properties.getResidentialDesignators());
        this.residentialUnitPattern = Pattern.compile(properties.getResidentialUnitPattern());
        this.residentialMaxLicenses = properties.getResidentialMaxLicenses();
        this.densityThreshold = properties.getDensityThreshold();
    }

    public Classification classify(LocationAggregate location) {
        String[] addressTokens = tokens(location.addressClean());
        String[] unitTokens = tokens(location.unit());

        if (containsKeyword(addressTokens) || containsKeyword(unitTokens)) {
            return new Classification(AddressType.COMMERCIAL, ClassificationRule.COMMERCIAL_KEYWORD);
        }
        if (location.totalLicenses() <= residentialMaxLicenses && hasResidentialUnit(unitTokens)) {
            return new Classification(AddressType.RESIDENTIAL, ClassificationRule.RESIDENTIAL_UNIT);
        }
        if (location.totalLicenses() > densityThreshold) {
            return new Classification(AddressType.COMMERCIAL, ClassificationRule.DENSITY);
        }
        return new Classification(AddressType.RESIDENTIAL, ClassificationRule.DEFAULT);
    }

    public LocationAggregate apply(LocationAggregate location) {
        Classification classification = classify(location);
        log.trace("Classified {} as {} by {}", location.addressKey(),
                classification.addressType().label(), classification.rule());
        return location.withAddressType(classification.addressType());
    }

    public List<LocationAggregate> classifyAll(AggregationResult aggregation) {
        return aggregation.locations().stream()
                .map(this::apply)
                .collect(Collectors.toList());
    }

    private boolean containsKeyword(String[] tokens) {
        for (String token : tokens) {
            if (commercialKeywords.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasResidentialUnit(String[] unitTokens) {
        for (int i = 0; i + 1 < unitTokens.length; i++) {
            if (residentialDesignators.contains(unitTokens[i])
                    && residentialUnitPattern.matcher(unitTokens[i + 1]).matches()) {
                return true;
            }
        }
        return false;
    }

    private static String[] tokens(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return WHITESPACE.split(text.trim().toUpperCase(Locale.ROOT));
    }

    private static Set<String> upperSet(List<String> values) {
        return values.stream()
                .map(v -> v.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
