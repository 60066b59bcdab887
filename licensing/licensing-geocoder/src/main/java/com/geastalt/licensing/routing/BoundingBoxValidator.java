/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

import com.geastalt.licensing.cache.FailureReason;
import com.geastalt.licensing.geo.UsStates;
import com.geastalt.licensing.model.BoundingBox;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rejects provider matches that fall outside the declared state.
 */
@Component
public class BoundingBoxValidator {

    public Optional<FailureReason> validate(String stateCode, double latitude, double longitude) {
        Optional<BoundingBox> bounds = UsStates.boundsOf(stateCode);
        if (bounds.isEmpty()) {
            return Optional.of(FailureReason.UNKNOWN_REGION);
        }
        if (!bounds.get().contains(latitude, longitude)) {
            return Optional.of(FailureReason.OUT_OF_BOUNDS);
        }
        return Optional.empty();
    }
}
