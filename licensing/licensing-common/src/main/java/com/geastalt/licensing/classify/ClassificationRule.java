/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.classify;

/**
 * The rule that decided a location's address type, in evaluation order.
 */
public enum ClassificationRule {
    COMMERCIAL_KEYWORD,
    RESIDENTIAL_UNIT,
    DENSITY,
    DEFAULT
}
