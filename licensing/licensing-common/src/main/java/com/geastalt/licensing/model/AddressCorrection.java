/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

/**
 * Repairs the normalizer applied to an address.
 */
public enum AddressCorrection {
    /** A street name run duplicated verbatim was collapsed. */
    GHOST_DATA,
    /** A detached unit/suite token was moved back into the unit field. */
    FLOATING_SUITE
}
