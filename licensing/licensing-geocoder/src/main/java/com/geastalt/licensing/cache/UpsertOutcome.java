/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.cache;

public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    /** The stored entry was resolved and the incoming one was not. */
    SKIPPED
}
