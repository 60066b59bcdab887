/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the NormalizationResult result type.
 */
class NormalizationResultTest {

    private static final NormalizedAddress ADDRESS = new NormalizedAddress("123 MAIN STREET", null,
            "MIAMI", "FL", "33101", "123 MAIN STREET||MIAMI|FL|33101", null);

    @Test
    @DisplayName("Should create accepted result")
    void shouldCreateAcceptedResult() {
        var result = NormalizationResult.accepted(ADDRESS);

        assertTrue(result.isAccepted());
        assertEquals(ADDRESS, result.getAddress());
        assertThrows(IllegalStateException.class, result::getReason);
    }

    @Test
    @DisplayName("Should create rejected result")
    void shouldCreateRejectedResult() {
        var result = NormalizationResult.rejected(RejectionReason.PO_BOX, "PO BOX 552");

        assertFalse(result.isAccepted());
        assertEquals(RejectionReason.PO_BOX, result.getReason());
        assertEquals("po_box", result.getReason().code());
        assertThrows(IllegalStateException.class, result::getAddress);
    }

    @Test
    @DisplayName("Should run only the matching callback")
    void shouldRunMatchingCallback() {
        var acceptedCalled = new AtomicBoolean(false);
        var rejected = new AtomicReference<NormalizationResult.Rejected>();

        NormalizationResult.rejected(RejectionReason.UNPARSABLE, null)
                .onAccepted(a -> acceptedCalled.set(true))
                .onRejected(rejected::set);

        assertFalse(acceptedCalled.get());
        assertEquals(RejectionReason.UNPARSABLE, rejected.get().reason());
        assertEquals("", rejected.get().detail());
    }

    @Test
    @DisplayName("Missing unit and corrections default to empty")
    void addressDefaults() {
        assertEquals("", ADDRESS.unit());
        assertFalse(ADDRESS.hasUnit());
        assertEquals(Set.of(), ADDRESS.corrections());
        assertEquals("123 MAIN STREET", ADDRESS.addressClean());
    }
}
