/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class UsStatesTest {

    @ParameterizedTest
    @ValueSource(strings = {"FL", "fl", "Florida", " florida ", "FLORIDA"})
    void resolvesCodesAndNames(String value) {
        assertEquals("FL", UsStates.lookup(value).orElseThrow().code());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "XX", "Atlantis"})
    void unknownValuesAreEmpty(String value) {
        assertTrue(UsStates.lookup(value).isEmpty());
    }

    @Test
    void nullIsEmpty() {
        assertTrue(UsStates.lookup(null).isEmpty());
    }

    @Test
    @DisplayName("Florida box contains Miami and excludes Atlanta")
    void floridaBounds() {
        var bounds = UsStates.boundsOf("FL").orElseThrow();

        assertTrue(bounds.contains(25.7617, -80.1918));
        assertFalse(bounds.contains(33.7490, -84.3880));
    }

    @Test
    void everyStateHasBounds() {
        assertTrue(UsStates.all().size() >= 51);
        UsStates.all().forEach(state -> assertNotNull(state.bounds(), state.code()));
    }
}
