/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.normalize;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fixed lookup tables for US street address tokens: suffixes, directionals and unit designators.
 * Keys include the canonical spellings so that already expanded input maps onto itself.
 */
final class StreetVocabulary {

    static final Map<String, String> SUFFIXES = Map.ofEntries(
            Map.entry("ST", "STREET"), Map.entry("STR", "STREET"), Map.entry("STREET", "STREET"),
            Map.entry("AVE", "AVENUE"), Map.entry("AV", "AVENUE"), Map.entry("AVEN", "AVENUE"),
            Map.entry("AVENUE", "AVENUE"),
            Map.entry("BLVD", "BOULEVARD"), Map.entry("BOUL", "BOULEVARD"), Map.entry("BOULEVARD", "BOULEVARD"),
            Map.entry("RD", "ROAD"), Map.entry("ROAD", "ROAD"),
            Map.entry("DR", "DRIVE"), Map.entry("DRV", "DRIVE"), Map.entry("DRIVE", "DRIVE"),
            Map.entry("LN", "LANE"), Map.entry("LANE", "LANE"),
            Map.entry("CT", "COURT"), Map.entry("CRT", "COURT"), Map.entry("COURT", "COURT"),
            Map.entry("PL", "PLACE"), Map.entry("PLACE", "PLACE"),
            Map.entry("PKWY", "PARKWAY"), Map.entry("PKY", "PARKWAY"), Map.entry("PARKWAY", "PARKWAY"),
            Map.entry("HWY", "HIGHWAY"), Map.entry("HIGHWAY", "HIGHWAY"),
            Map.entry("TER", "TERRACE"), Map.entry("TERR", "TERRACE"), Map.entry("TERRACE", "TERRACE"),
            Map.entry("CIR", "CIRCLE"), Map.entry("CIRCLE", "CIRCLE"),
            Map.entry("TRL", "TRAIL"), Map.entry("TRAIL", "TRAIL"),
            Map.entry("PLZ", "PLAZA"), Map.entry("PLAZA", "PLAZA"),
            Map.entry("SQ", "SQUARE"), Map.entry("SQUARE", "SQUARE"),
            Map.entry("CTR", "CENTER"), Map.entry("CENTER", "CENTER"),
            Map.entry("WAY", "WAY"),
            Map.entry("EXPY", "EXPRESSWAY"), Map.entry("EXPRESSWAY", "EXPRESSWAY"),
            Map.entry("FWY", "FREEWAY"), Map.entry("FREEWAY", "FREEWAY"),
            Map.entry("TPKE", "TURNPIKE"), Map.entry("TURNPIKE", "TURNPIKE"),
            Map.entry("ALY", "ALLEY"), Map.entry("ALLEY", "ALLEY"),
            Map.entry("CV", "COVE"), Map.entry("COVE", "COVE"),
            Map.entry("XING", "CROSSING"), Map.entry("CROSSING", "CROSSING"),
            Map.entry("PT", "POINT"), Map.entry("POINT", "POINT"),
            Map.entry("LOOP", "LOOP"),
            Map.entry("RTE", "ROUTE"), Map.entry("ROUTE", "ROUTE")
    );

    /** Suffixes usually followed by a route number rather than a unit. */
    static final Set<String> NUMBERED_ROUTES = Set.of("HIGHWAY", "ROUTE", "FREEWAY", "EXPRESSWAY", "TURNPIKE");

    static final Map<String, String> DIRECTIONALS = Map.ofEntries(
            Map.entry("N", "NORTH"), Map.entry("NORTH", "NORTH"),
            Map.entry("S", "SOUTH"), Map.entry("SOUTH", "SOUTH"),
            Map.entry("E", "EAST"), Map.entry("EAST", "EAST"),
            Map.entry("W", "WEST"), Map.entry("WEST", "WEST"),
            Map.entry("NE", "NORTHEAST"), Map.entry("NORTHEAST", "NORTHEAST"),
            Map.entry("NW", "NORTHWEST"), Map.entry("NORTHWEST", "NORTHWEST"),
            Map.entry("SE", "SOUTHEAST"), Map.entry("SOUTHEAST", "SOUTHEAST"),
            Map.entry("SW", "SOUTHWEST"), Map.entry("SOUTHWEST", "SOUTHWEST")
    );

    /**
     * Canonical unit designators. A bare {@code #} stays {@code #}: it marks apartments and
     * storefront suites alike, so it carries no residential or commercial meaning.
     */
    static final Map<String, String> UNIT_DESIGNATORS = Map.ofEntries(
            Map.entry("SUITE", "SUITE"), Map.entry("STE", "SUITE"), Map.entry("SUIT", "SUITE"),
            Map.entry("APT", "APT"), Map.entry("APARTMENT", "APT"),
            Map.entry("UNIT", "UNIT"), Map.entry("#", "#"),
            Map.entry("BLDG", "BLDG"), Map.entry("BUILDING", "BLDG"),
            Map.entry("RM", "ROOM"), Map.entry("ROOM", "ROOM"),
            Map.entry("FLR", "FLOOR"), Map.entry("FLOOR", "FLOOR"),
            Map.entry("LOT", "LOT"),
            Map.entry("TRLR", "TRLR"), Map.entry("TRAILER", "TRLR"),
            Map.entry("SPC", "SPACE"), Map.entry("SPACE", "SPACE")
    );

    static final Map<String, String> CITY_PREFIXES = Map.of(
            "ST", "SAINT",
            "FT", "FORT",
            "MT", "MOUNT",
            "PT", "PORT"
    );

    static final Pattern HOUSE_NUMBER = Pattern.compile("^\\d+[A-Z]?(?:-\\d+[A-Z]?)?$|^[NSEW]\\d+[NSEW]\\d+$");

    static final Pattern UNIT_ID = Pattern.compile("^(?=[A-Z0-9-]*\\d)[A-Z0-9-]{1,8}$|^[A-Z]$");

    private StreetVocabulary() {
    }

    static Optional<String> suffix(String token) {
        return Optional.ofNullable(SUFFIXES.get(token));
    }

    static Optional<String> directional(String token) {
        return Optional.ofNullable(DIRECTIONALS.get(token));
    }

    static Optional<String> unitDesignator(String token) {
        return Optional.ofNullable(UNIT_DESIGNATORS.get(token));
    }

    static boolean isHouseNumber(String token) {
        return HOUSE_NUMBER.matcher(token).matches();
    }

    static boolean isUnitId(String token) {
        return UNIT_ID.matcher(token).matches();
    }
}
