/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.geo;

import com.geastalt.licensing.model.BoundingBox;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * US states, DC and Puerto Rico with their postal codes, names and geographic bounding boxes.
 * Boxes are padded slightly beyond the surveyed extent so coastal and border addresses pass.
 */
public final class UsStates {

    public record State(String code, String name, BoundingBox bounds) {}

    private static final Map<String, State> BY_CODE = new LinkedHashMap<>();
    private static final Map<String, State> BY_NAME = new LinkedHashMap<>();

    static {
        add("AL", "ALABAMA", 30.1, 35.1, -88.5, -84.8);
        add("AK", "ALASKA", 51.2, 71.5, -179.2, -129.9);
        add("AZ", "ARIZONA", 31.3, 37.1, -114.9, -109.0);
        add("AR", "ARKANSAS", 33.0, 36.5, -94.7, -89.6);
        add("CA", "CALIFORNIA", 32.5, 42.1, -124.5, -114.1);
        add("CO", "COLORADO", 36.9, 41.1, -109.1, -102.0);
        add("CT", "CONNECTICUT", 40.9, 42.1, -73.8, -71.7);
        add("DE", "DELAWARE", 38.4, 39.9, -75.8, -75.0);
        add("DC", "DISTRICT OF COLUMBIA", 38.7, 39.0, -77.2, -76.9);
        add("FL", "FLORIDA", 24.3, 31.1, -87.7, -79.8);
        add("GA", "GEORGIA", 30.3, 35.1, -85.7, -80.8);
        add("HI", "HAWAII", 18.9, 22.3, -160.3, -154.8);
        add("ID", "IDAHO", 41.9, 49.1, -117.3, -111.0);
        add("IL", "ILLINOIS", 36.9, 42.6, -91.6, -87.0);
        add("IN", "INDIANA", 37.7, 41.8, -88.1, -84.7);
        add("IA", "IOWA", 40.3, 43.6, -96.7, -90.1);
        add("KS", "KANSAS", 36.9, 40.1, -102.1, -94.5);
        add("KY", "KENTUCKY", 36.4, 39.2, -89.6, -81.9);
        add("LA", "LOUISIANA", 28.9, 33.1, -94.1, -88.8);
        add("ME", "MAINE", 42.9, 47.5, -71.1, -66.9);
        add("MD", "MARYLAND", 37.9, 39.8, -79.5, -75.0);
        add("MA", "MASSACHUSETTS", 41.2, 42.9, -73.6, -69.9);
        add("MI", "MICHIGAN", 41.6, 48.4, -90.5, -82.1);
        add("MN", "MINNESOTA", 43.4, 49.4, -97.3, -89.4);
        add("MS", "MISSISSIPPI", 30.1, 35.1, -91.7, -88.0);
        add("MO", "MISSOURI", 35.9, 40.7, -95.8, -89.0);
        add("MT", "MONTANA", 44.3, 49.1, -116.1, -104.0);
        add("NE", "NEBRASKA", 39.9, 43.1, -104.1, -95.3);
        add("NV", "NEVADA", 35.0, 42.1, -120.1, -114.0);
        add("NH", "NEW HAMPSHIRE", 42.6, 45.4, -72.6, -70.6);
        add("NJ", "NEW JERSEY", 38.9, 41.4, -75.6, -73.8);
        add("NM", "NEW MEXICO", 31.3, 37.1, -109.1, -103.0);
        add("NY", "NEW YORK", 40.4, 45.1, -79.8, -71.8);
        add("NC", "NORTH CAROLINA", 33.8, 36.6, -84.4, -75.4);
        add("ND", "NORTH DAKOTA", 45.9, 49.1, -104.1, -96.5);
        add("OH", "OHIO", 38.4, 42.0, -84.9, -80.5);
        add("OK", "OKLAHOMA", 33.6, 37.1, -103.1, -94.4);
        add("OR", "OREGON", 41.9, 46.3, -124.6, -116.4);
        add("PA", "PENNSYLVANIA", 39.7, 42.3, -80.6, -74.7);
        add("RI", "RHODE ISLAND", 41.1, 42.1, -71.9, -71.1);
        add("SC", "SOUTH CAROLINA", 32.0, 35.3, -83.4, -78.5);
        add("SD", "SOUTH DAKOTA", 42.4, 46.0, -104.1, -96.4);
        add("TN", "TENNESSEE", 34.9, 36.7, -90.4, -81.6);
        add("TX", "TEXAS", 25.8, 36.5, -106.6, -93.5);
        add("UT", "UTAH", 36.9, 42.1, -114.1, -109.0);
        add("VT", "VERMONT", 42.7, 45.1, -73.5, -71.4);
        add("VA", "VIRGINIA", 36.5, 39.5, -83.7, -75.2);
        add("WA", "WASHINGTON", 45.5, 49.1, -124.8, -116.9);
        add("WV", "WEST VIRGINIA", 37.2, 40.7, -82.7, -77.7);
        add("WI", "WISCONSIN", 42.4, 47.1, -92.9, -86.2);
        add("WY", "WYOMING", 40.9, 45.1, -111.1, -104.0);
        add("PR", "PUERTO RICO", 17.8, 18.6, -68.0, -65.2);
    }

    private UsStates() {
    }

    private static void add(String code, String name, double minLat, double maxLat,
                            double minLon, double maxLon) {
        State state = new State(code, name, new BoundingBox(minLat, maxLat, minLon, maxLon));
        BY_CODE.put(code, state);
        BY_NAME.put(name, state);
    }

    /**
     * Resolves a state by postal code or full name, case-insensitively.
     */
    public static Optional<State> lookup(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String upper = value.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        State state = BY_CODE.get(upper);
        if (state == null) {
            state = BY_NAME.get(upper);
        }
        return Optional.ofNullable(state);
    }

    public static boolean isStateCode(String value) {
        return value != null && BY_CODE.containsKey(value);
    }

    public static Optional<BoundingBox> boundsOf(String code) {
        return Optional.ofNullable(BY_CODE.get(code)).map(State::bounds);
    }

    public static Collection<State> all() {
        return Collections.unmodifiableCollection(BY_CODE.values());
    }
}
