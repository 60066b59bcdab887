/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.normalize;

import com.geastalt.licensing.geo.UsStates;
import com.geastalt.licensing.model.AddressCorrection;
import com.geastalt.licensing.model.NormalizationResult;
import com.geastalt.licensing.model.NormalizedAddress;
import com.geastalt.licensing.model.RawAddress;
import com.geastalt.licensing.model.RejectionReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns free-text US addresses into a canonical form and a stable address key.
 *
 * <p>The street field may carry a whole one-line address; city, state and ZIP fields are then
 * treated as hints. Two inputs that differ only in casing, whitespace, punctuation or common
 * abbreviations produce the same key. PO boxes are rejected before any other processing.</p>
 */
@Slf4j
@Component
public class AddressNormalizer {

    private static final Pattern PO_BOX = Pattern.compile(
            "(?<![A-Z0-9])(?:P\\s*\\.?\\s*O\\s*\\.?\\s*BOX|POST\\s*OFFICE\\s*BOX)(?![A-Z])|^\\s*BOX\\s*#?\\s*\\d+");
    private static final Pattern LINE_ZIP = Pattern.compile("^\\d{5}(?:-\\d{4})?$|^\\d{9}$");
    private static final Pattern DROPPED_CHARS = Pattern.compile("['.]");
    private static final Pattern NON_ADDRESS_CHARS = Pattern.compile("[^A-Z0-9,#\\- ]");
    private static final Pattern NON_CITY_CHARS = Pattern.compile("[^A-Z0-9 ]");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern LETTER = Pattern.compile("[A-Z]");

    private record Token(String text, int segment) {
    }

    private record UnitSpan(String text, int segment, int position) {
    }

    /**
     * Normalizes one raw address. Never throws for bad input; every failure is a rejection.
     */
    public NormalizationResult normalize(RawAddress raw) {
        String street = upper(raw.street());
        String unitField = upper(raw.unit());

        if (isPoBox(street) || isPoBox(unitField)) {
            return reject(RejectionReason.PO_BOX, street.isEmpty() ? unitField : street);
        }

        List<Token> tokens = tokenize(street);
        String zip = cleanZip(raw.zip());
        String state = UsStates.lookup(raw.state()).map(UsStates.State::code).orElse(null);
        String city = cleanCity(raw.city());

        boolean tailFound = false;
        if (tokens.size() > 2 && LINE_ZIP.matcher(last(tokens).text()).matches()) {
            String lineZip = tokens.remove(tokens.size() - 1).text().substring(0, 5);
            zip = zip == null ? lineZip : zip;
            tailFound = true;
        }

        Optional<String> lineState = stripState(tokens, state, city, tailFound);
        if (lineState.isPresent()) {
            state = state == null ? lineState.get() : state;
            tailFound = true;
        }

        if (city != null) {
            int cityLength = cityTailLength(tokens, city);
            tokens.subList(tokens.size() - cityLength, tokens.size()).clear();
        } else {
            city = extractCity(tokens, tailFound);
        }

        if (city == null || state == null || zip == null) {
            return reject(RejectionReason.INCOMPLETE_LOCATION,
                    "city=" + city + " state=" + state + " zip=" + zip);
        }

        return parseStreet(tokens, unitField, city, state, zip);
    }

    private NormalizationResult parseStreet(List<Token> tokens, String unitField,
                                            String city, String state, String zip) {
        Set<AddressCorrection> corrections = EnumSet.noneOf(AddressCorrection.class);
        List<UnitSpan> spans = new ArrayList<>();
        List<Token> rest = extractUnitSpans(tokens, spans);

        int house = -1;
        for (int i = 0; i < rest.size(); i++) {
            if (StreetVocabulary.isHouseNumber(rest.get(i).text())) {
                house = i;
                break;
            }
        }
        if (house < 0) {
            return reject(RejectionReason.UNPARSABLE, "no house number: " + joinTokens(tokens));
        }
        int houseSegment = rest.get(house).segment();

        Set<String> unitParts = new LinkedHashSet<>();
        for (UnitSpan span : spans) {
            if (span.segment() != houseSegment || span.position() <= house) {
                corrections.add(AddressCorrection.FLOATING_SUITE);
            }
            unitParts.add(span.text());
        }

        List<String> street = new ArrayList<>();
        Map<Integer, List<String>> leftovers = new LinkedHashMap<>();
        for (int i = 0; i < rest.size(); i++) {
            Token token = rest.get(i);
            if (token.segment() == houseSegment && i >= house) {
                street.add(token.text());
            } else if (token.segment() != houseSegment) {
                leftovers.computeIfAbsent(token.segment(), s -> new ArrayList<>()).add(token.text());
            }
        }
        List<List<String>> dropped = new ArrayList<>();
        for (List<String> segment : leftovers.values()) {
            if (segment.size() == 1 && isBareUnitId(segment.get(0))) {
                unitParts.add("UNIT " + segment.get(0));
                corrections.add(AddressCorrection.FLOATING_SUITE);
            } else {
                log.trace("Dropping non-street segment: {}", segment);
                dropped.add(segment);
            }
        }

        unitParts.addAll(parseUnitField(unitField));

        expandAbbreviations(street);
        if (collapseRepeats(street)) {
            corrections.add(AddressCorrection.GHOST_DATA);
        }
        detachTrailingUnitId(street).ifPresent(id -> {
            unitParts.add("UNIT " + id);
            corrections.add(AddressCorrection.FLOATING_SUITE);
        });

        if (street.size() < 2 || street.subList(1, street.size()).stream()
                .noneMatch(t -> LETTER.matcher(t).find())) {
            return reject(RejectionReason.UNPARSABLE, "no street name: " + String.join(" ", street));
        }

        if (dropped.stream().anyMatch(segment -> repeatsStreet(segment, street))) {
            corrections.add(AddressCorrection.GHOST_DATA);
        }

        String streetClean = String.join(" ", street);
        String unit = String.join(" ", unitParts);
        String key = String.join("|", streetClean, unit, city, state, zip);
        return NormalizationResult.accepted(
                new NormalizedAddress(streetClean, unit, city, state, zip, key, corrections));
    }

    /**
     * Removes unit designators with their identifiers, returning the remaining tokens.
     * A span's position is the index in the remaining list at which it was found.
     */
    private static List<Token> extractUnitSpans(List<Token> tokens, List<UnitSpan> spans) {
        List<Token> rest = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Optional<String> designator = StreetVocabulary.unitDesignator(token.text());
            if (designator.isPresent()) {
                int j = i + 1;
                if (j < tokens.size() && sameSegment(tokens.get(j), token) && "#".equals(tokens.get(j).text())) {
                    j++;
                }
                if (j < tokens.size() && sameSegment(tokens.get(j), token)
                        && StreetVocabulary.isUnitId(tokens.get(j).text())) {
                    spans.add(new UnitSpan(designator.get() + " " + tokens.get(j).text(), token.segment(), rest.size()));
                    i = j;
                    continue;
                }
                if ("#".equals(token.text())) {
                    continue;
                }
            }
            rest.add(token);
        }
        return rest;
    }

    private static List<String> parseUnitField(String unitField) {
        List<Token> tokens = tokenize(unitField);
        if (tokens.isEmpty()) {
            return List.of();
        }
        List<UnitSpan> spans = new ArrayList<>();
        List<Token> rest = extractUnitSpans(tokens, spans);
        List<String> parts = spans.stream().map(UnitSpan::text).collect(Collectors.toCollection(ArrayList::new));
        if (rest.size() == 1 && StreetVocabulary.isUnitId(rest.get(0).text())) {
            parts.add("UNIT " + rest.get(0).text());
        } else if (!rest.isEmpty()) {
            parts.add(joinTokens(rest));
        }
        return parts;
    }

    private static Optional<String> stripState(List<Token> tokens, String stateHint, String cityHint,
                                               boolean zipStripped) {
        int size = tokens.size();
        for (int n = Math.min(3, size - 2); n >= 1; n--) {
            List<Token> tail = tokens.subList(size - n, size);
            Optional<UsStates.State> match = UsStates.lookup(joinTokens(tail));
            if (match.isEmpty()) {
                continue;
            }
            int segment = tail.get(0).segment();
            boolean ownSegment = segment > 0
                    && tail.stream().allMatch(t -> t.segment() == segment)
                    && tokens.get(size - n - 1).segment() != segment;
            String code = match.get().code();
            boolean afterCity = cityHint != null && code.equals(stateHint)
                    && cityTailLength(tokens.subList(0, size - n), cityHint) > 0;
            if (zipStripped || ownSegment || afterCity) {
                tail.clear();
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

    /**
     * Number of trailing tokens that spell the given city, or zero. At least a house number
     * and one name token are always left in place.
     */
    private static int cityTailLength(List<Token> tokens, String city) {
        for (int k = 1; k <= Math.min(5, tokens.size() - 2); k++) {
            String candidate = cleanCity(joinTokens(tokens.subList(tokens.size() - k, tokens.size())));
            if (city.equals(candidate)) {
                return k;
            }
        }
        return 0;
    }

    private static String extractCity(List<Token> tokens, boolean tailFound) {
        if (tokens.isEmpty()) {
            return null;
        }
        int lastSegment = last(tokens).segment();
        int firstOfSegment = tokens.size() - 1;
        while (firstOfSegment > 0 && tokens.get(firstOfSegment - 1).segment() == lastSegment) {
            firstOfSegment--;
        }
        List<Token> segment = tokens.subList(firstOfSegment, tokens.size());

        if (lastSegment != tokens.get(0).segment()
                && segment.stream().noneMatch(t -> DIGIT.matcher(t.text()).find())
                && StreetVocabulary.unitDesignator(segment.get(0).text()).isEmpty()) {
            String city = cleanCity(joinTokens(segment));
            segment.clear();
            return city;
        }
        if (!tailFound) {
            return null;
        }

        int start = cityStart(segment);
        if (start < 0) {
            return null;
        }
        List<Token> cityTokens = segment.subList(start, segment.size());
        String city = cleanCity(joinTokens(cityTokens));
        cityTokens.clear();
        return city;
    }

    /**
     * Index of the first city token in a segment: after the street suffix of a street segment,
     * then past any unit designators and bare unit identifiers.
     */
    private static int cityStart(List<Token> segment) {
        int i = 0;
        if (StreetVocabulary.isHouseNumber(segment.get(0).text())) {
            int suffixAt = -1;
            for (int j = 2; j < segment.size(); j++) {
                if (StreetVocabulary.suffix(segment.get(j).text()).isPresent()) {
                    suffixAt = j;
                    break;
                }
            }
            if (suffixAt < 0) {
                return -1;
            }
            i = suffixAt + 1;
        }
        while (i < segment.size()) {
            String text = segment.get(i).text();
            if (StreetVocabulary.unitDesignator(text).isPresent()) {
                i++;
                if (i < segment.size() && "#".equals(segment.get(i).text())) {
                    i++;
                }
                if (i < segment.size() && StreetVocabulary.isUnitId(segment.get(i).text())) {
                    i++;
                }
            } else if (isBareUnitId(text)) {
                i++;
            } else {
                break;
            }
        }
        return i < segment.size() ? i : -1;
    }

    private static void expandAbbreviations(List<String> street) {
        int n = street.size();
        for (int i = 1; i < n; i++) {
            String token = street.get(i);
            if (i == 1) {
                if ("ST".equals(token) && n > 2) {
                    street.set(i, "SAINT");
                } else if (n > 2) {
                    street.set(i, StreetVocabulary.directional(token).orElse(token));
                }
                continue;
            }
            Optional<String> suffix = StreetVocabulary.suffix(token);
            if (suffix.isPresent()) {
                street.set(i, suffix.get());
                continue;
            }
            Optional<String> directional = StreetVocabulary.directional(token);
            if (directional.isPresent()
                    && (i == n - 1 || StreetVocabulary.SUFFIXES.containsValue(street.get(i - 1)))) {
                street.set(i, directional.get());
            }
        }
    }

    /**
     * Collapses immediately repeated token runs. Single-token repeats only collapse for
     * suffixes and directionals, so names like WALLA WALLA survive.
     */
    static boolean collapseRepeats(List<String> street) {
        boolean changed = false;
        boolean again = true;
        while (again) {
            again = false;
            search:
            for (int len = street.size() / 2; len >= 1; len--) {
                for (int start = len >= 2 ? 0 : 1; start + 2 * len <= street.size(); start++) {
                    List<String> first = street.subList(start, start + len);
                    List<String> second = street.subList(start + len, start + 2 * len);
                    if (!first.equals(second)) {
                        continue;
                    }
                    if (len == 1 && !StreetVocabulary.SUFFIXES.containsValue(first.get(0))
                            && !StreetVocabulary.DIRECTIONALS.containsValue(first.get(0))) {
                        continue;
                    }
                    second.clear();
                    changed = true;
                    again = true;
                    break search;
                }
            }
        }
        return changed;
    }

    /**
     * Whether a dropped comma segment spells the street line again, with or without its house number.
     */
    private static boolean repeatsStreet(List<String> segment, List<String> street) {
        List<String> candidate = new ArrayList<>();
        if (!segment.get(0).equals(street.get(0))) {
            candidate.add(street.get(0));
        }
        candidate.addAll(segment);
        expandAbbreviations(candidate);
        collapseRepeats(candidate);
        return candidate.equals(street);
    }

    private static Optional<String> detachTrailingUnitId(List<String> street) {
        int n = street.size();
        if (n < 4 || !isBareUnitId(street.get(n - 1))) {
            return Optional.empty();
        }
        String previous = street.get(n - 2);
        boolean afterSuffix = StreetVocabulary.SUFFIXES.containsValue(previous)
                && !StreetVocabulary.NUMBERED_ROUTES.contains(previous);
        boolean afterDirectional = StreetVocabulary.DIRECTIONALS.containsValue(previous)
                && StreetVocabulary.SUFFIXES.containsValue(street.get(n - 3))
                && !StreetVocabulary.NUMBERED_ROUTES.contains(street.get(n - 3));
        if (afterSuffix || afterDirectional) {
            return Optional.of(street.remove(n - 1));
        }
        return Optional.empty();
    }

    static String cleanCity(String value) {
        if (value == null) {
            return null;
        }
        String text = DROPPED_CHARS.matcher(value.toUpperCase(Locale.ROOT)).replaceAll("");
        text = WHITESPACE.matcher(NON_CITY_CHARS.matcher(text).replaceAll(" ")).replaceAll(" ").trim();
        if (text.isEmpty()) {
            return null;
        }
        String[] words = text.split(" ");
        if (words.length > 1 && StreetVocabulary.CITY_PREFIXES.containsKey(words[0])) {
            words[0] = StreetVocabulary.CITY_PREFIXES.get(words[0]);
        }
        return String.join(" ", words);
    }

    /**
     * First five digits of a ZIP or ZIP+4. Spreadsheet artifacts are repaired: a trailing
     * {@code .0} is dropped and leading zeros lost from 3-4 digit values are restored.
     */
    static String cleanZip(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        if (text.endsWith(".0")) {
            text = text.substring(0, text.length() - 2);
        }
        String digits = NON_DIGITS.matcher(text).replaceAll("");
        if (digits.length() >= 5) {
            return digits.substring(0, 5);
        }
        if (digits.length() >= 3) {
            return "0".repeat(5 - digits.length()) + digits;
        }
        return null;
    }

    static boolean isPoBox(String upperText) {
        return !upperText.isEmpty() && PO_BOX.matcher(upperText).find();
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text.isEmpty()) {
            return tokens;
        }
        String cleaned = DROPPED_CHARS.matcher(text).replaceAll("");
        cleaned = NON_ADDRESS_CHARS.matcher(cleaned).replaceAll(" ").replace("#", " # ");
        int segment = 0;
        for (String part : cleaned.split(",")) {
            boolean any = false;
            for (String word : WHITESPACE.split(part.trim())) {
                String trimmed = EDGE_HYPHENS.matcher(word).replaceAll("");
                if (!trimmed.isEmpty()) {
                    tokens.add(new Token(trimmed, segment));
                    any = true;
                }
            }
            if (any) {
                segment++;
            }
        }
        return tokens;
    }

    private static boolean isBareUnitId(String token) {
        return StreetVocabulary.isUnitId(token) && DIGIT.matcher(token).find();
    }

    private static boolean sameSegment(Token a, Token b) {
        return a.segment() == b.segment();
    }

    private static Token last(List<Token> tokens) {
        return tokens.get(tokens.size() - 1);
    }

    private static String joinTokens(List<Token> tokens) {
        return tokens.stream().map(Token::text).collect(Collectors.joining(" "));
    }

    private static String upper(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    private static NormalizationResult reject(RejectionReason reason, String detail) {
        log.debug("Rejected address ({}): {}", reason.code(), detail);
        return NormalizationResult.rejected(reason, detail);
    }
}
