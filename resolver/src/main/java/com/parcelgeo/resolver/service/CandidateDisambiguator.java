/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.resolver.service;

import com.parcelgeo.resolver.config.ResolverProperties;
import com.parcelgeo.resolver.model.ParcelCandidate;
import com.parcelgeo.resolver.model.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Picks the parcel whose situs address best agrees with the input address text.
 *
 * <p>Scoring is token presence, not edit distance: it only has to separate the handful of
 * parcels inside one small envelope. A candidate earns the house-number weight if its
 * house number is one of the input tokens, the street-word weight for every word of its
 * street name found among the tokens, and the suffix weight if its street suffix is a
 * token. The highest score wins; on a tie the candidate listed first wins.
 */
@Slf4j
@Component
public class CandidateDisambiguator {

    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s,]+");

    private final ResolverProperties.Scoring weights;

    public CandidateDisambiguator(ResolverProperties properties) {
        this.weights = properties.getScoring();
    }

    public Optional<ScoredCandidate> selectBest(List<ParcelCandidate> candidates, String inputAddress) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() == 1 || inputAddress == null || inputAddress.isBlank()) {
            return Optional.of(new ScoredCandidate(candidates.get(0), 0));
        }

        Set<String> tokens = tokenize(inputAddress);
        ScoredCandidate best = null;
        for (ParcelCandidate candidate : candidates) {
            int score = score(candidate, tokens);
            log.trace("Candidate {} ({}) scored {}", candidate.getParcelId(), candidate.situsLine(), score);
            // strictly greater keeps the earliest candidate on ties
            if (best == null || score > best.score()) {
                best = new ScoredCandidate(candidate, score);
            }
        }
        return Optional.of(best);
    }

    public int score(ParcelCandidate candidate, Set<String> tokens) {
        int score = 0;

        String houseNumber = normalize(candidate.getSitusHouseNumber());
        if (!houseNumber.isEmpty() && tokens.contains(houseNumber)) {
            score += weights.getHouseNumber();
        }

        String streetName = normalize(candidate.getSitusStreetName());
        if (!streetName.isEmpty()) {
            for (String word : streetName.split("\\s+")) {
                if (tokens.contains(word)) {
                    score += weights.getStreetWord();
                }
            }
        }

        String suffix = normalize(candidate.getSitusStreetSuffix());
        if (!suffix.isEmpty() && tokens.contains(suffix)) {
            score += weights.getStreetSuffix();
        }
        return score;
    }

    /**
     * Upper-cases the address and splits it on whitespace and commas.
     */
    public static Set<String> tokenize(String address) {
        if (address == null) {
            return Set.of();
        }
        return Arrays.stream(TOKEN_SEPARATORS.split(address.toUpperCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String normalize(String field) {
        return field == null ? "" : field.trim().toUpperCase(Locale.ROOT);
    }
}
