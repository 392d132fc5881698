package com.listingpilot.domain.listing.model;

import java.util.List;

/**
 * Paid-search match-type recommendations derived from keyword research.
 */
public record PpcReport(
        List<PpcKeyword> exactMatch,
        List<PpcKeyword> phraseMatch,
        List<PpcKeyword> broadMatch,
        List<String> negativeSuggestions,
        PpcSummary summary
) {
    public PpcReport {
        exactMatch = List.copyOf(exactMatch);
        phraseMatch = List.copyOf(phraseMatch);
        broadMatch = List.copyOf(broadMatch);
        negativeSuggestions = List.copyOf(negativeSuggestions);
    }
}
