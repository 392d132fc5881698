package com.listingpilot.domain.listing.model;

/**
 * Paid-search match type a keyword is recommended for.
 */
public enum MatchType {
    EXACT("Top RJ + high volume - exact match for best ACoS"),
    PHRASE("Mid-range RJ - phrase match for reach + relevance"),
    BROAD("Long-tail - broad match for discovery");

    private final String rationale;

    MatchType(String rationale) {
        this.rationale = rationale;
    }

    public String rationale() {
        return rationale;
    }
}
