package com.listingpilot.domain.listing.model;

/**
 * @param phrase       keyword phrase
 * @param searchVolume monthly search volume
 * @param indexed      true if the phrase is covered by the listing text
 * @param matchType    recommended match type
 */
public record PpcKeyword(
        String phrase,
        int searchVolume,
        boolean indexed,
        MatchType matchType
) {
    public String rationale() {
        return matchType.rationale();
    }
}
