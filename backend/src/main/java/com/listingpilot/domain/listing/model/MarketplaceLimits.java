package com.listingpilot.domain.listing.model;

/**
 * Per-marketplace field limits.
 *
 * @param titleChars   max title length in characters
 * @param bulletChars  max bullet length in characters
 * @param backendBytes backend search-term budget in UTF-8 bytes, 0 if the marketplace has no such field
 * @param language     default listing language
 */
public record MarketplaceLimits(
        int titleChars,
        int bulletChars,
        int backendBytes,
        String language
) {}
