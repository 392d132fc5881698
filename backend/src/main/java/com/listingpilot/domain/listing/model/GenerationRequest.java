package com.listingpilot.domain.listing.model;

import com.listingpilot.domain.keyword.model.KeywordTiers;

/**
 * Everything the text generator needs to draft a listing.
 *
 * @param productTitle    working product name supplied by the seller
 * @param brand           brand name, placed at the start of the title
 * @param productLine     optional product line (nullable)
 * @param tiers           keywords partitioned by placement
 * @param language        listing language, e.g. "de"
 * @param limits          marketplace field limits
 * @param bulletCount     number of bullets to write
 * @param bulletCharLimit max characters per bullet for the product category
 */
public record GenerationRequest(
        String productTitle,
        String brand,
        String productLine,
        KeywordTiers tiers,
        String language,
        MarketplaceLimits limits,
        int bulletCount,
        int bulletCharLimit
) {}
