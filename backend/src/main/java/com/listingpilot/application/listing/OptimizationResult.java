package com.listingpilot.application.listing;

import com.listingpilot.domain.keyword.model.KeywordTiers;
import com.listingpilot.domain.listing.model.ListingDraft;
import com.listingpilot.domain.listing.model.ListingScoreReport;

/**
 * @param marketplace resolved marketplace id
 * @param language    resolved listing language
 * @param draft       post-processed listing with packed backend terms
 * @param tiers       keyword placement used for generation
 * @param report      merged scoring report
 */
public record OptimizationResult(
        String marketplace,
        String language,
        ListingDraft draft,
        KeywordTiers tiers,
        ListingScoreReport report
) {}
