package com.listingpilot.domain.listing.service;

import com.listingpilot.domain.listing.model.GeneratedListing;
import com.listingpilot.domain.listing.model.GenerationRequest;

/**
 * Domain port to the external text-generation service that drafts listing copy.
 * Production implementations call a remote model; development uses a local template.
 */
public interface ListingGenerator {

    /**
     * Drafts title, bullets, description and backend suggestions for the given keywords.
     *
     * @param request product data, tiered keywords and marketplace limits
     * @return the raw generated text
     * @throws ListingGenerationException if generation fails
     */
    GeneratedListing generate(GenerationRequest request);
}
