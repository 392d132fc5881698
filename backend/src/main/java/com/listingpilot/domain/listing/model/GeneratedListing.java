package com.listingpilot.domain.listing.model;

/**
 * Raw text returned by the generator, before post-processing.
 *
 * @param title              generated title
 * @param bulletsRaw         bullets as one block, one bullet per line
 * @param description        generated description
 * @param backendSuggestions extra search terms proposed by the generator (may be empty)
 */
public record GeneratedListing(
        String title,
        String bulletsRaw,
        String description,
        String backendSuggestions
) {}
