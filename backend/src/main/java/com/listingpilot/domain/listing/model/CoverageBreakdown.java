package com.listingpilot.domain.listing.model;

/**
 * Coverage percentage per listing placement.
 */
public record CoverageBreakdown(
        double titlePct,
        double bulletsPct,
        double backendPct,
        double descriptionPct
) {}
