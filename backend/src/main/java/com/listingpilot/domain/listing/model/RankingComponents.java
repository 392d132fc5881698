package com.listingpilot.domain.listing.model;

/**
 * The five component scores of a ranking score, each in [0, 100].
 */
public record RankingComponents(
        double keywordCoverage,
        double exactMatchDensity,
        double searchVolumeWeighted,
        double backendEfficiency,
        double structureQuality
) {}
