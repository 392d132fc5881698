package com.listingpilot.domain.listing.model;

import java.math.BigDecimal;

/**
 * Weights of the five ranking components. The default set sums to exactly 1.0.
 */
public record RankingWeights(
        double keywordCoverage,
        double exactMatchDensity,
        double searchVolumeWeighted,
        double backendEfficiency,
        double structureQuality
) {
    public static final RankingWeights DEFAULT = new RankingWeights(0.35, 0.30, 0.20, 0.10, 0.05);

    /**
     * Decimal sum of the weights, so 0.35 + 0.30 + 0.20 + 0.10 + 0.05 is exactly 1.0.
     */
    public double sum() {
        return BigDecimal.valueOf(keywordCoverage)
                .add(BigDecimal.valueOf(exactMatchDensity))
                .add(BigDecimal.valueOf(searchVolumeWeighted))
                .add(BigDecimal.valueOf(backendEfficiency))
                .add(BigDecimal.valueOf(structureQuality))
                .doubleValue();
    }

    public double apply(RankingComponents c) {
        return c.keywordCoverage() * keywordCoverage
                + c.exactMatchDensity() * exactMatchDensity
                + c.searchVolumeWeighted() * searchVolumeWeighted
                + c.backendEfficiency() * backendEfficiency
                + c.structureQuality() * structureQuality;
    }
}
