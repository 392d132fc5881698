package com.listingpilot.domain.listing.model;

/**
 * Composite ranking-quality score ("Ranking Juice") of a listing.
 *
 * @param score      weighted composite in [0, 100], 1 decimal
 * @param grade      letter grade
 * @param components component scores, 1 decimal each
 * @param weights    weights used to combine the components
 */
public record RankingScoreReport(
        double score,
        RankingGrade grade,
        RankingComponents components,
        RankingWeights weights
) {
    public String verdict() {
        return grade.verdict();
    }
}
