package com.listingpilot.domain.listing.model;

import java.util.List;

/**
 * Keyword coverage of a listing, overall and per placement.
 *
 * @param overallPct         share of keywords covered anywhere in the listing, 1 decimal
 * @param grade              grade derived from {@code overallPct}
 * @param coveredCount       number of keywords covered anywhere
 * @param totalCount         number of keywords evaluated
 * @param targetPct          coverage target a listing should reach
 * @param meetsTarget        true if {@code overallPct >= targetPct}
 * @param breakdown          per-placement percentages
 * @param uncoveredKeywords  phrases not covered anywhere, keyword-list order, at most 20
 */
public record CoverageReport(
        double overallPct,
        CoverageGrade grade,
        int coveredCount,
        int totalCount,
        double targetPct,
        boolean meetsTarget,
        CoverageBreakdown breakdown,
        List<String> uncoveredKeywords
) {
    public CoverageReport {
        uncoveredKeywords = List.copyOf(uncoveredKeywords);
    }
}
