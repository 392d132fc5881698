package com.listingpilot.domain.listing.model;

import java.util.List;

/**
 * Every scoring result for one listing draft, merged into a single report.
 *
 * @param coveragePct        coverage of all keywords against the full listing including backend terms
 * @param coverageGrade      grade of {@code coveragePct}
 * @param exactMatches       keywords found verbatim in the full listing
 * @param titleCoveragePct   coverage of the title-tier keywords against the title alone
 * @param backendBytes       UTF-8 size of the backend terms
 * @param backendUtilPct     backend bytes as a share of the marketplace budget, 0 without a budget
 * @param compliance         basic limit compliance merged with anti-stuffing warnings
 * @param policy             marketplace policy check
 * @param ranking            composite ranking score
 * @param coverage           per-placement coverage
 * @param ppc                paid-search recommendations
 * @param missingKeywords    keywords not covered anywhere, at most 20
 */
public record ListingScoreReport(
        double coveragePct,
        CoverageGrade coverageGrade,
        int exactMatches,
        double titleCoveragePct,
        int backendBytes,
        double backendUtilPct,
        ComplianceResult compliance,
        PolicyReport policy,
        RankingScoreReport ranking,
        CoverageReport coverage,
        PpcReport ppc,
        List<String> missingKeywords
) {
    public ListingScoreReport {
        missingKeywords = List.copyOf(missingKeywords);
    }
}
