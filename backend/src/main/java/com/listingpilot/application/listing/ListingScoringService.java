package com.listingpilot.application.listing;

import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.domain.listing.model.ComplianceResult;
import com.listingpilot.domain.listing.model.CoverageGrade;
import com.listingpilot.domain.listing.model.CoverageReport;
import com.listingpilot.domain.listing.model.ListingDraft;
import com.listingpilot.domain.listing.model.ListingScoreReport;
import com.listingpilot.domain.listing.model.MarketplaceLimits;
import com.listingpilot.domain.listing.model.PolicyReport;
import com.listingpilot.domain.listing.model.PpcReport;
import com.listingpilot.domain.listing.model.RankingScoreReport;
import com.listingpilot.infrastructure.scoring.ScoreMath;
import com.listingpilot.infrastructure.scoring.coverage.CoverageCalculator;
import com.listingpilot.infrastructure.scoring.marketplace.MarketplaceCatalog;
import com.listingpilot.infrastructure.scoring.ppc.PpcRecommender;
import com.listingpilot.infrastructure.scoring.ranking.RankingScoreCalculator;
import com.listingpilot.infrastructure.scoring.text.KeywordMatcher;
import com.listingpilot.infrastructure.scoring.validation.AntiStuffingChecker;
import com.listingpilot.infrastructure.scoring.validation.ListingComplianceChecker;
import com.listingpilot.infrastructure.scoring.validation.PolicyComplianceChecker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs every scorer over a listing draft and merges the results into one report.
 */
@Slf4j
@Service
public class ListingScoringService {

    private final KeywordMatcher matcher;
    private final CoverageCalculator coverageCalculator;
    private final RankingScoreCalculator rankingScoreCalculator;
    private final AntiStuffingChecker antiStuffingChecker;
    private final ListingComplianceChecker complianceChecker;
    private final PolicyComplianceChecker policyChecker;
    private final PpcRecommender ppcRecommender;
    private final MarketplaceCatalog marketplaceCatalog;
    private final int coverageTopN;

    public ListingScoringService(KeywordMatcher matcher,
                                 CoverageCalculator coverageCalculator,
                                 RankingScoreCalculator rankingScoreCalculator,
                                 AntiStuffingChecker antiStuffingChecker,
                                 ListingComplianceChecker complianceChecker,
                                 PolicyComplianceChecker policyChecker,
                                 PpcRecommender ppcRecommender,
                                 MarketplaceCatalog marketplaceCatalog,
                                 @Value("${listing.coverage.top-n:200}") int coverageTopN) {
        this.matcher = matcher;
        this.coverageCalculator = coverageCalculator;
        this.rankingScoreCalculator = rankingScoreCalculator;
        this.antiStuffingChecker = antiStuffingChecker;
        this.complianceChecker = complianceChecker;
        this.policyChecker = policyChecker;
        this.ppcRecommender = ppcRecommender;
        this.marketplaceCatalog = marketplaceCatalog;
        this.coverageTopN = coverageTopN;
    }

    /**
     * Score a listing draft.
     *
     * @param keywords      all keywords, sorted by search volume descending
     * @param titleKeywords the title tier, checked against the title alone
     * @param draft         the listing draft including backend terms
     * @param brand         brand expected near the start of the title (nullable)
     * @param marketplace   marketplace id, selects limits and policy rules
     */
    public ListingScoreReport score(List<Keyword> keywords, List<Keyword> titleKeywords,
                                    ListingDraft draft, String brand, String marketplace) {
        MarketplaceLimits limits = marketplaceCatalog.limitsFor(marketplace);
        String fullText = draft.fullText();
        int backendBytes = matcher.utf8Length(draft.backendTerms());

        double coveragePct = coverageCalculator.coveragePercent(keywords, fullText);
        int exactMatches = matcher.countExactMatches(keywords, fullText);
        double titleCoverage = coverageCalculator.coveragePercent(titleKeywords, draft.title());

        // Stuffing is a compliance concern too; it only ever adds warnings
        List<String> stuffingWarnings = antiStuffingChecker.check(draft.title(), draft.bullets(), draft.description());
        ComplianceResult compliance = complianceChecker.check(draft, brand, limits).withWarnings(stuffingWarnings);

        PolicyReport policy = policyChecker.check(draft.title(), draft.bullets(), draft.description(),
                draft.backendTerms(), marketplace);
        RankingScoreReport ranking = rankingScoreCalculator.calculate(keywords, draft.title(), draft.bullets(),
                draft.backendTerms(), draft.description());
        CoverageReport coverage = coverageCalculator.calculate(keywords, draft.title(), draft.bullets(),
                draft.backendTerms(), draft.description(), coverageTopN);
        PpcReport ppc = ppcRecommender.recommend(keywords, fullText);

        double backendUtil = limits.backendBytes() > 0
                ? ScoreMath.round1((double) backendBytes / limits.backendBytes() * 100.0)
                : 0.0;

        log.info("[Scoring] marketplace={} coverage={}% rj={} ({}) compliance={} policy={} backend={}B",
                marketplace, coveragePct, ranking.score(), ranking.grade().label(),
                compliance.status(), policy.status(), backendBytes);

        return new ListingScoreReport(
                coveragePct,
                CoverageGrade.of(coveragePct),
                exactMatches,
                titleCoverage,
                backendBytes,
                backendUtil,
                compliance,
                policy,
                ranking,
                coverage,
                ppc,
                coverage.uncoveredKeywords()
        );
    }
}
