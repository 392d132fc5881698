package com.listingpilot.infrastructure.scoring.ranking;

import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.domain.listing.model.RankingComponents;
import com.listingpilot.domain.listing.model.RankingGrade;
import com.listingpilot.domain.listing.model.RankingScoreReport;
import com.listingpilot.domain.listing.model.RankingWeights;
import com.listingpilot.infrastructure.scoring.ScoreMath;
import com.listingpilot.infrastructure.scoring.coverage.CoverageCalculator;
import com.listingpilot.infrastructure.scoring.text.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Ranking Juice: scores the ranking potential of a listing (0-100).
 *
 * <pre>
 * RJ = Coverage × 0.35 + Exact Match × 0.30 + Search Volume × 0.20
 *      + Backend Efficiency × 0.10 + Structure × 0.05
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RankingScoreCalculator {

    static final int COVERAGE_TOP_N = 200;
    static final int EXACT_MATCH_TOP_N = 30;
    static final int VOLUME_TOP_N = 50;

    static final double TITLE_MULTIPLIER = 1.5;
    static final double BULLET_MULTIPLIER = 1.0;
    static final double PARTIAL_MULTIPLIER = 0.3;

    // 98% raw coverage already earns a perfect component score
    static final double COVERAGE_PERFECT_PCT = 98.0;

    static final int BACKEND_HARD_LIMIT = 250;
    static final double BACKEND_OVER_LIMIT_SCORE = 50.0;
    static final double NO_VOLUME_SCORE = 50.0;

    static final int MIN_TITLE_LENGTH = 150;
    static final int MAX_TITLE_LENGTH = 200;
    static final int EXPECTED_BULLETS = 5;
    static final int MIN_BULLET_LENGTH = 100;
    static final int MAX_BULLET_LENGTH = 500;

    private final KeywordMatcher matcher;
    private final CoverageCalculator coverageCalculator;

    /**
     * Calculate the composite score with the default weights.
     *
     * @param keywords    keywords sorted by priority (search volume descending)
     * @param title       listing title
     * @param bullets     bullet points
     * @param backend     backend search terms
     * @param description product description
     */
    public RankingScoreReport calculate(List<Keyword> keywords, String title, List<String> bullets,
                                        String backend, String description) {
        String safeTitle = title == null ? "" : title;
        List<String> safeBullets = bullets == null ? List.of() : bullets;
        String safeBackend = backend == null ? "" : backend;
        String safeDescription = description == null ? "" : description;

        RankingComponents raw = new RankingComponents(
                coverageScore(keywords, safeTitle, safeBullets, safeBackend, safeDescription),
                exactMatchScore(keywords, safeTitle, safeBullets),
                searchVolumeScore(keywords, safeTitle, safeBullets),
                backendEfficiency(keywords, safeTitle, safeBullets, safeBackend, safeDescription),
                structureScore(safeTitle, safeBullets)
        );

        RankingWeights weights = RankingWeights.DEFAULT;
        double composite = weights.apply(raw);
        RankingGrade grade = RankingGrade.of(composite);

        RankingComponents rounded = new RankingComponents(
                ScoreMath.round1(raw.keywordCoverage()),
                ScoreMath.round1(raw.exactMatchDensity()),
                ScoreMath.round1(raw.searchVolumeWeighted()),
                ScoreMath.round1(raw.backendEfficiency()),
                ScoreMath.round1(raw.structureQuality())
        );

        log.debug("[RankingJuice] score={} grade={} components={}", ScoreMath.round1(composite), grade.label(), rounded);
        return new RankingScoreReport(ScoreMath.round1(composite), grade, rounded, weights);
    }

    /**
     * Just the number, truncated to an integer.
     */
    public int quickScore(List<Keyword> keywords, String title, List<String> bullets, String backend) {
        return (int) calculate(keywords, title, bullets, backend, "").score();
    }

    // --- Component calculators ---

    /** Share of the top 200 keywords covered anywhere, scaled so 98% maps to 100. */
    double coverageScore(List<Keyword> keywords, String title, List<String> bullets,
                         String backend, String description) {
        List<Keyword> top = top(keywords, COVERAGE_TOP_N);
        if (top.isEmpty()) {
            return 0;
        }
        Set<String> words = matcher.extractWords(
                title + " " + String.join(" ", bullets) + " " + backend + " " + description);
        long covered = top.stream().filter(kw -> matcher.phraseCovered(kw.phrase(), words)).count();
        double rawPct = (double) covered / top.size() * 100.0;
        return Math.min(100, rawPct / COVERAGE_PERFECT_PCT * 100.0);
    }

    /** Exact phrase matches among the top 30: title 1.5 points, bullets 1.0. */
    double exactMatchScore(List<Keyword> keywords, String title, List<String> bullets) {
        List<Keyword> top = top(keywords, EXACT_MATCH_TOP_N);
        String bulletsText = String.join(" ", bullets);
        double points = 0;
        for (Keyword kw : top) {
            if (matcher.exactPhraseMatch(kw.phrase(), title)) {
                points += TITLE_MULTIPLIER;
            } else if (matcher.exactPhraseMatch(kw.phrase(), bulletsText)) {
                points += BULLET_MULTIPLIER;
            }
        }
        double target = ScoreMath.clamp(0.5 * top.size(), 3, 8);
        return Math.min(100, points / target * 100.0);
    }

    /** Search volume captured by placement among the top 50: title 1.5x, bullets 1x, partial title overlap 0.3x. */
    double searchVolumeScore(List<Keyword> keywords, String title, List<String> bullets) {
        List<Keyword> top = top(keywords, VOLUME_TOP_N);
        long totalVolume = top.stream().mapToLong(Keyword::searchVolume).sum();
        if (totalVolume == 0) {
            return NO_VOLUME_SCORE;
        }

        String bulletsText = String.join(" ", bullets);
        Set<String> titleWords = matcher.extractWords(title);
        double captured = 0;
        for (Keyword kw : top) {
            int volume = kw.searchVolume();
            if (matcher.exactPhraseMatch(kw.phrase(), title)) {
                captured += volume * TITLE_MULTIPLIER;
            } else if (matcher.exactPhraseMatch(kw.phrase(), bulletsText)) {
                captured += volume * BULLET_MULTIPLIER;
            } else if (!Collections.disjoint(matcher.phraseWords(kw.phrase()), titleWords)) {
                captured += volume * PARTIAL_MULTIPLIER;
            }
        }
        return Math.min(100, captured / (totalVolume * TITLE_MULTIPLIER) * 100.0);
    }

    /**
     * Backend byte utilization. 240-249 bytes is optimal; over 250 bytes the whole field is dropped.
     * A listing whose visible text already covers 90%+ of keywords needs less backend, so it gets a floor.
     */
    double backendEfficiency(List<Keyword> keywords, String title, List<String> bullets,
                             String backend, String description) {
        int bytes = matcher.utf8Length(backend);
        if (bytes > BACKEND_HARD_LIMIT) {
            return BACKEND_OVER_LIMIT_SCORE;
        }

        double base;
        if (bytes >= 240 && bytes <= 249) {
            base = 100;
        } else if (bytes >= 230 && bytes < 240) {
            base = 95;
        } else if (bytes >= 220 && bytes < 230) {
            base = 85;
        } else if (bytes < 220) {
            base = bytes / 240.0 * 80;
        } else {
            base = bytes / 250.0 * 100;
        }

        double visibleCoverage = coverageCalculator
                .calculate(keywords, title, bullets, "", description)
                .overallPct();
        if (visibleCoverage >= 95) {
            return Math.max(80, base);
        }
        if (visibleCoverage >= 90) {
            return Math.max(60, base);
        }
        return base;
    }

    /** Title length, bullet count and length, dash separators in the title. */
    double structureScore(String title, List<String> bullets) {
        double score = 100;
        int titleLength = title.length();
        if (titleLength < MIN_TITLE_LENGTH) {
            score -= 15;
        } else if (titleLength > MAX_TITLE_LENGTH) {
            score -= 10;
        }

        if (bullets.size() < EXPECTED_BULLETS) {
            score -= (EXPECTED_BULLETS - bullets.size()) * 5;
        }

        for (String bullet : bullets) {
            int length = bullet == null ? 0 : bullet.length();
            if (length < MIN_BULLET_LENGTH) {
                score -= 3;
            } else if (length > MAX_BULLET_LENGTH) {
                score -= 2;
            }
        }

        // Dash separators help exact-match indexing of title segments
        if (title.contains(" - ")) {
            score += 5;
        }

        return ScoreMath.clamp(score, 0, 100);
    }

    private static List<Keyword> top(List<Keyword> keywords, int n) {
        return keywords.subList(0, Math.min(n, keywords.size()));
    }
}
