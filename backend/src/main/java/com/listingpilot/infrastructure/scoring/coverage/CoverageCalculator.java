package com.listingpilot.infrastructure.scoring.coverage;

import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.domain.listing.model.CoverageBreakdown;
import com.listingpilot.domain.listing.model.CoverageGrade;
import com.listingpilot.domain.listing.model.CoverageReport;
import com.listingpilot.infrastructure.scoring.ScoreMath;
import com.listingpilot.infrastructure.scoring.text.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-placement and overall keyword coverage with a 95% target.
 * Knowing where keywords are missing lets sellers fix one section instead of the whole listing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoverageCalculator {

    public static final double COVERAGE_TARGET = 95.0;
    public static final int DEFAULT_TOP_N = 200;
    public static final int MAX_UNCOVERED = 20;

    private final KeywordMatcher matcher;

    public CoverageReport calculate(List<Keyword> keywords, String title, List<String> bullets,
                                    String backend, String description) {
        return calculate(keywords, title, bullets, backend, description, DEFAULT_TOP_N);
    }

    /**
     * Coverage of the first {@code topN} keywords against each placement and against the whole listing.
     *
     * @param topN number of keywords (in list order) to evaluate, {@code >= 0}
     */
    public CoverageReport calculate(List<Keyword> keywords, String title, List<String> bullets,
                                    String backend, String description, int topN) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative: " + topN);
        }
        List<Keyword> top = keywords.subList(0, Math.min(topN, keywords.size()));

        Set<String> titleWords = matcher.extractWords(title);
        Set<String> bulletWords = matcher.extractWords(bullets == null ? "" : String.join(" ", bullets));
        Set<String> backendWords = matcher.extractWords(backend);
        Set<String> descriptionWords = matcher.extractWords(description);

        Set<String> allWords = new HashSet<>(titleWords);
        allWords.addAll(bulletWords);
        allWords.addAll(backendWords);
        allWords.addAll(descriptionWords);

        int inTitle = 0, inBullets = 0, inBackend = 0, inDescription = 0, covered = 0;
        List<String> uncovered = new ArrayList<>();

        for (Keyword kw : top) {
            String phrase = kw.phrase();
            if (matcher.phraseCovered(phrase, titleWords)) inTitle++;
            if (matcher.phraseCovered(phrase, bulletWords)) inBullets++;
            if (matcher.phraseCovered(phrase, backendWords)) inBackend++;
            if (matcher.phraseCovered(phrase, descriptionWords)) inDescription++;

            if (matcher.phraseCovered(phrase, allWords)) {
                covered++;
            } else if (!phrase.isBlank() && uncovered.size() < MAX_UNCOVERED) {
                uncovered.add(phrase);
            }
        }

        int total = top.size();
        double overall = pct(covered, total);
        CoverageBreakdown breakdown = new CoverageBreakdown(
                pct(inTitle, total), pct(inBullets, total), pct(inBackend, total), pct(inDescription, total));

        log.debug("[Coverage] {}/{} covered ({}%), title={} bullets={} backend={} description={}",
                covered, total, overall, breakdown.titlePct(), breakdown.bulletsPct(),
                breakdown.backendPct(), breakdown.descriptionPct());

        return new CoverageReport(
                overall,
                CoverageGrade.of(overall),
                covered,
                total,
                COVERAGE_TARGET,
                overall >= COVERAGE_TARGET,
                breakdown,
                uncovered
        );
    }

    /**
     * Coverage of all keywords against one piece of text, 1 decimal.
     */
    public double coveragePercent(List<Keyword> keywords, String text) {
        Set<String> words = matcher.extractWords(text);
        int covered = 0;
        for (Keyword kw : keywords) {
            if (matcher.phraseCovered(kw.phrase(), words)) {
                covered++;
            }
        }
        return pct(covered, keywords.size());
    }

    private static double pct(int part, int total) {
        return ScoreMath.round1(ScoreMath.percent(part, total));
    }
}
