package com.listingpilot.infrastructure.scoring.ppc;

import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.domain.listing.model.MatchType;
import com.listingpilot.domain.listing.model.PpcKeyword;
import com.listingpilot.domain.listing.model.PpcReport;
import com.listingpilot.domain.listing.model.PpcSummary;
import com.listingpilot.infrastructure.scoring.ScoreMath;
import com.listingpilot.infrastructure.scoring.text.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Paid-search match-type recommendations, computed from keyword research alone.
 * High-rank keywords get exact match, mid-range phrase match, the long tail broad match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PpcRecommender {

    static final int EXACT_RANK_LIMIT = 10;
    static final int EXACT_MIN_VOLUME = 1000;
    static final int PHRASE_RANK_LIMIT = 30;
    static final int PHRASE_MIN_VOLUME = 500;

    static final int MAX_EXACT = 15;
    static final int MAX_PHRASE = 20;
    static final int MAX_BROAD = 25;
    static final int MAX_NEGATIVE = 10;

    // Assumes 1% CTR at $0.75 average CPC
    static final double ASSUMED_CTR = 0.01;
    static final double ASSUMED_CPC_USD = 0.75;

    // Generic single words that are never competitor brands
    static final Set<String> GENERIC_TERMS = Set.of(
            // product nouns
            "set", "kit", "pack", "box", "case", "bag", "holder", "stand",
            "cover", "mat", "pad", "tool", "bottle", "cup", "glass", "plate",
            "mug", "lid", "jar", "bowl", "flask", "tumbler", "container", "organizer",
            "flasche", "trinkflasche", "becher", "deckel", "butelka", "kubek",
            // materials
            "steel", "stainless", "plastic", "metal", "wood", "wooden", "bamboo",
            "aluminium", "aluminum", "silicone", "leather", "cotton", "ceramic", "edelstahl",
            // colors
            "black", "white", "blue", "green", "pink", "grey", "gray", "silver", "gold",
            "schwarz", "weiss", "blau", "czarny",
            // sizes
            "small", "large", "mini", "liter", "litre", "inch", "size"
    );

    private final KeywordMatcher matcher;

    /**
     * Bucket keywords by rank and volume.
     *
     * @param keywordsSortedByVolume keywords sorted by search volume descending; the index is the rank
     * @param listingText            full listing text, used to flag keywords already indexed
     */
    public PpcReport recommend(List<Keyword> keywordsSortedByVolume, String listingText) {
        Set<String> listingWords = matcher.extractWords(listingText);

        List<PpcKeyword> exact = new ArrayList<>();
        List<PpcKeyword> phrase = new ArrayList<>();
        List<PpcKeyword> broad = new ArrayList<>();

        for (int i = 0; i < keywordsSortedByVolume.size(); i++) {
            Keyword kw = keywordsSortedByVolume.get(i);
            int volume = kw.searchVolume();
            boolean indexed = matcher.phraseCovered(kw.phrase(), listingWords);

            if (i < EXACT_RANK_LIMIT && volume >= EXACT_MIN_VOLUME) {
                exact.add(new PpcKeyword(kw.phrase(), volume, indexed, MatchType.EXACT));
            } else if (i < PHRASE_RANK_LIMIT || volume >= PHRASE_MIN_VOLUME) {
                phrase.add(new PpcKeyword(kw.phrase(), volume, indexed, MatchType.PHRASE));
            } else if (volume > 0) {
                broad.add(new PpcKeyword(kw.phrase(), volume, indexed, MatchType.BROAD));
            }
        }

        List<PpcKeyword> exactTop = cap(exact, MAX_EXACT);
        List<PpcKeyword> phraseTop = cap(phrase, MAX_PHRASE);
        List<PpcKeyword> broadTop = cap(broad, MAX_BROAD);
        List<String> negatives = cap(detectCompetitorTerms(keywordsSortedByVolume), MAX_NEGATIVE);

        PpcSummary summary = new PpcSummary(
                exactTop.size(),
                phraseTop.size(),
                broadTop.size(),
                negatives.size(),
                estimateDailyBudget(exactTop, phraseTop)
        );

        log.debug("[PPC] exact={} phrase={} broad={} negative={} budget=${}",
                summary.exactCount(), summary.phraseCount(), summary.broadCount(),
                summary.negativeCount(), summary.estimatedDailyBudgetUsd());
        return new PpcReport(exactTop, phraseTop, broadTop, negatives, summary);
    }

    /**
     * Single-word keywords that are not generic product terms may be competitor brands.
     * Suggestions only; the seller reviews them.
     */
    List<String> detectCompetitorTerms(List<Keyword> keywords) {
        List<String> suspects = new ArrayList<>();
        for (Keyword kw : keywords) {
            List<String> words = matcher.phraseWords(kw.phrase());
            if (words.size() == 1 && words.get(0).length() >= 4 && !GENERIC_TERMS.contains(words.get(0))) {
                suspects.add(kw.phrase());
            }
        }
        return suspects;
    }

    double estimateDailyBudget(List<PpcKeyword> exact, List<PpcKeyword> phrase) {
        long totalVolume = 0;
        for (PpcKeyword kw : exact) {
            totalVolume += kw.searchVolume();
        }
        for (PpcKeyword kw : phrase) {
            totalVolume += kw.searchVolume();
        }
        double dailyClicks = totalVolume / 30.0 * ASSUMED_CTR;
        return ScoreMath.round2(dailyClicks * ASSUMED_CPC_USD);
    }

    private static <T> List<T> cap(List<T> list, int max) {
        return List.copyOf(list.subList(0, Math.min(max, list.size())));
    }
}
