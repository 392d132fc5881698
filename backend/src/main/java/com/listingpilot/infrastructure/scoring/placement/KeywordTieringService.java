package com.listingpilot.infrastructure.scoring.placement;

import com.listingpilot.domain.keyword.model.AccountType;
import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.domain.keyword.model.KeywordTiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Assigns keywords to listing placements by search-volume rank.
 * Highest-volume keywords go to the title, mid-range to bullets, long tail to backend and description.
 */
@Slf4j
@Component
public class KeywordTieringService {

    private record Range(int from, int to) {
        List<Keyword> slice(List<Keyword> sorted) {
            int start = Math.min(from, sorted.size());
            int end = Math.min(to, sorted.size());
            return sorted.subList(start, end);
        }
    }

    private record Ranges(Range title, Range bullets, Range backend, Range description) {}

    private static final Ranges SELLER_RANGES = new Ranges(
            new Range(0, 7),
            new Range(7, 32),
            new Range(32, 100),
            new Range(100, 200)
    );

    // Vendors get 10 bullets, so the bullet range is wider and the rest shifts down
    private static final Ranges VENDOR_RANGES = new Ranges(
            new Range(0, 7),
            new Range(7, 52),
            new Range(52, 120),
            new Range(120, 250)
    );

    private static final Set<String> SHORT_BULLET_CATEGORIES = Set.of(
            "apparel", "clothing", "shoes", "jewelry", "fashion"
    );

    public static final int SHORT_BULLET_LIMIT = 150;
    public static final int DEFAULT_BULLET_LIMIT = 200;

    /**
     * Sort keywords by search volume (descending, ties keep input order) and slice them into tiers.
     *
     * @param keywords    researched keywords, duplicates allowed
     * @param accountType seller or vendor
     * @return the sorted list plus one list per placement
     */
    public KeywordTiers tierKeywords(List<Keyword> keywords, AccountType accountType) {
        List<Keyword> sorted = new ArrayList<>(keywords);
        sorted.sort(Comparator.comparingInt(Keyword::searchVolume).reversed());

        Ranges ranges = accountType == AccountType.VENDOR ? VENDOR_RANGES : SELLER_RANGES;
        KeywordTiers tiers = new KeywordTiers(
                sorted,
                ranges.title().slice(sorted),
                ranges.bullets().slice(sorted),
                ranges.backend().slice(sorted),
                ranges.description().slice(sorted)
        );

        log.debug("[Tiering] {} keywords, account={}, tiers={}/{}/{}/{}",
                sorted.size(), accountType, tiers.title().size(), tiers.bullets().size(),
                tiers.backend().size(), tiers.description().size());
        return tiers;
    }

    public int bulletCount(AccountType accountType) {
        return accountType == AccountType.VENDOR ? 10 : 5;
    }

    /**
     * Max characters per bullet; fashion-like categories are stricter.
     *
     * @param category product category (nullable)
     */
    public int bulletCharLimit(String category) {
        if (category == null || category.isBlank()) {
            return DEFAULT_BULLET_LIMIT;
        }
        String lower = category.toLowerCase(Locale.ROOT);
        for (String key : SHORT_BULLET_CATEGORIES) {
            if (lower.contains(key)) {
                return SHORT_BULLET_LIMIT;
            }
        }
        return DEFAULT_BULLET_LIMIT;
    }
}
