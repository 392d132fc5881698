package com.listingpilot.infrastructure.scoring.validation;

import com.listingpilot.domain.listing.model.ComplianceResult;
import com.listingpilot.domain.listing.model.ListingDraft;
import com.listingpilot.domain.listing.model.MarketplaceLimits;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Basic compliance against marketplace limits: lengths, brand placement,
 * promotional words and forbidden title characters.
 */
@Component
public class ListingComplianceChecker {

    static final int BRAND_WINDOW_CHARS = 50;

    static final List<String> PROMO_WORDS = List.of(
            "bestseller", "best seller", "top seller", "#1", "nr. 1", "günstig",
            "billig", "gratis", "free", "sale", "rabatt", "discount", "angebot",
            "deal", "preiswert", "sonderangebot", "ausverkauf", "cheap"
    );

    static final List<String> FORBIDDEN_CHARS = List.of("!", "¡", "$", "€", "™", "®", "©");

    private static final List<Pattern> PROMO_PATTERNS = PROMO_WORDS.stream()
            .map(ListingComplianceChecker::wordPattern)
            .toList();

    public ComplianceResult check(ListingDraft draft, String brand, MarketplaceLimits limits) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String title = draft.title();

        if (title.length() > limits.titleChars()) {
            errors.add(String.format("Title exceeds %d chars (%d)", limits.titleChars(), title.length()));
        }

        List<String> bullets = draft.bullets();
        for (int i = 0; i < bullets.size(); i++) {
            int length = bullets.get(i).length();
            if (length > limits.bulletChars()) {
                errors.add(String.format("Bullet %d exceeds %d chars (%d)", i + 1, limits.bulletChars(), length));
            }
        }

        // Brand belongs near the start of the title
        if (brand != null && !brand.isBlank()) {
            String head = title.substring(0, Math.min(BRAND_WINDOW_CHARS, title.length())).toLowerCase(Locale.ROOT);
            if (!head.contains(brand.toLowerCase(Locale.ROOT))) {
                warnings.add("Brand not found in first " + BRAND_WINDOW_CHARS + " chars of title");
            }
        }

        String titleAndBullets = title + " " + draft.bulletsText();
        for (int i = 0; i < PROMO_WORDS.size(); i++) {
            if (PROMO_PATTERNS.get(i).matcher(titleAndBullets).find()) {
                errors.add("Promotional word found: '" + PROMO_WORDS.get(i) + "'");
            }
        }

        for (String ch : FORBIDDEN_CHARS) {
            if (title.contains(ch)) {
                errors.add("Forbidden character in title: '" + ch + "'");
            }
        }

        return ComplianceResult.of(errors, warnings);
    }

    static Pattern wordPattern(String word) {
        return Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(word) + "(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
