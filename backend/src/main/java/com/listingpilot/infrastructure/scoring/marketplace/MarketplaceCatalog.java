package com.listingpilot.infrastructure.scoring.marketplace;

import com.listingpilot.domain.listing.model.MarketplaceLimits;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Field limits and default language per marketplace.
 */
@Component
public class MarketplaceCatalog {

    public static final String DEFAULT_MARKETPLACE = "amazon_de";

    private static final Map<String, MarketplaceLimits> LIMITS = Map.of(
            "amazon_de", new MarketplaceLimits(200, 500, 249, "de"),
            "amazon_com", new MarketplaceLimits(200, 500, 249, "en"),
            "amazon_us", new MarketplaceLimits(200, 500, 249, "en"),
            "amazon_pl", new MarketplaceLimits(200, 500, 249, "pl"),
            "amazon_fr", new MarketplaceLimits(200, 500, 249, "fr"),
            "amazon_it", new MarketplaceLimits(200, 500, 249, "it"),
            "amazon_es", new MarketplaceLimits(200, 500, 249, "es"),
            // No backend search-term field outside Amazon
            "ebay_de", new MarketplaceLimits(80, 300, 0, "de"),
            "kaufland", new MarketplaceLimits(150, 400, 0, "de"),
            "allegro", new MarketplaceLimits(75, 500, 0, "pl")
    );

    /**
     * Limits for the marketplace, falling back to {@value #DEFAULT_MARKETPLACE} for unknown ids.
     */
    public MarketplaceLimits limitsFor(String marketplace) {
        MarketplaceLimits limits = marketplace == null ? null : LIMITS.get(marketplace);
        return limits != null ? limits : LIMITS.get(DEFAULT_MARKETPLACE);
    }

    /**
     * An explicit language wins; otherwise the marketplace default.
     */
    public String resolveLanguage(String marketplace, String explicitLanguage) {
        if (explicitLanguage != null && !explicitLanguage.isBlank()) {
            return explicitLanguage;
        }
        return limitsFor(marketplace).language();
    }

    public boolean isKnown(String marketplace) {
        return marketplace != null && LIMITS.containsKey(marketplace);
    }
}
