package com.listingpilot.application.listing;

import com.listingpilot.domain.keyword.model.AccountType;
import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.domain.keyword.model.KeywordTiers;
import com.listingpilot.domain.listing.model.GeneratedListing;
import com.listingpilot.domain.listing.model.GenerationRequest;
import com.listingpilot.domain.listing.model.ListingDraft;
import com.listingpilot.domain.listing.model.ListingScoreReport;
import com.listingpilot.domain.listing.model.MarketplaceLimits;
import com.listingpilot.domain.listing.service.ListingGenerationException;
import com.listingpilot.domain.listing.service.ListingGenerator;
import com.listingpilot.infrastructure.scoring.marketplace.MarketplaceCatalog;
import com.listingpilot.infrastructure.scoring.packing.BackendTermPacker;
import com.listingpilot.infrastructure.scoring.placement.KeywordTieringService;
import com.listingpilot.infrastructure.scoring.validation.ListingPostProcessor;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Full optimization: keyword tiering → text generation → post-processing → backend packing → scoring.
 */
@Slf4j
@Service
@Validated
public class ListingOptimizationAppService {

    // The only marketplace whose description is rendered as HTML
    static final String BOLD_KEYWORDS_MARKETPLACE = "allegro";

    private final KeywordTieringService tieringService;
    private final MarketplaceCatalog marketplaceCatalog;
    private final ObjectProvider<ListingGenerator> listingGenerator;
    private final ListingPostProcessor postProcessor;
    private final BackendTermPacker backendTermPacker;
    private final ListingScoringService scoringService;
    private final String defaultMarketplace;

    public ListingOptimizationAppService(KeywordTieringService tieringService,
                                         MarketplaceCatalog marketplaceCatalog,
                                         ObjectProvider<ListingGenerator> listingGenerator,
                                         ListingPostProcessor postProcessor,
                                         BackendTermPacker backendTermPacker,
                                         ListingScoringService scoringService,
                                         @Value("${listing.optimize.default-marketplace:amazon_de}") String defaultMarketplace) {
        this.tieringService = tieringService;
        this.marketplaceCatalog = marketplaceCatalog;
        this.listingGenerator = listingGenerator;
        this.postProcessor = postProcessor;
        this.backendTermPacker = backendTermPacker;
        this.scoringService = scoringService;
        this.defaultMarketplace = defaultMarketplace;
    }

    public OptimizationResult optimize(@Valid OptimizationRequest request) {
        String marketplace = request.marketplace() == null || request.marketplace().isBlank()
                ? defaultMarketplace : request.marketplace();
        if (!marketplaceCatalog.isKnown(marketplace)) {
            log.warn("[Optimize] Unknown marketplace '{}', using {} limits", marketplace, MarketplaceCatalog.DEFAULT_MARKETPLACE);
        }
        AccountType accountType = request.accountType() == null ? AccountType.SELLER : request.accountType();
        MarketplaceLimits limits = marketplaceCatalog.limitsFor(marketplace);
        String language = marketplaceCatalog.resolveLanguage(marketplace, request.language());

        // 1. Keyword preparation
        KeywordTiers tiers = tieringService.tierKeywords(request.keywords(), accountType);
        int bulletCount = tieringService.bulletCount(accountType);
        int bulletCharLimit = Math.min(limits.bulletChars(), tieringService.bulletCharLimit(request.category()));

        log.info("[Optimize] start product='{}' marketplace={} keywords={} tiers={}/{}/{}",
                abbreviate(request.productTitle()), marketplace, tiers.all().size(),
                tiers.title().size(), tiers.bullets().size(), tiers.lowPriority().size());

        // 2. External text generation
        ListingGenerator generator = listingGenerator.getIfAvailable();
        if (generator == null) {
            throw new ListingGenerationException("No listing generator is configured");
        }
        GeneratedListing generated = generator.generate(new GenerationRequest(
                request.productTitle(), request.brand(), request.productLine(), tiers,
                language, limits, bulletCount, bulletCharLimit));
        if (generated == null || generated.title() == null || generated.title().isBlank()) {
            throw new ListingGenerationException("Generator returned no title");
        }

        // 3. Post-processing
        String title = postProcessor.cleanTitle(generated.title(), limits.titleChars());
        List<String> bullets = postProcessor.parseBullets(generated.bulletsRaw(), bulletCount).stream()
                .map(postProcessor::stripPromoWords)
                .toList();
        String description = postProcessor.cleanText(generated.description());
        if (BOLD_KEYWORDS_MARKETPLACE.equals(marketplace)) {
            description = postProcessor.boldKeywordsInHtml(description,
                    tiers.all().stream().map(Keyword::phrase).toList());
        }
        ListingDraft visible = new ListingDraft(title, bullets, description, "");

        // 4. Backend packing against what the shopper can already see
        String backend = backendTermPacker.pack(tiers.all(), visible.visibleText(),
                limits.backendBytes(), generated.backendSuggestions());
        ListingDraft draft = visible.withBackendTerms(backend);

        // 5. Scoring
        ListingScoreReport report = scoringService.score(tiers.all(), tiers.title(), draft,
                request.brand(), marketplace);

        log.info("[Optimize] done coverage={}% rj={} compliance={} policy={}",
                report.coveragePct(), report.ranking().score(),
                report.compliance().status(), report.policy().status());

        return new OptimizationResult(marketplace, language, draft, tiers, report);
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50);
    }
}
