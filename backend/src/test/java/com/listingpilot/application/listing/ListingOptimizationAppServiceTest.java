package com.listingpilot.application.listing;

import com.listingpilot.domain.keyword.model.AccountType;
import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.domain.listing.model.GeneratedListing;
import com.listingpilot.domain.listing.model.GenerationRequest;
import com.listingpilot.domain.listing.service.ListingGenerationException;
import com.listingpilot.domain.listing.service.ListingGenerator;
import com.listingpilot.infrastructure.scoring.coverage.CoverageCalculator;
import com.listingpilot.infrastructure.scoring.marketplace.MarketplaceCatalog;
import com.listingpilot.infrastructure.scoring.packing.BackendTermPacker;
import com.listingpilot.infrastructure.scoring.placement.KeywordTieringService;
import com.listingpilot.infrastructure.scoring.ppc.PpcRecommender;
import com.listingpilot.infrastructure.scoring.ranking.RankingScoreCalculator;
import com.listingpilot.infrastructure.scoring.text.KeywordMatcher;
import com.listingpilot.infrastructure.scoring.text.TextNormalizer;
import com.listingpilot.infrastructure.scoring.validation.AntiStuffingChecker;
import com.listingpilot.infrastructure.scoring.validation.ListingComplianceChecker;
import com.listingpilot.infrastructure.scoring.validation.ListingPostProcessor;
import com.listingpilot.infrastructure.scoring.validation.PolicyComplianceChecker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListingOptimizationAppServiceTest {

    private static final List<Keyword> KEYWORDS = List.of(
            Keyword.of("camping flask", 500),
            Keyword.of("steel bottle", 5000),
            Keyword.of("thermos", 1000),
            Keyword.of("leak proof lid", 3000),
            Keyword.of("water bottle kids", 300));

    private static final GeneratedListing GENERATED = new GeneratedListing(
            "Contigo Steel Bottle - Leak Proof Lid Bestseller",
            "1. Keeps drinks cold for 24 hours\n2. Leak proof lid for travel and office",
            "Double wall insulation keeps drinks cold.",
            "thermos, camping");

    @Mock
    private ListingGenerator listingGenerator;

    private ListingOptimizationAppService service;

    @BeforeEach
    void setUp() {
        service = newService(new StaticListableBeanFactory(Map.of("listingGenerator", listingGenerator))
                .getBeanProvider(ListingGenerator.class));
    }

    private static ListingOptimizationAppService newService(ObjectProvider<ListingGenerator> generators) {
        KeywordMatcher matcher = new KeywordMatcher();
        CoverageCalculator coverageCalculator = new CoverageCalculator(matcher);
        MarketplaceCatalog catalog = new MarketplaceCatalog();
        ListingScoringService scoringService = new ListingScoringService(
                matcher,
                coverageCalculator,
                new RankingScoreCalculator(matcher, coverageCalculator),
                new AntiStuffingChecker(),
                new ListingComplianceChecker(),
                new PolicyComplianceChecker(matcher),
                new PpcRecommender(matcher),
                catalog,
                200);

        return new ListingOptimizationAppService(
                new KeywordTieringService(),
                catalog,
                generators,
                new ListingPostProcessor(new TextNormalizer()),
                new BackendTermPacker(matcher),
                scoringService,
                "amazon_de");
    }

    private static OptimizationRequest request(String marketplace, AccountType accountType, String category) {
        return new OptimizationRequest("Steel Bottle", "Contigo", null, KEYWORDS,
                marketplace, accountType, category, null);
    }

    @Test
    @DisplayName("tiering → generation → post-processing → packing → scoring")
    void optimize() {
        when(listingGenerator.generate(any())).thenReturn(GENERATED);

        OptimizationResult result = service.optimize(request(null, null, "Kitchen"));

        assertThat(result.marketplace()).isEqualTo("amazon_de");
        assertThat(result.language()).isEqualTo("de");
        assertThat(result.draft().title()).isEqualTo("Contigo Steel Bottle - Leak Proof Lid");
        assertThat(result.draft().bullets()).containsExactly(
                "Keeps drinks cold for 24 hours",
                "Leak proof lid for travel and office");
        assertThat(result.draft().backendTerms()).startsWith("thermos camping flask water bottle kids");
        assertThat(result.draft().backendTerms().getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(249);
        assertThat(result.tiers().all().get(0).phrase()).isEqualTo("steel bottle");
        assertThat(result.report().coveragePct()).isEqualTo(100.0);
        assertThat(result.report().backendBytes()).isPositive();
    }

    @Test
    @DisplayName("generator receives seller bullets and the category limit")
    void generation_request_seller() {
        when(listingGenerator.generate(any())).thenReturn(GENERATED);

        service.optimize(request("amazon_de", AccountType.SELLER, "Kitchen"));

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(listingGenerator).generate(captor.capture());
        GenerationRequest sent = captor.getValue();
        assertThat(sent.bulletCount()).isEqualTo(5);
        assertThat(sent.bulletCharLimit()).isEqualTo(200);
        assertThat(sent.language()).isEqualTo("de");
        assertThat(sent.brand()).isEqualTo("Contigo");
        assertThat(sent.tiers().title()).hasSize(5);
    }

    @Test
    @DisplayName("vendors in fashion categories get 10 short bullets")
    void generation_request_vendor() {
        when(listingGenerator.generate(any())).thenReturn(GENERATED);

        service.optimize(request("amazon_com", AccountType.VENDOR, "Clothing"));

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(listingGenerator).generate(captor.capture());
        assertThat(captor.getValue().bulletCount()).isEqualTo(10);
        assertThat(captor.getValue().bulletCharLimit()).isEqualTo(150);
        assertThat(captor.getValue().language()).isEqualTo("en");
    }

    @Test
    @DisplayName("marketplace language is used unless one is given")
    void language() {
        when(listingGenerator.generate(any())).thenReturn(GENERATED);

        OptimizationResult result = service.optimize(request("amazon_fr", null, null));

        assertThat(result.language()).isEqualTo("fr");
    }

    @Test
    @DisplayName("marketplace without backend field gets no backend terms")
    void no_backend_budget() {
        when(listingGenerator.generate(any())).thenReturn(GENERATED);

        OptimizationResult result = service.optimize(request("ebay_de", null, null));

        assertThat(result.draft().backendTerms()).isEmpty();
        assertThat(result.report().backendUtilPct()).isZero();
    }

    @Test
    @DisplayName("blank generated title fails the optimization")
    void blank_title() {
        when(listingGenerator.generate(any())).thenReturn(new GeneratedListing(" ", "", "", ""));

        assertThatThrownBy(() -> service.optimize(request(null, null, null)))
                .isInstanceOf(ListingGenerationException.class);
    }

    @Test
    @DisplayName("generator failures propagate")
    void generator_failure() {
        when(listingGenerator.generate(any())).thenThrow(new ListingGenerationException("upstream timeout"));

        assertThatThrownBy(() -> service.optimize(request(null, null, null)))
                .isInstanceOf(ListingGenerationException.class)
                .hasMessage("upstream timeout");
    }

    @Test
    @DisplayName("without a configured generator the optimization fails with a generation error")
    void no_generator() {
        ListingOptimizationAppService withoutGenerator = newService(
                new StaticListableBeanFactory().getBeanProvider(ListingGenerator.class));

        assertThatThrownBy(() -> withoutGenerator.optimize(request(null, null, null)))
                .isInstanceOf(ListingGenerationException.class)
                .hasMessage("No listing generator is configured");
    }

    @Test
    @DisplayName("allegro descriptions get their keywords bolded, other marketplaces keep plain HTML")
    void allegro_bold_keywords() {
        String html = "<p>Steel bottle with a leak proof lid</p>";
        when(listingGenerator.generate(any())).thenReturn(new GeneratedListing(
                "Contigo Steel Bottle", GENERATED.bulletsRaw(), html, ""));

        OptimizationResult allegro = service.optimize(request("allegro", null, null));
        OptimizationResult amazon = service.optimize(request("amazon_de", null, null));

        assertThat(allegro.draft().description())
                .isEqualTo("<p><b>Steel bottle</b> with a <b>leak proof lid</b></p>");
        assertThat(amazon.draft().description()).isEqualTo(html);
    }
}
