package com.listingpilot.infrastructure.generation;

import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.domain.listing.model.GeneratedListing;
import com.listingpilot.domain.listing.model.GenerationRequest;
import com.listingpilot.domain.listing.service.ListingGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Development stand-in for the external text generator: lays keyword tiers out into
 * a deterministic draft so the pipeline runs without network access.
 */
@Slf4j
@Service
@Profile("!prod")
public class KeywordTemplateListingGenerator implements ListingGenerator {

    @Override
    public GeneratedListing generate(GenerationRequest request) {
        String title = request.brand() + " " + request.productTitle()
                + join(" - ", request.tiers().title());

        List<Keyword> bulletKeywords = request.tiers().bullets();
        int perBullet = Math.max(1, (int) Math.ceil((double) bulletKeywords.size() / request.bulletCount()));
        List<String> bullets = new ArrayList<>();
        for (int i = 0; i < request.bulletCount() && i * perBullet < bulletKeywords.size(); i++) {
            List<Keyword> chunk = bulletKeywords.subList(i * perBullet,
                    Math.min((i + 1) * perBullet, bulletKeywords.size()));
            String bullet = request.productTitle() + ": " + phrases(chunk, ", ");
            bullets.add(bullet.length() > request.bulletCharLimit()
                    ? bullet.substring(0, request.bulletCharLimit())
                    : bullet);
        }

        String description = request.brand() + " " + request.productTitle() + ". "
                + phrases(request.tiers().description(), ", ");

        log.info("""
                ========================================
                [DEV] Template listing generated
                language: {}
                title: {}
                bullets: {}
                ========================================""", request.language(), title, bullets.size());

        return new GeneratedListing(title, String.join("\n", bullets), description, "");
    }

    private static String join(String separator, List<Keyword> keywords) {
        if (keywords.isEmpty()) {
            return "";
        }
        return separator + phrases(keywords, separator);
    }

    private static String phrases(List<Keyword> keywords, String separator) {
        return keywords.stream().map(Keyword::phrase).collect(Collectors.joining(separator));
    }
}
