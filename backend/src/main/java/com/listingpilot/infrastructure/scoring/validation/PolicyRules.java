package com.listingpilot.infrastructure.scoring.validation;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Marketplace policy rule tables: phrase lists, forbidden characters and precompiled patterns.
 * Built once at class load and only read afterwards.
 */
final class PolicyRules {

    private PolicyRules() {
    }

    record PhraseRule(String rule, boolean suppression, String label, Pattern pattern) {}

    record ExternalPattern(Pattern pattern, String description) {}

    static final List<String> PROMO_PHRASES = List.of(
            "best seller", "bestseller", "best selling", "top seller", "top rated",
            "best deal", "best price", "#1", "nr 1", "no. 1", "number one",
            "hot item", "sale", "discount", "free shipping", "free gift",
            "on sale", "limited time", "special offer", "huge sale", "close-out",
            "deal", "cheap", "cheapest", "buy now", "shop now", "don't miss out",
            "guaranteed", "money back", "risk-free", "award winning", "proven",
            "100% natural", "100% effective", "100% quality", "premium quality",
            "highest quality", "buy with confidence", "unlike other brands",
            "perfect", "ultimate", "amazing", "incredible", "unbeatable",
            "fooled", "lush", "angebot", "sonderangebot", "ausverkauf",
            "günstig", "billig", "gratis", "rabatt", "preiswert"
    );

    // Medical claims trigger FDA review
    static final List<String> HEALTH_CLAIMS = List.of(
            "cure", "cures", "treat", "treats", "treatment", "heal", "healing",
            "remedy", "remedies", "medication", "diagnose", "prevent", "prevents",
            "mitigate", "weight loss", "fat burning", "appetite suppressant",
            "boosts metabolism", "reduces cholesterol", "aids digestion",
            "detox", "detoxify", "detoxification", "reduce anxiety",
            "insomnia", "increases energy", "joint pain", "heartburn",
            "inflammation", "arthritis", "immune booster"
    );

    // Antimicrobial claims require EPA registration
    static final List<String> PESTICIDE_CLAIMS = List.of(
            "antibacterial", "anti-bacterial", "antimicrobial", "anti-microbial",
            "antifungal", "fungicide", "sanitize", "sanitizes", "disinfect",
            "kills bacteria", "kills viruses", "kills germs", "mold resistant",
            "mildew resistant", "repels insects", "antiseptic"
    );

    static final List<String> DRUG_KEYWORDS = List.of(
            "cbd", "cannabinoid", "thc", "full spectrum hemp", "marijuana",
            "kratom", "psilocybin", "ephedrine", "ketamine"
    );

    // Green claims need a certification
    static final List<String> ECO_CLAIMS = List.of(
            "eco-friendly", "eco friendly", "biodegradable", "compostable",
            "environmentally friendly", "carbon neutral", "carbon-reducing",
            "decomposable", "degradable"
    );

    static final List<String> BACKEND_SUBJECTIVE = List.of(
            "best", "amazing", "perfect", "cheapest", "top-rated", "new", "on sale"
    );

    static final String FORBIDDEN_TITLE_CHARS = "!$?_{}^~#<>|*;\\\"¡€™®©";

    static final List<PhraseRule> CLAIM_RULES = List.of(
            new PhraseRule("promo_phrase", true, "Prohibited promotional phrase", phrasePattern(PROMO_PHRASES)),
            new PhraseRule("health_claim", true, "Health claim (FDA)", phrasePattern(HEALTH_CLAIMS)),
            new PhraseRule("pesticide_claim", true, "Pesticide claim (EPA)", phrasePattern(PESTICIDE_CLAIMS)),
            new PhraseRule("drug_keyword", true, "Drug-related keyword", phrasePattern(DRUG_KEYWORDS)),
            new PhraseRule("eco_claim", false, "Uncertified eco claim", phrasePattern(ECO_CLAIMS))
    );

    static final Pattern BACKEND_SUBJECTIVE_PATTERN = phrasePattern(BACKEND_SUBJECTIVE);

    static final List<ExternalPattern> EXTERNAL_PATTERNS = List.of(
            new ExternalPattern(Pattern.compile("https?://\\S+"), "URL found"),
            new ExternalPattern(Pattern.compile("www\\.\\S+"), "URL found"),
            new ExternalPattern(Pattern.compile("\\b[\\w.-]+@[\\w.-]+\\.\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS),
                    "Email address found"),
            new ExternalPattern(Pattern.compile("\\+?\\d[\\d\\s-]{8,}"), "Phone number found")
    );

    // ASIN: B0 + 8 alphanumerics, matched against upper-cased text
    static final Pattern ASIN_PATTERN = Pattern.compile("\\bB0[A-Z0-9]{8}\\b");

    static final Pattern TITLE_WORD = Pattern.compile("\\p{L}+");

    private static final String WORD_CHAR = "[\\p{L}\\p{N}_]";

    /**
     * One case-insensitive alternation over all phrases, bounded by non-word characters.
     */
    static Pattern phrasePattern(List<String> phrases) {
        String alternation = phrases.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<!" + WORD_CHAR + ")(?:" + alternation + ")(?!" + WORD_CHAR + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
