package com.listingpilot.infrastructure.scoring.validation;

import com.listingpilot.domain.listing.model.PolicyReport;
import com.listingpilot.domain.listing.model.Violation;
import com.listingpilot.infrastructure.scoring.text.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

/**
 * Rule-based marketplace policy checker for listings that risk suppression.
 * Checks title format, prohibited claims, external references and backend terms.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyComplianceChecker {

    static final int TITLE_MAX_CHARS = 200;
    static final int TITLE_MAX_WORD_REPEATS = 2;
    static final int BACKEND_MAX_BYTES = 250;

    private static final String FIELD_TITLE = "title";
    private static final String FIELD_CONTENT = "content";
    private static final String FIELD_BACKEND = "backend_keywords";

    private final KeywordMatcher matcher;

    /**
     * Run the full policy check.
     *
     * @param title       listing title
     * @param bullets     bullet points
     * @param description product description
     * @param backend     backend search terms (may be empty)
     * @param marketplace marketplace id; rules apply only to ids starting with "amazon"
     * @return violations with an aggregated status; always PASS for other marketplaces
     */
    public PolicyReport check(String title, List<String> bullets, String description,
                              String backend, String marketplace) {
        if (marketplace == null || !marketplace.startsWith("amazon")) {
            return PolicyReport.passed();
        }

        String safeTitle = title == null ? "" : title;
        String bulletsText = bullets == null ? "" : String.join(" ", bullets);
        String safeDescription = description == null ? "" : description;

        List<Violation> violations = new ArrayList<>();

        // 1. Title format
        checkTitleFormat(safeTitle, violations);

        // 2. Content: title + bullets + description
        String fullVisible = safeTitle + " " + bulletsText + " " + safeDescription;
        checkProhibitedClaims(fullVisible, violations);
        checkExternalReferences(fullVisible, violations);

        // 3. Backend search terms
        if (backend != null && !backend.isEmpty()) {
            checkBackendTerms(backend, violations);
        }

        PolicyReport report = PolicyReport.of(violations);
        if (report.suppressionRisk()) {
            log.warn("[Policy] Suppression risk on {}: {} violations ({})", marketplace,
                    report.violationCount(),
                    report.suppressions().stream().map(Violation::rule).distinct().collect(Collectors.joining(", ")));
        } else {
            log.debug("[Policy] {} on {}: {} violations", report.status(), marketplace, report.violationCount());
        }
        return report;
    }

    private void checkTitleFormat(String title, List<Violation> violations) {
        if (title.length() > TITLE_MAX_CHARS) {
            violations.add(Violation.suppression("title_length",
                    String.format("Title exceeds %d characters (%d)", TITLE_MAX_CHARS, title.length()), FIELD_TITLE));
        }

        // ALL CAPS words are auto-corrected or suppressed
        List<String> capsWords = new ArrayList<>();
        for (String word : title.split("\\s+")) {
            if (word.length() > 3 && isAlphabetic(word) && word.equals(word.toUpperCase(Locale.ROOT))) {
                capsWords.add(word);
            }
        }
        if (!capsWords.isEmpty()) {
            violations.add(Violation.suppression("title_all_caps",
                    "Words in ALL CAPS: " + String.join(", ", capsWords.subList(0, Math.min(3, capsWords.size()))),
                    FIELD_TITLE));
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher m = PolicyRules.TITLE_WORD.matcher(title.toLowerCase(Locale.ROOT));
        while (m.find()) {
            if (m.group().length() > 2) {
                counts.merge(m.group(), 1, Integer::sum);
            }
        }
        counts.forEach((word, count) -> {
            if (count > TITLE_MAX_WORD_REPEATS) {
                violations.add(Violation.suppression("title_word_repetition",
                        String.format("Word '%s' repeated %dx in title (max %dx)", word, count, TITLE_MAX_WORD_REPEATS),
                        FIELD_TITLE));
            }
        });

        Set<String> forbidden = new LinkedHashSet<>();
        title.codePoints()
                .filter(cp -> PolicyRules.FORBIDDEN_TITLE_CHARS.indexOf(cp) >= 0)
                .forEach(cp -> forbidden.add(new String(Character.toChars(cp))));
        if (!forbidden.isEmpty()) {
            violations.add(Violation.suppression("title_forbidden_chars",
                    "Forbidden characters in title: " + String.join(" ", forbidden), FIELD_TITLE));
        }
    }

    private void checkProhibitedClaims(String text, List<Violation> violations) {
        for (PolicyRules.PhraseRule rule : PolicyRules.CLAIM_RULES) {
            Matcher m = rule.pattern().matcher(text);
            while (m.find()) {
                String message = rule.label() + ": '" + m.group().toLowerCase(Locale.ROOT) + "'";
                violations.add(rule.suppression()
                        ? Violation.suppression(rule.rule(), message, FIELD_CONTENT)
                        : Violation.warning(rule.rule(), message, FIELD_CONTENT));
            }
        }
    }

    private void checkExternalReferences(String text, List<Violation> violations) {
        for (PolicyRules.ExternalPattern external : PolicyRules.EXTERNAL_PATTERNS) {
            if (external.pattern().matcher(text).find()) {
                violations.add(Violation.suppression("external_reference",
                        "External reference: " + external.description(), FIELD_CONTENT));
            }
        }
    }

    private void checkBackendTerms(String backend, List<Violation> violations) {
        // Over the limit, the whole field is silently dropped from the index
        int bytes = matcher.utf8Length(backend);
        if (bytes > BACKEND_MAX_BYTES) {
            violations.add(Violation.suppression("backend_byte_limit",
                    String.format("Backend keywords exceed %d bytes (%dB), the whole field will not be indexed",
                            BACKEND_MAX_BYTES, bytes),
                    FIELD_BACKEND));
        }

        if (PolicyRules.ASIN_PATTERN.matcher(backend.toUpperCase(Locale.ROOT)).find()) {
            violations.add(Violation.suppression("backend_asin",
                    "Competitor ASIN in backend keywords, account suspension risk", FIELD_BACKEND));
        }

        Matcher m = PolicyRules.BACKEND_SUBJECTIVE_PATTERN.matcher(backend);
        while (m.find()) {
            violations.add(Violation.warning("backend_subjective",
                    "Subjective word in backend keywords: '" + m.group().toLowerCase(Locale.ROOT) + "' wastes bytes",
                    FIELD_BACKEND));
        }
    }

    private static boolean isAlphabetic(String word) {
        return word.codePoints().allMatch(Character::isLetter);
    }
}
