package com.listingpilot.infrastructure.scoring.validation;

import com.listingpilot.infrastructure.scoring.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans generated copy: promotional words the generator slipped in,
 * over-long titles and numbering artifacts in bullets. Also bolds keywords in HTML descriptions.
 */
@Component
@RequiredArgsConstructor
public class ListingPostProcessor {

    static final int MIN_BULLET_CHARS = 10;

    // Keep a word-boundary cut only if it preserves more than this share of the limit
    static final double TITLE_CUT_RATIO = 0.8;

    static final int MAX_BOLD_KEYWORDS = 15;

    private static final List<Pattern> PROMO_PATTERNS = ListingComplianceChecker.PROMO_WORDS.stream()
            .map(ListingComplianceChecker::wordPattern)
            .toList();

    private static final Pattern MULTIPLE_WHITESPACE = Pattern.compile("\\s{2,}");
    private static final Pattern SPACE_BEFORE_COMMA = Pattern.compile("\\s,");
    private static final Pattern BULLET_PREFIX = Pattern.compile("^[\\d.\\-*•]+\\s*");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private static final int HTML_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS;

    private final TextNormalizer textNormalizer;

    /**
     * Remove promotional words and tidy the whitespace they leave behind.
     */
    public String stripPromoWords(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = text;
        for (Pattern promo : PROMO_PATTERNS) {
            result = promo.matcher(result).replaceAll("");
        }
        result = MULTIPLE_WHITESPACE.matcher(result).replaceAll(" ");
        result = SPACE_BEFORE_COMMA.matcher(result).replaceAll(",");
        return result.strip();
    }

    /**
     * Shorten a title to {@code maxChars}, at the last space when that keeps most of the limit.
     */
    public String truncateTitle(String title, int maxChars) {
        if (title.length() <= maxChars) {
            return title;
        }
        String truncated = title.substring(0, maxChars);
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > maxChars * TITLE_CUT_RATIO) {
            return truncated.substring(0, lastSpace);
        }
        return truncated;
    }

    /**
     * Split a generated bullet block into bullets: one per line, numbering stripped,
     * lines of {@value #MIN_BULLET_CHARS} chars or fewer dropped.
     */
    public List<String> parseBullets(String raw, int maxBullets) {
        List<String> bullets = new ArrayList<>();
        String normalized = textNormalizer.normalize(raw);
        if (normalized.isEmpty()) {
            return bullets;
        }
        for (String line : LINE_BREAK.split(normalized)) {
            String stripped = line.strip();
            if (stripped.length() <= MIN_BULLET_CHARS) {
                continue;
            }
            bullets.add(BULLET_PREFIX.matcher(stripped).replaceFirst("").strip());
            if (bullets.size() == maxBullets) {
                break;
            }
        }
        return bullets;
    }

    /**
     * Wrap the first text occurrence of each of the first {@value #MAX_BOLD_KEYWORDS} phrases in {@code <b>}.
     * Phrases shorter than 2 chars, phrases already inside a {@code <b>} element and
     * matches within tag markup are left alone. Matching ignores case and keeps the original casing.
     */
    public String boldKeywordsInHtml(String html, List<String> phrases) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String result = html;
        for (String phrase : phrases.subList(0, Math.min(MAX_BOLD_KEYWORDS, phrases.size()))) {
            if (phrase == null || phrase.length() < 2) {
                continue;
            }
            String quoted = Pattern.quote(phrase);
            if (Pattern.compile("<b>[^<]*" + quoted + "[^<]*</b>", HTML_FLAGS).matcher(result).find()) {
                continue;
            }
            Matcher m = Pattern.compile("(?<![<\\w/])" + quoted + "(?![^<]*>)", HTML_FLAGS).matcher(result);
            if (m.find()) {
                result = result.substring(0, m.start()) + "<b>" + m.group() + "</b>" + result.substring(m.end());
            }
        }
        return result;
    }

    /**
     * Normalize and strip a single-line field such as the title.
     */
    public String cleanTitle(String title, int maxChars) {
        return truncateTitle(stripPromoWords(textNormalizer.normalizeLine(title)), maxChars);
    }

    public String cleanText(String text) {
        return stripPromoWords(textNormalizer.normalize(text));
    }
}
