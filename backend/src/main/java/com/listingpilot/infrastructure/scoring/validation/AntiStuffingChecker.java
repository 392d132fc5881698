package com.listingpilot.infrastructure.scoring.validation;

import com.listingpilot.infrastructure.scoring.ScoreMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects keyword stuffing: per-word density caps and repetition limits.
 * Density is measured over title, bullets and description; repetition only over title and bullets.
 */
@Slf4j
@Component
public class AntiStuffingChecker {

    public static final double MAX_DENSITY_PCT = 3.0;
    public static final int TITLE_MAX_REPEATS = 2;
    public static final int LISTING_MAX_REPEATS = 3;

    private static final Pattern LETTERS = Pattern.compile("\\p{L}+");

    // Function words in EN/DE/PL/FR/IT/ES inflate density without being keywords
    static final Set<String> STOP_WORDS = Set.of(
            // English
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "is", "it", "as", "be", "was", "are",
            "not", "no", "can", "will", "has", "have", "do", "does", "so", "if",
            "this", "that", "your", "our", "its", "their", "all", "also", "more",
            // German
            "der", "die", "das", "den", "dem", "des", "und", "oder", "mit", "von",
            "fur", "für", "ein", "eine", "einen", "einem", "einer", "ist", "sind", "hat",
            "sie", "er", "es", "wir", "ihr", "nicht", "auch", "noch", "nur",
            "wird", "werden", "kann", "aus", "bei", "nach", "auf", "sich", "wie",
            "zu", "zum", "zur", "als", "da", "ob", "wenn", "man",
            "durch", "diese", "dieser", "dieses", "mehr", "sehr", "ihre", "ihren",
            "unsere", "unserer", "unserem", "unseren", "dank", "ihrer", "ihrem",
            // Polish
            "z", "w", "na", "i", "lub", "od", "dla", "ze", "po", "nie",
            "jest", "jak", "co", "ten", "ta", "te", "ich", "tym",
            // French
            "le", "la", "les", "un", "une", "et", "ou", "de", "du", "en",
            "est", "ce", "qui", "que", "pas", "par", "sur", "son", "ses", "aux",
            // Italian
            "il", "lo", "li", "una", "di", "per", "con",
            "che", "non", "del", "dei", "nel", "sul", "suo", "sua",
            // Spanish
            "el", "los", "las", "por", "su", "sus", "al", "se"
    );

    /**
     * Combined check.
     *
     * @return density warnings, then title repetition, then listing repetition
     */
    public List<String> check(String title, List<String> bullets, String description) {
        String safeTitle = title == null ? "" : title;
        String bulletsText = bullets == null ? "" : String.join(" ", bullets);
        String safeDescription = description == null ? "" : description;

        List<String> warnings = new ArrayList<>(
                checkDensity(safeTitle + " " + bulletsText + " " + safeDescription));
        warnings.addAll(checkRepetition(safeTitle, bulletsText));

        if (!warnings.isEmpty()) {
            log.debug("[AntiStuffing] {} warnings", warnings.size());
        }
        return warnings;
    }

    /**
     * Flags every word whose share of all counted words exceeds {@value #MAX_DENSITY_PCT}%.
     */
    public List<String> checkDensity(String text) {
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> counts = wordCounts(text);
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return warnings;
        }
        counts.forEach((word, count) -> {
            double density = (double) count / total * 100.0;
            if (density > MAX_DENSITY_PCT) {
                warnings.add(String.format(Locale.ROOT,
                        "Keyword stuffing: '%s' appears %dx (%s%% density, max %s%%)",
                        word, count, ScoreMath.format1(density), ScoreMath.format1(MAX_DENSITY_PCT)));
            }
        });
        return warnings;
    }

    private List<String> checkRepetition(String title, String bulletsText) {
        List<String> warnings = new ArrayList<>();

        wordCounts(title).forEach((word, count) -> {
            if (count > TITLE_MAX_REPEATS) {
                warnings.add(String.format(Locale.ROOT,
                        "Title repetition: '%s' appears %dx (max %dx in title)", word, count, TITLE_MAX_REPEATS));
            }
        });

        wordCounts(title + " " + bulletsText).forEach((word, count) -> {
            if (count > LISTING_MAX_REPEATS) {
                warnings.add(String.format(Locale.ROOT,
                        "Listing repetition: '%s' appears %dx (max %dx in listing)", word, count, LISTING_MAX_REPEATS));
            }
        });

        return warnings;
    }

    /**
     * Lowercase letter-word counts in first-occurrence order, without stop words and 1-letter words.
     */
    Map<String, Integer> wordCounts(String text) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher m = LETTERS.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String word = m.group();
            if (word.length() >= 2 && !STOP_WORDS.contains(word)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        return counts;
    }
}
