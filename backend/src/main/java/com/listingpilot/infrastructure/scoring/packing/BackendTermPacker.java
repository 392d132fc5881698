package com.listingpilot.infrastructure.scoring.packing;

import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.infrastructure.scoring.text.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Greedy byte-packing of backend search terms.
 *
 * Four passes in fixed order, each seeing what the previous ones consumed:
 * <ol>
 *   <li>full phrases not yet covered by the visible listing</li>
 *   <li>root words ranked by cumulative search volume</li>
 *   <li>plural/singular variants of the root words</li>
 *   <li>externally suggested synonyms and related terms</li>
 * </ol>
 * The result never exceeds the byte budget when UTF-8 encoded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendTermPacker {

    private static final String ROOT_STRIP_CHARS = ".,;:-()[]";

    // Size units, materials and adjectives have no useful plural form
    private static final Set<String> SKIP_VARIANT = Set.of(
            "bpa", "ml", "cm", "kg", "oz", "mm", "xl", "xxl",
            "free", "steel", "stainless", "insulated", "vacuum",
            "safe", "portable", "durable", "large", "small",
            "cold", "warm", "with", "from", "pour"
    );

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final KeywordMatcher matcher;

    public String pack(List<Keyword> keywords, String visibleText, int maxBytes) {
        return pack(keywords, visibleText, maxBytes, "");
    }

    /**
     * Pack search terms missing from the visible listing into at most {@code maxBytes} bytes.
     *
     * @param keywords    keywords in priority order
     * @param visibleText title, bullets and description combined
     * @param maxBytes    UTF-8 byte budget; {@code <= 0} yields an empty string
     * @param suggestions free text with extra candidate terms (nullable)
     * @return accepted terms joined by single spaces, in acceptance order
     */
    public String pack(List<Keyword> keywords, String visibleText, int maxBytes, String suggestions) {
        if (maxBytes <= 0) {
            return "";
        }

        Set<String> visibleWords = matcher.extractWords(visibleText);
        Packing packing = new Packing(maxBytes);

        // Pass 1: full phrases
        for (Keyword kw : keywords) {
            List<String> words = matcher.phraseWords(kw.phrase());
            if (visibleWords.containsAll(words)) {
                continue;
            }
            packing.tryAdd(kw.phrase().strip());
        }
        int afterPhrases = packing.terms.size();

        // Pass 2: root words by cumulative search volume, ties in first-seen order
        Map<String, Long> roots = new LinkedHashMap<>();
        for (Keyword kw : keywords) {
            for (String word : matcher.phraseWords(kw.phrase())) {
                String root = stripEnds(word);
                if (root.length() >= 2) {
                    roots.merge(root, (long) kw.searchVolume(), Long::sum);
                }
            }
        }
        List<Map.Entry<String, Long>> ranked = new ArrayList<>(roots.entrySet());
        ranked.sort(Map.Entry.<String, Long>comparingByValue().reversed());
        for (Map.Entry<String, Long> entry : ranked) {
            String word = entry.getKey();
            if (visibleWords.contains(word) || packing.words.contains(word)) {
                continue;
            }
            packing.tryAdd(word);
        }
        int afterRoots = packing.terms.size();

        // Pass 3: plural/singular variants, e.g. bottle/bottles, Flasche/Flaschen
        Set<String> known = new HashSet<>(visibleWords);
        known.addAll(packing.words);
        Set<String> variants = new LinkedHashSet<>();
        for (String word : roots.keySet()) {
            if (word.length() < 4 || SKIP_VARIANT.contains(word) || DIGIT.matcher(word).find()) {
                continue;
            }
            if (word.endsWith("s") && word.length() >= 5 && word.length() <= 9) {
                addVariant(word.substring(0, word.length() - 1), known, variants);
            } else if (!word.endsWith("s") && word.length() <= 8) {
                addVariant(word + "s", known, variants);
            }
            if (word.endsWith("e") && word.length() >= 8) {
                addVariant(word + "n", known, variants);
            }
        }
        for (String variant : variants) {
            if (!packing.words.contains(variant)) {
                packing.tryAdd(variant);
            }
        }
        int afterVariants = packing.terms.size();

        // Pass 4: suggested terms, reduced to plain word tokens
        if (suggestions != null && !suggestions.isBlank()) {
            String cleaned = NON_WORD.matcher(suggestions).replaceAll(" ").toLowerCase(Locale.ROOT).strip();
            if (!cleaned.isEmpty()) {
                for (String term : WHITESPACE.split(cleaned)) {
                    if (term.length() < 2 || visibleWords.contains(term) || packing.words.contains(term)) {
                        continue;
                    }
                    packing.tryAdd(term);
                }
            }
        }

        String result = String.join(" ", packing.terms);
        log.debug("[Packer] {}/{} bytes, terms: phrases={} roots={} variants={} suggestions={}",
                packing.bytes, maxBytes, afterPhrases, afterRoots - afterPhrases,
                afterVariants - afterRoots, packing.terms.size() - afterVariants);
        return result;
    }

    private static void addVariant(String variant, Set<String> known, Set<String> variants) {
        if (!known.contains(variant)) {
            variants.add(variant);
        }
    }

    private static String stripEnds(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && ROOT_STRIP_CHARS.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && ROOT_STRIP_CHARS.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }

    /**
     * Accepted terms and the bytes they use, including single-space separators.
     */
    private final class Packing {
        private final int maxBytes;
        private final List<String> terms = new ArrayList<>();
        private final Set<String> words = new HashSet<>();
        private int bytes;

        private Packing(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        boolean tryAdd(String term) {
            if (term.isEmpty()) {
                return false;
            }
            int separator = terms.isEmpty() ? 0 : 1;
            int termBytes = matcher.utf8Length(term);
            if (bytes + separator + termBytes > maxBytes) {
                return false;
            }
            terms.add(term);
            bytes += separator + termBytes;
            words.addAll(matcher.phraseWords(term));
            return true;
        }
    }
}
