package com.listingpilot.infrastructure.scoring.text;

import com.listingpilot.domain.keyword.model.Keyword;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-level matching primitives shared by every scorer.
 *
 * Coverage is decided on whole words, never substrings: "cap" is not covered by "capsule".
 */
@Component
public class KeywordMatcher {

    /** A phrase counts as covered when at least this share of its words is present. */
    public static final double COVERAGE_THRESHOLD = 0.7;

    // Unicode letters (incl. DE/PL/FR/IT/ES diacritics) and digits
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    // Unicode spaces too, e.g. the NBSP of phrases pasted from spreadsheets
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final String WORD_CHAR = "[\\p{L}\\p{N}_]";

    /**
     * Extract the set of unique lowercase words in the text.
     *
     * @param text any text (nullable)
     * @return unique tokens, empty for null or blank text
     */
    public Set<String> extractWords(String text) {
        Set<String> words = new HashSet<>();
        if (text == null || text.isEmpty()) {
            return words;
        }
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    /**
     * Whitespace-split lowercase words of a phrase.
     */
    public List<String> phraseWords(String phrase) {
        if (phrase == null) {
            return List.of();
        }
        return WHITESPACE.splitAsStream(phrase.toLowerCase(Locale.ROOT))
                .filter(word -> !word.isEmpty())
                .toList();
    }

    /**
     * True if at least 70% of the phrase's words are in the word-set.
     * One- to three-word phrases therefore need every word; four-word phrases need three.
     */
    public boolean phraseCovered(String phrase, Set<String> wordSet) {
        List<String> words = phraseWords(phrase);
        if (words.isEmpty()) {
            return false;
        }
        long matched = words.stream().filter(wordSet::contains).count();
        return (double) matched / words.size() >= COVERAGE_THRESHOLD;
    }

    /**
     * True if the phrase occurs verbatim in the text, bounded by non-word characters on both ends.
     */
    public boolean exactPhraseMatch(String phrase, String text) {
        if (phrase == null || text == null) {
            return false;
        }
        String needle = phrase.strip().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return false;
        }
        Pattern p = Pattern.compile("(?<!" + WORD_CHAR + ")" + Pattern.quote(needle) + "(?!" + WORD_CHAR + ")");
        return p.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Number of keywords whose phrase is an exact match in the text.
     */
    public int countExactMatches(Collection<Keyword> keywords, String text) {
        int count = 0;
        for (Keyword kw : keywords) {
            if (exactPhraseMatch(kw.phrase(), text)) {
                count++;
            }
        }
        return count;
    }

    public int utf8Length(String text) {
        return text == null ? 0 : text.getBytes(StandardCharsets.UTF_8).length;
    }
}
