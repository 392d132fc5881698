package com.listingpilot.infrastructure.scoring.text;

import com.listingpilot.domain.keyword.model.Keyword;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordMatcherTest {

    private KeywordMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new KeywordMatcher();
    }

    @Nested
    @DisplayName("extractWords")
    class ExtractWords {

        @Test
        @DisplayName("lowercases and keeps letters, digits and diacritics")
        void unicode_words() {
            assertThat(matcher.extractWords("Steel Bottle, 750ml ÄPFEL żółw!"))
                    .containsExactlyInAnyOrder("steel", "bottle", "750ml", "äpfel", "żółw");
        }

        @Test
        @DisplayName("duplicates collapse into one entry")
        void unique_words() {
            assertThat(matcher.extractWords("bottle Bottle BOTTLE")).containsExactly("bottle");
        }

        @Test
        @DisplayName("null and empty text yield an empty set")
        void null_and_empty() {
            assertThat(matcher.extractWords(null)).isEmpty();
            assertThat(matcher.extractWords("")).isEmpty();
            assertThat(matcher.extractWords(" -- ")).isEmpty();
        }
    }

    @Nested
    @DisplayName("phraseCovered")
    class PhraseCovered {

        @Test
        @DisplayName("single word requires exact presence, not a substring")
        void single_word_is_not_a_substring() {
            Set<String> words = matcher.extractWords("coffee capsule");
            assertThat(matcher.phraseCovered("cap", words)).isFalse();
            assertThat(matcher.phraseCovered("capsule", words)).isTrue();
        }

        @Test
        @DisplayName("three-word phrase needs all three words (2/3 is below 70%)")
        void three_words_need_all() {
            Set<String> words = matcher.extractWords("steel bottle");
            assertThat(matcher.phraseCovered("steel water bottle", words)).isFalse();
        }

        @Test
        @DisplayName("four-word phrase is covered with three words present")
        void four_words_need_three() {
            Set<String> words = matcher.extractWords("stainless steel bottle");
            assertThat(matcher.phraseCovered("stainless steel water bottle", words)).isTrue();
        }

        @Test
        @DisplayName("matching ignores case and surrounding whitespace")
        void case_insensitive() {
            Set<String> words = matcher.extractWords("Steel Bottle Pro");
            assertThat(matcher.phraseCovered("  STEEL   bottle ", words)).isTrue();
        }

        @Test
        @DisplayName("non-breaking and other Unicode spaces separate words")
        void unicode_spaces() {
            Set<String> words = matcher.extractWords("Steel Bottle Pro");

            assertThat(matcher.phraseWords("\u00A0steel\u00A0bottle\u2009pro\u00A0"))
                    .containsExactly("steel", "bottle", "pro");
            assertThat(matcher.phraseCovered("steel\u00A0bottle", words)).isTrue();
        }

        @Test
        @DisplayName("blank phrase is never covered")
        void blank_phrase() {
            assertThat(matcher.phraseCovered(" ", Set.of("steel"))).isFalse();
        }
    }

    @Nested
    @DisplayName("exactPhraseMatch")
    class ExactPhraseMatch {

        @Test
        @DisplayName("phrase bounded by non-word characters matches")
        void bounded_match() {
            assertThat(matcher.exactPhraseMatch("steel bottle", "Great Steel Bottle!")).isTrue();
        }

        @Test
        @DisplayName("phrase inside a longer word does not match")
        void inside_word() {
            assertThat(matcher.exactPhraseMatch("cap", "coffee capsule")).isFalse();
            assertThat(matcher.exactPhraseMatch("bottle", "two bottles")).isFalse();
        }

        @Test
        @DisplayName("words must be contiguous")
        void contiguous() {
            assertThat(matcher.exactPhraseMatch("steel bottle", "steel water bottle")).isFalse();
        }

        @Test
        @DisplayName("phrases starting with a symbol still match")
        void symbol_phrase() {
            assertThat(matcher.exactPhraseMatch("#1", "the #1 choice")).isTrue();
        }

        @Test
        @DisplayName("null or blank inputs never match")
        void null_inputs() {
            assertThat(matcher.exactPhraseMatch(null, "text")).isFalse();
            assertThat(matcher.exactPhraseMatch("text", null)).isFalse();
            assertThat(matcher.exactPhraseMatch(" ", "text")).isFalse();
        }
    }

    @Test
    @DisplayName("countExactMatches counts each keyword once")
    void count_exact_matches() {
        List<Keyword> keywords = List.of(
                Keyword.of("steel bottle", 100),
                Keyword.of("leak proof", 50),
                Keyword.of("thermos", 10));

        assertThat(matcher.countExactMatches(keywords, "Steel Bottle - leak proof, steel bottle")).isEqualTo(2);
    }

    @Test
    @DisplayName("utf8Length counts multi-byte characters")
    void utf8_length() {
        assertThat(matcher.utf8Length("żółw")).isEqualTo(7);
        assertThat(matcher.utf8Length("abc")).isEqualTo(3);
        assertThat(matcher.utf8Length(null)).isZero();
    }
}
