package com.listingpilot.infrastructure.scoring.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class AntiStuffingCheckerTest {

    private AntiStuffingChecker checker;

    @BeforeEach
    void setUp() {
        checker = new AntiStuffingChecker();
    }

    /** Forty distinct letter-only filler words, none of them stop words. */
    private static String filler() {
        return filler(40);
    }

    private static String filler(int words) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words; i++) {
            sb.append('x').append((char) ('a' + i / 26)).append((char) ('a' + i % 26)).append(' ');
        }
        return sb.toString();
    }

    @Nested
    @DisplayName("density")
    class Density {

        @Test
        @DisplayName("words at or below 3% pass")
        void below_limit() {
            assertThat(checker.checkDensity(filler() + "bottle")).isEmpty();
        }

        @Test
        @DisplayName("word above 3% is flagged with count and density")
        void above_limit() {
            List<String> warnings = checker.checkDensity(filler() + "bottle bottle");

            assertThat(warnings).containsExactly(
                    "Keyword stuffing: 'bottle' appears 2x (4.8% density, max 3.0%)");
        }

        @Test
        @DisplayName("a density exactly halfway rounds to the even digit")
        void halfway_density() {
            List<String> warnings = checker.checkDensity(filler(75) + "bottle bottle bottle bottle bottle");

            assertThat(warnings).containsExactly(
                    "Keyword stuffing: 'bottle' appears 5x (6.2% density, max 3.0%)");
        }

        @Test
        @DisplayName("empty text has no warnings")
        void empty() {
            assertThat(checker.checkDensity("")).isEmpty();
        }
    }

    @Test
    @DisplayName("stop words and one-letter tokens are not counted")
    void word_counts() {
        assertThat(checker.wordCounts("The bottle and the lid, a b c"))
                .containsExactly(
                        entry("bottle", 1),
                        entry("lid", 1));
        assertThat(checker.wordCounts("die Flasche für den Sport"))
                .containsOnlyKeys("flasche", "sport");
    }

    @Nested
    @DisplayName("repetition")
    class Repetition {

        @Test
        @DisplayName("density warnings come before title repetition")
        void title_repetition() {
            List<String> warnings = checker.check("bottle bottle bottle", List.of(), "");

            assertThat(warnings).containsExactly(
                    "Keyword stuffing: 'bottle' appears 3x (100.0% density, max 3.0%)",
                    "Title repetition: 'bottle' appears 3x (max 2x in title)");
        }

        @Test
        @DisplayName("more than 3 uses across title and bullets is flagged")
        void listing_repetition() {
            List<String> warnings = checker.check("steel bottle",
                    List.of("bottle lid", "bottle cap", "bottle"), "");

            assertThat(warnings).contains("Listing repetition: 'bottle' appears 4x (max 3x in listing)");
            assertThat(warnings).noneMatch(w -> w.startsWith("Title repetition"));
        }

        @Test
        @DisplayName("description counts toward density but not repetition")
        void description_excluded_from_repetition() {
            List<String> warnings = checker.check(filler(), List.of(), "bottle bottle bottle bottle");

            assertThat(warnings).anyMatch(w -> w.startsWith("Keyword stuffing: 'bottle'"));
            assertThat(warnings).noneMatch(w -> w.contains("repetition"));
        }
    }

    @Test
    @DisplayName("null fields are treated as empty")
    void null_fields() {
        assertThat(checker.check(null, null, null)).isEmpty();
    }
}
