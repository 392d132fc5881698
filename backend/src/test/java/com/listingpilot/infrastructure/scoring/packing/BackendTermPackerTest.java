package com.listingpilot.infrastructure.scoring.packing;

import com.listingpilot.domain.keyword.model.Keyword;
import com.listingpilot.infrastructure.scoring.text.KeywordMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BackendTermPackerTest {

    private BackendTermPacker packer;

    @BeforeEach
    void setUp() {
        packer = new BackendTermPacker(new KeywordMatcher());
    }

    private static int bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    @Nested
    @DisplayName("byte budget")
    class ByteBudget {

        @Test
        @DisplayName("single fitting phrase is packed and nothing else fits")
        void single_phrase() {
            String result = packer.pack(List.of(Keyword.of("durable", 10)), "visible text without keyword", 10);

            assertThat(result).isEqualTo("durable");
        }

        @Test
        @DisplayName("zero or negative budget returns an empty string")
        void no_budget() {
            List<Keyword> keywords = List.of(Keyword.of("thermos", 10));

            assertThat(packer.pack(keywords, "", 0)).isEmpty();
            assertThat(packer.pack(keywords, "", -5)).isEmpty();
        }

        @Test
        @DisplayName("separator bytes count toward the budget")
        void separator_counts() {
            List<Keyword> keywords = List.of(Keyword.of("ab", 2), Keyword.of("cd", 1));

            assertThat(packer.pack(keywords, "", 5)).isEqualTo("ab cd");
            assertThat(packer.pack(keywords, "", 4)).isEqualTo("ab");
        }

        @Test
        @DisplayName("multi-byte phrases never exceed the budget")
        void multi_byte() {
            List<Keyword> keywords = List.of(
                    Keyword.of("butelka na wodę dla dzieci", 900),
                    Keyword.of("bidon rowerowy żółty", 800),
                    Keyword.of("kubek termiczny różowy", 700),
                    Keyword.of("Trinkflasche für Kinder auslaufsicher", 600),
                    Keyword.of("gourde isotherme enfant", 500),
                    Keyword.of("źródło wody świeżej", 400));

            for (int max : new int[]{1, 3, 7, 10, 23, 37, 50, 100, 249}) {
                String result = packer.pack(keywords, "", max, "größe, łódź; ÜBERRASCHUNG!");
                assertThat(bytes(result)).as("max %d", max).isLessThanOrEqualTo(max);
            }
        }

        @Test
        @DisplayName("a rejected candidate does not stop later smaller ones")
        void continues_after_rejection() {
            List<Keyword> keywords = List.of(
                    Keyword.of("stainless steel vacuum", 100),
                    Keyword.of("mug", 1));

            assertThat(packer.pack(keywords, "", 5)).isEqualTo("mug");
        }
    }

    @Nested
    @DisplayName("passes")
    class Passes {

        @Test
        @DisplayName("phrases, then roots, then variants in that order")
        void pass_order() {
            List<Keyword> keywords = List.of(
                    Keyword.of("insulated flask", 500),
                    Keyword.of("lid", 100));

            assertThat(packer.pack(keywords, "", 249)).isEqualTo("insulated flask lid flasks");
        }

        @Test
        @DisplayName("fully visible phrases are skipped, their plural is added")
        void visible_phrase_skipped() {
            String result = packer.pack(List.of(Keyword.of("steel bottle", 100)), "Steel Bottle Pro", 249);

            assertThat(result).isEqualTo("bottles");
        }

        @Test
        @DisplayName("partially visible phrase is packed whole")
        void partially_visible() {
            String result = packer.pack(List.of(Keyword.of("steel mug", 100)), "Steel Bottle", 9);

            assertThat(result).isEqualTo("steel mug");
        }

        @Test
        @DisplayName("roots are ranked by cumulative search volume")
        void root_ranking() {
            List<Keyword> keywords = List.of(
                    Keyword.of("camping flask set", 300),
                    Keyword.of("flask gift", 200));

            // no phrase fits in 5 bytes; "flask" (500 cumulative) is tried before "camping" and "set" (300)
            assertThat(packer.pack(keywords, "", 5)).isEqualTo("flask");
        }

        @Test
        @DisplayName("singular of a plural root")
        void singular_variant() {
            assertThat(packer.pack(List.of(Keyword.of("bottles", 10)), "bottles", 249)).isEqualTo("bottle");
        }

        @Test
        @DisplayName("German -e plural: Trinkflasche becomes Trinkflaschen")
        void german_plural() {
            String result = packer.pack(List.of(Keyword.of("trinkflasche", 100)), "Trinkflasche aus Edelstahl", 249);

            assertThat(result).isEqualTo("trinkflaschen");
        }

        @Test
        @DisplayName("skip-list and numeric roots produce no variants")
        void no_variants() {
            String result = packer.pack(List.of(Keyword.of("durable 750ml", 100)), "durable 750ml", 249);

            assertThat(result).isEmpty();
        }

        @Test
        @DisplayName("suggestions are reduced to plain tokens and deduplicated")
        void suggestions() {
            String result = packer.pack(List.of(), "Steel bottle", 249, "Thermos, camping-flask; bottle! thermos");

            assertThat(result).isEqualTo("thermos camping flask");
        }

        @Test
        @DisplayName("blank suggestions are ignored")
        void blank_suggestions() {
            assertThat(packer.pack(List.of(), "", 249, "  ")).isEmpty();
            assertThat(packer.pack(List.of(), "", 249, null)).isEmpty();
        }
    }

    @Test
    @DisplayName("same input gives the same output")
    void idempotent() {
        List<Keyword> keywords = List.of(
                Keyword.of("insulated flask", 500),
                Keyword.of("kubek termiczny", 300),
                Keyword.of("lid", 100));

        String first = packer.pack(keywords, "Steel Bottle", 40, "gourde");
        String second = packer.pack(keywords, "Steel Bottle", 40, "gourde");

        assertThat(first).isEqualTo(second);
    }
}
