package com.listingpilot.domain.keyword.model;

import java.util.Objects;

/**
 * A researched keyword with its monthly search volume.
 * Negative volumes carry no signal and are stored as 0.
 *
 * @param phrase       the keyword phrase as researched (never null)
 * @param searchVolume monthly search volume, {@code >= 0}
 */
public record Keyword(String phrase, int searchVolume) {
    public Keyword {
        Objects.requireNonNull(phrase, "phrase");
        searchVolume = Math.max(0, searchVolume);
    }

    public static Keyword of(String phrase, int searchVolume) {
        return new Keyword(phrase, searchVolume);
    }
}
