package com.listingpilot.domain.listing.model;

import java.util.List;

/**
 * A drafted listing as produced by the text generator and consumed read-only by the scorers.
 * Missing text fields are treated as empty.
 *
 * @param title        product title
 * @param bullets      bullet points in display order
 * @param description  product description
 * @param backendTerms backend search terms, space separated
 */
public record ListingDraft(
        String title,
        List<String> bullets,
        String description,
        String backendTerms
) {
    public ListingDraft {
        title = title == null ? "" : title;
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
        description = description == null ? "" : description;
        backendTerms = backendTerms == null ? "" : backendTerms;
    }

    public String bulletsText() {
        return String.join(" ", bullets);
    }

    /**
     * Title, bullets and description: the text a shopper can see.
     */
    public String visibleText() {
        return title + " " + bulletsText() + " " + description;
    }

    public String fullText() {
        return visibleText() + " " + backendTerms;
    }

    public ListingDraft withBackendTerms(String terms) {
        return new ListingDraft(title, bullets, description, terms);
    }
}
