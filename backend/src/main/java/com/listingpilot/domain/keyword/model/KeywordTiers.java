package com.listingpilot.domain.keyword.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Keywords sorted by search volume and partitioned into listing placements.
 *
 * @param all         every keyword, sorted by search volume descending
 * @param title       tier 1, placed in the title
 * @param bullets     tier 2, placed in the bullet points
 * @param backend     tier 3, placed in the backend search terms
 * @param description placed in the product description
 */
public record KeywordTiers(
        List<Keyword> all,
        List<Keyword> title,
        List<Keyword> bullets,
        List<Keyword> backend,
        List<Keyword> description
) {
    public KeywordTiers {
        all = List.copyOf(all);
        title = List.copyOf(title);
        bullets = List.copyOf(bullets);
        backend = List.copyOf(backend);
        description = List.copyOf(description);
    }

    /**
     * Backend and description keywords merged, for callers that work with three tiers.
     */
    public List<Keyword> lowPriority() {
        List<Keyword> merged = new ArrayList<>(backend.size() + description.size());
        merged.addAll(backend);
        merged.addAll(description);
        return List.copyOf(merged);
    }
}
