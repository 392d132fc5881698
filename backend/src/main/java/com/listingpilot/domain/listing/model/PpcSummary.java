package com.listingpilot.domain.listing.model;

public record PpcSummary(
        int exactCount,
        int phraseCount,
        int broadCount,
        int negativeCount,
        double estimatedDailyBudgetUsd
) {}
