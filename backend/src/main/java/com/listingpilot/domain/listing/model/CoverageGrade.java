package com.listingpilot.domain.listing.model;

public enum CoverageGrade {
    EXCELLENT,
    GOOD,
    MODERATE,
    LOW;

    public static CoverageGrade of(double pct) {
        if (pct >= 95) {
            return EXCELLENT;
        }
        if (pct >= 85) {
            return GOOD;
        }
        if (pct >= 70) {
            return MODERATE;
        }
        return LOW;
    }
}
