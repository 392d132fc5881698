package com.listingpilot.domain.listing.model;

/**
 * A marketplace policy violation found in a listing.
 *
 * @param rule     machine-readable rule id, e.g. "title_all_caps"
 * @param severity SUPPRESSION risks a listing takedown, WARNING is advisory
 * @param message  human-readable description
 * @param field    listing field the rule applies to: title, content or backend_keywords
 */
public record Violation(
        String rule,
        Severity severity,
        String message,
        String field
) {
    public enum Severity {
        SUPPRESSION,
        WARNING
    }

    public static Violation suppression(String rule, String message, String field) {
        return new Violation(rule, Severity.SUPPRESSION, message, field);
    }

    public static Violation warning(String rule, String message, String field) {
        return new Violation(rule, Severity.WARNING, message, field);
    }
}
