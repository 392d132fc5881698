package com.listingpilot.domain.listing.model;

import java.util.List;

/**
 * Result of a marketplace policy check.
 *
 * @param violations      all violations, in detection order
 * @param status          FAIL on any suppression, WARN on warnings only, PASS otherwise
 * @param suppressionRisk true if at least one SUPPRESSION violation exists
 */
public record PolicyReport(
        List<Violation> violations,
        PolicyStatus status,
        boolean suppressionRisk
) {
    public PolicyReport {
        violations = List.copyOf(violations);
    }

    public static PolicyReport passed() {
        return new PolicyReport(List.of(), PolicyStatus.PASS, false);
    }

    public static PolicyReport of(List<Violation> violations) {
        boolean suppression = violations.stream()
                .anyMatch(v -> v.severity() == Violation.Severity.SUPPRESSION);
        boolean warning = violations.stream()
                .anyMatch(v -> v.severity() == Violation.Severity.WARNING);
        PolicyStatus status = suppression ? PolicyStatus.FAIL : warning ? PolicyStatus.WARN : PolicyStatus.PASS;
        return new PolicyReport(violations, status, suppression);
    }

    public int violationCount() {
        return violations.size();
    }

    public List<Violation> suppressions() {
        return violations.stream().filter(v -> v.severity() == Violation.Severity.SUPPRESSION).toList();
    }

    public List<Violation> warnings() {
        return violations.stream().filter(v -> v.severity() == Violation.Severity.WARNING).toList();
    }
}
