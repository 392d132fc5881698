package com.listingpilot.domain.listing.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Basic marketplace-limit compliance of a listing.
 *
 * @param status   FAIL if there are errors, WARN if only warnings, PASS otherwise
 * @param errors   hard rule breaks
 * @param warnings advisory findings
 */
public record ComplianceResult(
        ComplianceStatus status,
        List<String> errors,
        List<String> warnings
) {
    public ComplianceResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ComplianceResult of(List<String> errors, List<String> warnings) {
        ComplianceStatus status = !errors.isEmpty() ? ComplianceStatus.FAIL
                : !warnings.isEmpty() ? ComplianceStatus.WARN : ComplianceStatus.PASS;
        return new ComplianceResult(status, errors, warnings);
    }

    /**
     * Appends further warnings; a PASS result becomes WARN.
     */
    public ComplianceResult withWarnings(List<String> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extra);
        ComplianceStatus mergedStatus = status == ComplianceStatus.PASS ? ComplianceStatus.WARN : status;
        return new ComplianceResult(mergedStatus, errors, merged);
    }

    public int errorCount() {
        return errors.size();
    }

    public int warningCount() {
        return warnings.size();
    }
}
