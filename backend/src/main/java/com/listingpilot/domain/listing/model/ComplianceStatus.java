package com.listingpilot.domain.listing.model;

public enum ComplianceStatus {
    PASS,
    WARN,
    FAIL
}
