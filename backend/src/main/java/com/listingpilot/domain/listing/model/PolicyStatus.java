package com.listingpilot.domain.listing.model;

public enum PolicyStatus {
    PASS,
    WARN,
    FAIL
}
