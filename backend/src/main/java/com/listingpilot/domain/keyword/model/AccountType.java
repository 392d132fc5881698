package com.listingpilot.domain.keyword.model;

/**
 * Marketplace account type. Vendors get more bullets and wider keyword ranges.
 */
public enum AccountType {
    SELLER,
    VENDOR;

    /**
     * Resolves a free-form account type; anything other than "vendor" is a seller.
     */
    public static AccountType from(String value) {
        return value != null && value.trim().equalsIgnoreCase("vendor") ? VENDOR : SELLER;
    }
}
