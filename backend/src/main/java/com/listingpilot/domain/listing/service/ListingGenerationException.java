package com.listingpilot.domain.listing.service;

/**
 * The external text generator failed or returned unusable output.
 */
public class ListingGenerationException extends RuntimeException {

    public ListingGenerationException(String message) {
        super(message);
    }

    public ListingGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
