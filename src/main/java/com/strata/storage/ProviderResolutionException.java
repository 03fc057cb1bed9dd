package com.strata.storage;

/**
 * Thrown when no storage provider can be found for a tier, technology or table.
 */
public class ProviderResolutionException extends RuntimeException {
    
    public ProviderResolutionException(String message) {
        super(message);
    }
}
