package com.credential.dedupe.provider;

/**
 * Thrown when a plugin is registered under a provider id that is already taken.
 */
public class DuplicateProviderIdException extends RuntimeException {

    private final String providerId;

    public DuplicateProviderIdException(String providerId) {
        super("Provider plugin already registered: " + providerId);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
