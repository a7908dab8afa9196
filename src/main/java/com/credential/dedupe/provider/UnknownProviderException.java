package com.credential.dedupe.provider;

/**
 * Thrown when a provider id is looked up that no plugin was registered under.
 */
public class UnknownProviderException extends RuntimeException {

    private final String providerId;

    public UnknownProviderException(String providerId) {
        super("No plugin registered for provider: " + providerId);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
