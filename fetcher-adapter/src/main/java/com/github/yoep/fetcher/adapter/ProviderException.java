package com.github.yoep.fetcher.adapter;

import java.util.Optional;

/**
 * Exception indicating that a subtitle provider is unknown or misbehaved while executing a task.
 */
public class ProviderException extends FetcherException {
    private final String providerName;

    public ProviderException(String providerName) {
        super("Subtitle provider " + providerName + " is unknown");
        this.providerName = providerName;
    }

    public ProviderException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    public ProviderException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    /**
     * Get the name of the provider which caused this exception.
     *
     * @return Returns the provider name if known, else {@link Optional#empty()}.
     */
    public Optional<String> getProviderName() {
        return Optional.ofNullable(providerName);
    }
}
