package com.github.yoep.fetcher.adapter;

/**
 * Exception indicating that a single subtitle candidate could not be downloaded.
 * The candidate is skipped and the next ranked candidate of the same video is tried.
 */
public class DownloadFailedException extends ProviderException {
    public DownloadFailedException(String providerName, String message) {
        super(providerName, message);
    }

    public DownloadFailedException(String providerName, String message, Throwable cause) {
        super(providerName, message, cause);
    }
}
