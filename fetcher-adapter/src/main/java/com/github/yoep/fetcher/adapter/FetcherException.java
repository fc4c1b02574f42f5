package com.github.yoep.fetcher.adapter;

/**
 * Exception indicating that an error occurred while listing, ranking or downloading subtitles.
 */
public class FetcherException extends RuntimeException {
    public FetcherException(String message) {
        super(message);
    }

    public FetcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
