package com.github.yoep.fetcher;

import com.github.yoep.fetcher.adapter.FetcherException;

/**
 * Exception indicating that a language code is not a known ISO 639-1 code.
 */
public class InvalidLanguageException extends FetcherException {
    private final String language;

    public InvalidLanguageException(String language) {
        super("Language " + language + " is not a valid ISO 639-1 code");
        this.language = language;
    }

    /**
     * Get the invalid language code.
     *
     * @return Returns the invalid language code.
     */
    public String getLanguage() {
        return language;
    }
}
