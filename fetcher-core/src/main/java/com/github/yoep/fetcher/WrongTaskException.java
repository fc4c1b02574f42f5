package com.github.yoep.fetcher;

import com.github.yoep.fetcher.adapter.FetcherException;

/**
 * Exception indicating that a task cannot be submitted to the workers.
 */
public class WrongTaskException extends FetcherException {
    public WrongTaskException(String message) {
        super(message);
    }
}
