package com.github.yoep.fetcher.lifecycle;

import com.github.yoep.fetcher.adapter.FetcherException;

import java.util.Arrays;
import java.util.List;

/**
 * Exception indicating that a lifecycle operation has been invoked in the wrong state.
 */
public class InvalidStateException extends FetcherException {
    private final FetcherState state;
    private final List<FetcherState> expected;

    public InvalidStateException(FetcherState state, FetcherState... expected) {
        super("Fetcher is in an invalid state, state is " + state + " but expected " + Arrays.toString(expected));
        this.state = state;
        this.expected = List.of(expected);
    }

    /**
     * Get the state at the moment of the invalid invocation.
     *
     * @return Returns the actual state.
     */
    public FetcherState getState() {
        return state;
    }

    /**
     * Get the states in which the invocation would have been accepted.
     *
     * @return Returns the expected states.
     */
    public List<FetcherState> getExpected() {
        return expected;
    }
}
