package com.github.yoep.fetcher.lifecycle;

/**
 * The state of the worker pool lifecycle.
 */
public enum FetcherState {
    /**
     * No workers are alive.
     */
    IDLE,
    /**
     * The workers are alive and processing tasks.
     */
    RUNNING,
    /**
     * The workers have been interrupted while tasks were still queued.
     * The queued tasks are processed once the workers are started again.
     */
    PAUSED
}
