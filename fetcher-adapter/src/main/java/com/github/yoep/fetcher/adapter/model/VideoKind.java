package com.github.yoep.fetcher.adapter.model;

/**
 * The kind of video which has been identified.
 */
public enum VideoKind {
    MOVIE,
    EPISODE,
    /**
     * The video could not be identified as either a movie or an episode.
     */
    UNKNOWN
}
