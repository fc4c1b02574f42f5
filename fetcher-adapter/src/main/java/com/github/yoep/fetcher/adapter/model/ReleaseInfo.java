package com.github.yoep.fetcher.adapter.model;

import lombok.Builder;

import java.util.Set;

/**
 * The metadata inferred from a subtitle release name.
 *
 * @param kind     The kind of video the release name describes.
 * @param title    The movie title, if any.
 * @param year     The movie year, if any.
 * @param series   The series name, if any.
 * @param season   The season number, if any.
 * @param episode  The episode number, if any.
 * @param keywords The keywords found in the release name, such as the release group or the video format.
 */
@Builder
public record ReleaseInfo(VideoKind kind, String title, Integer year, String series, Integer season, Integer episode,
                          Set<String> keywords) {
    private static final ReleaseInfo UNKNOWN = new ReleaseInfo(VideoKind.UNKNOWN, null, null, null, null, null, Set.of());

    public ReleaseInfo {
        kind = kind != null ? kind : VideoKind.UNKNOWN;
        keywords = keywords != null ? Set.copyOf(keywords) : Set.of();
    }

    /**
     * Get the release info of a release name from which nothing could be inferred.
     *
     * @return Returns the unknown release info.
     */
    public static ReleaseInfo unknown() {
        return UNKNOWN;
    }
}
