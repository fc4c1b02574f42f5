package com.github.yoep.fetcher.worker;

import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.adapter.model.Video;

import java.util.List;
import java.util.Objects;

/**
 * The subtitle candidates a single provider returned for a video.
 *
 * @param video     The listed video.
 * @param subtitles The candidates found by the provider.
 */
public record ListResult(Video video, List<Subtitle> subtitles) {
    public ListResult {
        Objects.requireNonNull(video, "video cannot be null");
        subtitles = subtitles != null ? List.copyOf(subtitles) : List.of();
    }
}
