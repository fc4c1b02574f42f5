package com.github.yoep.fetcher.adapter.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Set;

@Getter
@ToString(callSuper = true)
public class Episode extends Video {
    private final String series;
    private final int season;
    private final int episode;

    @Builder
    public Episode(Path path, String series, int season, int episode, Set<String> keywords) {
        super(path, keywords);
        this.series = series;
        this.season = season;
        this.episode = episode;
    }

    @Override
    public VideoKind getKind() {
        return VideoKind.EPISODE;
    }
}
