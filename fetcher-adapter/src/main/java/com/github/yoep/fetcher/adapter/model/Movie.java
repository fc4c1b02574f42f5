package com.github.yoep.fetcher.adapter.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

@Getter
@ToString(callSuper = true)
public class Movie extends Video {
    private final String title;
    private final Integer year;

    @Builder
    public Movie(Path path, String title, Integer year, Set<String> keywords) {
        super(path, keywords);
        this.title = title;
        this.year = year;
    }

    public Optional<Integer> getYear() {
        return Optional.ofNullable(year);
    }

    @Override
    public VideoKind getKind() {
        return VideoKind.MOVIE;
    }
}
