package com.github.yoep.fetcher.adapter.model;

import lombok.ToString;

import java.nio.file.Path;
import java.util.Set;

/**
 * A video which could not be identified.
 * Providers can still search subtitles for it by file hash or name.
 */
@ToString(callSuper = true)
public class UnknownVideo extends Video {
    public UnknownVideo(Path path) {
        super(path, Set.of());
    }

    public UnknownVideo(Path path, Set<String> keywords) {
        super(path, keywords);
    }

    @Override
    public VideoKind getKind() {
        return VideoKind.UNKNOWN;
    }
}
