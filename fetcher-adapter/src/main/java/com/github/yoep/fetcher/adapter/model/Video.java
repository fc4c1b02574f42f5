package com.github.yoep.fetcher.adapter.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * A video for which subtitles are searched.
 * Videos are identified by their normalized absolute path.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "path")
public abstract class Video {
    private final Path path;
    /**
     * The keywords inferred from the video path, such as the release group or the video format.
     */
    private final Set<String> keywords;

    protected Video(Path path, Set<String> keywords) {
        Objects.requireNonNull(path, "path cannot be null");
        this.path = path.toAbsolutePath().normalize();
        this.keywords = keywords != null ? Set.copyOf(keywords) : Collections.emptySet();
    }

    /**
     * Get the kind of this video.
     *
     * @return Returns the video kind.
     */
    public abstract VideoKind getKind();
}
