package com.github.yoep.fetcher.adapter;

import com.github.yoep.fetcher.adapter.model.Video;

import java.nio.file.Path;

/**
 * Identifies the video behind a file path, deciding whether it's a movie or an episode
 * and inferring its metadata and keywords.
 */
public interface VideoFactory {
    /**
     * Create the video for the given path.
     * The path doesn't need to exist, in which case only its name is used.
     *
     * @param path The normalized absolute path of the video.
     * @return Returns the identified video.
     */
    Video create(Path path);
}
