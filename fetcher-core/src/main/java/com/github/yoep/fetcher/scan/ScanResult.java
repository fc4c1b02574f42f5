package com.github.yoep.fetcher.scan;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * A video found by the {@link VideoScanner}, with the subtitles already present next to it.
 *
 * @param path              The normalized absolute path of the video.
 * @param languages         The languages of the {@code <video>.<lang>.<ext>} subtitle files.
 * @param hasSingleSubtitle Indicates if a {@code <video>.<ext>} subtitle file without language exists.
 */
public record ScanResult(Path path, Set<String> languages, boolean hasSingleSubtitle) {
    public ScanResult {
        Objects.requireNonNull(path, "path cannot be null");
        languages = languages != null ? Set.copyOf(languages) : Set.of();
    }
}
