package com.github.yoep.fetcher.adapter.model;

import lombok.Builder;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The configuration handed to providers when they're created for a listing task.
 *
 * @param multi    Indicates if one subtitle per language is wanted instead of a single subtitle.
 * @param cacheDir The directory providers can use to cache data, if any.
 * @param fileMode The permission bits, such as {@code 0644}, to apply to downloaded subtitle files, if any.
 */
@Builder
public record ProviderConfig(boolean multi, Path cacheDir, Integer fileMode) {
    public Optional<Path> getCacheDir() {
        return Optional.ofNullable(cacheDir);
    }

    public Optional<Integer> getFileMode() {
        return Optional.ofNullable(fileMode);
    }
}
