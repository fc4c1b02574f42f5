package com.github.yoep.fetcher.tasks;

import com.github.yoep.fetcher.adapter.model.ProviderConfig;
import com.github.yoep.fetcher.adapter.model.Video;
import lombok.Builder;

import java.util.Objects;
import java.util.Set;

/**
 * Lists the subtitle candidates of a video at a single provider.
 *
 * @param video        The video to list the subtitles of.
 * @param languages    The wanted languages, all supported by the provider.
 * @param providerName The name of the provider to query.
 * @param config       The configuration handed to the provider.
 */
@Builder
public record ListTask(Video video, Set<String> languages, String providerName, ProviderConfig config) implements Task {
    public ListTask {
        Objects.requireNonNull(video, "video cannot be null");
        Objects.requireNonNull(languages, "languages cannot be null");
        Objects.requireNonNull(providerName, "providerName cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        languages = Set.copyOf(languages);
    }
}
