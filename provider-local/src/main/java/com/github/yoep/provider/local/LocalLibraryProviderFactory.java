package com.github.yoep.provider.local;

import com.github.yoep.fetcher.Languages;
import com.github.yoep.fetcher.adapter.SubtitleProvider;
import com.github.yoep.fetcher.adapter.SubtitleProviderFactory;
import com.github.yoep.fetcher.adapter.WorkerContext;
import com.github.yoep.fetcher.adapter.model.ProviderConfig;
import com.github.yoep.fetcher.adapter.model.Video;
import com.github.yoep.fetcher.config.properties.FetcherProperties;
import com.github.yoep.provider.local.config.properties.LocalLibraryProperties;
import lombok.RequiredArgsConstructor;

import java.util.Set;

@RequiredArgsConstructor
public class LocalLibraryProviderFactory implements SubtitleProviderFactory {
    public static final String NAME = "LocalLibrary";

    private final LocalLibraryProperties properties;
    private final FetcherProperties fetcherProperties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isApiBased() {
        return true;
    }

    @Override
    public Set<String> availableLanguages() {
        return Languages.ISO_639_1;
    }

    @Override
    public boolean isValidVideo(Video video) {
        return video.getPath().getFileName() != null;
    }

    @Override
    public SubtitleProvider create(ProviderConfig config, WorkerContext context) {
        return new LocalLibraryProvider(properties.getDirectory(), config, context);
    }

    @Override
    public SubtitleProvider create() {
        return create(ProviderConfig.builder()
                .multi(fetcherProperties.isMulti())
                .fileMode(fetcherProperties.getFileModeBits().orElse(null))
                .build(), new WorkerContext());
    }
}
