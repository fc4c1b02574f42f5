package com.github.yoep.fetcher.adapter;

import com.github.yoep.fetcher.adapter.model.ProviderConfig;
import com.github.yoep.fetcher.adapter.model.Video;

import java.util.Set;

/**
 * Registry entry of a subtitle source.
 * The factory describes the capabilities of the source and creates {@link SubtitleProvider} instances on demand.
 */
public interface SubtitleProviderFactory {
    /**
     * Get the unique name of the provider.
     *
     * @return Returns the provider name.
     */
    String getName();

    /**
     * Check if the provider is API based.
     * API based providers are used by default when no provider preference has been configured.
     *
     * @return Returns true if the provider is API based, else false.
     */
    boolean isApiBased();

    /**
     * Get the languages supported by the provider.
     *
     * @return Returns the ISO 639-1 codes supported by the provider.
     */
    Set<String> availableLanguages();

    /**
     * Check if the provider is able to search subtitles for the given video.
     *
     * @param video The video to verify.
     * @return Returns true if the provider can handle the video, else false.
     */
    boolean isValidVideo(Video video);

    /**
     * Create a new provider instance for listing subtitles.
     *
     * @param config  The provider configuration of the current run.
     * @param context The scratch space of the worker executing the task.
     * @return Returns the new provider instance.
     */
    SubtitleProvider create(ProviderConfig config, WorkerContext context);

    /**
     * Create a new provider instance for downloading subtitles.
     *
     * @return Returns the new provider instance.
     */
    default SubtitleProvider create() {
        return create(ProviderConfig.builder().build(), new WorkerContext());
    }
}
