package com.github.yoep.fetcher.adapter;

import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.adapter.model.Video;

import java.util.List;
import java.util.Set;

/**
 * A subtitle provider instance which is able to list and download subtitles from a single subtitle source.
 * Instances are created by their {@link SubtitleProviderFactory} for the duration of one task.
 */
public interface SubtitleProvider {
    /**
     * List the available subtitle candidates of the given video.
     *
     * @param video     The video to list the subtitles of.
     * @param languages The wanted languages, all of them supported by the provider.
     * @return Returns the subtitle candidates, or an empty list when none are found.
     * @throws ProviderException Is thrown when the provider failed to list the subtitles.
     */
    List<Subtitle> list(Video video, Set<String> languages);

    /**
     * Download the given subtitle candidate.
     *
     * @param subtitle The subtitle candidate to download.
     * @return Returns the downloaded subtitle with its local path populated.
     * @throws DownloadFailedException Is thrown when this candidate could not be fetched.
     * @throws ProviderException       Is thrown when the provider encountered an unrecoverable fault.
     */
    Subtitle download(Subtitle subtitle);
}
