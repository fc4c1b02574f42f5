package com.github.yoep.fetcher.tasks;

import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.adapter.model.Video;
import org.apache.commons.lang3.Validate;

import java.util.List;

/**
 * Downloads one subtitle of a video, trying the candidates in order until one succeeds.
 *
 * @param subtitles The candidates of a single video, ranked best first.
 */
public record DownloadTask(List<Subtitle> subtitles) implements Task {
    public DownloadTask {
        Validate.notEmpty(subtitles, "subtitles cannot be empty");
        subtitles = List.copyOf(subtitles);
    }

    /**
     * Get the video the candidates belong to.
     *
     * @return Returns the video of the first candidate.
     */
    public Video video() {
        return subtitles.get(0).getVideo();
    }
}
