package com.github.yoep.fetcher.adapter.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A subtitle candidate of a video, as returned by a provider listing.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Subtitle {
    private final Video video;
    private final String providerName;
    /**
     * The ISO 639-1 code of the subtitle language.
     */
    private final String language;
    /**
     * The confidence reported by the provider that this subtitle belongs to the video, in the range [0, 1].
     */
    private final double confidence;
    /**
     * The release name of the subtitle, if the provider knows it.
     */
    private final String release;
    private final Set<String> keywords;
    /**
     * The provider specific link used to download the subtitle.
     */
    private final String link;
    /**
     * The local path the subtitle file is written to when downloaded.
     */
    private final Path path;

    @Builder(toBuilder = true)
    public Subtitle(Video video, String providerName, String language, double confidence, String release,
                    Set<String> keywords, String link, Path path) {
        Objects.requireNonNull(video, "video cannot be null");
        Objects.requireNonNull(providerName, "providerName cannot be null");
        Objects.requireNonNull(language, "language cannot be null");
        Validate.inclusiveBetween(0.0, 1.0, confidence, "confidence must be between 0 and 1, got %s", confidence);
        this.video = video;
        this.providerName = providerName;
        this.language = language;
        this.confidence = confidence;
        this.release = release;
        this.keywords = keywords != null ? Set.copyOf(keywords) : Collections.emptySet();
        this.link = link;
        this.path = path;
    }

    /**
     * Check if the provider gave a release name for this subtitle.
     *
     * @return Returns true when a non-blank release name is known, else false.
     */
    public boolean hasRelease() {
        return StringUtils.isNotBlank(release);
    }

    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }
}
