package com.github.yoep.fetcher.config.properties;

import com.github.yoep.fetcher.ranking.RankCriterion;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Validated
@ConfigurationProperties("fetcher")
public class FetcherProperties {
    /**
     * The number of workers which execute list and download tasks concurrently.
     */
    @Min(1)
    private int workers = 4;
    /**
     * Download one subtitle per wanted language instead of a single subtitle per video.
     */
    private boolean multi;
    /**
     * Search subtitles even when subtitles already exist next to the video.
     */
    private boolean force;
    /**
     * The maximum depth to recurse into directories, 0 for no limit.
     */
    @Min(0)
    private int maxDepth = 3;
    /**
     * The directory which providers can use to cache data.
     */
    private Path cacheDir;
    /**
     * The octal permissions, such as "644", applied to downloaded subtitle files.
     */
    @Pattern(regexp = "[0-7]{3,4}")
    private String fileMode;
    /**
     * The wanted languages as ISO 639-1 codes, most preferred first.
     * All languages are wanted when empty.
     */
    @NotNull
    private List<String> languages = new ArrayList<>();
    /**
     * The providers to use, most preferred first.
     * All API based providers are used when empty.
     */
    @NotNull
    private List<String> providers = new ArrayList<>();
    /**
     * The criteria used to rank subtitle candidates, most significant first.
     */
    @NotNull
    private List<RankCriterion> sortOrder = new ArrayList<>(List.of(
            RankCriterion.LANGUAGE_INDEX,
            RankCriterion.PROVIDER_INDEX,
            RankCriterion.PROVIDER_CONFIDENCE));

    /**
     * Get the file mode as permission bits.
     *
     * @return Returns the permission bits, or {@link Optional#empty()} when no file mode is configured.
     */
    public Optional<Integer> getFileModeBits() {
        return Optional.ofNullable(fileMode)
                .map(e -> Integer.parseInt(e, 8));
    }
}
