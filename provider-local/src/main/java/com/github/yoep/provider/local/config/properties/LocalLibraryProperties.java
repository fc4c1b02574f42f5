package com.github.yoep.provider.local.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.NotNull;
import java.nio.file.Path;

@Data
@Validated
@ConfigurationProperties("fetcher.local")
public class LocalLibraryProperties {
    /**
     * The directory containing the subtitle library.
     * Subtitles are expected to be named {@code <release>.<lang>.srt}.
     */
    @NotNull
    private Path directory;
}
