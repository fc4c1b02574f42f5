package com.github.yoep.provider.local;

import com.github.yoep.fetcher.adapter.DownloadFailedException;
import com.github.yoep.fetcher.adapter.ProviderException;
import com.github.yoep.fetcher.adapter.SubtitleProvider;
import com.github.yoep.fetcher.adapter.WorkerContext;
import com.github.yoep.fetcher.adapter.model.ProviderConfig;
import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.adapter.model.Video;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.*;

/**
 * Lists the subtitles of a local library directory whose name starts with the video name.
 * A library file named exactly after the video has full confidence, other matches have half.
 */
@Slf4j
public class LocalLibraryProvider implements SubtitleProvider {
    static final double EXACT_CONFIDENCE = 1.0;
    static final double PARTIAL_CONFIDENCE = 0.5;

    private final Path directory;
    private final ProviderConfig config;
    private final WorkerContext context;

    public LocalLibraryProvider(Path directory, ProviderConfig config, WorkerContext context) {
        Objects.requireNonNull(directory, "directory cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(context, "context cannot be null");
        this.directory = directory;
        this.config = config;
        this.context = context;
    }

    @Override
    public List<Subtitle> list(Video video, Set<String> languages) {
        Objects.requireNonNull(video, "video cannot be null");
        Objects.requireNonNull(languages, "languages cannot be null");
        var videoName = FilenameUtils.getBaseName(video.getPath().getFileName().toString());
        var index = context.computeIfAbsent(LibraryIndex.CONTEXT_KEY, LibraryIndex.class, this::loadIndex);
        var result = new ArrayList<Subtitle>();

        for (var file : index.files()) {
            // <release>.<lang>.srt
            var name = FilenameUtils.getBaseName(file.getFileName().toString());
            var language = FilenameUtils.getExtension(name);
            var release = FilenameUtils.getBaseName(name);

            if (!languages.contains(language) || !StringUtils.startsWithIgnoreCase(release, videoName))
                continue;

            result.add(Subtitle.builder()
                    .video(video)
                    .providerName(LocalLibraryProviderFactory.NAME)
                    .language(language)
                    .confidence(release.equalsIgnoreCase(videoName) ? EXACT_CONFIDENCE : PARTIAL_CONFIDENCE)
                    .release(release)
                    .link(file.toAbsolutePath().toString())
                    .path(targetPath(video, videoName, language))
                    .build());
        }

        log.trace("Found {} library subtitles for {}", result.size(), video.getPath());
        return result;
    }

    @Override
    public Subtitle download(Subtitle subtitle) {
        Objects.requireNonNull(subtitle, "subtitle cannot be null");
        var source = Path.of(subtitle.getLink());
        var target = subtitle.getPath()
                .orElseThrow(() -> new ProviderException(LocalLibraryProviderFactory.NAME, "Subtitle " + subtitle + " has no target path"));

        if (!Files.isRegularFile(source))
            throw new DownloadFailedException(LocalLibraryProviderFactory.NAME, "Library subtitle " + source + " no longer exists");

        try {
            FileUtils.copyFile(source.toFile(), target.toFile());
            config.getFileMode().ifPresent(e -> applyFileMode(target, e));
            log.debug("Copied library subtitle {} to {}", source, target);
            return subtitle;
        } catch (IOException ex) {
            throw new DownloadFailedException(LocalLibraryProviderFactory.NAME, "Failed to copy " + source + " to " + target, ex);
        }
    }

    private LibraryIndex loadIndex() {
        var index = LibraryIndex.load(directory);
        log.debug("Indexed {} subtitles in library {}", index.files().size(), directory);
        return index;
    }

    private Path targetPath(Video video, String videoName, String language) {
        var filename = config.multi()
                ? videoName + "." + language + "." + LibraryIndex.EXTENSION
                : videoName + "." + LibraryIndex.EXTENSION;
        return video.getPath().resolveSibling(filename);
    }

    private static void applyFileMode(Path target, int mode) {
        var permissions = EnumSet.noneOf(PosixFilePermission.class);
        var values = PosixFilePermission.values();

        // OWNER_READ is the most significant bit of the 9 permission bits
        for (int i = 0; i < values.length; i++) {
            if ((mode & (1 << (values.length - 1 - i))) != 0) {
                permissions.add(values[i]);
            }
        }

        try {
            Files.setPosixFilePermissions(target, permissions);
        } catch (UnsupportedOperationException | IOException ex) {
            log.warn("Failed to apply file mode {} to {}, {}", Integer.toOctalString(mode), target, ex.getMessage());
        }
    }
}
