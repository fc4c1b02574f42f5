package com.github.yoep.fetcher.scan;

import com.github.yoep.fetcher.Languages;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Resolves file and directory entries to the videos they contain, and detects the subtitles already next to them.
 */
@Slf4j
public class VideoScanner {
    public static final Set<String> VIDEO_EXTENSIONS = Set.of(
            "3g2", "3gp", "3gp2", "asf", "avi", "divx", "flv", "m4v", "mk2", "mka", "mkv", "mov", "mp4", "mp4a",
            "mpeg", "mpg", "ogg", "ogm", "ogv", "qt", "ra", "ram", "rm", "ts", "wav", "webm", "wma", "wmv");
    public static final Set<String> SUBTITLE_EXTENSIONS = Set.of("srt", "sub", "smi", "txt", "ssa", "ass", "mpl");

    /**
     * Scan the given entry.
     * A file entry is always trusted to be a video, files found while recursing into directories must have a
     * video extension. An entry which doesn't exist is returned as is, so it can still be searched by name.
     *
     * @param entry    The file or directory to scan.
     * @param maxDepth The maximum directory depth to recurse into, 0 for no limit.
     * @return Returns the videos found for the entry.
     */
    public List<ScanResult> scan(Path entry, int maxDepth) {
        Objects.requireNonNull(entry, "entry cannot be null");
        var path = entry.toAbsolutePath().normalize();

        if (Files.notExists(path)) {
            log.debug("Entry {} doesn't exist, searching by name only", path);
            return List.of(new ScanResult(path, Set.of(), false));
        }

        var result = new ArrayList<ScanResult>();
        scan(path, 0, maxDepth, result);
        return result;
    }

    private void scan(Path path, int depth, int maxDepth, List<ScanResult> result) {
        if (depth > maxDepth && maxDepth != 0)
            return;

        if (Files.isRegularFile(path)) {
            if (depth == 0 || isVideo(path)) {
                result.add(detectSubtitles(path));
            }
        } else if (Files.isDirectory(path)) {
            try (Stream<Path> children = Files.list(path)) {
                children.sorted()
                        .forEach(e -> scan(e, depth + 1, maxDepth, result));
            } catch (IOException ex) {
                log.warn("Failed to scan directory {}, {}", path, ex.getMessage(), ex);
            }
        }
    }

    private ScanResult detectSubtitles(Path video) {
        var baseName = FilenameUtils.getBaseName(video.getFileName().toString());
        var prefix = baseName + ".";
        var languages = new HashSet<String>();
        var hasSingle = false;

        try (Stream<Path> siblings = Files.list(video.getParent())) {
            var names = siblings
                    .map(e -> e.getFileName().toString())
                    .filter(e -> e.startsWith(prefix))
                    .map(e -> e.substring(prefix.length()))
                    .toList();

            for (var name : names) {
                // either "<ext>" or "<lang>.<ext>"
                var label = StringUtils.substringBeforeLast(name, ".");
                var extension = name.equals(label) ? name : StringUtils.substringAfterLast(name, ".");
                if (!SUBTITLE_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT)))
                    continue;

                if (name.equals(label)) {
                    hasSingle = true;
                } else if (Languages.isValid(label)) {
                    languages.add(label);
                }
            }
        } catch (IOException ex) {
            log.warn("Failed to detect the existing subtitles of {}, {}", video, ex.getMessage(), ex);
        }

        log.trace("Detected subtitles {} (single: {}) for {}", languages, hasSingle, video);
        return new ScanResult(video, languages, hasSingle);
    }

    private static boolean isVideo(Path path) {
        var extension = FilenameUtils.getExtension(path.getFileName().toString());
        return VIDEO_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }
}
