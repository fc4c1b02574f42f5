package com.github.yoep.provider.local;

import com.github.yoep.fetcher.adapter.DownloadFailedException;
import com.github.yoep.fetcher.adapter.ProviderException;
import com.github.yoep.fetcher.adapter.WorkerContext;
import com.github.yoep.fetcher.adapter.model.ProviderConfig;
import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.adapter.model.UnknownVideo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LocalLibraryProviderTest {
    @TempDir
    Path workingDir;

    private Path library;
    private UnknownVideo video;
    private WorkerContext context;

    @BeforeEach
    void setUp() throws IOException {
        library = Files.createDirectories(workingDir.resolve("library"));
        var videos = Files.createDirectories(workingDir.resolve("videos"));
        video = new UnknownVideo(Files.createFile(videos.resolve("Inception.mkv")));
        context = new WorkerContext();
        Files.writeString(library.resolve("Inception.en.srt"), "english");
        Files.writeString(library.resolve("Inception.2010.720p.fr.srt"), "french");
        Files.writeString(library.resolve("Inception.de.srt"), "german");
        Files.writeString(library.resolve("Inception.en.txt"), "notes");
        Files.writeString(library.resolve("Other.en.srt"), "other");
    }

    @Test
    void testList_shouldReturnTheLibrarySubtitlesOfTheVideo() {
        var provider = new LocalLibraryProvider(library, ProviderConfig.builder().build(), context);

        var result = provider.list(video, Set.of("en", "fr"));

        assertEquals(2, result.size());
        var french = result.get(0);
        assertEquals("fr", french.getLanguage());
        assertEquals("Inception.2010.720p", french.getRelease());
        assertEquals(LocalLibraryProvider.PARTIAL_CONFIDENCE, french.getConfidence());
        var english = result.get(1);
        assertEquals("en", english.getLanguage());
        assertEquals(LocalLibraryProvider.EXACT_CONFIDENCE, english.getConfidence());
        assertEquals(LocalLibraryProviderFactory.NAME, english.getProviderName());
        assertEquals(library.resolve("Inception.en.srt").toAbsolutePath().toString(), english.getLink());
        assertEquals(video.getPath().resolveSibling("Inception.srt"), english.getPath().orElse(null));
    }

    @Test
    void testList_whenMulti_shouldTargetALanguageSpecificFile() {
        var provider = new LocalLibraryProvider(library, ProviderConfig.builder().multi(true).build(), context);

        var result = provider.list(video, Set.of("en"));

        assertEquals(1, result.size());
        assertEquals(video.getPath().resolveSibling("Inception.en.srt"), result.get(0).getPath().orElse(null));
    }

    @Test
    void testList_whenInvokedWithTheSameContext_shouldReuseTheIndex() throws IOException {
        var config = ProviderConfig.builder().build();
        new LocalLibraryProvider(library, config, context).list(video, Set.of("en"));
        Files.writeString(library.resolve("Inception.nl.srt"), "dutch");

        var cached = new LocalLibraryProvider(library, config, context).list(video, Set.of("nl"));
        var fresh = new LocalLibraryProvider(library, config, new WorkerContext()).list(video, Set.of("nl"));

        assertTrue(cached.isEmpty());
        assertEquals(1, fresh.size());
    }

    @Test
    void testList_whenLibraryDoesNotExist_shouldThrowProviderException() {
        var provider = new LocalLibraryProvider(workingDir.resolve("missing"), ProviderConfig.builder().build(), context);

        assertThrows(ProviderException.class, () -> provider.list(video, Set.of("en")));
    }

    @Test
    void testDownload_shouldCopyTheLibrarySubtitleNextToTheVideo() throws IOException {
        var provider = new LocalLibraryProvider(library, ProviderConfig.builder().build(), context);
        var subtitle = english(provider);

        var result = provider.download(subtitle);

        assertEquals(subtitle, result);
        assertEquals("english", Files.readString(video.getPath().resolveSibling("Inception.srt")));
    }

    @Test
    void testDownload_whenLibrarySubtitleIsRemoved_shouldThrowDownloadFailedException() throws IOException {
        var provider = new LocalLibraryProvider(library, ProviderConfig.builder().build(), context);
        var subtitle = english(provider);
        Files.delete(library.resolve("Inception.en.srt"));

        assertThrows(DownloadFailedException.class, () -> provider.download(subtitle));
    }

    @Test
    void testDownload_whenSubtitleHasNoTargetPath_shouldThrowProviderException() {
        var provider = new LocalLibraryProvider(library, ProviderConfig.builder().build(), context);
        var subtitle = Subtitle.builder()
                .video(video)
                .providerName(LocalLibraryProviderFactory.NAME)
                .language("en")
                .link(library.resolve("Inception.en.srt").toString())
                .build();

        var ex = assertThrows(ProviderException.class, () -> provider.download(subtitle));

        assertFalse(ex instanceof DownloadFailedException);
    }

    @Test
    void testDownload_whenFileModeIsConfigured_shouldApplyIt() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        var provider = new LocalLibraryProvider(library, ProviderConfig.builder().fileMode(0640).build(), context);

        provider.download(english(provider));

        var permissions = Files.getPosixFilePermissions(video.getPath().resolveSibling("Inception.srt"));
        assertEquals(PosixFilePermissions.fromString("rw-r-----"), permissions);
    }

    private Subtitle english(LocalLibraryProvider provider) {
        List<Subtitle> subtitles = provider.list(video, Set.of("en"));
        assertEquals(1, subtitles.size());
        return subtitles.get(0);
    }
}
