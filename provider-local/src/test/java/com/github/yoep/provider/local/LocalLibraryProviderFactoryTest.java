package com.github.yoep.provider.local;

import com.github.yoep.fetcher.adapter.WorkerContext;
import com.github.yoep.fetcher.adapter.model.ProviderConfig;
import com.github.yoep.fetcher.adapter.model.UnknownVideo;
import com.github.yoep.fetcher.config.properties.FetcherProperties;
import com.github.yoep.provider.local.config.properties.LocalLibraryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LocalLibraryProviderFactoryTest {
    @TempDir
    Path workingDir;

    private final LocalLibraryProperties properties = new LocalLibraryProperties();
    private final FetcherProperties fetcherProperties = new FetcherProperties();
    private LocalLibraryProviderFactory factory;

    @BeforeEach
    void setUp() {
        properties.setDirectory(workingDir);
        factory = new LocalLibraryProviderFactory(properties, fetcherProperties);
    }

    @Test
    void testCapabilities() {
        assertEquals("LocalLibrary", factory.getName());
        assertTrue(factory.isApiBased());
        assertTrue(factory.availableLanguages().containsAll(Set.of("en", "fr", "nl")));
        assertTrue(factory.isValidVideo(new UnknownVideo(workingDir.resolve("Inception.mkv"))));
    }

    @Test
    void testCreate_whenInvokedWithoutConfig_shouldUseTheFetcherProperties() throws IOException {
        fetcherProperties.setMulti(true);
        Files.writeString(workingDir.resolve("Inception.en.srt"), "english");
        var video = new UnknownVideo(workingDir.resolve("videos").resolve("Inception.mkv"));

        var result = factory.create().list(video, Set.of("en"));

        assertEquals(1, result.size());
        assertEquals(video.getPath().resolveSibling("Inception.en.srt"), result.get(0).getPath().orElse(null));
    }

    @Test
    void testCreate_shouldUseTheGivenContext() throws IOException {
        var context = new WorkerContext();

        factory.create(ProviderConfig.builder().build(), context)
                .list(new UnknownVideo(workingDir.resolve("Inception.mkv")), Set.of("en"));

        assertTrue(context.get(LibraryIndex.CONTEXT_KEY, LibraryIndex.class).isPresent());
    }
}
