package com.github.yoep.fetcher;

import com.github.yoep.fetcher.adapter.*;
import com.github.yoep.fetcher.adapter.model.Movie;
import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.adapter.model.Video;
import com.github.yoep.fetcher.config.properties.FetcherProperties;
import com.github.yoep.fetcher.lifecycle.FetcherController;
import com.github.yoep.fetcher.lifecycle.FetcherState;
import com.github.yoep.fetcher.lifecycle.InvalidStateException;
import com.github.yoep.fetcher.providers.ProviderRegistry;
import com.github.yoep.fetcher.ranking.MatchingConfidence;
import com.github.yoep.fetcher.ranking.RankCriterion;
import com.github.yoep.fetcher.ranking.RankingEngine;
import com.github.yoep.fetcher.scan.ScanFilter;
import com.github.yoep.fetcher.scan.VideoScanner;
import com.github.yoep.fetcher.worker.ListResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubtitleFetcherTest {
    @Mock
    private SubtitleProviderFactory factoryA;
    @Mock
    private SubtitleProviderFactory factoryB;
    @Mock
    private SubtitleProvider providerA;
    @Mock
    private SubtitleProvider providerB;
    @Mock
    private ReleaseParser releaseParser;
    @TempDir
    Path workingDir;

    private final FetcherProperties properties = new FetcherProperties();
    private final VideoFactory videoFactory = path -> Movie.builder()
            .path(path)
            .title("Inception")
            .build();
    private FetcherController controller;
    private SubtitleFetcher fetcher;
    private Path video;

    @BeforeEach
    void setUp() throws IOException {
        properties.setWorkers(2);
        properties.setLanguages(List.of("en"));
        video = Files.createFile(workingDir.resolve("Inception.mkv"));
        mockFactory(factoryA, providerA, "ProviderA", "en", "fr");
        mockFactory(factoryB, providerB, "ProviderB", "en", "fr");
    }

    @AfterEach
    void tearDown() {
        if (controller != null && controller.getState() == FetcherState.RUNNING) {
            controller.pauseNow();
        }
    }

    @Test
    void testSetLanguages_shouldRemoveDuplicatesKeepingTheFirstOccurrence() {
        createFetcher();

        fetcher.setLanguages(List.of("fr", "en", "fr", "nl"));

        assertEquals(List.of("fr", "en", "nl"), fetcher.getLanguages());
    }

    @Test
    void testSetLanguages_whenLanguageIsUnknown_shouldThrowInvalidLanguageException() {
        createFetcher();

        var ex = assertThrows(InvalidLanguageException.class, () -> fetcher.setLanguages(List.of("fr", "xx")));

        assertEquals("xx", ex.getLanguage());
        assertEquals(List.of("en"), fetcher.getLanguages());
    }

    @Test
    void testSetProviders_whenProviderIsUnknown_shouldThrowProviderException() {
        createFetcher();
        fetcher.setProviders(List.of("ProviderB"));

        assertThrows(ProviderException.class, () -> fetcher.setProviders(List.of("ProviderA", "Unknown")));
        assertEquals(List.of("ProviderB"), fetcher.getProviders());
    }

    @Test
    void testNew_whenCacheDirIsConfigured_shouldCreateIt() {
        var cacheDir = workingDir.resolve("cache").resolve("subtitles");
        properties.setCacheDir(cacheDir);

        createFetcher();

        assertTrue(Files.isDirectory(cacheDir));
        assertEquals(Optional.of(cacheDir), fetcher.getCacheDir());
    }

    @Test
    void testListSubtitles_shouldReturnTheCandidatesOfEveryProvider() {
        var subtitleA = TestVideos.subtitle(movie(), "ProviderA", "en", 0.9);
        var subtitleB = TestVideos.subtitle(movie(), "ProviderB", "en", 0.4);
        when(providerA.list(movie(), Set.of("en"))).thenReturn(List.of(subtitleA));
        when(providerB.list(movie(), Set.of("en"))).thenReturn(List.of(subtitleB));
        createFetcher();

        var result = fetcher.listSubtitles(List.of(video));

        assertEquals(2, result.size());
        assertTrue(result.contains(new ListResult(movie(), List.of(subtitleA))));
        assertTrue(result.contains(new ListResult(movie(), List.of(subtitleB))));
        assertEquals(FetcherState.IDLE, fetcher.getState());
    }

    @Test
    void testListSubtitles_whenSubtitleAlreadyExists_shouldNotListTheVideo() throws IOException {
        Files.createFile(workingDir.resolve("Inception.srt"));
        createFetcher();

        var result = fetcher.listSubtitles(List.of(video));

        assertTrue(result.isEmpty());
        verify(providerA, never()).list(any(), any());
        verify(providerB, never()).list(any(), any());
    }

    @Test
    void testListSubtitles_whenForced_shouldListTheVideoAnyway() throws IOException {
        Files.createFile(workingDir.resolve("Inception.srt"));
        properties.setForce(true);
        properties.setProviders(List.of("ProviderA"));
        when(providerA.list(any(), any())).thenReturn(Collections.emptyList());
        createFetcher();

        var result = fetcher.listSubtitles(List.of(video));

        assertEquals(List.of(new ListResult(movie(), List.of())), result);
    }

    @Test
    void testListSubtitles_shouldOnlyRequestTheLanguagesSupportedByTheProvider() {
        properties.setLanguages(List.of("nl", "en"));
        properties.setProviders(List.of("ProviderA"));
        when(providerA.list(any(), any())).thenReturn(Collections.emptyList());
        createFetcher();

        fetcher.listSubtitles(List.of(video));

        verify(providerA).list(movie(), Set.of("en"));
    }

    @Test
    void testListSubtitles_whenProviderRejectsTheVideo_shouldSkipTheProvider() {
        when(factoryA.isValidVideo(any())).thenReturn(false);
        when(providerB.list(any(), any())).thenReturn(Collections.emptyList());
        createFetcher();

        var result = fetcher.listSubtitles(List.of(video));

        assertEquals(1, result.size());
        verify(providerA, never()).list(any(), any());
    }

    @Test
    void testListSubtitles_whenNoProvidersAreConfigured_shouldOnlyUseApiBasedProviders() {
        when(factoryB.isApiBased()).thenReturn(false);
        when(providerA.list(any(), any())).thenReturn(Collections.emptyList());
        createFetcher();

        fetcher.listSubtitles(List.of(video));

        verify(providerB, never()).list(any(), any());
    }

    @Test
    void testListSubtitles_whenWorkersAreNotIdle_shouldThrowInvalidStateException() {
        createFetcher();
        fetcher.start();

        assertThrows(InvalidStateException.class, () -> fetcher.listSubtitles(List.of(video)));
        assertEquals(FetcherState.RUNNING, fetcher.getState());
    }

    @Test
    void testListSubtitles_whenLifecycleIsManual_shouldKeepTheWorkersRunning() {
        properties.setProviders(List.of("ProviderA"));
        when(providerA.list(any(), any())).thenReturn(Collections.emptyList());
        createFetcher();
        fetcher.start();

        var result = fetcher.listSubtitles(List.of(video), false);

        assertEquals(1, result.size());
        assertEquals(FetcherState.RUNNING, fetcher.getState());
        fetcher.stopAndDrain();
        assertEquals(FetcherState.IDLE, fetcher.getState());
    }

    @Test
    void testClearResults_whenManualCallFailed_shouldDiscardItsResults() throws IOException {
        var broken = Files.createFile(workingDir.resolve("Broken.mkv"));
        var other = Files.createFile(workingDir.resolve("Other.mkv"));
        properties.setProviders(List.of("ProviderA"));
        when(providerA.list(any(), any())).thenReturn(Collections.emptyList());
        createFetcher(path -> {
            if (path.equals(broken)) {
                throw new IllegalStateException("Video cannot be identified");
            }
            return videoFactory.create(path);
        });
        fetcher.start();
        assertThrows(IllegalStateException.class, () -> fetcher.listSubtitles(List.of(video, broken), false));
        fetcher.stopAndDrain();

        fetcher.clearResults();
        fetcher.start();
        var result = fetcher.listSubtitles(List.of(other), false);
        fetcher.stopAndDrain();

        assertEquals(List.of(new ListResult(videoFactory.create(other), List.of())), result);
    }

    @Test
    void testDownloadSubtitles_whenBestCandidateFails_shouldFallbackToTheNextCandidate() {
        var subtitleA = TestVideos.subtitle(movie(), "ProviderA", "en", 0.9);
        var subtitleB = TestVideos.subtitle(movie(), "ProviderB", "en", 0.4);
        var downloaded = subtitleB.toBuilder().path(workingDir.resolve("Inception.srt")).build();
        properties.setSortOrder(List.of(RankCriterion.PROVIDER_CONFIDENCE));
        when(providerA.list(any(), any())).thenReturn(List.of(subtitleA));
        when(providerB.list(any(), any())).thenReturn(List.of(subtitleB));
        when(providerA.download(subtitleA)).thenThrow(new DownloadFailedException("ProviderA", "not found"));
        when(providerB.download(subtitleB)).thenReturn(downloaded);
        createFetcher();

        var result = fetcher.downloadSubtitles(List.of(video));

        assertEquals(List.of(downloaded), result);
        var order = inOrder(providerA, providerB);
        order.verify(providerA).download(subtitleA);
        order.verify(providerB).download(subtitleB);
        assertEquals(FetcherState.IDLE, fetcher.getState());
    }

    @Test
    void testDownloadSubtitles_whenNothingIsListed_shouldReturnEmpty() {
        when(providerA.list(any(), any())).thenReturn(Collections.emptyList());
        when(providerB.list(any(), any())).thenReturn(Collections.emptyList());
        createFetcher();

        var result = fetcher.downloadSubtitles(List.of(video));

        assertTrue(result.isEmpty());
        verify(providerA, never()).download(any());
    }

    @Test
    void testDownloadSubtitles_whenMulti_shouldDownloadTheBestSubtitleOfEveryLanguage() {
        var englishLow = TestVideos.subtitle(movie(), "ProviderA", "en", 0.5);
        var french = TestVideos.subtitle(movie(), "ProviderA", "fr", 0.9);
        var englishHigh = TestVideos.subtitle(movie(), "ProviderA", "en", 0.8);
        properties.setMulti(true);
        properties.setLanguages(List.of("en", "fr"));
        properties.setProviders(List.of("ProviderA"));
        properties.setSortOrder(List.of(RankCriterion.PROVIDER_CONFIDENCE));
        when(providerA.list(any(), any())).thenReturn(List.of(englishLow, french, englishHigh));
        when(providerA.download(any())).thenAnswer(invocation -> invocation.getArgument(0));
        createFetcher();

        var result = fetcher.downloadSubtitles(List.of(video));

        assertEquals(Set.of(englishHigh, french), new HashSet<>(result));
        assertEquals(2, result.size());
        verify(providerA, never()).download(englishLow);
        assertEquals(List.of(RankCriterion.PROVIDER_CONFIDENCE), properties.getSortOrder());
    }

    @Test
    void testRank_shouldUseTheLanguagePreference() {
        createFetcher();
        fetcher.setLanguages(List.of("fr", "en"));
        var english = TestVideos.subtitle(movie(), "ProviderA", "en", 0.9);
        var french = TestVideos.subtitle(movie(), "ProviderA", "fr", 0.1);

        var result = fetcher.rank(List.of(english, french), movie(), List.of(RankCriterion.LANGUAGE_INDEX));

        assertEquals(List.of(french, english), result);
    }

    @Test
    void testGroupByVideo_shouldMergeTheResultsOfTheSameVideo() {
        createFetcher();
        var other = TestVideos.movie("Other");
        var subtitleA = TestVideos.subtitle(movie(), "ProviderA", "en", 0.9);
        var subtitleB = TestVideos.subtitle(movie(), "ProviderB", "en", 0.4);
        var subtitleOther = TestVideos.subtitle(other, "ProviderA", "en", 0.4);

        var result = fetcher.groupByVideo(List.of(
                new ListResult(movie(), List.of(subtitleA)),
                new ListResult(other, List.of(subtitleOther)),
                new ListResult(movie(), List.of(subtitleB))));

        assertEquals(List.of(movie(), other), new ArrayList<>(result.keySet()));
        assertEquals(List.of(subtitleA, subtitleB), result.get(movie()));
    }

    private void createFetcher() {
        createFetcher(videoFactory);
    }

    private void createFetcher(VideoFactory videoFactory) {
        var registry = new ProviderRegistry(List.of(factoryA, factoryB));
        controller = new FetcherController(properties.getWorkers(), registry);
        fetcher = new SubtitleFetcher(properties, controller, registry, videoFactory, new VideoScanner(), new ScanFilter(),
                new RankingEngine(new MatchingConfidence(releaseParser)));
    }

    private Video movie() {
        return videoFactory.create(video);
    }

    private static void mockFactory(SubtitleProviderFactory factory, SubtitleProvider provider, String name, String... languages) {
        lenient().when(factory.getName()).thenReturn(name);
        lenient().when(factory.isApiBased()).thenReturn(true);
        lenient().when(factory.availableLanguages()).thenReturn(Set.of(languages));
        lenient().when(factory.isValidVideo(any())).thenReturn(true);
        lenient().when(factory.create(any(), any())).thenReturn(provider);
        lenient().when(factory.create()).thenReturn(provider);
    }
}
