package com.github.yoep.fetcher;

import com.github.yoep.fetcher.adapter.ProviderException;
import com.github.yoep.fetcher.adapter.VideoFactory;
import com.github.yoep.fetcher.adapter.model.ProviderConfig;
import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.adapter.model.Video;
import com.github.yoep.fetcher.config.properties.FetcherProperties;
import com.github.yoep.fetcher.lifecycle.FetcherController;
import com.github.yoep.fetcher.lifecycle.FetcherState;
import com.github.yoep.fetcher.lifecycle.InvalidStateException;
import com.github.yoep.fetcher.providers.ProviderRegistry;
import com.github.yoep.fetcher.ranking.RankCriterion;
import com.github.yoep.fetcher.ranking.RankPreferences;
import com.github.yoep.fetcher.ranking.RankingEngine;
import com.github.yoep.fetcher.scan.ScanFilter;
import com.github.yoep.fetcher.scan.ScanResult;
import com.github.yoep.fetcher.scan.VideoScanner;
import com.github.yoep.fetcher.tasks.DownloadTask;
import com.github.yoep.fetcher.tasks.ListTask;
import com.github.yoep.fetcher.tasks.Task;
import com.github.yoep.fetcher.worker.ListResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Supplier;

/**
 * Lists and downloads the subtitles of videos across the configured providers.
 * <p>
 * Listing creates one list task per video and provider, downloading ranks the listed candidates and creates one
 * download task per video, or per video and language in multi mode. The tasks are executed by the workers of the
 * {@link FetcherController}, which are started and stopped around each call unless the lifecycle is managed
 * manually.
 */
@Slf4j
public class SubtitleFetcher {
    private final FetcherProperties properties;
    private final FetcherController controller;
    private final ProviderRegistry registry;
    private final VideoFactory videoFactory;
    private final VideoScanner videoScanner;
    private final ScanFilter scanFilter;
    private final RankingEngine rankingEngine;

    private List<String> languages = Collections.emptyList();
    private List<String> providers = Collections.emptyList();
    private Path cacheDir;

    public SubtitleFetcher(FetcherProperties properties,
                           FetcherController controller,
                           ProviderRegistry registry,
                           VideoFactory videoFactory,
                           VideoScanner videoScanner,
                           ScanFilter scanFilter,
                           RankingEngine rankingEngine) {
        Objects.requireNonNull(properties, "properties cannot be null");
        Objects.requireNonNull(controller, "controller cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(videoFactory, "videoFactory cannot be null");
        Objects.requireNonNull(videoScanner, "videoScanner cannot be null");
        Objects.requireNonNull(scanFilter, "scanFilter cannot be null");
        Objects.requireNonNull(rankingEngine, "rankingEngine cannot be null");
        this.properties = properties;
        this.controller = controller;
        this.registry = registry;
        this.videoFactory = videoFactory;
        this.videoScanner = videoScanner;
        this.scanFilter = scanFilter;
        this.rankingEngine = rankingEngine;
        init();
    }

    //region Properties

    /**
     * Get the wanted languages, most preferred first.
     *
     * @return Returns the wanted languages, an empty list means every language is wanted.
     */
    public List<String> getLanguages() {
        return languages;
    }

    /**
     * Set the wanted languages, most preferred first.
     * Duplicates are removed, keeping the first occurrence.
     *
     * @param languages The ISO 639-1 codes of the wanted languages.
     * @throws InvalidLanguageException Is thrown when one of the codes is unknown, the languages are left untouched.
     */
    public void setLanguages(Collection<String> languages) {
        Objects.requireNonNull(languages, "languages cannot be null");
        log.debug("Setting languages to {}", languages);
        var result = new LinkedHashSet<String>();

        for (var language : languages) {
            if (!Languages.isValid(language))
                throw new InvalidLanguageException(language);

            result.add(language);
        }

        this.languages = List.copyOf(result);
    }

    /**
     * Get the providers to use, most preferred first.
     *
     * @return Returns the provider names.
     */
    public List<String> getProviders() {
        return providers;
    }

    /**
     * Set the providers to use, most preferred first.
     * Duplicates are removed, keeping the first occurrence.
     *
     * @param providers The names of the providers.
     * @throws ProviderException Is thrown when one of the providers is unknown, the providers are left untouched.
     */
    public void setProviders(Collection<String> providers) {
        Objects.requireNonNull(providers, "providers cannot be null");
        log.debug("Setting providers to {}", providers);
        var result = new LinkedHashSet<String>();

        for (var provider : providers) {
            if (!registry.contains(provider))
                throw new ProviderException(provider);

            result.add(provider);
        }

        this.providers = List.copyOf(result);
    }

    /**
     * Get the cache directory handed to the providers.
     *
     * @return Returns the cache directory, or {@link Optional#empty()} when none is configured or it's unusable.
     */
    public Optional<Path> getCacheDir() {
        return Optional.ofNullable(cacheDir);
    }

    public FetcherState getState() {
        return controller.getState();
    }

    //endregion

    //region Methods

    /**
     * List the subtitles of the given entries while managing the workers automatically.
     *
     * @param entries The video files or directories containing videos.
     * @return Returns the candidates found per video and provider.
     * @see #listSubtitles(Collection, boolean)
     */
    public List<ListResult> listSubtitles(Collection<Path> entries) {
        return listSubtitles(entries, true);
    }

    /**
     * List the subtitles of the given entries.
     * Videos for which subtitles already exist are skipped, unless forced.
     * When {@code auto} is false the workers must have been started through {@link #start()}.
     * If a manual call fails after submitting tasks, the results of those tasks stay behind; stop the workers and
     * invoke {@link #clearResults()} before the next manual call.
     *
     * @param entries The video files or directories containing videos.
     * @param auto    Indicates if the workers should be started and stopped by this call.
     * @return Returns the candidates found per video and provider.
     * @throws InvalidStateException Is thrown when {@code auto} is set and the workers are not idle.
     */
    public List<ListResult> listSubtitles(Collection<Path> entries, boolean auto) {
        Objects.requireNonNull(entries, "entries cannot be null");
        return withWorkers(auto, () -> {
            var taskCount = submitListTasks(entries);
            return controller.awaitListResults(taskCount);
        });
    }

    /**
     * Download the best subtitles of the given entries while managing the workers automatically.
     *
     * @param entries The video files or directories containing videos.
     * @return Returns the downloaded subtitles.
     * @see #downloadSubtitles(Collection, boolean)
     */
    public List<Subtitle> downloadSubtitles(Collection<Path> entries) {
        return downloadSubtitles(entries, true);
    }

    /**
     * Download the best subtitles of the given entries.
     * The candidates of each video are ranked and tried in order until one has been downloaded.
     * Videos for which no candidate could be downloaded are absent from the result.
     * A failed manual call leaves its results behind, see {@link #listSubtitles(Collection, boolean)}.
     *
     * @param entries The video files or directories containing videos.
     * @param auto    Indicates if the workers should be started and stopped by this call.
     * @return Returns the downloaded subtitles.
     * @throws InvalidStateException Is thrown when {@code auto} is set and the workers are not idle.
     */
    public List<Subtitle> downloadSubtitles(Collection<Path> entries, boolean auto) {
        Objects.requireNonNull(entries, "entries cannot be null");
        return withWorkers(auto, () -> {
            var byVideo = groupByVideo(listSubtitles(entries, false));
            var criteria = sortOrder();
            var taskCount = 0;

            for (var entry : byVideo.entrySet()) {
                var video = entry.getKey();
                if (entry.getValue().isEmpty()) {
                    log.debug("No subtitles found for {}, nothing to download", video.getPath());
                    continue;
                }

                var ranked = rank(entry.getValue(), video, criteria);

                if (!properties.isMulti()) {
                    controller.submit(new DownloadTask(ranked));
                    taskCount++;
                    continue;
                }

                for (var byLanguage : groupByLanguage(ranked)) {
                    controller.submit(new DownloadTask(byLanguage));
                    taskCount++;
                }
            }

            return controller.awaitDownloadResults(taskCount);
        });
    }

    /**
     * Rank the candidates of a video against the current language and provider preferences.
     *
     * @param subtitles The candidates of the video.
     * @param video     The video.
     * @param criteria  The rank criteria, most significant first.
     * @return Returns the candidates ordered best first.
     */
    public List<Subtitle> rank(List<Subtitle> subtitles, Video video, List<RankCriterion> criteria) {
        return rankingEngine.rank(subtitles, video, criteria, RankPreferences.builder()
                .languages(languages)
                .providers(effectiveProviders())
                .build());
    }

    /**
     * Merge the listing results of the different providers per video.
     *
     * @param results The listing results.
     * @return Returns the candidates per video, in listing order.
     */
    public Map<Video, List<Subtitle>> groupByVideo(List<ListResult> results) {
        Objects.requireNonNull(results, "results cannot be null");
        var grouped = new LinkedHashMap<Video, List<Subtitle>>();

        for (var result : results) {
            grouped.computeIfAbsent(result.video(), e -> new ArrayList<>())
                    .addAll(result.subtitles());
        }

        return grouped;
    }

    /**
     * Submit a list or download task to the workers.
     *
     * @param task The task to submit.
     */
    public void submit(Task task) {
        controller.submit(task);
    }

    public void start() {
        controller.start();
    }

    public void stopAndDrain() {
        controller.stopAndDrain();
    }

    public void pauseNow() {
        controller.pauseNow();
    }

    /**
     * Discard the task results which have not been collected.
     * Invoke this while the workers are stopped, after a manual call has failed.
     */
    public void clearResults() {
        controller.clearResults();
    }

    //endregion

    //region Functions

    private void init() {
        setLanguages(properties.getLanguages());
        setProviders(properties.getProviders());
        initializeCacheDir();
    }

    private void initializeCacheDir() {
        var directory = properties.getCacheDir();
        if (directory == null)
            return;

        try {
            FileUtils.forceMkdir(directory.toFile());
            cacheDir = directory.toAbsolutePath().normalize();
            log.debug("Using cache directory {}", cacheDir);
        } catch (IOException ex) {
            log.warn("Failed to use the cache directory {}, continuing without it, {}", directory, ex.getMessage(), ex);
        }
    }

    private int submitListTasks(Collection<Path> entries) {
        var config = ProviderConfig.builder()
                .multi(properties.isMulti())
                .cacheDir(cacheDir)
                .fileMode(properties.getFileModeBits().orElse(null))
                .build();
        var taskCount = 0;

        for (var scanResult : scan(entries)) {
            var wanted = scanFilter.needsSearch(scanResult.languages(), scanResult.hasSingleSubtitle(), wantedLanguages(),
                    properties.isMulti(), properties.isForce());

            if (wanted.isEmpty()) {
                log.debug("No need to list subtitles {} for {}, subtitles already exist {}", languages, scanResult.path(),
                        scanResult.languages());
                continue;
            }

            log.debug("Listing subtitles {} for {} with {}", wanted, scanResult.path(), effectiveProviders());
            Video video = null;

            for (var providerName : effectiveProviders()) {
                var factory = registry.getFactory(providerName);
                var providerLanguages = new LinkedHashSet<>(wanted);
                providerLanguages.retainAll(factory.availableLanguages());
                if (providerLanguages.isEmpty())
                    continue;

                if (video == null) {
                    video = videoFactory.create(scanResult.path());
                }
                if (!factory.isValidVideo(video))
                    continue;

                controller.submit(ListTask.builder()
                        .video(video)
                        .languages(providerLanguages)
                        .providerName(providerName)
                        .config(config)
                        .build());
                taskCount++;
            }
        }

        return taskCount;
    }

    private List<ScanResult> scan(Collection<Path> entries) {
        var result = new ArrayList<ScanResult>();

        for (var entry : entries) {
            result.addAll(videoScanner.scan(entry, properties.getMaxDepth()));
        }

        return result;
    }

    private Set<String> wantedLanguages() {
        return languages.isEmpty() ? Languages.ISO_639_1 : new LinkedHashSet<>(languages);
    }

    private List<String> effectiveProviders() {
        return providers.isEmpty() ? registry.getApiBasedNames() : providers;
    }

    private List<RankCriterion> sortOrder() {
        var sortOrder = properties.getSortOrder();
        return properties.isMulti() ? RankingEngine.languageFirst(sortOrder) : List.copyOf(sortOrder);
    }

    private <T> List<T> withWorkers(boolean auto, Supplier<List<T>> call) {
        if (auto) {
            if (controller.getState() != FetcherState.IDLE)
                throw new InvalidStateException(controller.getState(), FetcherState.IDLE);

            controller.start();
        }

        try {
            return call.get();
        } catch (RuntimeException ex) {
            if (auto) {
                controller.stopAndDrain();
                controller.clearResults();
            }
            throw ex;
        } finally {
            if (auto && controller.getState() == FetcherState.RUNNING) {
                controller.stopAndDrain();
            }
        }
    }

    private static List<List<Subtitle>> groupByLanguage(List<Subtitle> ranked) {
        var grouped = new LinkedHashMap<String, List<Subtitle>>();

        for (var subtitle : ranked) {
            grouped.computeIfAbsent(subtitle.getLanguage(), e -> new ArrayList<>())
                    .add(subtitle);
        }

        return new ArrayList<>(grouped.values());
    }

    //endregion
}
