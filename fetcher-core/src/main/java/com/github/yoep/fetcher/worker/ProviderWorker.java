package com.github.yoep.fetcher.worker;

import com.github.yoep.fetcher.adapter.DownloadFailedException;
import com.github.yoep.fetcher.adapter.WorkerContext;
import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.providers.ProviderRegistry;
import com.github.yoep.fetcher.queue.PriorityWorkQueue;
import com.github.yoep.fetcher.tasks.DownloadTask;
import com.github.yoep.fetcher.tasks.ListTask;
import com.github.yoep.fetcher.tasks.StopTask;
import com.github.yoep.fetcher.tasks.Task;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * A single worker of the pool.
 * It pops tasks until it receives a {@link StopTask} and publishes exactly one result for every other task,
 * whether the providers succeed or fail.
 */
@Slf4j
public class ProviderWorker implements Runnable {
    private final String name;
    private final PriorityWorkQueue taskQueue;
    private final BlockingQueue<List<ListResult>> listResults;
    private final BlockingQueue<List<Subtitle>> downloadResults;
    private final ProviderRegistry registry;
    private final WorkerContext context = new WorkerContext();

    public ProviderWorker(String name,
                          PriorityWorkQueue taskQueue,
                          BlockingQueue<List<ListResult>> listResults,
                          BlockingQueue<List<Subtitle>> downloadResults,
                          ProviderRegistry registry) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(taskQueue, "taskQueue cannot be null");
        Objects.requireNonNull(listResults, "listResults cannot be null");
        Objects.requireNonNull(downloadResults, "downloadResults cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        this.name = name;
        this.taskQueue = taskQueue;
        this.listResults = listResults;
        this.downloadResults = downloadResults;
        this.registry = registry;
    }

    public String getName() {
        return name;
    }

    @Override
    public void run() {
        while (true) {
            Task task;
            try {
                task = taskQueue.pop();
            } catch (InterruptedException ex) {
                log.warn("Worker {} has been interrupted while waiting for a task", name);
                Thread.currentThread().interrupt();
                break;
            }

            if (task instanceof StopTask) {
                log.debug("Poison pill received, terminating worker {}", name);
                taskQueue.acknowledge();
                break;
            }

            try {
                execute(task);
            } catch (VirtualMachineError ex) {
                log.error("Worker {} is terminating on a fatal error, {}", name, ex.getMessage(), ex);
                throw ex;
            } catch (Error ex) {
                log.error("Worker {} failed to execute {}, {}", name, task, ex.getMessage(), ex);
            } finally {
                taskQueue.acknowledge();
            }
        }

        log.debug("Worker {} terminated", name);
    }

    /**
     * Execute the given task and publish its result.
     * A result is published even when the task fails with an {@link Error}, an empty one in that case.
     */
    void execute(Task task) {
        if (task instanceof ListTask listTask) {
            List<ListResult> result = Collections.emptyList();
            try {
                result = list(listTask);
            } finally {
                listResults.add(result);
            }
        } else if (task instanceof DownloadTask downloadTask) {
            List<Subtitle> result = Collections.emptyList();
            try {
                result = download(downloadTask);
            } finally {
                downloadResults.add(result);
            }
        } else {
            throw new IllegalArgumentException("Unsupported task type " + task.getClass().getSimpleName());
        }
    }

    private List<ListResult> list(ListTask task) {
        try {
            var provider = registry.getFactory(task.providerName()).create(task.config(), context);
            var subtitles = provider.list(task.video(), task.languages());

            log.debug("Provider {} found {} subtitles for {}", task.providerName(), subtitles.size(), task.video().getPath());
            return List.of(new ListResult(task.video(), subtitles));
        } catch (Exception ex) {
            log.error("Failed to list subtitles of {} with provider {} in worker {}, {}",
                    task.video().getPath(), task.providerName(), name, ex.getMessage(), ex);
            return Collections.emptyList();
        }
    }

    private List<Subtitle> download(DownloadTask task) {
        var video = task.video();

        try {
            for (var subtitle : task.subtitles()) {
                var provider = registry.getFactory(subtitle.getProviderName()).create();

                try {
                    var downloaded = provider.download(subtitle);

                    if (downloaded != null) {
                        log.debug("Downloaded {} subtitle of {} from {}", subtitle.getLanguage(), video.getPath(), subtitle.getProviderName());
                        return List.of(downloaded);
                    }

                    log.warn("Provider {} returned no subtitle for {}, trying next", subtitle.getProviderName(), subtitle);
                } catch (DownloadFailedException ex) {
                    log.warn("Could not download subtitle {}, trying next, {}", subtitle, ex.getMessage());
                }
            }

            log.error("No subtitles could be downloaded for video {}", video.getPath());
        } catch (Exception ex) {
            log.error("Failed to download subtitles of {} in worker {}, {}", video.getPath(), name, ex.getMessage(), ex);
        }

        return Collections.emptyList();
    }
}
