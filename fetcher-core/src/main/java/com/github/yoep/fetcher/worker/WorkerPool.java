package com.github.yoep.fetcher.worker;

import com.github.yoep.fetcher.adapter.FetcherException;
import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.providers.ProviderRegistry;
import com.github.yoep.fetcher.queue.PriorityWorkQueue;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A fixed number of {@link ProviderWorker}'s sharing a single work queue.
 * A pool is started once and joined once; a new pool is created for every run.
 */
@Slf4j
public class WorkerPool {
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final int size;
    private final PriorityWorkQueue taskQueue;
    private final BlockingQueue<List<ListResult>> listResults;
    private final BlockingQueue<List<Subtitle>> downloadResults;
    private final ProviderRegistry registry;
    private final String namePrefix = "fetcher-" + POOL_SEQUENCE.incrementAndGet() + "-worker-";

    private ThreadPoolTaskExecutor executor;
    private List<Future<?>> workers;

    public WorkerPool(int size,
                      PriorityWorkQueue taskQueue,
                      BlockingQueue<List<ListResult>> listResults,
                      BlockingQueue<List<Subtitle>> downloadResults,
                      ProviderRegistry registry) {
        Validate.isTrue(size > 0, "size must be greater than 0, got %d", size);
        this.size = size;
        this.taskQueue = taskQueue;
        this.listResults = listResults;
        this.downloadResults = downloadResults;
        this.registry = registry;
    }

    public int getSize() {
        return size;
    }

    /**
     * Start all workers of the pool.
     *
     * @throws IllegalStateException Is thrown when the pool has already been started.
     */
    public synchronized void start() {
        Validate.validState(executor == null, "worker pool has already been started");
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(namePrefix);
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        workers = new ArrayList<>(size);

        for (int i = 1; i <= size; i++) {
            var worker = new ProviderWorker(namePrefix + i, taskQueue, listResults, downloadResults, registry);
            workers.add(executor.submit(worker));
            log.debug("Worker {} added to the pool", worker.getName());
        }
    }

    /**
     * Block until every worker of the pool has terminated.
     * The workers only terminate when they pop a stop task, which should be pushed before invoking this method.
     */
    public synchronized void join() {
        Validate.validState(executor != null, "worker pool has not been started");

        try {
            for (var worker : workers) {
                awaitWorker(worker);
            }
        } finally {
            executor.shutdown();
        }

        log.debug("All {} workers have been terminated", size);
    }

    private void awaitWorker(Future<?> worker) {
        try {
            worker.get();
        } catch (ExecutionException ex) {
            log.error("A worker of {} terminated unexpectedly, {}", namePrefix, ex.getCause().getMessage(), ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FetcherException("Interrupted while waiting for the workers to terminate", ex);
        }
    }
}
