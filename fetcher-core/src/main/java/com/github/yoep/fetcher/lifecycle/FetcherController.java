package com.github.yoep.fetcher.lifecycle;

import com.github.yoep.fetcher.WrongTaskException;
import com.github.yoep.fetcher.adapter.FetcherException;
import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.providers.ProviderRegistry;
import com.github.yoep.fetcher.queue.PriorityWorkQueue;
import com.github.yoep.fetcher.tasks.StopTask;
import com.github.yoep.fetcher.tasks.Task;
import com.github.yoep.fetcher.worker.ListResult;
import com.github.yoep.fetcher.worker.WorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * The controller owns the work queue, the result channels and the worker pool of a run.
 * <p>
 * Workers are stopped by pushing one {@link StopTask} per worker onto the work queue,
 * either behind all pending work ({@link #stopAndDrain()}) or in front of it ({@link #pauseNow()}).
 * Both calls return only once every worker has terminated.
 */
@Slf4j
public class FetcherController {
    private final int workers;
    private final ProviderRegistry registry;
    private final PriorityWorkQueue taskQueue = new PriorityWorkQueue();
    private final BlockingQueue<List<ListResult>> listResults = new LinkedBlockingQueue<>();
    private final BlockingQueue<List<Subtitle>> downloadResults = new LinkedBlockingQueue<>();

    private volatile FetcherState state = FetcherState.IDLE;
    private WorkerPool pool;

    public FetcherController(int workers, ProviderRegistry registry) {
        Validate.isTrue(workers > 0, "workers must be greater than 0, got %d", workers);
        Objects.requireNonNull(registry, "registry cannot be null");
        this.workers = workers;
        this.registry = registry;
    }

    //region Getters

    public FetcherState getState() {
        return state;
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * Get the number of tasks which are queued and not yet picked up by a worker.
     *
     * @return Returns the number of pending tasks.
     */
    public int getPendingTaskCount() {
        return taskQueue.size();
    }

    //endregion

    //region Methods

    /**
     * Start the workers.
     * A paused controller resumes the tasks which were still queued when it was paused.
     *
     * @throws InvalidStateException Is thrown when the workers are already running.
     */
    public synchronized void start() {
        if (state == FetcherState.RUNNING) {
            throw new InvalidStateException(state, FetcherState.IDLE, FetcherState.PAUSED);
        }

        log.debug("Starting {} workers, {} tasks pending", workers, taskQueue.size());
        pool = new WorkerPool(workers, taskQueue, listResults, downloadResults, registry);
        pool.start();
        state = FetcherState.RUNNING;
    }

    /**
     * Stop the workers once every task which is currently queued has been processed.
     * This call blocks until all workers have terminated.
     *
     * @throws InvalidStateException Is thrown when the workers are not running.
     */
    public synchronized void stopAndDrain() {
        assertRunning();
        log.debug("Stopping workers after the pending tasks");
        terminateWorkers(PriorityWorkQueue.PRIORITY_DRAIN);
        state = FetcherState.IDLE;
    }

    /**
     * Stop the workers as soon as they finish the task they're currently executing.
     * Tasks which haven't been picked up yet stay queued until the workers are started again.
     * This call blocks until all workers have terminated.
     *
     * @throws InvalidStateException Is thrown when the workers are not running.
     */
    public synchronized void pauseNow() {
        assertRunning();
        log.debug("Pausing workers");
        terminateWorkers(PriorityWorkQueue.PRIORITY_ABORT);
        state = taskQueue.isEmpty() ? FetcherState.IDLE : FetcherState.PAUSED;
        log.debug("Workers paused with {} pending tasks, state is {}", taskQueue.size(), state);
    }

    /**
     * Submit the given task with a normal priority.
     * Tasks submitted while no workers are running stay queued until {@link #start()} is invoked.
     *
     * @param task The list or download task to submit.
     * @throws WrongTaskException Is thrown when the task is a stop task or no task at all.
     */
    public void submit(Task task) {
        if (task == null || task instanceof StopTask) {
            throw new WrongTaskException("Only list and download tasks can be submitted, got " + task);
        }

        taskQueue.push(PriorityWorkQueue.PRIORITY_NORMAL, task);
    }

    /**
     * Wait for the given number of listing results.
     * Every submitted list task publishes exactly one result, which might be empty.
     *
     * @param count The number of list tasks which have been submitted.
     * @return Returns the combined listing results.
     */
    public List<ListResult> awaitListResults(int count) {
        return await(listResults, count);
    }

    /**
     * Wait for the given number of download results.
     * Every submitted download task publishes exactly one result, which might be empty.
     *
     * @param count The number of download tasks which have been submitted.
     * @return Returns the downloaded subtitles.
     */
    public List<Subtitle> awaitDownloadResults(int count) {
        return await(downloadResults, count);
    }

    /**
     * Discard the results which have been published but not awaited.
     */
    public void clearResults() {
        listResults.clear();
        downloadResults.clear();
    }

    //endregion

    //region PreDestroy

    @PreDestroy
    void onDestroy() {
        if (state == FetcherState.RUNNING) {
            log.debug("Interrupting the running workers");
            pauseNow();
        }
    }

    //endregion

    //region Functions

    private void assertRunning() {
        if (state != FetcherState.RUNNING) {
            throw new InvalidStateException(state, FetcherState.RUNNING);
        }
    }

    private void terminateWorkers(int priority) {
        for (int i = 0; i < workers; i++) {
            taskQueue.push(priority, new StopTask());
        }

        pool.join();
        pool = null;

        // a worker which died on a fatal error never consumed its stop task
        var stale = taskQueue.removeIf(StopTask.class::isInstance);
        if (stale > 0) {
            log.warn("Removed {} stop tasks which were not consumed by a terminated worker", stale);
        }
    }

    private static <T> List<T> await(BlockingQueue<List<T>> channel, int count) {
        var result = new ArrayList<T>();

        try {
            for (int i = 0; i < count; i++) {
                result.addAll(channel.take());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FetcherException("Interrupted while waiting for the task results", ex);
        }

        return result;
    }

    //endregion
}
