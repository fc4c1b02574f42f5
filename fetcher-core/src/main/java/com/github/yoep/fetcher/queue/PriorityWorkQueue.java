package com.github.yoep.fetcher.queue;

import com.github.yoep.fetcher.tasks.Task;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Unbounded thread-safe work queue which serves the lowest priority value first.
 * Tasks with an equal priority are served in the order they were pushed.
 * <p>
 * Every popped task is acknowledged exactly once by the worker which popped it, through {@link #acknowledge()}.
 */
@Slf4j
public class PriorityWorkQueue {
    /**
     * Served before any pending work, used to interrupt the workers.
     */
    public static final int PRIORITY_ABORT = 0;
    public static final int PRIORITY_NORMAL = 5;
    /**
     * Served after all pending work, used to stop the workers once the queue has been drained.
     */
    public static final int PRIORITY_DRAIN = 10;

    private final PriorityBlockingQueue<Entry> queue = new PriorityBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger unfinished = new AtomicInteger();

    /**
     * Push the given task onto the queue.
     * This call never blocks.
     *
     * @param priority The priority of the task, lower values are served first.
     * @param task     The task to push.
     */
    public void push(int priority, Task task) {
        Objects.requireNonNull(task, "task cannot be null");
        unfinished.incrementAndGet();
        queue.put(new Entry(priority, sequence.getAndIncrement(), task));
        log.trace("Pushed {} with priority {}", task, priority);
    }

    /**
     * Pop the task with the lowest priority value.
     * This call blocks until a task is available.
     *
     * @return Returns the popped task.
     * @throws InterruptedException Is thrown when the calling thread is interrupted while waiting.
     */
    public Task pop() throws InterruptedException {
        var entry = queue.take();
        log.trace("Popped {} with priority {}", entry.task(), entry.priority());
        return entry.task();
    }

    /**
     * Acknowledge that a popped task has been fully processed.
     *
     * @throws IllegalStateException Is thrown when more tasks are acknowledged than were pushed.
     */
    public void acknowledge() {
        var remaining = unfinished.decrementAndGet();

        if (remaining < 0) {
            unfinished.incrementAndGet();
            throw new IllegalStateException("acknowledge() called more times than there were tasks pushed");
        }
    }

    /**
     * Remove the queued tasks matching the given filter.
     * Removed tasks count as finished.
     *
     * @param filter The filter of the tasks to remove.
     * @return Returns the number of removed tasks.
     */
    public int removeIf(Predicate<Task> filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        var removed = 0;

        for (var entry : queue) {
            if (filter.test(entry.task()) && queue.remove(entry)) {
                unfinished.decrementAndGet();
                removed++;
            }
        }

        return removed;
    }

    /**
     * Get the number of tasks which are waiting to be popped.
     *
     * @return Returns the number of queued tasks.
     */
    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Get the number of pushed tasks which have not been acknowledged yet.
     * This includes the queued tasks and the ones being processed.
     *
     * @return Returns the number of unfinished tasks.
     */
    public int getUnfinishedCount() {
        return unfinished.get();
    }

    private record Entry(int priority, long sequence, Task task) implements Comparable<Entry> {
        @Override
        public int compareTo(Entry other) {
            var result = Integer.compare(priority, other.priority);
            return result != 0 ? result : Long.compare(sequence, other.sequence);
        }
    }
}
