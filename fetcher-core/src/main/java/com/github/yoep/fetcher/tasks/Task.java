package com.github.yoep.fetcher.tasks;

/**
 * A unit of work executed by a worker.
 * The priority of a task is decided when it's pushed onto the work queue, not by the task itself.
 */
public sealed interface Task permits ListTask, DownloadTask, StopTask {
}
