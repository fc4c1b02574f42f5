package com.github.yoep.fetcher.tasks;

/**
 * Poison pill which terminates the worker popping it.
 */
public record StopTask() implements Task {
}
