package com.gentoro.reformat.scheduler;

/**
 * Running totals reported after each task resolution.
 *
 * @param completed number of resolved tasks, i.e. {@code succeeded + failed + canceled}
 * @param latest the resolution that triggered this report
 */
public record PoolProgress<T>(
    int total, int completed, int succeeded, int failed, int canceled, TaskResult<T> latest) {}
