package com.scanq.core;

import java.util.Objects;

/**
 * Bulk ready count used to prime the scheduler without one call per job,
 * typically from a durable job store at startup.
 *
 * @param library  Library owning the jobs
 * @param priority Priority band of the jobs
 * @param count    Number of ready jobs (0 entries are ignored by the scheduler)
 */
public record ReadyCountEntry(
        LibraryId library,
        JobPriority priority,
        long count
) {
    public ReadyCountEntry {
        Objects.requireNonNull(library, "library cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");
        if (count < 0) {
            throw new IllegalArgumentException("Ready count cannot be negative: " + count);
        }
    }
}
