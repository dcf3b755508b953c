package com.scanq.scheduler;

import com.scanq.core.JobPriority;
import com.scanq.core.LibraryId;

import java.util.UUID;

/**
 * Provisional admission of one job for a (library, priority) pair.
 * Must be resolved exactly once through confirm or cancel.
 *
 * @param id       Reservation id
 * @param library  Admitted library
 * @param priority Priority class the job should be taken from
 */
public record Reservation(
        UUID id,
        LibraryId library,
        JobPriority priority
) {
}
