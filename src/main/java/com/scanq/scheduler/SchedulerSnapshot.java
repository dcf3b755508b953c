package com.scanq.scheduler;

import com.scanq.core.LibraryId;

import java.util.Map;

/**
 * Diagnostic view of the whole scheduler.
 *
 * @param libraries               Per-library counters, in registration order
 * @param outstandingReservations Reservations awaiting confirm or cancel
 * @param ringCursor              Next priority ring position
 */
public record SchedulerSnapshot(
        Map<LibraryId, LibrarySnapshot> libraries,
        int outstandingReservations,
        int ringCursor
) {
    public LibrarySnapshot library(LibraryId library) {
        return libraries.get(library);
    }
}
