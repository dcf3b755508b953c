package com.scanq.scheduler;

import com.scanq.core.JobPriority;
import com.scanq.core.LibraryId;

import java.time.Instant;
import java.util.Map;

/**
 * Outstanding reservation as stored by the scheduler.
 *
 * @param weightDebt    Total weight charged to the winner; refunded on cancel
 * @param roundAccruals Credit accrued by each eligible library in the selecting round
 * @param createdAt     Reservation time, used for lease expiry
 */
record ReservationState(
        LibraryId library,
        JobPriority priority,
        long weightDebt,
        Map<LibraryId, Integer> roundAccruals,
        Instant createdAt
) {
}
