package com.scanq.scheduler;

import com.scanq.core.JobPriority;

import java.util.Map;

/**
 * Point-in-time view of one library's admission counters.
 *
 * @param cap        Effective in-flight cap
 * @param weight     Effective weight
 * @param inflight   Confirmed jobs not yet released
 * @param pending    Reservations not yet confirmed or cancelled
 * @param priorities Ready count and credit per priority the library has seen
 */
public record LibrarySnapshot(
        int cap,
        int weight,
        int inflight,
        int pending,
        Map<JobPriority, CreditSnapshot> priorities
) {
    /**
     * Ready jobs summed over all priorities.
     */
    public long totalReady() {
        return priorities.values().stream().mapToLong(CreditSnapshot::ready).sum();
    }

    public long ready(JobPriority priority) {
        CreditSnapshot credit = priorities.get(priority);
        return credit != null ? credit.ready() : 0;
    }

    public long credit(JobPriority priority) {
        CreditSnapshot credit = priorities.get(priority);
        return credit != null ? credit.credit() : 0;
    }
}
