package com.scanq.scheduler;

/**
 * Point-in-time view of one (library, priority) pair.
 *
 * @param ready  Jobs known to be ready and not yet reserved
 * @param credit Accrued fair-queueing credit
 */
public record CreditSnapshot(long ready, long credit) {
}
