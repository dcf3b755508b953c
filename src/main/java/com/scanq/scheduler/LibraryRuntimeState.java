package com.scanq.scheduler;

import com.scanq.core.JobPriority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mutable admission counters of one library.
 * <p>
 * {@code inflight + pending <= cap} holds whenever the scheduler lock is released.
 * Not thread-safe; only touched under the scheduler lock.
 */
final class LibraryRuntimeState {

    private final int cap;
    private final int weight;
    private int inflight;
    private int pending;
    private final Map<JobPriority, PriorityCredit> priorities = new EnumMap<>(JobPriority.class);

    LibraryRuntimeState(int cap, int weight) {
        this.cap = cap;
        this.weight = weight;
    }

    int cap() {
        return cap;
    }

    int weight() {
        return weight;
    }

    int inflight() {
        return inflight;
    }

    int pending() {
        return pending;
    }

    boolean atCapacity() {
        return inflight + pending >= cap;
    }

    PriorityCredit ensurePriority(JobPriority priority) {
        return priorities.computeIfAbsent(priority, p -> new PriorityCredit());
    }

    /**
     * Credit entry for a priority, or null if the library never had work at that priority.
     */
    PriorityCredit priority(JobPriority priority) {
        return priorities.get(priority);
    }

    void addPending() {
        pending++;
    }

    void dropPending() {
        if (pending > 0) {
            pending--;
        }
    }

    /**
     * Reservation confirmed: one pending slot becomes in-flight.
     */
    void promotePending() {
        dropPending();
        inflight++;
    }

    void releaseInflight() {
        if (inflight > 0) {
            inflight--;
        }
    }

    long totalReady() {
        long total = 0;
        for (PriorityCredit credit : priorities.values()) {
            total += credit.ready();
        }
        return total;
    }

    LibrarySnapshot snapshot() {
        Map<JobPriority, CreditSnapshot> credits = new EnumMap<>(JobPriority.class);
        priorities.forEach((priority, credit) -> credits.put(priority, credit.snapshot()));
        return new LibrarySnapshot(cap, weight, inflight, pending, Collections.unmodifiableMap(credits));
    }

    @Override
    public String toString() {
        return "LibraryRuntimeState{" +
                "cap=" + cap +
                ", weight=" + weight +
                ", inflight=" + inflight +
                ", pending=" + pending +
                ", priorityCount=" + priorities.size() +
                '}';
    }
}
