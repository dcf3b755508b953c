package com.scanq.scheduler;

import com.scanq.core.JobPriority;
import com.scanq.core.LibraryId;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * All mutable scheduler state. Guarded by the owning scheduler's lock.
 * <p>
 * Libraries are kept in registration order so that selection ties always resolve
 * to the earliest-registered library.
 */
final class SchedulerState {

    private final Map<LibraryId, LibraryRuntimeState> libraries = new LinkedHashMap<>();
    private final Map<UUID, ReservationState> reservations = new LinkedHashMap<>();
    private int ringCursor;

    LibraryRuntimeState ensureLibrary(LibraryId library, PolicyResolver resolver) {
        return libraries.computeIfAbsent(library, resolver::newState);
    }

    LibraryRuntimeState library(LibraryId library) {
        return libraries.get(library);
    }

    Map<LibraryId, LibraryRuntimeState> libraries() {
        return libraries;
    }

    Map<UUID, ReservationState> reservations() {
        return reservations;
    }

    int ringCursor() {
        return ringCursor;
    }

    /**
     * Returns the current ring position and advances the cursor by one.
     */
    int advanceCursor(int ringSize) {
        int current = ringCursor;
        ringCursor = (ringCursor + 1) % ringSize;
        return current;
    }

    /**
     * Weighted-fair pick of one library with ready work at {@code priority}.
     * <p>
     * Every library with spare capacity and ready work accrues its weight as credit.
     * The library with the highest credit (first seen wins ties) pays back the total
     * weight accrued this round, gives up one ready job and gains one pending slot.
     *
     * @return the winner and the total weight charged to it, or empty if none is eligible
     */
    Optional<Selection> selectForPriority(JobPriority priority) {
        LibraryId bestId = null;
        PriorityCredit bestCredit = null;
        LibraryRuntimeState bestState = null;
        long totalWeight = 0;
        Map<LibraryId, Integer> accruals = new LinkedHashMap<>();

        for (Map.Entry<LibraryId, LibraryRuntimeState> entry : libraries.entrySet()) {
            LibraryRuntimeState state = entry.getValue();
            if (state.atCapacity()) {
                continue;
            }
            PriorityCredit credit = state.priority(priority);
            if (credit == null || credit.ready() == 0) {
                continue;
            }
            credit.accrue(state.weight());
            totalWeight += state.weight();
            accruals.put(entry.getKey(), state.weight());

            if (bestCredit == null || credit.credit() > bestCredit.credit()) {
                bestId = entry.getKey();
                bestCredit = credit;
                bestState = state;
            }
        }

        if (bestCredit == null) {
            return Optional.empty();
        }

        bestCredit.charge(totalWeight);
        bestCredit.takeReady();
        bestState.addPending();
        return Optional.of(new Selection(bestId, totalWeight, accruals));
    }

    /**
     * Exact inverse of the {@link #selectForPriority} step that produced a reservation:
     * the winner gets its ready job, pending slot and weight debt back, and every
     * library that accrued credit in that round gives the accrual back.
     */
    void rollback(ReservationState reservation) {
        LibraryRuntimeState state = libraries.get(reservation.library());
        if (state == null) {
            return;
        }
        state.dropPending();
        PriorityCredit credit = state.priority(reservation.priority());
        if (credit != null) {
            credit.addReady(1);
            credit.accrue(reservation.weightDebt());
        }
        reservation.roundAccruals().forEach((library, weight) -> {
            LibraryRuntimeState participant = libraries.get(library);
            PriorityCredit accrued = participant != null ? participant.priority(reservation.priority()) : null;
            if (accrued != null) {
                accrued.charge(weight);
            }
        });
    }

    SchedulerSnapshot snapshot() {
        Map<LibraryId, LibrarySnapshot> views = new LinkedHashMap<>();
        libraries.forEach((id, state) -> views.put(id, state.snapshot()));
        return new SchedulerSnapshot(views, reservations.size(), ringCursor);
    }

    /**
     * Winner of a selection round.
     *
     * @param library     Selected library
     * @param totalWeight Weight charged to the winner (sum of all eligible weights)
     * @param accruals    Credit each eligible library accrued this round, winner included
     */
    record Selection(LibraryId library, long totalWeight, Map<LibraryId, Integer> accruals) {
    }
}
