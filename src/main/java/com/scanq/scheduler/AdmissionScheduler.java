package com.scanq.scheduler;

import com.scanq.core.JobPriority;
import com.scanq.core.LibraryId;
import com.scanq.core.ReadyCountEntry;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Admission control for scan workers.
 * Tracks ready/in-flight counts per library and decides which (library, priority)
 * pair a free worker should take next. Holds counters only, never job payloads.
 * <p>
 * Worker protocol: {@link #reserve()}, then {@link #confirm(UUID)} before starting the
 * job and {@link #release(LibraryId)} when it finishes, or {@link #cancel(UUID)} if the
 * job is not started after all.
 */
public interface AdmissionScheduler {

    /**
     * Create the library's state if absent, without adding ready work.
     */
    void registerLibrary(LibraryId library);

    /**
     * One more job is ready for the pair.
     */
    void recordReady(LibraryId library, JobPriority priority);

    /**
     * Same as {@link #recordReady}, named for producers that just enqueued a job.
     */
    void recordEnqueued(LibraryId library, JobPriority priority);

    /**
     * Add ready counts in one batch, e.g. when re-seeding from a job store at startup.
     * Entries with a zero count are skipped.
     */
    void recordReadyBulk(Collection<ReadyCountEntry> entries);

    /**
     * Reserve one job slot, walking at most one full turn of the priority ring.
     *
     * @return Reservation if any library has admissible work, empty otherwise
     */
    Optional<Reservation> reserve();

    /**
     * Worker started the reserved job: pending becomes in-flight.
     *
     * @return The confirmed reservation, or empty if the id is unknown or already resolved
     */
    Optional<Reservation> confirm(UUID reservationId);

    /**
     * Worker gave up before starting: the reservation is rolled back exactly.
     * Unknown or already-resolved ids are ignored.
     */
    void cancel(UUID reservationId);

    /**
     * A confirmed job finished; frees one slot of the library's cap.
     */
    void release(LibraryId library);

    /**
     * Same as {@link #release}.
     */
    void recordCompleted(LibraryId library);

    /**
     * Cancel every reservation older than {@code ttl}.
     *
     * @return Number of reservations reclaimed
     */
    int cancelExpired(Duration ttl);

    /**
     * Number of reservations awaiting confirm or cancel.
     */
    int outstandingReservations();

    /**
     * Non-blocking diagnostic view.
     *
     * @return Snapshot, or empty if the scheduler lock is currently held
     */
    Optional<SchedulerSnapshot> snapshot();
}
