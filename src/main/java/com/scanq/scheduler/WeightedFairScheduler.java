package com.scanq.scheduler;

import com.scanq.config.PriorityWeights;
import com.scanq.config.QueueConfig;
import com.scanq.config.ScanQueueConfig;
import com.scanq.core.JobPriority;
import com.scanq.core.LibraryId;
import com.scanq.core.ReadyCountEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Weighted-fair scan admission scheduler shared by worker pools.
 * <p>
 * Keeps a minimal in-memory view of ready counts per (library, priority) and enforces
 * per-library in-flight caps. Priority classes are served in the ratio of the
 * {@link PriorityRing}; libraries sharing a class are served in proportion to their
 * weights among those currently eligible.
 * <p>
 * All state sits behind a single lock. Critical sections are pure arithmetic over the
 * registered libraries; logging happens after the lock is released.
 */
public class WeightedFairScheduler implements AdmissionScheduler {

    private static final Logger log = LoggerFactory.getLogger(WeightedFairScheduler.class);

    private final PolicyResolver policies;
    private final PriorityRing ring;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final SchedulerState state = new SchedulerState();

    public WeightedFairScheduler(ScanQueueConfig config) {
        this(config.queue(), config.priorityWeights(), Clock.systemUTC());
    }

    public WeightedFairScheduler(QueueConfig queueConfig, PriorityWeights priorityWeights) {
        this(queueConfig, priorityWeights, Clock.systemUTC());
    }

    public WeightedFairScheduler(QueueConfig queueConfig, PriorityWeights priorityWeights, Clock clock) {
        this.policies = new PolicyResolver(Objects.requireNonNull(queueConfig, "queueConfig cannot be null"));
        this.ring = PriorityRing.fromWeights(Objects.requireNonNull(priorityWeights, "priorityWeights cannot be null"));
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");

        log.info("WeightedFairScheduler initialized: defaultCap={}, defaultWeight={}, overrides={}, ring={}",
                policies.defaultCap(), policies.defaultWeight(), policies.overrideCount(), ring.slots());
    }

    @Override
    public void registerLibrary(LibraryId library) {
        Objects.requireNonNull(library, "library cannot be null");
        lock.lock();
        try {
            state.ensureLibrary(library, policies);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordReady(LibraryId library, JobPriority priority) {
        Objects.requireNonNull(library, "library cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");
        long ready;
        lock.lock();
        try {
            PriorityCredit credit = state.ensureLibrary(library, policies).ensurePriority(priority);
            credit.addReady(1);
            ready = credit.ready();
        } finally {
            lock.unlock();
        }
        log.trace("Ready job recorded for library {} at {} (ready={})", library, priority, ready);
    }

    @Override
    public void recordEnqueued(LibraryId library, JobPriority priority) {
        recordReady(library, priority);
    }

    @Override
    public void recordReadyBulk(Collection<ReadyCountEntry> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        long total = 0;
        int applied = 0;
        lock.lock();
        try {
            for (ReadyCountEntry entry : entries) {
                if (entry.count() == 0) {
                    continue;
                }
                state.ensureLibrary(entry.library(), policies)
                        .ensurePriority(entry.priority())
                        .addReady(entry.count());
                total += entry.count();
                applied++;
            }
        } finally {
            lock.unlock();
        }
        log.debug("Primed ready counts: {} jobs across {} (library, priority) entries", total, applied);
    }

    @Override
    public Optional<Reservation> reserve() {
        Reservation reservation = null;
        lock.lock();
        try {
            for (int attempt = 0; attempt < ring.size(); attempt++) {
                JobPriority priority = ring.get(state.advanceCursor(ring.size()));
                Optional<SchedulerState.Selection> selection = state.selectForPriority(priority);
                if (selection.isPresent()) {
                    SchedulerState.Selection selected = selection.get();
                    UUID id = UUID.randomUUID();
                    state.reservations().put(id, new ReservationState(
                            selected.library(), priority, selected.totalWeight(),
                            selected.accruals(), clock.instant()));
                    reservation = new Reservation(id, selected.library(), priority);
                    break;
                }
            }
        } finally {
            lock.unlock();
        }

        if (reservation != null) {
            log.debug("Reservation {} granted for library {} at {}",
                    reservation.id(), reservation.library(), reservation.priority());
        }
        return Optional.ofNullable(reservation);
    }

    @Override
    public Optional<Reservation> confirm(UUID reservationId) {
        Objects.requireNonNull(reservationId, "reservationId cannot be null");
        ReservationState reservation;
        lock.lock();
        try {
            reservation = state.reservations().remove(reservationId);
            if (reservation != null) {
                LibraryRuntimeState library = state.library(reservation.library());
                if (library != null) {
                    library.promotePending();
                }
            }
        } finally {
            lock.unlock();
        }

        if (reservation == null) {
            log.debug("Confirm ignored for unknown or resolved reservation {}", reservationId);
            return Optional.empty();
        }
        log.debug("Reservation {} confirmed for library {}", reservationId, reservation.library());
        return Optional.of(new Reservation(reservationId, reservation.library(), reservation.priority()));
    }

    @Override
    public void cancel(UUID reservationId) {
        Objects.requireNonNull(reservationId, "reservationId cannot be null");
        ReservationState reservation;
        lock.lock();
        try {
            reservation = state.reservations().remove(reservationId);
            if (reservation != null) {
                state.rollback(reservation);
            }
        } finally {
            lock.unlock();
        }

        if (reservation != null) {
            log.debug("Reservation {} cancelled for library {} (refunded weight {})",
                    reservationId, reservation.library(), reservation.weightDebt());
        }
    }

    @Override
    public void release(LibraryId library) {
        Objects.requireNonNull(library, "library cannot be null");
        boolean known;
        lock.lock();
        try {
            LibraryRuntimeState libraryState = state.library(library);
            known = libraryState != null;
            if (known) {
                libraryState.releaseInflight();
            }
        } finally {
            lock.unlock();
        }
        if (!known) {
            log.warn("Release ignored for unregistered library {}", library);
        }
    }

    @Override
    public void recordCompleted(LibraryId library) {
        release(library);
    }

    @Override
    public int cancelExpired(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isZero() || ttl.isNegative()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(ttl);
        List<Map.Entry<UUID, ReservationState>> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Map.Entry<UUID, ReservationState>> it = state.reservations().entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<UUID, ReservationState> entry = it.next();
                if (!entry.getValue().createdAt().isAfter(cutoff)) {
                    it.remove();
                    state.rollback(entry.getValue());
                    expired.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }

        for (Map.Entry<UUID, ReservationState> entry : expired) {
            log.warn("Reservation {} for library {} expired after {}ms without confirm or cancel",
                    entry.getKey(), entry.getValue().library(), ttl.toMillis());
        }
        return expired.size();
    }

    @Override
    public int outstandingReservations() {
        lock.lock();
        try {
            return state.reservations().size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<SchedulerSnapshot> snapshot() {
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.of(state.snapshot());
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stateLock() {
        return lock;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("WeightedFairScheduler{")
                .append("defaultCap=").append(policies.defaultCap())
                .append(", defaultWeight=").append(policies.defaultWeight())
                .append(", overrideCount=").append(policies.overrideCount())
                .append(", ringLength=").append(ring.size());
        if (lock.tryLock()) {
            try {
                sb.append(", libraryCount=").append(state.libraries().size())
                        .append(", reservationCount=").append(state.reservations().size())
                        .append(", ringCursor=").append(state.ringCursor());
            } finally {
                lock.unlock();
            }
        } else {
            sb.append(", state=<locked>");
        }
        return sb.append('}').toString();
    }
}
