package com.scanq.scheduler;

import com.scanq.config.LibraryPolicy;
import com.scanq.config.PriorityWeights;
import com.scanq.config.QueueConfig;
import com.scanq.core.JobPriority;
import com.scanq.core.LibraryId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent producers and workers against one scheduler.
 */
class WeightedFairSchedulerConcurrencyTest {

    private static final int LIBRARIES = 4;
    private static final int JOBS_PER_LIBRARY = 250;
    private static final int PRODUCERS = 4;
    private static final int WORKERS = 8;

    @Test
    @DisplayName("Concurrent reserve/confirm/release admits every job without breaking caps")
    void concurrentWorkersDrainAllWork() throws Exception {
        List<LibraryId> libraries = List.of(LibraryId.random(), LibraryId.random(),
                LibraryId.random(), LibraryId.random());
        WeightedFairScheduler scheduler = new WeightedFairScheduler(
                new QueueConfig(2, 1, Map.of(libraries.get(0), LibraryPolicy.of(3, 2))),
                PriorityWeights.defaults());
        int totalJobs = LIBRARIES * JOBS_PER_LIBRARY;

        AtomicInteger admitted = new AtomicInteger(0);
        AtomicInteger cancelled = new AtomicInteger(0);
        AtomicBoolean capViolated = new AtomicBoolean(false);
        Map<LibraryId, AtomicInteger> perLibrary = new ConcurrentHashMap<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(PRODUCERS + WORKERS + 1);
        List<Future<?>> tasks = new ArrayList<>();

        // Producers: each library's jobs are spread over all producers and priorities
        for (int p = 0; p < PRODUCERS; p++) {
            int producer = p;
            tasks.add(executor.submit(() -> {
                start.await();
                for (int i = producer; i < totalJobs; i += PRODUCERS) {
                    LibraryId library = libraries.get(i % LIBRARIES);
                    scheduler.recordReady(library, JobPriority.values()[(i / LIBRARIES) % 4]);
                }
                return null;
            }));
        }

        // Workers: every 7th reservation is cancelled and retried later
        for (int w = 0; w < WORKERS; w++) {
            tasks.add(executor.submit(() -> {
                start.await();
                int attempts = 0;
                while (admitted.get() < totalJobs) {
                    Optional<Reservation> reservation = scheduler.reserve();
                    if (reservation.isEmpty()) {
                        Thread.onSpinWait();
                        continue;
                    }
                    Reservation r = reservation.get();
                    if (++attempts % 7 == 0) {
                        scheduler.cancel(r.id());
                        cancelled.incrementAndGet();
                        continue;
                    }
                    assertTrue(scheduler.confirm(r.id()).isPresent());
                    perLibrary.computeIfAbsent(r.library(), k -> new AtomicInteger()).incrementAndGet();
                    admitted.incrementAndGet();
                    scheduler.release(r.library());
                }
                return null;
            }));
        }

        // Checker: samples the non-blocking snapshot while the others run
        tasks.add(executor.submit(() -> {
            start.await();
            while (admitted.get() < totalJobs) {
                scheduler.snapshot().ifPresent(snapshot -> snapshot.libraries().values().forEach(s -> {
                    if (s.inflight() + s.pending() > s.cap()) {
                        capViolated.set(true);
                    }
                }));
                Thread.onSpinWait();
            }
            return null;
        }));

        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS), "workers did not drain the scheduler");
        // Rethrows any assertion or interruption raised inside a task
        for (Future<?> task : tasks) {
            task.get();
        }

        assertFalse(capViolated.get(), "a library exceeded its cap");
        assertEquals(totalJobs, admitted.get());
        for (LibraryId library : libraries) {
            assertEquals(JOBS_PER_LIBRARY, perLibrary.get(library).get(), "admitted for " + library);
        }

        SchedulerSnapshot snapshot = scheduler.snapshot().orElseThrow();
        assertEquals(0, snapshot.outstandingReservations());
        for (LibrarySnapshot library : snapshot.libraries().values()) {
            assertEquals(0, library.inflight());
            assertEquals(0, library.pending());
            assertEquals(0, library.totalReady());
        }
        assertTrue(scheduler.reserve().isEmpty());
    }
}
