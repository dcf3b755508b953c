package com.scanq.adapter.lease;

import com.scanq.config.LeaseConfig;
import com.scanq.scheduler.AdmissionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically reclaims reservations that were never confirmed or cancelled.
 * Runs on a single daemon thread; each run cancels reservations older than the TTL.
 * With a disabled {@link LeaseConfig} the sweeper never starts a thread.
 */
public class ReservationSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReservationSweeper.class);

    private final AdmissionScheduler scheduler;
    private final Duration ttl;
    private final long intervalMs;
    private volatile ScheduledExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong reclaimedCount = new AtomicLong(0);

    public ReservationSweeper(AdmissionScheduler scheduler, LeaseConfig config) {
        if (scheduler == null) {
            throw new IllegalArgumentException("Scheduler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Lease config cannot be null");
        }
        if (config.enabled() && config.sweepIntervalMs() <= 0) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
        this.scheduler = scheduler;
        this.ttl = config.reservationTtl();
        this.intervalMs = config.sweepIntervalMs();
    }

    /**
     * Start periodic sweeping. Calling more than once has no effect.
     */
    public void start() {
        if (!isEnabled()) {
            log.info("Reservation TTL not configured, reservations never expire");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scanq-reservation-sweeper");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("ReservationSweeper started: ttl={}ms, interval={}ms", ttl.toMillis(), intervalMs);
    }

    /**
     * Run one sweep on the calling thread.
     *
     * @return Number of reservations reclaimed
     */
    public int sweep() {
        try {
            int reclaimed = scheduler.cancelExpired(ttl);
            if (reclaimed > 0) {
                reclaimedCount.addAndGet(reclaimed);
                log.info("Reclaimed {} expired reservations", reclaimed);
            }
            return reclaimed;
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            log.error("Reservation sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Total reservations reclaimed since construction.
     */
    public long getReclaimedCount() {
        return reclaimedCount.get();
    }

    public boolean isEnabled() {
        return ttl.toMillis() > 0;
    }

    public boolean isStarted() {
        return started.get();
    }

    @Override
    public void close() {
        ScheduledExecutorService running = executor;
        if (running == null) {
            return;
        }
        running.shutdownNow();
        log.info("ReservationSweeper stopped, {} reservations reclaimed in total", reclaimedCount.get());
    }
}
