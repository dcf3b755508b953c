package com.scanq.config;

import java.time.Duration;

/**
 * Optional expiry of reservations that were never confirmed or cancelled.
 *
 * @param reservationTtlMs Age after which a reservation is reclaimed (0 = never)
 * @param sweepIntervalMs  How often the sweeper looks for expired reservations
 */
public record LeaseConfig(
        long reservationTtlMs,
        long sweepIntervalMs
) {
    public static LeaseConfig disabled() {
        return new LeaseConfig(0, 1000);
    }

    public boolean enabled() {
        return reservationTtlMs > 0;
    }

    public Duration reservationTtl() {
        return Duration.ofMillis(reservationTtlMs);
    }
}
