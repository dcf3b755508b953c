package com.scanq.core;

import com.scanq.config.PriorityWeights;

import java.util.Locale;

/**
 * Priority bands for scan and index jobs.
 * Lower ordinal = more urgent. P0 is served most often by the default ring.
 */
public enum JobPriority {
    P0,
    P1,
    P2,
    P3;

    /**
     * Configured ring weight for this priority class.
     */
    public int weight(PriorityWeights weights) {
        return switch (this) {
            case P0 -> weights.p0();
            case P1 -> weights.p1();
            case P2 -> weights.p2();
            case P3 -> weights.p3();
        };
    }

    /**
     * Returns the more urgent of this priority and {@code target}.
     */
    public JobPriority elevate(JobPriority target) {
        return target.ordinal() <= ordinal() ? target : this;
    }

    /**
     * Parse a priority name as written in configuration ("p0", "P2", ...).
     */
    public static JobPriority fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Priority cannot be null or blank");
        }
        return JobPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
