package com.scanq.config;

import com.scanq.exception.ConfigurationException;

/**
 * Relative service frequency of the four priority classes.
 * Zero is allowed and treated as 1 when the ring is built.
 */
public record PriorityWeights(
        int p0,
        int p1,
        int p2,
        int p3
) {
    public PriorityWeights {
        if (p0 < 0 || p1 < 0 || p2 < 0 || p3 < 0) {
            throw new ConfigurationException(
                    "Priority weights cannot be negative: p0=" + p0 + ", p1=" + p1
                            + ", p2=" + p2 + ", p3=" + p3);
        }
    }

    public static PriorityWeights defaults() {
        return new PriorityWeights(3, 2, 1, 1);
    }

    public static PriorityWeights uniform() {
        return new PriorityWeights(1, 1, 1, 1);
    }
}
