package com.scanq.config;

/**
 * Root configuration for the scan admission scheduler.
 *
 * @param name            Scheduler name (for logs)
 * @param queue           Per-library caps and weights
 * @param priorityWeights Priority ring weights
 * @param lease           Reservation expiry settings
 */
public record ScanQueueConfig(
        String name,
        QueueConfig queue,
        PriorityWeights priorityWeights,
        LeaseConfig lease
) {
    public ScanQueueConfig {
        name = name == null || name.isBlank() ? "scanq" : name;
        queue = queue == null ? QueueConfig.defaults() : queue;
        priorityWeights = priorityWeights == null ? PriorityWeights.defaults() : priorityWeights;
        lease = lease == null ? LeaseConfig.disabled() : lease;
    }

    /**
     * Default configuration for testing.
     */
    public static ScanQueueConfig defaults() {
        return new ScanQueueConfig("scanq", QueueConfig.defaults(), PriorityWeights.defaults(),
                LeaseConfig.disabled());
    }
}
