package com.scanq.scheduler;

import com.scanq.config.LibraryPolicy;
import com.scanq.config.QueueConfig;
import com.scanq.core.LibraryId;

/**
 * Resolves the effective cap and weight of a library from {@link QueueConfig}.
 * Both are floored at 1. Resolution happens once, when the library state is created.
 */
final class PolicyResolver {

    private final int defaultCap;
    private final int defaultWeight;
    private final QueueConfig config;

    PolicyResolver(QueueConfig config) {
        this.config = config;
        this.defaultCap = Math.max(1, config.defaultLibraryCap());
        this.defaultWeight = Math.max(1, config.defaultLibraryWeight());
    }

    int capFor(LibraryId library) {
        LibraryPolicy policy = config.policyFor(library);
        int cap = policy.maxInflight() != null ? policy.maxInflight() : defaultCap;
        return Math.max(1, cap);
    }

    int weightFor(LibraryId library) {
        LibraryPolicy policy = config.policyFor(library);
        int weight = policy.weight() != null ? policy.weight() : defaultWeight;
        return Math.max(1, weight);
    }

    LibraryRuntimeState newState(LibraryId library) {
        return new LibraryRuntimeState(capFor(library), weightFor(library));
    }

    int defaultCap() {
        return defaultCap;
    }

    int defaultWeight() {
        return defaultWeight;
    }

    int overrideCount() {
        return config.libraryOverrides().size();
    }
}
