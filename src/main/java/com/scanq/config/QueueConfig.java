package com.scanq.config;

import com.scanq.core.LibraryId;

import java.util.Map;

/**
 * Per-library admission defaults and overrides.
 *
 * @param defaultLibraryCap    In-flight cap for libraries without an override
 * @param defaultLibraryWeight Weight for libraries without an override
 * @param libraryOverrides     Policies for specific libraries
 */
public record QueueConfig(
        int defaultLibraryCap,
        int defaultLibraryWeight,
        Map<LibraryId, LibraryPolicy> libraryOverrides
) {
    public QueueConfig {
        libraryOverrides = libraryOverrides == null ? Map.of() : Map.copyOf(libraryOverrides);
    }

    public static QueueConfig defaults() {
        return new QueueConfig(1, 1, Map.of());
    }

    /**
     * Override for a library, or {@link LibraryPolicy#inherit()} when none is configured.
     */
    public LibraryPolicy policyFor(LibraryId library) {
        return libraryOverrides.getOrDefault(library, LibraryPolicy.inherit());
    }
}
