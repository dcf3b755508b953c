package com.scanq.config;

/**
 * Per-library override of the queue defaults.
 * A null field means "use the configured default".
 *
 * @param maxInflight Maximum reserved + running jobs for the library
 * @param weight      Fair-share weight among libraries in the same priority class
 */
public record LibraryPolicy(
        Integer maxInflight,
        Integer weight
) {
    public static LibraryPolicy inherit() {
        return new LibraryPolicy(null, null);
    }

    public static LibraryPolicy of(int maxInflight, int weight) {
        return new LibraryPolicy(maxInflight, weight);
    }
}
