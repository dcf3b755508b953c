package com.scanq.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of a media library (content collection) producing scan work.
 *
 * @param value underlying UUID
 */
public record LibraryId(UUID value) {

    public LibraryId {
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static LibraryId random() {
        return new LibraryId(UUID.randomUUID());
    }

    public static LibraryId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Library id cannot be null or blank");
        }
        return new LibraryId(UUID.fromString(text.trim()));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
