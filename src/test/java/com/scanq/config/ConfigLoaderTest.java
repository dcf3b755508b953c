package com.scanq.config;

import com.scanq.core.LibraryId;
import com.scanq.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for YAML configuration loading.
 */
class ConfigLoaderTest {

    private static final LibraryId MOVIES = LibraryId.parse("7d9f3c52-6b1e-4a8e-9c0f-2f4b5d6e7a81");
    private static final LibraryId SHOWS = LibraryId.parse("0b6a1e2d-3c4f-4a5b-8c7d-9e0f1a2b3c4d");

    @Test
    @DisplayName("Loads a full configuration from the classpath")
    void loadsFullConfiguration() {
        ScanQueueConfig config = ConfigLoader.load("classpath:scanq-test.yaml");

        assertEquals("test-scan", config.name());
        assertEquals(2, config.queue().defaultLibraryCap());
        assertEquals(1, config.queue().defaultLibraryWeight());
        assertEquals(2, config.queue().libraryOverrides().size());
        assertEquals(LibraryPolicy.of(8, 3), config.queue().policyFor(MOVIES));
        assertEquals(new LibraryPolicy(null, 2), config.queue().policyFor(SHOWS));
        assertEquals(new PriorityWeights(4, 2, 0, 1), config.priorityWeights());
        assertEquals(30000, config.lease().reservationTtlMs());
        assertEquals(500, config.lease().sweepIntervalMs());
        assertTrue(config.lease().enabled());
    }

    @Test
    @DisplayName("Bundled default configuration keeps reservations forever")
    void loadsBundledDefaults() {
        ScanQueueConfig config = ConfigLoader.load("classpath:scanq.yaml");

        assertEquals(4, config.queue().defaultLibraryCap());
        assertEquals(PriorityWeights.defaults(), config.priorityWeights());
        assertFalse(config.lease().enabled());
    }

    @Test
    @DisplayName("Missing sections fall back to defaults")
    void minimalConfigurationUsesDefaults() {
        ScanQueueConfig config = ConfigLoader.load("classpath:scanq-minimal.yaml");

        assertEquals("minimal", config.name());
        assertEquals(QueueConfig.defaults(), config.queue());
        assertEquals(PriorityWeights.defaults(), config.priorityWeights());
        assertEquals(LeaseConfig.disabled(), config.lease());
        assertEquals(LibraryPolicy.inherit(), config.queue().policyFor(LibraryId.random()));
    }

    @ParameterizedTest
    @DisplayName("Invalid configuration fails fast")
    @CsvSource({
            "classpath:scanq-bad-library.yaml",
            "classpath:scanq-negative.yaml",
            "classpath:scanq-duplicate.yaml",
            "classpath:scanq-empty.yaml",
            "classpath:does-not-exist.yaml"
    })
    void invalidConfigurationThrows(String path) {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(path));
    }

    @Test
    @DisplayName("TTL without a sweep interval is rejected")
    void ttlRequiresInterval() {
        String yaml = """
                lease:
                  reservation-ttl-ms: 1000
                  sweep-interval-ms: 0
                """;

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains("sweep-interval-ms"));
    }

    @Test
    @DisplayName("Non-numeric values are reported with their key")
    void nonNumericValue() {
        String yaml = """
                scanq:
                  priority-weights:
                    p1: lots
                """;

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains("p1"));
    }

    @ParameterizedTest
    @DisplayName("Numbers that do not fit an int field are rejected, not truncated")
    @CsvSource({
            "'max-inflight: 5000000000', max-inflight",
            "'max-inflight: 2.5', max-inflight",
            "'weight: 1.0e3', weight"
    })
    void numbersAreNotNarrowed(String field, String key) {
        String yaml = """
                queue:
                  library-overrides:
                    - library-id: 7d9f3c52-6b1e-4a8e-9c0f-2f4b5d6e7a81
                      %s
                """.formatted(field);

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains(key));
    }

    @Test
    @DisplayName("Fractional lease durations are rejected")
    void fractionalLeaseTtl() {
        String yaml = """
                lease:
                  reservation-ttl-ms: 1500.5
                """;

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains("reservation-ttl-ms"));
    }

    @Test
    @DisplayName("Priority keys are case-insensitive and unknown ones are rejected")
    void priorityKeys() {
        String yaml = """
                priority-weights:
                  P0: 5
                  p3: 2
                """;
        ScanQueueConfig config = ConfigLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        assertEquals(new PriorityWeights(5, 2, 1, 2), config.priorityWeights());

        String unknown = """
                priority-weights:
                  p7: 1
                """;
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parse(new ByteArrayInputStream(unknown.getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains("p7"));
    }

    @Test
    @DisplayName("Negative priority weights are rejected")
    void negativePriorityWeights() {
        assertThrows(ConfigurationException.class, () -> new PriorityWeights(1, -1, 1, 1));
    }

    @Test
    @DisplayName("Override map is copied at construction")
    void overridesAreCopied() {
        Map<LibraryId, LibraryPolicy> overrides = new HashMap<>();
        overrides.put(MOVIES, LibraryPolicy.of(2, 2));
        QueueConfig queue = new QueueConfig(1, 1, overrides);

        overrides.put(SHOWS, LibraryPolicy.of(9, 9));

        assertEquals(1, queue.libraryOverrides().size());
        assertEquals(LibraryPolicy.inherit(), queue.policyFor(SHOWS));
    }
}
