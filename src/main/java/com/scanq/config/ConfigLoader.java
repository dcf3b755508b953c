package com.scanq.config;

import com.scanq.core.JobPriority;
import com.scanq.core.LibraryId;
import com.scanq.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads scheduler configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ScanQueueConfig load(String path) {
        log.info("Loading scan queue configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     * The scheduler section may sit at the root or under a 'scanq' key.
     */
    @SuppressWarnings("unchecked")
    public static ScanQueueConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        Map<String, Object> section = root.containsKey("scanq")
                ? (Map<String, Object>) root.get("scanq")
                : root;
        if (section == null) {
            throw new ConfigurationException("Configuration section 'scanq' is empty");
        }

        String name = getString(section, "name", "scanq");
        QueueConfig queue = parseQueueConfig((Map<String, Object>) section.get("queue"));
        PriorityWeights weights = parsePriorityWeights((Map<String, Object>) section.get("priority-weights"));
        LeaseConfig lease = parseLeaseConfig((Map<String, Object>) section.get("lease"));

        ScanQueueConfig config = new ScanQueueConfig(name, queue, weights, lease);

        log.info("Loaded scan queue configuration '{}': defaultCap={}, defaultWeight={}, {} overrides, weights={}, leaseTtlMs={}",
                name, queue.defaultLibraryCap(), queue.defaultLibraryWeight(),
                queue.libraryOverrides().size(), weights, lease.reservationTtlMs());

        return config;
    }

    @SuppressWarnings("unchecked")
    private static QueueConfig parseQueueConfig(Map<String, Object> map) {
        if (map == null) {
            return QueueConfig.defaults();
        }

        int defaultCap = getNonNegativeInt(map, "default-library-cap", 1);
        int defaultWeight = getNonNegativeInt(map, "default-library-weight", 1);

        Map<LibraryId, LibraryPolicy> overrides = new LinkedHashMap<>();
        List<Map<String, Object>> overrideList = (List<Map<String, Object>>) map.get("library-overrides");
        if (overrideList != null) {
            for (int i = 0; i < overrideList.size(); i++) {
                Map<String, Object> entry = overrideList.get(i);
                LibraryId library = parseLibraryId(entry, i);
                Integer maxInflight = getOptionalNonNegativeInt(entry, "max-inflight");
                Integer weight = getOptionalNonNegativeInt(entry, "weight");
                if (overrides.putIfAbsent(library, new LibraryPolicy(maxInflight, weight)) != null) {
                    throw new ConfigurationException("Duplicate library override for '" + library + "'");
                }
                log.debug("Parsed library override: library={}, maxInflight={}, weight={}",
                        library, maxInflight, weight);
            }
        }

        return new QueueConfig(defaultCap, defaultWeight, overrides);
    }

    private static LibraryId parseLibraryId(Map<String, Object> entry, int index) {
        String raw = getString(entry, "library-id", null);
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Library override " + index + " is missing 'library-id'");
        }
        try {
            return LibraryId.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Library override " + index + " has invalid library-id '" + raw + "'", e);
        }
    }

    private static PriorityWeights parsePriorityWeights(Map<String, Object> map) {
        if (map == null) {
            return PriorityWeights.defaults();
        }
        PriorityWeights defaults = PriorityWeights.defaults();
        Map<JobPriority, Integer> weights = new EnumMap<>(JobPriority.class);
        for (JobPriority priority : JobPriority.values()) {
            weights.put(priority, priority.weight(defaults));
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) map).entrySet()) {
            String key = String.valueOf(entry.getKey());
            JobPriority priority;
            try {
                priority = JobPriority.fromString(key);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown priority in priority-weights: '" + key + "'", e);
            }
            if (entry.getValue() != null) {
                weights.put(priority, parseNonNegativeInt(key, entry.getValue()));
            }
        }
        return new PriorityWeights(
                weights.get(JobPriority.P0),
                weights.get(JobPriority.P1),
                weights.get(JobPriority.P2),
                weights.get(JobPriority.P3)
        );
    }

    private static LeaseConfig parseLeaseConfig(Map<String, Object> map) {
        if (map == null) {
            return LeaseConfig.disabled();
        }
        long ttl = getNonNegativeLong(map, "reservation-ttl-ms", 0);
        long interval = getNonNegativeLong(map, "sweep-interval-ms", 1000);
        if (ttl > 0 && interval == 0) {
            throw new ConfigurationException("lease.sweep-interval-ms must be positive when a reservation TTL is set");
        }
        return new LeaseConfig(ttl, interval);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getNonNegativeInt(Map<String, Object> map, String key, int defaultValue) {
        Integer value = getOptionalNonNegativeInt(map, key);
        return value != null ? value : defaultValue;
    }

    private static Integer getOptionalNonNegativeInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? parseNonNegativeInt(key, value) : null;
    }

    private static int parseNonNegativeInt(String key, Object value) {
        long parsed = parseNonNegativeLong(key, value);
        if (parsed > Integer.MAX_VALUE) {
            throw new ConfigurationException("'" + key + "' is out of range: " + value);
        }
        return (int) parsed;
    }

    private static long getNonNegativeLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        return value != null ? parseNonNegativeLong(key, value) : defaultValue;
    }

    private static long parseNonNegativeLong(String key, Object value) {
        long parsed;
        if (value instanceof Integer || value instanceof Long) {
            parsed = ((Number) value).longValue();
        } else if (value instanceof Number) {
            // Fractions and values beyond a long
            throw new ConfigurationException("'" + key + "' is not an integer: " + value);
        } else {
            try {
                parsed = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("'" + key + "' is not an integer: " + value, e);
            }
        }
        if (parsed < 0) {
            throw new ConfigurationException("'" + key + "' cannot be negative: " + parsed);
        }
        return parsed;
    }
}
