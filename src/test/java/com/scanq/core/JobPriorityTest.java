package com.scanq.core;

import com.scanq.config.PriorityWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class JobPriorityTest {

    @ParameterizedTest
    @DisplayName("Elevate keeps the more urgent priority")
    @CsvSource({
            "P2, P0, P0",
            "P0, P3, P0",
            "P1, P1, P1",
            "P3, P2, P2"
    })
    void elevate(JobPriority current, JobPriority target, JobPriority expected) {
        assertEquals(expected, current.elevate(target));
    }

    @Test
    @DisplayName("Weight reads the matching ring weight")
    void weight() {
        PriorityWeights weights = new PriorityWeights(5, 4, 3, 2);

        assertEquals(5, JobPriority.P0.weight(weights));
        assertEquals(4, JobPriority.P1.weight(weights));
        assertEquals(3, JobPriority.P2.weight(weights));
        assertEquals(2, JobPriority.P3.weight(weights));
    }

    @ParameterizedTest
    @DisplayName("Parses configuration names")
    @CsvSource({"p0, P0", "P1, P1", " p3 , P3"})
    void fromString(String raw, JobPriority expected) {
        assertEquals(expected, JobPriority.fromString(raw));
    }

    @Test
    @DisplayName("Unknown names are rejected")
    void fromStringRejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> JobPriority.fromString("p9"));
        assertThrows(IllegalArgumentException.class, () -> JobPriority.fromString(" "));
    }
}
