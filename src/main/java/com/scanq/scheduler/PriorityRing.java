package com.scanq.scheduler;

import com.scanq.config.PriorityWeights;
import com.scanq.core.JobPriority;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Round-robin sequence of priority classes built once from {@link PriorityWeights}.
 * <p>
 * Each priority appears max(1, weight) times, in order P0, P1, P2, P3.
 * Weights {3,2,1,1} produce [P0,P0,P0,P1,P1,P2,P3]. The ring fixes how often a class
 * gets a turn, not how much work it gets: a class with nothing ready is skipped.
 */
public final class PriorityRing {

    private final List<JobPriority> slots;

    private PriorityRing(List<JobPriority> slots) {
        this.slots = Collections.unmodifiableList(slots);
    }

    public static PriorityRing fromWeights(PriorityWeights weights) {
        List<JobPriority> slots = new ArrayList<>();
        for (JobPriority priority : JobPriority.values()) {
            int copies = Math.max(1, priority.weight(weights));
            for (int i = 0; i < copies; i++) {
                slots.add(priority);
            }
        }
        return new PriorityRing(slots);
    }

    public JobPriority get(int index) {
        return slots.get(index);
    }

    public int size() {
        return slots.size();
    }

    public List<JobPriority> slots() {
        return slots;
    }

    @Override
    public String toString() {
        return "PriorityRing" + slots;
    }
}
