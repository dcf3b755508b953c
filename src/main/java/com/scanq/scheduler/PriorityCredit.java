package com.scanq.scheduler;

/**
 * Ready count and fair-queueing credit of one (library, priority) pair.
 * Not thread-safe; only touched under the scheduler lock.
 */
final class PriorityCredit {

    private long ready;
    private long credit;

    long ready() {
        return ready;
    }

    long credit() {
        return credit;
    }

    void addReady(long count) {
        ready = count > Long.MAX_VALUE - ready ? Long.MAX_VALUE : ready + count;
    }

    void takeReady() {
        if (ready > 0) {
            ready--;
        }
    }

    void accrue(long amount) {
        credit += amount;
    }

    void charge(long amount) {
        credit -= amount;
    }

    CreditSnapshot snapshot() {
        return new CreditSnapshot(ready, credit);
    }
}
