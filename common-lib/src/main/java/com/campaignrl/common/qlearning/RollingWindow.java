package com.campaignrl.common.qlearning;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-size window of the most recent samples. Thread-safe.
 */
final class RollingWindow {

    private final Deque<Double> samples = new ArrayDeque<>();
    private final int capacity;

    RollingWindow(int capacity) {
        this.capacity = capacity;
    }

    synchronized void add(double value) {
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(value);
    }

    synchronized double mean() {
        return samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    synchronized double max() {
        return samples.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }
}
