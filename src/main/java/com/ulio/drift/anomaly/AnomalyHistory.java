package com.ulio.drift.anomaly;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Most recent results that contained sustained anomalies, oldest evicted first.
 */
public class AnomalyHistory {
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<CheckResult> results = new ArrayDeque<>();

    public AnomalyHistory(int capacity) {
        this.capacity = capacity > 0 ? capacity : DEFAULT_CAPACITY;
    }

    public void append(CheckResult result) {
        if (result == null) {
            return;
        }
        results.addLast(result);
        while (results.size() > capacity) {
            results.removeFirst();
        }
    }

    public List<CheckResult> snapshot() {
        return new ArrayList<>(results);
    }

    public int size() {
        return results.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        results.clear();
    }
}
