package com.ulio.drift.testutil;

import com.ulio.drift.telemetry.SampleSet;
import com.ulio.drift.telemetry.SystemMetricsSource;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Replays queued values; once the queue is drained it keeps returning the last set.
 */
public class QueuedSampleSource implements SystemMetricsSource {
    private final Deque<Map<String, Double>> queue = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private Map<String, Double> last = Map.of();

    public synchronized QueuedSampleSource then(Map<String, Double> values) {
        queue.addLast(values);
        return this;
    }

    @Override
    public synchronized SampleSet collect() {
        calls.incrementAndGet();
        if (!queue.isEmpty()) {
            last = queue.removeFirst();
        }
        return new SampleSet(Instant.now(), last);
    }

    public int getCalls() {
        return calls.get();
    }
}
