package com.ulio.drift.comms;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

final class NotifierState {
    private boolean inAlarm;
    private boolean recoverySent;
    private final Deque<Instant> sentTimestamps = new ArrayDeque<>();

    boolean isInAlarm() {
        return inAlarm;
    }

    boolean isRecoverySent() {
        return recoverySent;
    }

    void enterAlarm() {
        inAlarm = true;
        recoverySent = false;
    }

    void leaveAlarm(boolean notified) {
        inAlarm = false;
        recoverySent = notified;
    }

    /**
     * Drops timestamps that are not after {@code windowStart} and returns how many remain.
     */
    int prune(Instant windowStart) {
        while (!sentTimestamps.isEmpty() && !sentTimestamps.peekFirst().isAfter(windowStart)) {
            sentTimestamps.removeFirst();
        }
        return sentTimestamps.size();
    }

    void recordSent(Instant timestamp) {
        sentTimestamps.addLast(timestamp);
    }
}
