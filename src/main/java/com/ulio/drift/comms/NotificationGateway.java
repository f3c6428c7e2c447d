package com.ulio.drift.comms;

import com.ulio.drift.anomaly.AnomalyEvent;
import com.ulio.drift.anomaly.RecoveryTransition;
import com.ulio.drift.exception.NotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Alert-then-recover lifecycle per metric.
 *
 * <p>Each metric is either NORMAL or ALARMED. One alert is sent when a metric enters
 * ALARMED and one recovery when it leaves; repeated sustained cycles in between are
 * deduplicated. Both kinds of notification share a per-metric allowance of
 * {@code rateLimitPerHour} over a sliding one-hour window. Attempts over the allowance
 * are dropped, not queued.
 *
 * <p>Not thread-safe; the monitor calls it under its lock.
 */
public class NotificationGateway {
    private static final Logger LOG = LoggerFactory.getLogger(NotificationGateway.class);

    static final Duration RATE_LIMIT_WINDOW = Duration.ofHours(1);
    public static final int DEFAULT_RATE_LIMIT_PER_HOUR = 10;

    private final NotificationTransport transport;
    private final int rateLimitPerHour;
    private final boolean recoveryEnabled;
    private final Clock clock;
    private final Map<String, NotifierState> states = new HashMap<>();

    public NotificationGateway(NotificationTransport transport, int rateLimitPerHour, boolean recoveryEnabled,
            Clock clock) {
        if (transport == null) {
            throw new IllegalArgumentException("transport is null");
        }
        this.transport = transport;
        this.rateLimitPerHour = rateLimitPerHour > 0 ? rateLimitPerHour : DEFAULT_RATE_LIMIT_PER_HOUR;
        this.recoveryEnabled = recoveryEnabled;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public DeliveryStatus alert(AnomalyEvent event) {
        NotifierState state = stateFor(event.getMetric());
        if (state.isInAlarm()) {
            return DeliveryStatus.NOT_APPLICABLE;
        }

        Instant now = clock.instant();
        if (isRateLimited(state, now)) {
            LOG.warn("Rate limited alert for metric {}", event.getMetric());
            return DeliveryStatus.RATE_LIMITED;
        }

        DeliveryStatus status = dispatch(NotificationPayload.alert(event));
        if (status.delivered()) {
            state.recordSent(now);
            state.enterAlarm();
        }
        return status;
    }

    public DeliveryStatus recover(RecoveryTransition transition) {
        String metric = transition.getMetric();
        NotifierState state = states.get(metric);
        if (state == null || !state.isInAlarm() || state.isRecoverySent()) {
            return DeliveryStatus.NOT_APPLICABLE;
        }

        if (!recoveryEnabled) {
            state.leaveAlarm(false);
            LOG.debug("Metric {} recovered, recovery notifications disabled", metric);
            return DeliveryStatus.NOT_APPLICABLE;
        }

        Instant now = clock.instant();
        if (isRateLimited(state, now)) {
            LOG.warn("Rate limited recovery for metric {}", metric);
            return DeliveryStatus.RATE_LIMITED;
        }

        DeliveryStatus status = dispatch(NotificationPayload.recovery(transition, now));
        if (status.delivered()) {
            state.recordSent(now);
            state.leaveAlarm(true);
        }
        return status;
    }

    public boolean isAlarmed(String metric) {
        NotifierState state = states.get(metric);
        return state != null && state.isInAlarm();
    }

    public boolean isRecoverySent(String metric) {
        NotifierState state = states.get(metric);
        return state != null && state.isRecoverySent();
    }

    /**
     * Notifications counted against {@code metric}'s allowance inside the current window.
     */
    public int getSentInWindow(String metric) {
        NotifierState state = states.get(metric);
        if (state == null) {
            return 0;
        }
        return state.prune(clock.instant().minus(RATE_LIMIT_WINDOW));
    }

    public int getRateLimitPerHour() {
        return rateLimitPerHour;
    }

    public boolean isRecoveryEnabled() {
        return recoveryEnabled;
    }

    public void reset() {
        states.clear();
    }

    private boolean isRateLimited(NotifierState state, Instant now) {
        return state.prune(now.minus(RATE_LIMIT_WINDOW)) >= rateLimitPerHour;
    }

    private DeliveryStatus dispatch(NotificationPayload payload) {
        try {
            transport.send(payload);
            LOG.info("Sent {} notification for metric {}", payload.getKind(), payload.getMetric());
            return DeliveryStatus.DELIVERED;
        } catch (NotificationException e) {
            LOG.error("Failed to send {} notification for metric {}: {}",
                    payload.getKind(), payload.getMetric(), e.getMessage());
            return DeliveryStatus.FAILED;
        } catch (Throwable e) {
            LOG.error("Notification transport crashed for metric {}", payload.getMetric(), e);
            return DeliveryStatus.FAILED;
        }
    }

    private NotifierState stateFor(String metric) {
        return states.computeIfAbsent(metric, ignored -> new NotifierState());
    }
}
