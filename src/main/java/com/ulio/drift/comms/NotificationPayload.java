package com.ulio.drift.comms;

import com.ulio.drift.anomaly.AnomalyEvent;
import com.ulio.drift.anomaly.RecoveryTransition;
import com.ulio.drift.anomaly.Severity;

import java.time.Instant;

public class NotificationPayload {
    public static final int COLOR_MEDIUM = 0xFFFF00;
    public static final int COLOR_HIGH = 0xFF0000;
    public static final int COLOR_RECOVERED = 0x2ECC71;

    static final String ALERT_TITLE = "Anomaly Detected";
    static final String RECOVERY_TITLE = "Metric Recovered";

    private final NotificationKind kind;
    private final String title;
    private final int color;
    private final String metric;
    private final double value;
    private final Severity severity;
    private final int duration;
    private final String algorithm;
    private final Double score;
    private final Instant timestamp;

    private NotificationPayload(
            NotificationKind kind,
            String title,
            int color,
            String metric,
            double value,
            Severity severity,
            int duration,
            String algorithm,
            Double score,
            Instant timestamp
    ) {
        this.kind = kind;
        this.title = title;
        this.color = color;
        this.metric = metric;
        this.value = value;
        this.severity = severity;
        this.duration = duration;
        this.algorithm = algorithm;
        this.score = score;
        this.timestamp = timestamp;
    }

    public static NotificationPayload alert(AnomalyEvent event) {
        Severity severity = event.getSeverity() == null ? Severity.MEDIUM : event.getSeverity();
        return new NotificationPayload(
                NotificationKind.ALERT,
                ALERT_TITLE,
                severity == Severity.HIGH ? COLOR_HIGH : COLOR_MEDIUM,
                event.getMetric(),
                event.getValue(),
                severity,
                event.getConsecutiveCount(),
                event.getAlgorithm() == null ? "Unknown" : event.getAlgorithm().name(),
                event.getScore(),
                event.getTimestamp() == null ? Instant.now() : event.getTimestamp()
        );
    }

    public static NotificationPayload recovery(RecoveryTransition transition, Instant timestamp) {
        return new NotificationPayload(
                NotificationKind.RECOVERY,
                RECOVERY_TITLE,
                COLOR_RECOVERED,
                transition.getMetric(),
                transition.getLastAnomalousValue(),
                null,
                transition.getEpisodeLength(),
                null,
                null,
                timestamp
        );
    }

    public NotificationKind getKind() {
        return kind;
    }

    public String getTitle() {
        return title;
    }

    public int getColor() {
        return color;
    }

    public String getMetric() {
        return metric;
    }

    /**
     * Anomalous value for an alert, the last anomalous value for a recovery.
     */
    public double getValue() {
        return value;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getDuration() {
        return duration;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public Double getScore() {
        return score;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
