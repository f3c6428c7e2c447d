package com.ulio.drift.comms;

import com.ulio.drift.anomaly.Severity;
import com.ulio.drift.testutil.MutableClock;
import com.ulio.drift.testutil.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.ulio.drift.testutil.TestFactory.T0;
import static com.ulio.drift.testutil.TestFactory.event;
import static com.ulio.drift.testutil.TestFactory.recovery;
import static org.assertj.core.api.Assertions.assertThat;

public class NotificationGatewayTest {

    private static final String CPU = "cpu_percent";

    private RecordingTransport transport;
    private MutableClock clock;

    @BeforeEach
    public void setUp() {
        transport = new RecordingTransport();
        clock = new MutableClock(T0);
    }

    @Test
    public void testFirstSustainedEventAlarmsAndSendsAlert() {
        NotificationGateway gateway = new NotificationGateway(transport, 10, true, clock);

        DeliveryStatus status = gateway.alert(event(CPU, Severity.HIGH, 7));

        assertThat(status).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(gateway.isAlarmed(CPU)).isTrue();
        assertThat(transport.getSent()).hasSize(1);
        NotificationPayload payload = transport.getSent().get(0);
        assertThat(payload.getKind()).isEqualTo(NotificationKind.ALERT);
        assertThat(payload.getTitle()).isEqualTo("Anomaly Detected");
        assertThat(payload.getColor()).isEqualTo(NotificationPayload.COLOR_HIGH);
        assertThat(payload.getDuration()).isEqualTo(7);
        assertThat(payload.getAlgorithm()).isEqualTo("CUMSUM");
    }

    @Test
    public void testRepeatedSustainedEventsInSameEpisodeAreDeduplicated() {
        NotificationGateway gateway = new NotificationGateway(transport, 10, true, clock);
        gateway.alert(event(CPU));

        assertThat(gateway.alert(event(CPU))).isEqualTo(DeliveryStatus.NOT_APPLICABLE);
        assertThat(gateway.alert(event(CPU, Severity.HIGH, 9))).isEqualTo(DeliveryStatus.NOT_APPLICABLE);
        assertThat(transport.getAttempts()).isEqualTo(1);
    }

    @Test
    public void testRecoveryAfterAlarmSendsOnce() {
        NotificationGateway gateway = new NotificationGateway(transport, 10, true, clock);
        gateway.alert(event(CPU));

        assertThat(gateway.recover(recovery(CPU))).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(gateway.isAlarmed(CPU)).isFalse();
        assertThat(gateway.isRecoverySent(CPU)).isTrue();

        // same episode, no new alarm in between
        assertThat(gateway.recover(recovery(CPU))).isEqualTo(DeliveryStatus.NOT_APPLICABLE);

        assertThat(transport.getSent(NotificationKind.RECOVERY)).hasSize(1);
        NotificationPayload payload = transport.getSent(NotificationKind.RECOVERY).get(0);
        assertThat(payload.getTitle()).isEqualTo("Metric Recovered");
        assertThat(payload.getColor()).isEqualTo(NotificationPayload.COLOR_RECOVERED);
        assertThat(payload.getValue()).isEqualTo(95.0);
    }

    @Test
    public void testRecoveryForMetricNeverAlarmedIsNotApplicable() {
        NotificationGateway gateway = new NotificationGateway(transport, 10, true, clock);

        assertThat(gateway.recover(recovery(CPU))).isEqualTo(DeliveryStatus.NOT_APPLICABLE);
        assertThat(transport.getAttempts()).isZero();
    }

    @Test
    public void testNewEpisodeAlertsAgainAfterRecovery() {
        NotificationGateway gateway = new NotificationGateway(transport, 10, true, clock);
        gateway.alert(event(CPU));
        gateway.recover(recovery(CPU));

        assertThat(gateway.alert(event(CPU))).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(gateway.isRecoverySent(CPU)).isFalse();
        assertThat(transport.getSent(NotificationKind.ALERT)).hasSize(2);
    }

    /**
     * With a limit of two per hour the third alert is dropped, and the fourth goes out
     * once the oldest one has left the window.
     */
    @Test
    public void testAlertsBeyondHourlyLimitAreDropped() {
        NotificationGateway gateway = new NotificationGateway(transport, 2, false, clock);

        assertThat(gateway.alert(event(CPU)).delivered()).isTrue();
        gateway.recover(recovery(CPU));

        clock.advance(Duration.ofMinutes(10));
        assertThat(gateway.alert(event(CPU)).delivered()).isTrue();
        gateway.recover(recovery(CPU));

        clock.advance(Duration.ofMinutes(10));
        assertThat(gateway.alert(event(CPU))).isEqualTo(DeliveryStatus.RATE_LIMITED);
        assertThat(gateway.isAlarmed(CPU)).isFalse();

        clock.advance(Duration.ofMinutes(41));
        assertThat(gateway.alert(event(CPU)).delivered()).isTrue();
        assertThat(gateway.getSentInWindow(CPU)).isEqualTo(2);
        assertThat(transport.getSent()).hasSize(3);
    }

    @Test
    public void testRateLimitIsPerMetric() {
        NotificationGateway gateway = new NotificationGateway(transport, 1, true, clock);
        gateway.alert(event(CPU));

        assertThat(gateway.alert(event("ram_percent"))).isEqualTo(DeliveryStatus.DELIVERED);
    }

    @Test
    public void testRateLimitedRecoveryKeepsMetricAlarmed() {
        NotificationGateway gateway = new NotificationGateway(transport, 1, true, clock);
        gateway.alert(event(CPU));

        assertThat(gateway.recover(recovery(CPU))).isEqualTo(DeliveryStatus.RATE_LIMITED);
        assertThat(gateway.isAlarmed(CPU)).isTrue();

        clock.advance(Duration.ofMinutes(61));
        assertThat(gateway.recover(recovery(CPU))).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(gateway.isAlarmed(CPU)).isFalse();
    }

    @Test
    public void testDisabledRecoveryReturnsToNormalSilently() {
        NotificationGateway gateway = new NotificationGateway(transport, 10, false, clock);
        gateway.alert(event(CPU));

        assertThat(gateway.recover(recovery(CPU))).isEqualTo(DeliveryStatus.NOT_APPLICABLE);
        assertThat(gateway.isAlarmed(CPU)).isFalse();
        assertThat(transport.getSent(NotificationKind.RECOVERY)).isEmpty();
        assertThat(gateway.getSentInWindow(CPU)).isEqualTo(1);
    }

    @Test
    public void testTransportFailureLeavesStateUntouched() {
        NotificationGateway gateway = new NotificationGateway(transport, 10, true, clock);
        transport.setFailing(true);

        assertThat(gateway.alert(event(CPU))).isEqualTo(DeliveryStatus.FAILED);
        assertThat(gateway.isAlarmed(CPU)).isFalse();
        assertThat(gateway.getSentInWindow(CPU)).isZero();

        transport.setFailing(false);
        assertThat(gateway.alert(event(CPU))).isEqualTo(DeliveryStatus.DELIVERED);

        transport.setFailing(true);
        assertThat(gateway.recover(recovery(CPU))).isEqualTo(DeliveryStatus.FAILED);
        assertThat(gateway.isAlarmed(CPU)).isTrue();
        assertThat(gateway.isRecoverySent(CPU)).isFalse();
        assertThat(gateway.getSentInWindow(CPU)).isEqualTo(1);
    }

    @Test
    public void testResetForgetsAlarmsAndRateLimits() {
        NotificationGateway gateway = new NotificationGateway(transport, 1, true, clock);
        gateway.alert(event(CPU));

        gateway.reset();

        assertThat(gateway.isAlarmed(CPU)).isFalse();
        assertThat(gateway.alert(event(CPU))).isEqualTo(DeliveryStatus.DELIVERED);
    }

    @Test
    public void testTransportThrowingErrorIsReportedAsFailure() {
        NotificationTransport crashing = payload -> {
            throw new AssertionError("boom");
        };
        NotificationGateway gateway = new NotificationGateway(crashing, 10, true, clock);

        assertThat(gateway.alert(event(CPU))).isEqualTo(DeliveryStatus.FAILED);
        assertThat(gateway.isAlarmed(CPU)).isFalse();
        assertThat(gateway.getSentInWindow(CPU)).isZero();
    }
}
