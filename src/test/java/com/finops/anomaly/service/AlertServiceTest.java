package com.finops.anomaly.service;

import com.finops.anomaly.alert.AlertChannelManager;
import com.finops.anomaly.alert.AlertChannelRegistry;
import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.ChannelType;
import com.finops.anomaly.alert.DeliveryOutcome;
import com.finops.anomaly.alert.DeliveryReport;
import com.finops.anomaly.alert.DeliveryStatus;
import com.finops.anomaly.config.MetricsConfig;
import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.model.AlertData;
import com.finops.anomaly.model.AlertRequest;
import com.finops.anomaly.model.AlertResponse;
import com.finops.anomaly.model.Severity;
import com.finops.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static com.finops.anomaly.testutil.TestDataFactory.MONDAY_10AM;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    @Mock private AlertChannelRegistry channelRegistry;
    @Mock private AlertChannelManager channelManager;
    @Mock private MetricsConfig metricsConfig;

    private AlertService alertService;

    @BeforeEach
    void setUp() {
        alertService = new AlertService(channelRegistry, channelManager, metricsConfig,
                Clock.fixed(MONDAY_10AM, ZoneOffset.UTC));
    }

    @Test
    void send_reportsPerChannelResults() {
        List<AlertChannelTarget> targets = List.of(
                TestDataFactory.target("slack", ChannelType.SLACK, "https://hooks.slack.test/T1"),
                AlertChannelTarget.builder().name("pagerduty").build());
        when(channelRegistry.resolve(anyList())).thenReturn(targets);
        when(channelManager.send(any(), eq(targets))).thenReturn(new DeliveryReport("alert-1", Duration.ofMillis(420),
                List.of(outcome("slack", DeliveryStatus.SUCCESS, null),
                        DeliveryOutcome.skipped(targets.get(1), "channel not configured")),
                true));

        AlertResponse response = alertService.send(request(List.of("slack", "pagerduty")));

        assertThat(response.getAlertId()).isEqualTo("alert-1");
        assertThat(response.getAlertsSent()).isEqualTo(1);
        assertThat(response.isSlaMet()).isTrue();
        assertThat(response.getOverallElapsedMs()).isEqualTo(420);
        assertThat(response.getChannelResults()).containsOnlyKeys("slack", "pagerduty");
        assertThat(response.getChannelResults().get("slack").getStatus()).isEqualTo("success");
        assertThat(response.getChannelResults().get("slack").getError()).isNull();
        assertThat(response.getChannelResults().get("pagerduty").getStatus()).isEqualTo("skipped");
        assertThat(response.getChannelResults().get("pagerduty").getError()).isEqualTo("channel not configured");

        verify(metricsConfig).recordDelivery("slack", "success");
        verify(metricsConfig).recordDelivery("pagerduty", "skipped");
        verify(metricsConfig).recordAlertSend(Duration.ofMillis(420), true);
    }

    @Test
    void send_duplicateChannelNames_deliveredOnce() {
        when(channelRegistry.resolve(anyList())).thenReturn(List.of());
        when(channelManager.send(any(), anyList()))
                .thenReturn(new DeliveryReport("alert-2", Duration.ZERO, List.of(), true));

        alertService.send(request(List.of("slack", "discord", "slack")));

        verify(channelRegistry).resolve(eq(List.of("slack", "discord")));
    }

    @Test
    void send_missingTimestamp_defaultsToNow() {
        when(channelRegistry.resolve(anyList())).thenReturn(List.of());
        when(channelManager.send(any(), anyList()))
                .thenReturn(new DeliveryReport("alert-3", Duration.ZERO, List.of(), true));
        AlertData alert = AlertData.builder().severity(Severity.INFO).title("Daily digest").build();

        alertService.send(AlertRequest.builder().alertData(alert).channels(List.of("slack")).build());

        ArgumentCaptor<AlertData> sent = ArgumentCaptor.forClass(AlertData.class);
        verify(channelManager).send(sent.capture(), anyList());
        assertThat(sent.getValue().getTimestamp()).isEqualTo(MONDAY_10AM);
    }

    @Test
    void send_invalidRequests_rejectedWithoutDelivery() {
        assertRejected(null, "alert_data");
        assertRejected(AlertRequest.builder().channels(List.of("slack")).build(), "alert_data");
        assertRejected(request(List.of()), "channels");
        assertRejected(request(Arrays.asList("slack", " ")), "channels");
        assertRejected(AlertRequest.builder()
                .alertData(AlertData.builder().severity(Severity.WARNING).build())
                .channels(List.of("slack")).build(), "alert_data.title");
        assertRejected(AlertRequest.builder()
                .alertData(AlertData.builder().title("No severity").build())
                .channels(List.of("slack")).build(), "alert_data.severity");

        verifyNoInteractions(channelRegistry, channelManager, metricsConfig);
    }

    private void assertRejected(AlertRequest request, String field) {
        assertThatThrownBy(() -> alertService.send(request))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo(field);
    }

    private static AlertRequest request(List<String> channels) {
        return AlertRequest.builder()
                .alertData(TestDataFactory.alert(Severity.WARNING, "Cost spike"))
                .channels(channels)
                .build();
    }

    private static DeliveryOutcome outcome(String channel, DeliveryStatus status, String error) {
        return DeliveryOutcome.builder()
                .channel(channel)
                .status(status)
                .elapsed(Duration.ofMillis(400))
                .attempts(1)
                .errorDetail(error)
                .build();
    }
}
