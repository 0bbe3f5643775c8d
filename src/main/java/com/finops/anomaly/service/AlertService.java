package com.finops.anomaly.service;

import com.finops.anomaly.alert.AlertChannelManager;
import com.finops.anomaly.alert.AlertChannelRegistry;
import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.DeliveryOutcome;
import com.finops.anomaly.alert.DeliveryReport;
import com.finops.anomaly.config.MetricsConfig;
import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.model.AlertData;
import com.finops.anomaly.model.AlertRequest;
import com.finops.anomaly.model.AlertResponse;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class AlertService {

    private final AlertChannelRegistry channelRegistry;
    private final AlertChannelManager channelManager;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertService(AlertChannelRegistry channelRegistry,
                        AlertChannelManager channelManager,
                        MetricsConfig metricsConfig,
                        Clock clock) {
        this.channelRegistry = channelRegistry;
        this.channelManager = channelManager;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Delivers the alert to every named channel. Channel failures are part of the response,
     * only a malformed request throws.
     */
    @Observed(name = "alert.send", contextualName = "send-alert")
    public AlertResponse send(AlertRequest request) {
        AlertData alert = validate(request);
        // Duplicate names would be delivered twice but reported once
        Set<String> channelNames = new LinkedHashSet<>(request.getChannels());
        DeliveryReport report = deliver(alert, List.copyOf(channelNames));

        Map<String, AlertResponse.ChannelResult> results = new LinkedHashMap<>();
        for (DeliveryOutcome outcome : report.getOutcomes()) {
            results.put(outcome.getChannel(), AlertResponse.ChannelResult.builder()
                    .status(outcome.getStatus().wireName())
                    .error(outcome.getErrorDetail())
                    .build());
        }

        return AlertResponse.builder()
                .alertId(report.getAlertId())
                .alertsSent(report.successCount())
                .slaMet(report.isSlaMet())
                .overallElapsedMs(report.getOverallElapsed().toMillis())
                .channelResults(results)
                .build();
    }

    /**
     * Sends to already validated channel names and records delivery metrics.
     */
    public DeliveryReport deliver(AlertData alert, List<String> channelNames) {
        if (alert.getTimestamp() == null) {
            alert.setTimestamp(clock.instant());
        }
        List<AlertChannelTarget> targets = channelRegistry.resolve(channelNames);
        DeliveryReport report = channelManager.send(alert, targets);

        for (DeliveryOutcome outcome : report.getOutcomes()) {
            metricsConfig.recordDelivery(outcome.getChannel(), outcome.getStatus().wireName());
        }
        metricsConfig.recordAlertSend(report.getOverallElapsed(), report.isSlaMet());
        return report;
    }

    private static AlertData validate(AlertRequest request) {
        if (request == null || request.getAlertData() == null) {
            throw new ValidationException("alert_data is required", "alert_data");
        }
        AlertData alert = request.getAlertData();
        if (alert.getTitle() == null || alert.getTitle().isBlank()) {
            throw new ValidationException("alert_data.title is required", "alert_data.title");
        }
        if (alert.getSeverity() == null) {
            throw new ValidationException("alert_data.severity is required", "alert_data.severity");
        }
        if (request.getChannels() == null || request.getChannels().isEmpty()) {
            throw new ValidationException("channels must name at least one channel", "channels");
        }
        for (String channel : request.getChannels()) {
            if (channel == null || channel.isBlank()) {
                throw new ValidationException("channel names must not be blank", "channels");
            }
        }
        return alert;
    }
}
