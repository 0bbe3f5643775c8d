package com.finops.anomaly.service;

import com.finops.anomaly.alert.DeliveryReport;
import com.finops.anomaly.config.AnomalyProperties;
import com.finops.anomaly.model.AlertData;
import com.finops.anomaly.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Sends detected anomalies to the channels routed for their severity, off the request thread.
 * Repeats of the same metric / entity / severity inside the dedup window are dropped.
 */
@Service
public class AutoAlertService {

    private static final Logger log = LoggerFactory.getLogger(AutoAlertService.class);

    private final AnomalyProperties.AutoAlert config;
    private final AlertService alertService;
    private final Clock clock;
    private final ConcurrentHashMap<String, Instant> lastSent = new ConcurrentHashMap<>();

    public AutoAlertService(AnomalyProperties properties, AlertService alertService, Clock clock) {
        this.config = properties.getAlerting().getAutoAlert();
        this.alertService = alertService;
        this.clock = clock;
    }

    @Async
    public void alertAsync(List<AnomalyEvent> events, String entityId) {
        alert(events, entityId);
    }

    /**
     * @return number of events that were sent to at least one channel
     */
    public int alert(List<AnomalyEvent> events, String entityId) {
        if (!config.isEnabled()) {
            return 0;
        }
        int sent = 0;
        for (AnomalyEvent event : events) {
            if (!event.getSeverity().isAtLeast(config.getMinSeverity())) {
                continue;
            }
            List<String> channels = config.getSeverityRouting().get(event.getSeverity());
            if (channels == null || channels.isEmpty()) {
                log.debug("No channels routed for {} alerts", event.getSeverity().wireName());
                continue;
            }
            String key = dedupKey(event, entityId);
            Instant claimedAt = claim(key);
            if (claimedAt == null) {
                log.debug("Suppressed duplicate {} alert for {} ({})",
                        event.getSeverity().wireName(), event.getMetricName(), entityId);
                continue;
            }
            boolean delivered = false;
            try {
                DeliveryReport report = alertService.deliver(AlertData.fromEvent(event), channels);
                delivered = report.successCount() > 0;
            } catch (RuntimeException e) {
                log.error("Automatic alert for {} failed: {}", event.getMetricName(), e.getMessage(), e);
            }
            if (delivered) {
                sent++;
            } else {
                // Nothing went out, so a repeat inside the window must not be suppressed
                lastSent.remove(key, claimedAt);
            }
        }
        return sent;
    }

    @Scheduled(fixedRate = 60, timeUnit = TimeUnit.SECONDS, initialDelay = 60)
    public void evictExpired() {
        Instant cutoff = clock.instant().minus(config.getDedupWindow());
        lastSent.values().removeIf(sentAt -> sentAt.isBefore(cutoff));
    }

    // Records this alert when no identical one went out inside the dedup window and returns the
    // recorded time, or null when it is a duplicate
    private Instant claim(String key) {
        Instant now = clock.instant();
        Instant[] claimed = new Instant[1];
        lastSent.compute(key, (k, previous) -> {
            if (previous == null || !previous.plus(config.getDedupWindow()).isAfter(now)) {
                claimed[0] = now;
                return now;
            }
            return previous;
        });
        return claimed[0];
    }

    private static String dedupKey(AnomalyEvent event, String entityId) {
        return event.getMetricName() + "|" + entityId + "|" + event.getSeverity().wireName();
    }
}
