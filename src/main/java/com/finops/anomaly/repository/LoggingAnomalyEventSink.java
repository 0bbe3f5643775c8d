package com.finops.anomaly.repository;

import com.finops.anomaly.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "anomaly.event-sink.aerospike", name = "enabled", havingValue = "false",
        matchIfMissing = true)
public class LoggingAnomalyEventSink implements AnomalyEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingAnomalyEventSink.class);

    @Override
    public void record(AnomalyEvent event, String entityId) {
        log.info("Anomaly event: metric={}, entity={}, severity={}, current={}, baseline={}, confidence={}",
                event.getMetricName(), entityId, event.getSeverity().wireName(),
                event.getCurrentValue(), event.getBaselineValue(), event.getConfidence());
    }
}
