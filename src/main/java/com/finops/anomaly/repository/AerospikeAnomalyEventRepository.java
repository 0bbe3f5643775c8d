package com.finops.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finops.anomaly.config.AnomalyProperties;
import com.finops.anomaly.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Stores anomaly events in an Aerospike set, one record per event, expiring after the
 * configured TTL.
 */
@Repository
@ConditionalOnProperty(prefix = "anomaly.event-sink.aerospike", name = "enabled", havingValue = "true")
public class AerospikeAnomalyEventRepository implements AnomalyEventSink {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAnomalyEventRepository.class);

    private final AerospikeClient client;
    private final WritePolicy writePolicy;
    private final String namespace;
    private final String setName;
    private final ObjectMapper objectMapper;

    public AerospikeAnomalyEventRepository(AerospikeClient client,
                                           @Qualifier("anomalyEventWritePolicy") WritePolicy writePolicy,
                                           AnomalyProperties properties,
                                           ObjectMapper objectMapper) {
        this.client = client;
        this.writePolicy = writePolicy;
        this.namespace = properties.getEventSink().getAerospike().getNamespace();
        this.setName = properties.getEventSink().getAerospike().getSet();
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(AnomalyEvent event, String entityId) {
        String eventId = UUID.randomUUID().toString();
        Key key = new Key(namespace, setName, eventId);

        try {
            client.put(writePolicy, key,
                    new Bin("metricName", event.getMetricName()),
                    new Bin("entityId", entityId),
                    new Bin("currentValue", event.getCurrentValue()),
                    new Bin("baselineValue", event.getBaselineValue()),
                    new Bin("severity", event.getSeverity().wireName()),
                    new Bin("confidence", event.getConfidence()),
                    new Bin("context", serializeContext(event)),
                    new Bin("detectedAt", event.getDetectedAt().toEpochMilli()));
        } catch (AerospikeException e) {
            log.error("Failed to store anomaly event {} for metric {}: {}",
                    eventId, event.getMetricName(), e.getMessage(), e);
        }
    }

    private String serializeContext(AnomalyEvent event) {
        try {
            return objectMapper.writeValueAsString(event.getContext());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize context of {} event: {}", event.getMetricName(), e.getMessage());
            return "{}";
        }
    }
}
