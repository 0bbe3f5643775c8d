package com.finops.anomaly.alert.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.AlertFormatter;
import com.finops.anomaly.exception.ChannelDeliveryException;
import com.finops.anomaly.model.AlertData;

import java.util.Map;

/**
 * Base for channels that POST a JSON document rendered by {@link AlertFormatter}.
 */
public abstract class JsonHttpChannelAdapter implements ChannelAdapter {

    protected final AlertFormatter formatter;
    protected final HttpJsonSender sender;
    private final ObjectMapper objectMapper;

    protected JsonHttpChannelAdapter(AlertFormatter formatter, HttpJsonSender sender, ObjectMapper objectMapper) {
        this.formatter = formatter;
        this.sender = sender;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured(AlertChannelTarget target) {
        return target.hasEndpoint();
    }

    @Override
    public byte[] format(AlertData alert, AlertChannelTarget target) {
        try {
            return objectMapper.writeValueAsBytes(render(alert, target));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + type().name().toLowerCase() + " payload", e);
        }
    }

    @Override
    public void deliver(byte[] payload, AlertChannelTarget target) throws ChannelDeliveryException {
        sender.post(url(target), payload, headers(target), target.getTimeout());
    }

    /**
     * Document for one target. Channels that only need the alert use the formatter's rendering
     * for their type.
     */
    protected Map<String, Object> render(AlertData alert, AlertChannelTarget target) {
        return formatter.render(alert, type());
    }

    protected String url(AlertChannelTarget target) {
        return target.getEndpoint();
    }

    protected Map<String, String> headers(AlertChannelTarget target) {
        return Map.of();
    }
}
