package com.finops.anomaly.alert.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.AlertFormatter;
import com.finops.anomaly.alert.ChannelType;

import java.util.Map;

/**
 * Generic JSON webhook. A configured credential is sent as a bearer token.
 */
public class WebhookChannelAdapter extends JsonHttpChannelAdapter {

    public WebhookChannelAdapter(AlertFormatter formatter, HttpJsonSender sender, ObjectMapper objectMapper) {
        super(formatter, sender, objectMapper);
    }

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    protected Map<String, String> headers(AlertChannelTarget target) {
        return target.hasCredential() ? Map.of("Authorization", "Bearer " + target.getCredential()) : Map.of();
    }
}
