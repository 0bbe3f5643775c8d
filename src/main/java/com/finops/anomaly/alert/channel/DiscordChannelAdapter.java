package com.finops.anomaly.alert.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finops.anomaly.alert.AlertFormatter;
import com.finops.anomaly.alert.ChannelType;

public class DiscordChannelAdapter extends JsonHttpChannelAdapter {

    public DiscordChannelAdapter(AlertFormatter formatter, HttpJsonSender sender, ObjectMapper objectMapper) {
        super(formatter, sender, objectMapper);
    }

    @Override
    public ChannelType type() {
        return ChannelType.DISCORD;
    }
}
