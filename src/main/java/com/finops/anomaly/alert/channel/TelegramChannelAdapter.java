package com.finops.anomaly.alert.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.AlertFormatter;
import com.finops.anomaly.alert.ChannelType;
import com.finops.anomaly.model.AlertData;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram Bot API {@code sendMessage}. The credential is the bot token and the
 * {@code chat-id} property names the destination chat.
 */
public class TelegramChannelAdapter extends JsonHttpChannelAdapter {

    static final String DEFAULT_API_BASE = "https://api.telegram.org";

    public TelegramChannelAdapter(AlertFormatter formatter, HttpJsonSender sender, ObjectMapper objectMapper) {
        super(formatter, sender, objectMapper);
    }

    @Override
    public ChannelType type() {
        return ChannelType.TELEGRAM;
    }

    @Override
    public boolean isConfigured(AlertChannelTarget target) {
        String chatId = target.property("chat-id");
        return target.hasCredential() && chatId != null && !chatId.isBlank();
    }

    @Override
    protected Map<String, Object> render(AlertData alert, AlertChannelTarget target) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", target.property("chat-id"));
        payload.putAll(super.render(alert, target));
        return payload;
    }

    @Override
    protected String url(AlertChannelTarget target) {
        String apiBase = target.property("api-base");
        return (apiBase != null ? apiBase : DEFAULT_API_BASE) + "/bot" + target.getCredential() + "/sendMessage";
    }
}
