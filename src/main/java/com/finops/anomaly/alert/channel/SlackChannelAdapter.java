package com.finops.anomaly.alert.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.AlertFormatter;
import com.finops.anomaly.alert.ChannelType;
import com.finops.anomaly.model.AlertData;

import java.util.Map;

/**
 * Slack through {@code chat.postMessage} when a bot token is configured as the credential,
 * otherwise through the incoming webhook endpoint.
 */
public class SlackChannelAdapter extends JsonHttpChannelAdapter {

    static final String DEFAULT_API_URL = "https://slack.com/api/chat.postMessage";
    static final String DEFAULT_SLACK_CHANNEL = "#alerts";

    public SlackChannelAdapter(AlertFormatter formatter, HttpJsonSender sender, ObjectMapper objectMapper) {
        super(formatter, sender, objectMapper);
    }

    @Override
    public ChannelType type() {
        return ChannelType.SLACK;
    }

    @Override
    public boolean isConfigured(AlertChannelTarget target) {
        return target.hasEndpoint() || target.hasCredential();
    }

    @Override
    protected Map<String, Object> render(AlertData alert, AlertChannelTarget target) {
        if (usesBotApi(target)) {
            String slackChannel = target.property("slack-channel");
            return formatter.renderSlackBlocks(alert, slackChannel != null ? slackChannel : DEFAULT_SLACK_CHANNEL);
        }
        return super.render(alert, target);
    }

    @Override
    protected String url(AlertChannelTarget target) {
        if (usesBotApi(target)) {
            String apiUrl = target.property("api-url");
            return apiUrl != null ? apiUrl : DEFAULT_API_URL;
        }
        return target.getEndpoint();
    }

    @Override
    protected Map<String, String> headers(AlertChannelTarget target) {
        if (usesBotApi(target)) {
            return Map.of("Authorization", "Bearer " + target.getCredential());
        }
        return Map.of();
    }

    private static boolean usesBotApi(AlertChannelTarget target) {
        return target.hasCredential();
    }
}
