package com.finops.anomaly.alert;

import com.finops.anomaly.model.AlertData;
import com.finops.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders alert content into the structured message of each channel type.
 * Pure and stateless: the same alert and channel type always give an equal payload.
 */
@Component
public class AlertFormatter {

    // Slack caps context block elements
    static final int SLACK_CONTEXT_LIMIT = 10;

    private static final String DEFAULT_TITLE = "Alert";

    public Map<String, Object> render(AlertData alert, ChannelType type) {
        switch (type) {
            case SLACK:
                return renderSlackAttachment(alert);
            case DISCORD:
                return renderDiscordEmbed(alert);
            case TELEGRAM:
                return renderTelegramMessage(alert);
            case WEBHOOK:
                return renderWebhook(alert);
            case SMS:
                return renderText(alert);
            default:
                throw new IllegalArgumentException("Unsupported channel type: " + type);
        }
    }

    public String color(Severity severity) {
        switch (severityOrInfo(severity)) {
            case CRITICAL:
                return "#FF0000";
            case WARNING:
                return "#FFA500";
            default:
                return "#00FF00";
        }
    }

    public int colorValue(Severity severity) {
        return Integer.parseInt(color(severity).substring(1), 16);
    }

    public String marker(Severity severity) {
        switch (severityOrInfo(severity)) {
            case CRITICAL:
                return "🚨";
            case WARNING:
                return "⚠️";
            default:
                return "💡";
        }
    }

    /**
     * Slack incoming-webhook attachment.
     */
    public Map<String, Object> renderSlackAttachment(AlertData alert) {
        List<Map<String, Object>> fields = new ArrayList<>();
        contextOf(alert).forEach((key, value) -> {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("title", titleCase(key));
            field.put("value", String.valueOf(value));
            field.put("short", true);
            fields.add(field);
        });

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color(alert.getSeverity()));
        attachment.put("title", titleOf(alert));
        attachment.put("text", messageOf(alert));
        attachment.put("fields", fields);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("attachments", List.of(attachment));
        return payload;
    }

    /**
     * Slack bot API {@code chat.postMessage} body with section and context blocks.
     */
    public Map<String, Object> renderSlackBlocks(AlertData alert, String slackChannel) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(Map.of(
                "type", "section",
                "text", Map.of(
                        "type", "mrkdwn",
                        "text", marker(alert.getSeverity()) + " *" + titleOf(alert) + "*\n" + messageOf(alert))));

        List<Map<String, Object>> elements = contextOf(alert).entrySet().stream()
                .limit(SLACK_CONTEXT_LIMIT)
                .map(e -> Map.<String, Object>of(
                        "type", "mrkdwn",
                        "text", "*" + titleCase(e.getKey()) + ":* " + e.getValue()))
                .collect(Collectors.toList());
        if (!elements.isEmpty()) {
            blocks.add(Map.of("type", "context", "elements", elements));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", slackChannel);
        payload.put("blocks", blocks);
        payload.put("username", "FinOps Alert Bot");
        payload.put("icon_emoji", ":warning:");
        return payload;
    }

    public Map<String, Object> renderDiscordEmbed(AlertData alert) {
        List<Map<String, Object>> fields = new ArrayList<>();
        contextOf(alert).forEach((key, value) -> {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("name", titleCase(key));
            field.put("value", String.valueOf(value));
            field.put("inline", true);
            fields.add(field);
        });

        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", titleOf(alert));
        embed.put("description", messageOf(alert));
        embed.put("color", colorValue(alert.getSeverity()));
        embed.put("fields", fields);
        embed.put("timestamp", timestampOf(alert));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("embeds", List.of(embed));
        return payload;
    }

    /**
     * Telegram {@code sendMessage} body without {@code chat_id}, which belongs to the target.
     */
    public Map<String, Object> renderTelegramMessage(AlertData alert) {
        List<String> lines = new ArrayList<>();
        lines.add(marker(alert.getSeverity()) + " *" + titleOf(alert) + "*");
        lines.add(messageOf(alert));
        contextOf(alert).forEach((key, value) -> lines.add(titleCase(key) + ": `" + value + "`"));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", String.join("\n", lines));
        payload.put("parse_mode", "Markdown");
        return payload;
    }

    public Map<String, Object> renderWebhook(AlertData alert) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", titleOf(alert));
        body.put("message", messageOf(alert));
        body.put("severity", severityOrInfo(alert.getSeverity()).wireName());
        body.put("timestamp", timestampOf(alert));
        body.put("metadata", new LinkedHashMap<>(contextOf(alert)));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert", body);
        return payload;
    }

    /**
     * Plain text for SMS-like channels, under {@code body}.
     */
    public Map<String, Object> renderText(AlertData alert) {
        StringBuilder sb = new StringBuilder()
                .append('[').append(severityOrInfo(alert.getSeverity()).wireName().toUpperCase()).append("] ")
                .append(titleOf(alert));
        String message = messageOf(alert);
        if (!message.isEmpty()) {
            sb.append('\n').append(message);
        }
        contextOf(alert).forEach((key, value) -> sb.append('\n').append(titleCase(key)).append(": ").append(value));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("body", sb.toString());
        return payload;
    }

    /**
     * {@code persona_id} becomes {@code Persona Id}.
     */
    static String titleCase(String key) {
        return Arrays.stream(key.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1).toLowerCase())
                .collect(Collectors.joining(" "));
    }

    private static Severity severityOrInfo(Severity severity) {
        return severity != null ? severity : Severity.INFO;
    }

    private static String titleOf(AlertData alert) {
        return alert.getTitle() != null ? alert.getTitle() : DEFAULT_TITLE;
    }

    private static String messageOf(AlertData alert) {
        return alert.getMessage() != null ? alert.getMessage() : "";
    }

    private static Map<String, Object> contextOf(AlertData alert) {
        return alert.getContext() != null ? alert.getContext() : Map.of();
    }

    private static String timestampOf(AlertData alert) {
        Instant ts = alert.getTimestamp();
        return ts != null ? ts.toString() : null;
    }
}
