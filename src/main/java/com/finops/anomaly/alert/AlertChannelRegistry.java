package com.finops.anomaly.alert;

import com.finops.anomaly.config.AnomalyProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Resolves channel names from requests to delivery targets configured under
 * {@code anomaly.alerting.channels}.
 */
@Component
public class AlertChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(AlertChannelRegistry.class);

    private final AnomalyProperties.Alerting alerting;

    public AlertChannelRegistry(AnomalyProperties properties) {
        this.alerting = properties.getAlerting();
    }

    @PostConstruct
    public void init() {
        alerting.getChannels().forEach((name, channel) ->
                log.info("Alert channel registered: {} (type={})", name, typeOf(name, channel)));
    }

    public List<AlertChannelTarget> resolve(Collection<String> channelNames) {
        List<AlertChannelTarget> targets = new ArrayList<>(channelNames.size());
        for (String name : channelNames) {
            targets.add(resolve(name));
        }
        return targets;
    }

    /**
     * Target for one channel name. Unknown names give a target with no type, which the
     * channel manager reports as skipped.
     */
    public AlertChannelTarget resolve(String channelName) {
        AnomalyProperties.Channel channel = alerting.getChannels().get(channelName);
        if (channel == null) {
            return AlertChannelTarget.builder()
                    .name(channelName)
                    .timeout(alerting.getDefaultTimeout())
                    .maxAttempts(alerting.getDefaultMaxAttempts())
                    .build();
        }

        Duration timeout = channel.getTimeout() != null ? channel.getTimeout() : alerting.getDefaultTimeout();
        int maxAttempts = channel.getMaxAttempts() != null ? channel.getMaxAttempts() : alerting.getDefaultMaxAttempts();

        AlertChannelTarget.AlertChannelTargetBuilder builder = AlertChannelTarget.builder()
                .name(channelName)
                .type(typeOf(channelName, channel))
                .endpoint(channel.getEndpoint())
                .credential(channel.getCredential())
                .timeout(timeout)
                .maxAttempts(maxAttempts);
        for (Map.Entry<String, String> property : channel.getProperties().entrySet()) {
            if (property.getValue() != null) {
                builder.property(property.getKey(), property.getValue());
            }
        }
        return builder.build();
    }

    public Map<String, AnomalyProperties.Channel> configuredChannels() {
        return alerting.getChannels();
    }

    // A channel named after a type ("slack", "discord") needs no explicit type
    private static ChannelType typeOf(String name, AnomalyProperties.Channel channel) {
        return channel.getType() != null ? channel.getType() : ChannelType.fromChannelName(name);
    }
}
