package com.finops.anomaly.alert;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * One delivery destination. {@code type} is null for channel names that have no configuration.
 */
@Value
@Builder(toBuilder = true)
public class AlertChannelTarget {
    String name;
    ChannelType type;
    String endpoint;
    String credential;
    Duration timeout;
    int maxAttempts;
    @Singular
    Map<String, String> properties;

    public String property(String key) {
        return properties.get(key);
    }

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }

    public boolean hasCredential() {
        return credential != null && !credential.isBlank();
    }

    @Override
    public String toString() {
        // credential and endpoint may carry secrets
        return "AlertChannelTarget(name=" + name + ", type=" + type + ", timeout=" + timeout
                + ", maxAttempts=" + maxAttempts + ")";
    }
}
