package com.finops.anomaly.alert;

/**
 * Payload format / transport family of a channel.
 */
public enum ChannelType {
    SLACK,
    DISCORD,
    TELEGRAM,
    WEBHOOK,
    SMS;

    /**
     * Channel type whose name matches a channel name, or null.
     */
    public static ChannelType fromChannelName(String name) {
        if (name == null) {
            return null;
        }
        for (ChannelType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        return null;
    }
}
