package com.finops.anomaly.alert;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Terminal state of one channel within a send.
 */
@Value
@Builder
public class DeliveryOutcome {
    String channel;
    ChannelType channelType;
    DeliveryStatus status;
    Duration elapsed;
    int attempts;
    // Last error for failed / timed out channels, reason for skipped ones
    String errorDetail;

    public static DeliveryOutcome skipped(AlertChannelTarget target, String reason) {
        return DeliveryOutcome.builder()
                .channel(target.getName())
                .channelType(target.getType())
                .status(DeliveryStatus.SKIPPED)
                .elapsed(Duration.ZERO)
                .attempts(0)
                .errorDetail(reason)
                .build();
    }
}
