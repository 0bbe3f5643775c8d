package com.finops.anomaly.exception;

import java.time.Duration;

public class ChannelTimeoutException extends ChannelDeliveryException {

    public ChannelTimeoutException(String channel, Duration timeout) {
        super(String.format("Attempt to %s exceeded %d ms", channel, timeout.toMillis()));
    }
}
