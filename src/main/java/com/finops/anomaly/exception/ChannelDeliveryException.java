package com.finops.anomaly.exception;

/**
 * A single delivery attempt to a channel failed. Retried by the channel manager.
 */
public class ChannelDeliveryException extends Exception {

    public ChannelDeliveryException(String message) {
        super(message);
    }

    public ChannelDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
