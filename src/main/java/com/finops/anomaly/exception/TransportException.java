package com.finops.anomaly.exception;

/**
 * Network failure or non-2xx response from a channel endpoint.
 */
public class TransportException extends ChannelDeliveryException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
