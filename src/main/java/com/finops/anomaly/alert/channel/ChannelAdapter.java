package com.finops.anomaly.alert.channel;

import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.ChannelType;
import com.finops.anomaly.exception.ChannelDeliveryException;
import com.finops.anomaly.model.AlertData;

/**
 * Transport for one channel type. Formatting happens once per send; {@link #deliver} runs
 * once per attempt with the same payload.
 */
public interface ChannelAdapter {

    ChannelType type();

    /**
     * Whether the target carries everything this channel needs. Unconfigured targets are
     * reported as skipped without an attempt.
     */
    boolean isConfigured(AlertChannelTarget target);

    byte[] format(AlertData alert, AlertChannelTarget target);

    void deliver(byte[] payload, AlertChannelTarget target) throws ChannelDeliveryException;
}
