package com.finops.anomaly.alert.channel;

import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.AlertFormatter;
import com.finops.anomaly.alert.ChannelType;
import com.finops.anomaly.exception.ChannelDeliveryException;
import com.finops.anomaly.exception.TransportException;
import com.finops.anomaly.model.AlertData;
import com.twilio.exception.ApiException;
import com.twilio.exception.TwilioException;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * SMS / WhatsApp through Twilio. The credential is {@code accountSid:authToken}, the endpoint
 * is the destination number and the {@code from} property the sending number. Setting
 * {@code whatsapp=true} routes through WhatsApp.
 */
public class TwilioSmsChannelAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(TwilioSmsChannelAdapter.class);

    private final AlertFormatter formatter;

    public TwilioSmsChannelAdapter(AlertFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public ChannelType type() {
        return ChannelType.SMS;
    }

    @Override
    public boolean isConfigured(AlertChannelTarget target) {
        String from = target.property("from");
        return target.hasEndpoint() && target.hasCredential()
                && target.getCredential().indexOf(':') > 0
                && from != null && !from.isBlank();
    }

    @Override
    public byte[] format(AlertData alert, AlertChannelTarget target) {
        return String.valueOf(formatter.render(alert, type()).get("body")).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void deliver(byte[] payload, AlertChannelTarget target) throws ChannelDeliveryException {
        String[] credential = target.getCredential().split(":", 2);
        TwilioRestClient client = new TwilioRestClient.Builder(credential[0], credential[1]).build();

        String to = resolveNumber(target, target.getEndpoint());
        String from = resolveNumber(target, target.property("from"));
        try {
            String sid = createMessage(client, to, from, new String(payload, StandardCharsets.UTF_8));
            log.debug("Twilio message accepted for channel={}, sid={}", target.getName(), sid);
        } catch (ApiException e) {
            throw new TransportException("Twilio rejected message (status " + e.getStatusCode() + "): "
                    + e.getMessage(), e);
        } catch (TwilioException e) {
            throw new TransportException("Twilio request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Creates the message and returns its SID.
     */
    protected String createMessage(TwilioRestClient client, String to, String from, String body) {
        Message message = Message.creator(new PhoneNumber(to), new PhoneNumber(from), body).create(client);
        return message.getSid();
    }

    private static String resolveNumber(AlertChannelTarget target, String number) {
        if (Boolean.parseBoolean(target.property("whatsapp")) && !number.startsWith("whatsapp:")) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
