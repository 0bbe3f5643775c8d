package com.finops.anomaly.alert.channel;

import com.finops.anomaly.alert.AlertChannelTarget;
import com.finops.anomaly.alert.AlertFormatter;
import com.finops.anomaly.alert.ChannelType;
import com.finops.anomaly.exception.TransportException;
import com.finops.anomaly.model.Severity;
import com.finops.anomaly.testutil.TestDataFactory;
import com.twilio.exception.ApiException;
import com.twilio.http.TwilioRestClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TwilioSmsChannelAdapterTest {

    private final RecordingAdapter adapter = new RecordingAdapter();

    @Test
    void isConfigured_requiresNumberCredentialAndSender() {
        AlertChannelTarget base = TestDataFactory.target("sms", ChannelType.SMS, "+15550001111");

        assertThat(adapter.isConfigured(base)).isFalse();
        assertThat(adapter.isConfigured(base.toBuilder().credential("AC123:token").build())).isFalse();
        assertThat(adapter.isConfigured(base.toBuilder().credential("no-colon").property("from", "+15559990000")
                .build())).isFalse();
        assertThat(adapter.isConfigured(smsTarget(false))).isTrue();
    }

    @Test
    void deliver_sendsPlainTextBody() throws Exception {
        AlertChannelTarget target = smsTarget(false);

        byte[] payload = adapter.format(TestDataFactory.alert(Severity.CRITICAL, "Cost spike"), target);
        adapter.deliver(payload, target);

        assertThat(adapter.sent).hasSize(1);
        String[] sent = adapter.sent.get(0);
        assertThat(sent[0]).isEqualTo("+15550001111");
        assertThat(sent[1]).isEqualTo("+15559990000");
        assertThat(sent[2]).startsWith("[CRITICAL] Cost spike");
    }

    @Test
    void deliver_whatsappPrefixesBothNumbers() throws Exception {
        AlertChannelTarget target = smsTarget(true);

        adapter.deliver(adapter.format(TestDataFactory.alert(Severity.INFO, "FYI"), target), target);

        String[] sent = adapter.sent.get(0);
        assertThat(sent[0]).isEqualTo("whatsapp:+15550001111");
        assertThat(sent[1]).isEqualTo("whatsapp:+15559990000");
    }

    @Test
    void deliver_apiRejection_becomesTransportException() {
        adapter.failWith = new ApiException("The 'To' number is not a valid phone number.");
        AlertChannelTarget target = smsTarget(false);

        assertThatThrownBy(() -> adapter.deliver(new byte[0], target))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("Twilio rejected message");
    }

    private static AlertChannelTarget smsTarget(boolean whatsapp) {
        AlertChannelTarget.AlertChannelTargetBuilder builder = TestDataFactory
                .target("sms", ChannelType.SMS, "+15550001111").toBuilder()
                .credential("AC123:token")
                .property("from", "+15559990000");
        if (whatsapp) {
            builder.property("whatsapp", "true");
        }
        return builder.build();
    }

    private static class RecordingAdapter extends TwilioSmsChannelAdapter {

        final List<String[]> sent = new ArrayList<>();
        RuntimeException failWith;

        RecordingAdapter() {
            super(new AlertFormatter());
        }

        @Override
        protected String createMessage(TwilioRestClient client, String to, String from, String body) {
            if (failWith != null) {
                throw failWith;
            }
            sent.add(new String[] {to, from, body});
            return "SM" + sent.size();
        }
    }
}
