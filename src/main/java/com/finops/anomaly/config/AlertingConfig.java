package com.finops.anomaly.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finops.anomaly.alert.AlertChannelManager;
import com.finops.anomaly.alert.AlertFormatter;
import com.finops.anomaly.alert.BackoffPolicy;
import com.finops.anomaly.alert.ExponentialBackoffPolicy;
import com.finops.anomaly.alert.channel.ChannelAdapter;
import com.finops.anomaly.alert.channel.DiscordChannelAdapter;
import com.finops.anomaly.alert.channel.HttpJsonSender;
import com.finops.anomaly.alert.channel.SlackChannelAdapter;
import com.finops.anomaly.alert.channel.TelegramChannelAdapter;
import com.finops.anomaly.alert.channel.TwilioSmsChannelAdapter;
import com.finops.anomaly.alert.channel.WebhookChannelAdapter;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AlertingConfig {

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    @Bean
    public OkHttpClient alertHttpClient() {
        // Per-call timeouts come from each channel target
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public HttpJsonSender httpJsonSender(OkHttpClient alertHttpClient) {
        return new HttpJsonSender(alertHttpClient);
    }

    @Bean
    public SlackChannelAdapter slackChannelAdapter(AlertFormatter formatter, HttpJsonSender sender,
                                                   ObjectMapper objectMapper) {
        return new SlackChannelAdapter(formatter, sender, objectMapper);
    }

    @Bean
    public DiscordChannelAdapter discordChannelAdapter(AlertFormatter formatter, HttpJsonSender sender,
                                                       ObjectMapper objectMapper) {
        return new DiscordChannelAdapter(formatter, sender, objectMapper);
    }

    @Bean
    public TelegramChannelAdapter telegramChannelAdapter(AlertFormatter formatter, HttpJsonSender sender,
                                                         ObjectMapper objectMapper) {
        return new TelegramChannelAdapter(formatter, sender, objectMapper);
    }

    @Bean
    public WebhookChannelAdapter webhookChannelAdapter(AlertFormatter formatter, HttpJsonSender sender,
                                                       ObjectMapper objectMapper) {
        return new WebhookChannelAdapter(formatter, sender, objectMapper);
    }

    @Bean
    public TwilioSmsChannelAdapter twilioSmsChannelAdapter(AlertFormatter formatter) {
        return new TwilioSmsChannelAdapter(formatter);
    }

    @Bean
    public BackoffPolicy alertBackoffPolicy(AnomalyProperties properties) {
        return new ExponentialBackoffPolicy(properties.getAlerting().getBackoffBase(), MAX_BACKOFF);
    }

    /**
     * The manager owns its two pools and shuts them down with the context. Attempts run on an
     * unbounded pool since an attempt abandoned on timeout may hold its thread until the
     * transport gives up.
     */
    @Bean
    public AlertChannelManager alertChannelManager(List<ChannelAdapter> channelAdapters,
                                                   BackoffPolicy alertBackoffPolicy,
                                                   AnomalyProperties properties) {
        AnomalyProperties.Alerting alerting = properties.getAlerting();
        ExecutorService dispatchExecutor = Executors.newFixedThreadPool(
                alerting.getDispatchThreads(), namedThreads("alert-dispatch-"));
        ExecutorService attemptExecutor = Executors.newCachedThreadPool(namedThreads("alert-attempt-"));
        return new AlertChannelManager(channelAdapters, dispatchExecutor, attemptExecutor,
                alertBackoffPolicy, alerting.getSla());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
