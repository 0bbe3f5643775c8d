package com.finops.anomaly.config;

import com.finops.anomaly.alert.ChannelType;
import com.finops.anomaly.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    // Per-metric overrides of the compiled threshold defaults, keyed by metric name.
    // Only the fields that are set replace the defaults.
    private Map<String, ThresholdOverride> thresholds = new LinkedHashMap<>();

    private Models models = new Models();

    private Alerting alerting = new Alerting();

    private EventSink eventSink = new EventSink();

    @Data
    public static class ThresholdOverride {
        private Double baseline;
        private Double warningPct;
        private Double criticalPct;
        private Double elevatedMultiplier;
        private Double criticalMultiplier;
        private Integer windowSize;
        private Double outlierZScore;
        private Double trendDeviationPct;
        private Double decayFactor;
    }

    @Data
    public static class Models {
        // Zone used to map sample timestamps onto hour-of-day / day-of-week buckets
        private String timeZone = "UTC";

        // Samples a seasonal model must see before it reports anything (one weekly cycle)
        private int seasonalMinSamples = 168;

        // Fatigue added per single use of a pattern
        private double fatigueIncrementPerUse = 0.1;

        // Length of one fatigue decay period
        private Duration fatigueDecayBucket = Duration.ofHours(1);
    }

    @Data
    public static class Alerting {
        // End-to-end budget for one send across all channels
        private Duration sla = Duration.ofSeconds(60);

        private Duration defaultTimeout = Duration.ofSeconds(30);

        private int defaultMaxAttempts = 3;

        // Backoff before retry n (0-based) is base * 2^n
        private Duration backoffBase = Duration.ofSeconds(1);

        private int dispatchThreads = 16;

        private Map<String, Channel> channels = new LinkedHashMap<>();

        private AutoAlert autoAlert = new AutoAlert();
    }

    @Data
    public static class Channel {
        private ChannelType type;
        private String endpoint;
        private String credential;
        private Duration timeout;
        private Integer maxAttempts;
        // Channel-specific extras: chat-id (telegram), from (sms), slack-channel, whatsapp
        private Map<String, String> properties = new LinkedHashMap<>();
    }

    @Data
    public static class AutoAlert {
        private boolean enabled = false;
        private Severity minSeverity = Severity.WARNING;
        private Map<Severity, List<String>> severityRouting = new LinkedHashMap<>();
        // Identical metric/entity/severity alerts inside this window are suppressed
        private Duration dedupWindow = Duration.ofMinutes(5);
    }

    @Data
    public static class EventSink {
        private Aerospike aerospike = new Aerospike();
    }

    @Data
    public static class Aerospike {
        private boolean enabled = false;
        private String host = "127.0.0.1";
        private int port = 3000;
        private String namespace = "finops";
        private String set = "anomaly_events";
        private int ttlSeconds = 2_592_000;
    }
}
