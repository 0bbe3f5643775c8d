package com.finops.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI anomalyAlertingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Anomaly Alerting API")
                        .version("1.0.0")
                        .description(
                                "Streaming anomaly detection for FinOps metrics with multi-channel alert delivery.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit metric values via `POST /anomaly/detect`\n" +
                                "2. Each value updates its rolling statistical, hour-of-day and weekly models\n" +
                                "3. Business rules classify cost rises and viral-coefficient drops by severity\n" +
                                "4. Pattern usage feeds a decaying fatigue score per content pattern\n" +
                                "5. Every finding is returned as an anomaly event with severity and confidence\n\n" +
                                "**Severity Tiers:**\n" +
                                "- `critical` - cost at 2x baseline, viral coefficient below 50%, fatigue at 0.9\n" +
                                "- `warning` - cost at 1.25x baseline, viral coefficient below 70%, fatigue at 0.8\n" +
                                "- `info` - statistical outliers and hourly / weekly trend breaks\n\n" +
                                "**Alerting:** `POST /anomaly/alert` fans out to Slack, Discord, Telegram, " +
                                "webhooks and SMS concurrently with retries, inside a 60 second budget.")
                        .contact(new Contact().name("FinOps Platform Team")));
    }
}
