package com.finops.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Per-channel delivery result of an alert")
public class AlertResponse {

    @Schema(description = "Identifier of this send request")
    private String alertId;

    @Schema(description = "Number of channels that delivered successfully", example = "1")
    private int alertsSent;

    @Schema(description = "Whether every channel reached a terminal state inside the SLA")
    private boolean slaMet;

    @Schema(description = "Wall-clock duration of the send in milliseconds", example = "412")
    private long overallElapsedMs;

    @Schema(description = "Channel name to delivery result")
    private Map<String, ChannelResult> channelResults;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "Delivery result of one channel")
    public static class ChannelResult {

        @Schema(example = "success", allowableValues = {"success", "failed", "skipped", "timed_out"})
        private String status;

        @Schema(description = "Error detail for failed or timed out channels, reason for skipped ones")
        private String error;
    }
}
