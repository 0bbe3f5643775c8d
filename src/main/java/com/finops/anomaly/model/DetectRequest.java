package com.finops.anomaly.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Latest metric values for one entity. At least one metric must be present.")
public class DetectRequest {

    @Schema(description = "Unit cost in dollars per post", example = "0.026")
    private Double costPerPost;

    @Schema(description = "Growth / virality coefficient", example = "0.85")
    private Double viralCoefficient;

    @Schema(description = "Number of uses of the pattern since the last report", example = "3")
    private Double patternUsageCount;

    @Schema(description = "Content pattern identifier, required with pattern_usage_count", example = "controversial_take")
    private String patternName;

    @Schema(description = "Engagement rate", example = "0.061")
    private Double engagementRate;

    @Schema(description = "Entity (persona, account) the metrics belong to", example = "ai_jesus")
    private String entityId;

    @Schema(description = "Observation time in epoch milliseconds. Defaults to now.", example = "1739886764000")
    private Long timestamp;
}
