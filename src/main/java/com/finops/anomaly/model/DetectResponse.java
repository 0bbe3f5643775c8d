package com.finops.anomaly.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Result of evaluating one detect request")
public class DetectResponse {

    @Schema(description = "Number of anomalies detected", example = "1")
    private int anomaliesDetected;

    @Schema(description = "Detected anomalies")
    private List<AnomalyEvent> anomalies;

    @Schema(description = "Model keys updated by this request", example = "[\"statistical:cost_per_post@ai_jesus\"]")
    private List<String> modelsUpdated;
}
