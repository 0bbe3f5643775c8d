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
@Schema(description = "Alert to deliver and the channels to deliver it to")
public class AlertRequest {

    @Schema(description = "Alert content")
    private AlertData alertData;

    @Schema(description = "Configured channel names", example = "[\"slack\", \"discord\"]")
    private List<String> channels;
}
