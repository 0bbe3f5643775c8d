package com.finops.anomaly.controller;

import com.finops.anomaly.model.AlertRequest;
import com.finops.anomaly.model.AlertResponse;
import com.finops.anomaly.model.DetectRequest;
import com.finops.anomaly.model.DetectResponse;
import com.finops.anomaly.service.AlertService;
import com.finops.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/anomaly")
@Tag(name = "Anomalies", description = "Detect metric anomalies and deliver alerts")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;
    private final AlertService alertService;

    public AnomalyController(AnomalyDetectionService detectionService, AlertService alertService) {
        this.detectionService = detectionService;
        this.alertService = alertService;
    }

    @Operation(summary = "Evaluate metric values for anomalies",
            description = "Each metric present in the body updates its statistical, hour-of-day and weekly models " +
                    "(or the pattern's fatigue score) and is checked against its severity rules. " +
                    "A single value may produce several anomalies.")
    @PostMapping("/detect")
    public ResponseEntity<DetectResponse> detect(@RequestBody DetectRequest request) {
        return ResponseEntity.ok(detectionService.detect(request));
    }

    @Operation(summary = "Send an alert to channels",
            description = "Delivers to all named channels concurrently with retries. Channel failures are reported " +
                    "per channel; channels without configuration are reported as skipped.")
    @PostMapping("/alert")
    public ResponseEntity<AlertResponse> sendAlert(@RequestBody AlertRequest request) {
        return ResponseEntity.ok(alertService.send(request));
    }
}
