package com.finops.anomaly.controller;

import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/anomaly/models")
@Tag(name = "Models", description = "Detection model diagnostics and reset")
public class ModelController {

    private final AnomalyDetectionService detectionService;

    public ModelController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Get per-model diagnostics",
            description = "Sample counts, rolling mean / stddev and bucket occupancy for every model key.")
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(detectionService.modelStats());
    }

    @Operation(summary = "Reset model state",
            description = "Clears learned state for the listed model kinds (statistical, trend, seasonal, fatigue or all). " +
                    "Thresholds are not affected.")
    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset(@RequestBody Map<String, Object> body) {
        List<String> models = modelNames(body.get("models"));
        int cleared = detectionService.resetModels(models);
        return ResponseEntity.ok(Map.of(
                "status", "reset",
                "models", models,
                "keys_cleared", cleared
        ));
    }

    private static List<String> modelNames(Object raw) {
        if (raw instanceof String s) {
            return List.of(s);
        }
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.toList());
        }
        throw new ValidationException("models must be a list of model kinds", "models");
    }
}
