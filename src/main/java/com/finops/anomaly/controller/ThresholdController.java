package com.finops.anomaly.controller;

import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.model.MetricKind;
import com.finops.anomaly.model.ThresholdConfig;
import com.finops.anomaly.service.ThresholdRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/anomaly/thresholds")
@Tag(name = "Thresholds", description = "View and modify per-metric detection thresholds")
public class ThresholdController {

    // Flat keys accepted for compatibility: key -> {metric, field}
    private static final Map<String, String[]> FLAT_KEYS = Map.of(
            "cost_baseline", new String[]{MetricKind.COST_PER_POST.getMetricName(), "baseline"},
            "cost_threshold", new String[]{MetricKind.COST_PER_POST.getMetricName(), "warning_pct"},
            "viral_baseline", new String[]{MetricKind.VIRAL_COEFFICIENT.getMetricName(), "baseline"},
            "viral_drop_threshold", new String[]{MetricKind.VIRAL_COEFFICIENT.getMetricName(), "warning_pct"},
            "fatigue_threshold", new String[]{MetricKind.PATTERN_FATIGUE.getMetricName(), "warning_pct"}
    );

    private final ThresholdRegistry thresholdRegistry;

    public ThresholdController(ThresholdRegistry thresholdRegistry) {
        this.thresholdRegistry = thresholdRegistry;
    }

    @Operation(summary = "Get thresholds for every metric")
    @GetMapping
    public ResponseEntity<Map<String, ThresholdConfig>> getThresholds() {
        return ResponseEntity.ok(thresholdRegistry.getAll());
    }

    @Operation(summary = "Update thresholds",
            description = "Accepts nested per-metric objects ({\"cost_per_post\": {\"baseline\": 0.03}}) and the flat " +
                    "keys cost_baseline, cost_threshold, viral_baseline, viral_drop_threshold and fatigue_threshold. " +
                    "A flat warning key that crosses its critical tier moves that tier with it, unless the request " +
                    "sets the tier too. The whole request is validated before anything changes. Changes reset on restart.")
    @PutMapping
    public ResponseEntity<Map<String, ThresholdConfig>> updateThresholds(@RequestBody Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            throw new ValidationException("request body must contain at least one threshold", "body");
        }

        Map<String, Map<String, Object>> updates = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : body.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            String[] flat = FLAT_KEYS.get(key);
            if (flat != null) {
                updates.computeIfAbsent(flat[0], m -> new LinkedHashMap<>()).put(flat[1], value);
            } else if (value instanceof Map<?, ?> nested) {
                Map<String, Object> fields = updates.computeIfAbsent(key, m -> new LinkedHashMap<>());
                nested.forEach((field, fieldValue) -> fields.put(String.valueOf(field), fieldValue));
            } else {
                throw new ValidationException("Unknown threshold key: " + key, key);
            }
        }

        for (String key : body.keySet()) {
            if (FLAT_KEYS.containsKey(key)) {
                alignPairedTier(key, updates.get(FLAT_KEYS.get(key)[0]));
            }
        }

        thresholdRegistry.setAll(updates);
        return getThresholds();
    }

    // A legacy warning value may not cross its critical tier, so the tier follows it
    private void alignPairedTier(String flatKey, Map<String, Object> fields) {
        if (!(fields.get("warning_pct") instanceof Number number)) {
            return;
        }
        double warning = number.doubleValue();
        ThresholdConfig current = thresholdRegistry.get(FLAT_KEYS.get(flatKey)[0]);
        switch (flatKey) {
            case "cost_threshold" -> {
                double elevated = 1.0 + warning;
                if (!fields.containsKey("elevated_multiplier") && elevated > current.getElevatedMultiplier()) {
                    fields.put("elevated_multiplier", elevated);
                    if (!fields.containsKey("critical_multiplier") && elevated > current.getCriticalMultiplier()) {
                        fields.put("critical_multiplier", elevated);
                    }
                }
            }
            case "viral_drop_threshold" -> {
                if (!fields.containsKey("critical_pct") && warning < current.getCriticalPct()) {
                    fields.put("critical_pct", warning);
                }
            }
            case "fatigue_threshold" -> {
                if (!fields.containsKey("critical_pct") && warning > current.getCriticalPct()) {
                    fields.put("critical_pct", warning);
                }
            }
            default -> { }
        }
    }
}
