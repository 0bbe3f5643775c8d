package com.finops.anomaly.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.finops.anomaly.exception.ValidationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable per-metric threshold configuration. Field meaning depends on the metric:
 * <ul>
 *   <li>cost_per_post: {@code warningPct} is the fraction above baseline for the low warning
 *       tier, {@code elevatedMultiplier} and {@code criticalMultiplier} are ratios to baseline.</li>
 *   <li>viral_coefficient: {@code warningPct} and {@code criticalPct} are ratio-of-baseline floors.</li>
 *   <li>pattern_fatigue: {@code warningPct} and {@code criticalPct} are fatigue score thresholds,
 *       {@code decayFactor} is applied per elapsed decay bucket.</li>
 * </ul>
 * Every metric uses {@code windowSize}, {@code outlierZScore} and {@code trendDeviationPct}
 * for its statistical, trend and seasonal models.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Threshold configuration of one metric")
public class ThresholdConfig {

    // Every statistical buffer is allocated at this size, so it bounds model memory per key
    public static final int MAX_WINDOW_SIZE = 10_000;

    @Schema(example = "cost_per_post")
    String metricName;

    @Schema(description = "Expected value of the metric", example = "0.02")
    double baseline;

    @Schema(description = "Warning threshold, fraction in [0, 1]", example = "0.25")
    double warningPct;

    @Schema(description = "Critical threshold, fraction in [0, 1]", example = "0.5")
    double criticalPct;

    @Schema(description = "Ratio to baseline for the elevated warning tier (> 1)", example = "1.5")
    double elevatedMultiplier;

    @Schema(description = "Ratio to baseline for the critical tier (> 1)", example = "2.0")
    double criticalMultiplier;

    @Schema(description = "Capacity of the rolling statistical window, at most 10000", example = "100")
    int windowSize;

    @Schema(description = "Z-score above which a sample is a statistical outlier", example = "2.0")
    double outlierZScore;

    @Schema(description = "Fractional deviation from a bucket average that counts as a trend break", example = "0.5")
    double trendDeviationPct;

    @Schema(description = "Fatigue decay factor per elapsed bucket, in [0, 1]", example = "0.95")
    double decayFactor;

    /**
     * Checks every invariant and throws on the first violation.
     */
    public void validate() {
        requireFinite(baseline, "baseline");
        if (baseline < 0) {
            throw new ValidationException("baseline must be >= 0", "baseline");
        }
        requireFraction(warningPct, "warning_pct");
        requireFraction(criticalPct, "critical_pct");
        requireFraction(trendDeviationPct, "trend_deviation_pct");
        requireFraction(decayFactor, "decay_factor");
        requireFinite(elevatedMultiplier, "elevated_multiplier");
        requireFinite(criticalMultiplier, "critical_multiplier");
        if (elevatedMultiplier <= 1.0) {
            throw new ValidationException("elevated_multiplier must be > 1", "elevated_multiplier");
        }
        if (criticalMultiplier <= 1.0) {
            throw new ValidationException("critical_multiplier must be > 1", "critical_multiplier");
        }
        if (criticalMultiplier < elevatedMultiplier) {
            throw new ValidationException("critical_multiplier must be >= elevated_multiplier", "critical_multiplier");
        }
        if (windowSize < 2 || windowSize > MAX_WINDOW_SIZE) {
            throw new ValidationException("window_size must be in [2, " + MAX_WINDOW_SIZE + "]", "window_size");
        }
        requireFinite(outlierZScore, "outlier_z_score");
        if (outlierZScore <= 0) {
            throw new ValidationException("outlier_z_score must be > 0", "outlier_z_score");
        }

        MetricKind kind = MetricKind.fromMetricName(metricName);
        if (kind == MetricKind.COST_PER_POST && 1.0 + warningPct > elevatedMultiplier) {
            throw new ValidationException("1 + warning_pct must not exceed elevated_multiplier", "warning_pct");
        }
        if (kind == MetricKind.VIRAL_COEFFICIENT && criticalPct > warningPct) {
            throw new ValidationException("critical_pct must be <= warning_pct for drop thresholds", "critical_pct");
        }
        if (kind == MetricKind.PATTERN_FATIGUE && criticalPct < warningPct) {
            throw new ValidationException("critical_pct must be >= warning_pct for fatigue thresholds", "critical_pct");
        }
    }

    private static void requireFraction(double value, String field) {
        requireFinite(value, field);
        if (value < 0 || value > 1) {
            throw new ValidationException(field + " must be in [0, 1]", field);
        }
    }

    private static void requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(field + " must be a finite number", field);
        }
    }
}
