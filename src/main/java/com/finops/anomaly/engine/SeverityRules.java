package com.finops.anomaly.engine;

import com.finops.anomaly.model.Severity;
import com.finops.anomaly.model.ThresholdConfig;
import lombok.Value;

import java.util.Optional;

/**
 * Business severity tiers. All comparisons are boundary-inclusive; a small tolerance keeps
 * values such as exactly 125% of baseline on the inclusive side despite floating point ratios.
 */
public final class SeverityRules {

    static final double EPSILON = 1e-9;

    public static final double COST_CRITICAL_CONFIDENCE = 0.9;
    public static final double COST_ELEVATED_CONFIDENCE = 0.8;
    public static final double COST_WARNING_CONFIDENCE = 0.6;
    public static final double VIRAL_CRITICAL_CONFIDENCE = 0.85;
    public static final double VIRAL_WARNING_CONFIDENCE = 0.7;
    public static final double FATIGUE_CRITICAL_CONFIDENCE = 0.9;
    public static final double FATIGUE_WARNING_CONFIDENCE = 0.75;

    private SeverityRules() {}

    @Value
    public static class Finding {
        Severity severity;
        double confidence;
        double ratio;
    }

    /**
     * Cost spike: ratio to baseline at or above critical multiplier, elevated multiplier,
     * or 1 + warning pct.
     */
    public static Optional<Finding> cost(double current, ThresholdConfig config) {
        double baseline = config.getBaseline();
        if (baseline <= 0 || current < 0) {
            return Optional.empty();
        }
        double ratio = current / baseline;
        if (ratio + EPSILON >= config.getCriticalMultiplier()) {
            return Optional.of(new Finding(Severity.CRITICAL, COST_CRITICAL_CONFIDENCE, ratio));
        }
        if (ratio + EPSILON >= config.getElevatedMultiplier()) {
            return Optional.of(new Finding(Severity.WARNING, COST_ELEVATED_CONFIDENCE, ratio));
        }
        if (ratio + EPSILON >= 1.0 + config.getWarningPct()) {
            return Optional.of(new Finding(Severity.WARNING, COST_WARNING_CONFIDENCE, ratio));
        }
        return Optional.empty();
    }

    /**
     * Viral coefficient drop: ratio to baseline at or below critical pct, or warning pct.
     */
    public static Optional<Finding> viralDrop(double current, ThresholdConfig config) {
        double baseline = config.getBaseline();
        if (baseline <= 0) {
            return Optional.empty();
        }
        double ratio = current / baseline;
        if (ratio - EPSILON <= config.getCriticalPct()) {
            return Optional.of(new Finding(Severity.CRITICAL, VIRAL_CRITICAL_CONFIDENCE, ratio));
        }
        if (ratio - EPSILON <= config.getWarningPct()) {
            return Optional.of(new Finding(Severity.WARNING, VIRAL_WARNING_CONFIDENCE, ratio));
        }
        return Optional.empty();
    }

    /**
     * Pattern fatigue: score at or above critical pct, or warning pct.
     */
    public static Optional<Finding> fatigue(double score, ThresholdConfig config) {
        if (score + EPSILON >= config.getCriticalPct()) {
            return Optional.of(new Finding(Severity.CRITICAL, FATIGUE_CRITICAL_CONFIDENCE, score));
        }
        if (score + EPSILON >= config.getWarningPct()) {
            return Optional.of(new Finding(Severity.WARNING, FATIGUE_WARNING_CONFIDENCE, score));
        }
        return Optional.empty();
    }

    /**
     * Statistical outlier: info above the z threshold, warning at twice it.
     * Confidence is the Chebyshev bound {@code 1 - 1/z^2}.
     */
    public static Finding outlier(double zScore, ThresholdConfig config) {
        Severity severity = zScore >= 2 * config.getOutlierZScore() ? Severity.WARNING : Severity.INFO;
        return new Finding(severity, clamp(1.0 - 1.0 / (zScore * zScore)), zScore);
    }

    /**
     * Trend or seasonal break: always info; confidence grows with the excess over the threshold.
     */
    public static Finding bucketBreak(double deviation, ThresholdConfig config) {
        double confidence = Math.min(0.9, 0.5 + (deviation - config.getTrendDeviationPct()));
        return new Finding(Severity.INFO, clamp(confidence), deviation);
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
