package org.cleanseam.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration for quality scoring weights, wear multipliers and verdict bands.
 * Defaults apply to any key the catalog does not override.
 */
public final class ScoringConfig {

    private final Map<String, Double> values;

    // Scoring weight keys
    public static final String WEIGHT_DURABILITY = "weight_durability";
    public static final String WEIGHT_TRANSPARENCY = "weight_transparency";

    // Fallback keys
    public static final String FALLBACK_CENTER = "fallback_center";
    public static final String FALLBACK_SLOPE = "fallback_slope";

    // Wear multiplier keys
    public static final String MULTIPLIER_MIN = "multiplier_min";
    public static final String MULTIPLIER_MAX = "multiplier_max";

    // Verdict and summary keys
    public static final String VERDICT_EXCELLENT_FLOOR = "verdict_excellent_floor";
    public static final String VERDICT_FAIR_FLOOR = "verdict_fair_floor";
    public static final String QUALITY_EXCELLENT_FLOOR = "quality_excellent_floor";
    public static final String QUALITY_GOOD_FLOOR = "quality_good_floor";
    public static final String QUALITY_AVERAGE_FLOOR = "quality_average_floor";
    public static final String QUALITY_BELOW_AVERAGE_FLOOR = "quality_below_average_floor";
    public static final String CATEGORY_MARGIN = "category_margin";
    public static final String VALUE_GOOD_CPW = "value_good_cpw";
    public static final String VALUE_REASONABLE_CPW = "value_reasonable_cpw";

    // Alternatives keys
    public static final String ALTERNATIVES_MIN_MARGIN = "alternatives_min_margin";
    public static final String ALTERNATIVES_LIMIT = "alternatives_limit";

    private static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(WEIGHT_DURABILITY, 0.10);
        defaults.put(WEIGHT_TRANSPARENCY, 0.05);
        defaults.put(FALLBACK_CENTER, 40.0);
        defaults.put(FALLBACK_SLOPE, 20.0);
        defaults.put(MULTIPLIER_MIN, 0.5);
        defaults.put(MULTIPLIER_MAX, 2.0);
        defaults.put(VERDICT_EXCELLENT_FLOOR, 75.0);
        defaults.put(VERDICT_FAIR_FLOOR, 50.0);
        defaults.put(QUALITY_EXCELLENT_FLOOR, 75.0);
        defaults.put(QUALITY_GOOD_FLOOR, 55.0);
        defaults.put(QUALITY_AVERAGE_FLOOR, 40.0);
        defaults.put(QUALITY_BELOW_AVERAGE_FLOOR, 25.0);
        defaults.put(CATEGORY_MARGIN, 10.0);
        defaults.put(VALUE_GOOD_CPW, 1.0);
        defaults.put(VALUE_REASONABLE_CPW, 2.0);
        defaults.put(ALTERNATIVES_MIN_MARGIN, 5.0);
        defaults.put(ALTERNATIVES_LIMIT, 3.0);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private ScoringConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates a ScoringConfig from overrides layered on top of the defaults.
     *
     * @throws IllegalArgumentException if a key is unknown, the multiplier range is inverted
     *         or a set of band floors is out of order
     */
    public static ScoringConfig fromMap(Map<String, Double> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Double> merged = new HashMap<>(DEFAULTS);
        for (Map.Entry<String, Double> entry : overrides.entrySet()) {
            if (!DEFAULTS.containsKey(entry.getKey())) {
                throw new IllegalArgumentException("Unknown scoring config key: " + entry.getKey());
            }
            merged.put(entry.getKey(), Objects.requireNonNull(entry.getValue(),
                    () -> "value for " + entry.getKey() + " must not be null"));
        }
        ScoringConfig config = new ScoringConfig(merged);
        if (config.getMultiplierMin() <= 0 || config.getMultiplierMax() < config.getMultiplierMin()) {
            throw new IllegalArgumentException("Wear multiplier range must satisfy 0 < min <= max, got ["
                    + config.getMultiplierMin() + ", " + config.getMultiplierMax() + "]");
        }
        if (config.getVerdictFairFloor() > config.getVerdictExcellentFloor()) {
            throw new IllegalArgumentException("verdict_fair_floor must not exceed verdict_excellent_floor");
        }
        if (config.getQualityBelowAverageFloor() > config.getQualityAverageFloor()
                || config.getQualityAverageFloor() > config.getQualityGoodFloor()
                || config.getQualityGoodFloor() > config.getQualityExcellentFloor()) {
            throw new IllegalArgumentException("Quality band floors must not decrease from poor to excellent");
        }
        return config;
    }

    /**
     * Creates the default configuration.
     */
    public static ScoringConfig defaults() {
        return new ScoringConfig(DEFAULTS);
    }

    /**
     * Gets a configuration value by key.
     */
    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        return value;
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public double getDurabilityWeight() {
        return get(WEIGHT_DURABILITY);
    }

    public double getTransparencyWeight() {
        return get(WEIGHT_TRANSPARENCY);
    }

    public double getFallbackCenter() {
        return get(FALLBACK_CENTER);
    }

    public double getFallbackSlope() {
        return get(FALLBACK_SLOPE);
    }

    public double getMultiplierMin() {
        return get(MULTIPLIER_MIN);
    }

    public double getMultiplierMax() {
        return get(MULTIPLIER_MAX);
    }

    public double getVerdictExcellentFloor() {
        return get(VERDICT_EXCELLENT_FLOOR);
    }

    public double getVerdictFairFloor() {
        return get(VERDICT_FAIR_FLOOR);
    }

    public double getQualityExcellentFloor() {
        return get(QUALITY_EXCELLENT_FLOOR);
    }

    public double getQualityGoodFloor() {
        return get(QUALITY_GOOD_FLOOR);
    }

    public double getQualityAverageFloor() {
        return get(QUALITY_AVERAGE_FLOOR);
    }

    public double getQualityBelowAverageFloor() {
        return get(QUALITY_BELOW_AVERAGE_FLOOR);
    }

    public double getCategoryMargin() {
        return get(CATEGORY_MARGIN);
    }

    public double getValueGoodCpw() {
        return get(VALUE_GOOD_CPW);
    }

    public double getValueReasonableCpw() {
        return get(VALUE_REASONABLE_CPW);
    }

    public double getAlternativesMinMargin() {
        return get(ALTERNATIVES_MIN_MARGIN);
    }

    public int getAlternativesLimit() {
        return (int) get(ALTERNATIVES_LIMIT);
    }

    @Override
    public String toString() {
        return "ScoringConfig" + values;
    }
}
