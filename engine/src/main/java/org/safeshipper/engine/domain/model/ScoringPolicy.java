package org.safeshipper.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable scoring weights and capacity thresholds.
 * Defaults are overridden by the "config" section of the reference data.
 */
public final class ScoringPolicy {

    private final Map<String, Double> values;

    // Deduction keys
    public static final String DEDUCTION_CRITICAL = "deduction_critical";
    public static final String DEDUCTION_WARNING = "deduction_warning";
    public static final String DEDUCTION_MISSING_EQUIPMENT = "deduction_missing_equipment";
    public static final String DEDUCTION_EXPIRED_EQUIPMENT = "deduction_expired_equipment";

    // Bonus keys
    public static final String BONUS_MARGIN_FACTOR = "bonus_margin_factor";
    public static final String BONUS_MARGIN_CAP = "bonus_margin_cap";

    // Threshold keys
    public static final String UTILIZATION_WARNING_PERCENT = "utilization_warning_percent";
    public static final String UTILIZATION_LIMIT_PERCENT = "utilization_limit_percent";
    public static final String EXPIRY_WARNING_DAYS = "expiry_warning_days";

    private ScoringPolicy(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates a policy from key-value pairs, falling back to defaults for missing keys.
     */
    public static ScoringPolicy fromMap(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        Map<String, Double> merged = new HashMap<>(defaultValues());
        merged.putAll(values);
        return new ScoringPolicy(merged);
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(defaultValues());
    }

    private static Map<String, Double> defaultValues() {
        Map<String, Double> defaults = new HashMap<>();
        // A single blocking issue must outweigh several advisory ones
        defaults.put(DEDUCTION_CRITICAL, 25.0);
        defaults.put(DEDUCTION_WARNING, 5.0);
        defaults.put(DEDUCTION_MISSING_EQUIPMENT, 10.0);
        defaults.put(DEDUCTION_EXPIRED_EQUIPMENT, 15.0);
        defaults.put(BONUS_MARGIN_FACTOR, 2.0);
        defaults.put(BONUS_MARGIN_CAP, 10.0);
        defaults.put(UTILIZATION_WARNING_PERCENT, 90.0);
        defaults.put(UTILIZATION_LIMIT_PERCENT, 100.0);
        defaults.put(EXPIRY_WARNING_DAYS, 30.0);
        return defaults;
    }

    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown policy key: " + key);
        }
        return value;
    }

    public double getOrDefault(String key, double defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public double getCriticalDeduction() {
        return getOrDefault(DEDUCTION_CRITICAL, 25.0);
    }

    public double getWarningDeduction() {
        return getOrDefault(DEDUCTION_WARNING, 5.0);
    }

    public double getMissingEquipmentDeduction() {
        return getOrDefault(DEDUCTION_MISSING_EQUIPMENT, 10.0);
    }

    public double getExpiredEquipmentDeduction() {
        return getOrDefault(DEDUCTION_EXPIRED_EQUIPMENT, 15.0);
    }

    public double getMarginBonusFactor() {
        return getOrDefault(BONUS_MARGIN_FACTOR, 2.0);
    }

    public double getMarginBonusCap() {
        return getOrDefault(BONUS_MARGIN_CAP, 10.0);
    }

    public double getUtilizationWarningPercent() {
        return getOrDefault(UTILIZATION_WARNING_PERCENT, 90.0);
    }

    public double getUtilizationLimitPercent() {
        return getOrDefault(UTILIZATION_LIMIT_PERCENT, 100.0);
    }

    public int getExpiryWarningDays() {
        return (int) getOrDefault(EXPIRY_WARNING_DAYS, 30.0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ScoringPolicy && values.equals(((ScoringPolicy) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ScoringPolicy" + values;
    }
}
