package com.gasview.alerts.model;

import com.gasview.alerts.exception.ValidationException;

/**
 * Flag columns produced by the detector, in evaluation order.
 */
public enum AlertRule {
    RUPTURE("rupture", "rupture_alert"),
    SLOPE("slope", "slope_alert"),
    PLATEAU("plateau", "plateau_alert"),
    COMBINED("all", "alert");

    private final String key;
    private final String column;

    AlertRule(String key, String column) {
        this.key = key;
        this.column = column;
    }

    public String getKey() {
        return key;
    }

    public String getColumn() {
        return column;
    }

    /**
     * Resolve a rule from its request key ({@code rupture}, {@code slope}, {@code plateau}, {@code all}).
     */
    public static AlertRule fromKey(String key) {
        if (key == null) {
            throw new ValidationException("alert rule must not be null");
        }
        for (AlertRule rule : values()) {
            if (rule.key.equalsIgnoreCase(key.trim())) {
                return rule;
            }
        }
        throw new ValidationException("Unknown alert rule: " + key);
    }
}
