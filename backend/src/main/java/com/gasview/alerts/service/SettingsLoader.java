package com.gasview.alerts.service;

import com.gasview.alerts.exception.ValidationException;
import com.gasview.alerts.model.SettingsOverrides;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads deployment-level detector settings from environment variables.
 * Unset or blank variables leave the defaults in place.
 */
public class SettingsLoader {

    public static final String LOWER_LIMIT = "ALERT_LOWER_LIMIT";
    public static final String UPPER_LIMIT = "ALERT_UPPER_LIMIT";
    public static final String SLOW_WINDOW = "ALERT_SLOW_WINDOW";
    public static final String FAST_WINDOW = "ALERT_FAST_WINDOW";
    public static final String SLOPE_DELTA = "ALERT_SLOPE_DELTA";
    public static final String PLATEAU_LENGTH = "ALERT_PLATEAU_LENGTH";
    public static final String PLATEAU_DELTA = "ALERT_PLATEAU_DELTA";

    public SettingsOverrides fromEnvironment(Map<String, String> env) {
        List<String> errors = new ArrayList<>();
        SettingsOverrides overrides = new SettingsOverrides();

        overrides.setLowerLimit(parseDouble(env, LOWER_LIMIT, errors));
        overrides.setUpperLimit(parseDouble(env, UPPER_LIMIT, errors));
        overrides.setSlowWindow(parseInt(env, SLOW_WINDOW, errors));
        overrides.setFastWindow(parseInt(env, FAST_WINDOW, errors));
        overrides.setSlopeDelta(parseDouble(env, SLOPE_DELTA, errors));
        overrides.setPlateauLength(parseInt(env, PLATEAU_LENGTH, errors));
        overrides.setPlateauDelta(parseDouble(env, PLATEAU_DELTA, errors));

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return overrides;
    }

    private Double parseDouble(Map<String, String> env, String key, List<String> errors) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            errors.add(key + " must be a number: " + raw);
            return null;
        }
    }

    private Integer parseInt(Map<String, String> env, String key, List<String> errors) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            errors.add(key + " must be an integer: " + raw);
            return null;
        }
    }
}
