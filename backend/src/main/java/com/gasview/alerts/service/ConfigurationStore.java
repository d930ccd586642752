package com.gasview.alerts.service;

import com.gasview.alerts.exception.ValidationException;
import com.gasview.alerts.model.DetectorSettings;
import com.gasview.alerts.model.SettingsOverrides;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated detector parameters.
 *
 * Every setter checks its value against the current state before committing. A rejected
 * value throws {@link ValidationException} and leaves the store as it was, so callers can
 * carry on with the previous configuration.
 *
 * Limits and windows are validated against the value of their counterpart at the time of
 * the call: lowering the upper limit below the current lower limit is rejected even if the
 * lower limit is about to be changed too.
 */
public class ConfigurationStore {

    public static final int MIN_SLOW_WINDOW = 20;
    public static final int MIN_FAST_WINDOW = 5;
    public static final int MIN_PLATEAU_LENGTH = 10;

    private double lowerLimit;
    private double upperLimit;
    private int slowWindow;
    private int fastWindow;
    private double slopeDelta;
    private int plateauLength;
    private double plateauDelta;

    public ConfigurationStore() {
        DetectorSettings defaults = DetectorSettings.DEFAULTS;
        this.lowerLimit = defaults.getLowerLimit();
        this.upperLimit = defaults.getUpperLimit();
        this.slowWindow = defaults.getSlowWindow();
        this.fastWindow = defaults.getFastWindow();
        this.slopeDelta = defaults.getSlopeDelta();
        this.plateauLength = defaults.getPlateauLength();
        this.plateauDelta = defaults.getPlateauDelta();
    }

    public void setLowerLimit(double lowerLimit) {
        requireFinite("lower_limit", lowerLimit);
        if (upperLimit <= lowerLimit) {
            reject("lower limit must be smaller than upper limit");
        }
        this.lowerLimit = lowerLimit;
    }

    public void setUpperLimit(double upperLimit) {
        requireFinite("upper_limit", upperLimit);
        if (lowerLimit >= upperLimit) {
            reject("upper limit must be greater than lower limit");
        }
        this.upperLimit = upperLimit;
    }

    public void setSlowWindow(int slowWindow) {
        if (fastWindow >= slowWindow) {
            reject("fast_window size must be smaller than slow_window size");
        }
        if (slowWindow < MIN_SLOW_WINDOW) {
            reject("minimum allowed value for slow_window is " + MIN_SLOW_WINDOW);
        }
        this.slowWindow = slowWindow;
    }

    public void setFastWindow(int fastWindow) {
        if (slowWindow <= fastWindow) {
            reject("slow_window size must be greater than fast_window size");
        }
        if (fastWindow < MIN_FAST_WINDOW) {
            reject("minimum allowed value for fast_window is " + MIN_FAST_WINDOW);
        }
        this.fastWindow = fastWindow;
    }

    public void setSlopeDelta(double slopeDelta) {
        requireFinite("slope_delta", slopeDelta);
        if (slopeDelta < 0) {
            reject("slope_delta must be equal or greater than 0");
        }
        if (slopeDelta >= upperLimit - lowerLimit) {
            reject("slope_delta must be smaller than upper_limit minus lower_limit interval");
        }
        this.slopeDelta = slopeDelta;
    }

    public void setPlateauLength(int plateauLength) {
        if (plateauLength < MIN_PLATEAU_LENGTH) {
            reject("minimum allowed value for plateau_length is " + MIN_PLATEAU_LENGTH);
        }
        this.plateauLength = plateauLength;
    }

    public void setPlateauDelta(double plateauDelta) {
        requireFinite("plateau_delta", plateauDelta);
        if (plateauDelta < 0) {
            reject("plateau_delta must be equal or greater than 0");
        }
        this.plateauDelta = plateauDelta;
    }

    /**
     * Write every non-null field through its setter.
     *
     * Fields are written in the order lower limit, upper limit, slow window, fast window,
     * slope delta, plateau length, plateau delta. When both limits are given and the new lower
     * limit is not below the current upper limit, the upper limit goes first. When both windows
     * are given and the new slow window is not above the current fast window, the fast window
     * goes first. Either pair can then be moved past its current bounds in one call.
     * Accepted fields stay applied; all rejections are reported together.
     */
    public void apply(SettingsOverrides overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return;
        }
        List<String> errors = new ArrayList<>();

        Double lower = overrides.getLowerLimit();
        Double upper = overrides.getUpperLimit();
        if (lower != null && upper != null && lower >= upperLimit) {
            attempt(errors, () -> setUpperLimit(upper));
            attempt(errors, () -> setLowerLimit(lower));
        } else {
            if (lower != null) attempt(errors, () -> setLowerLimit(lower));
            if (upper != null) attempt(errors, () -> setUpperLimit(upper));
        }

        Integer slow = overrides.getSlowWindow();
        Integer fast = overrides.getFastWindow();
        if (slow != null && fast != null && slow <= fastWindow) {
            attempt(errors, () -> setFastWindow(fast));
            attempt(errors, () -> setSlowWindow(slow));
        } else {
            if (slow != null) attempt(errors, () -> setSlowWindow(slow));
            if (fast != null) attempt(errors, () -> setFastWindow(fast));
        }

        if (overrides.getSlopeDelta() != null) {
            attempt(errors, () -> setSlopeDelta(overrides.getSlopeDelta()));
        }
        if (overrides.getPlateauLength() != null) {
            attempt(errors, () -> setPlateauLength(overrides.getPlateauLength()));
        }
        if (overrides.getPlateauDelta() != null) {
            attempt(errors, () -> setPlateauDelta(overrides.getPlateauDelta()));
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    public DetectorSettings snapshot() {
        return DetectorSettings.builder()
                .lowerLimit(lowerLimit)
                .upperLimit(upperLimit)
                .slowWindow(slowWindow)
                .fastWindow(fastWindow)
                .slopeDelta(slopeDelta)
                .plateauLength(plateauLength)
                .plateauDelta(plateauDelta)
                .build();
    }

    public double getLowerLimit() {
        return lowerLimit;
    }

    public double getUpperLimit() {
        return upperLimit;
    }

    public int getSlowWindow() {
        return slowWindow;
    }

    public int getFastWindow() {
        return fastWindow;
    }

    public double getSlopeDelta() {
        return slopeDelta;
    }

    public int getPlateauLength() {
        return plateauLength;
    }

    public double getPlateauDelta() {
        return plateauDelta;
    }

    private static void attempt(List<String> errors, Runnable setter) {
        try {
            setter.run();
        } catch (ValidationException e) {
            errors.addAll(e.getErrors());
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            reject(name + " value must be a finite number");
        }
    }

    private static void reject(String message) {
        System.out.println("[Config] Rejected: " + message);
        throw new ValidationException(message);
    }
}
