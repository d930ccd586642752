package com.gasview.alerts.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of the seven detector parameters.
 * {@link #DEFAULTS} seeds every new configuration store.
 */
@Value
@Builder(toBuilder = true)
public class DetectorSettings {

    public static final DetectorSettings DEFAULTS = DetectorSettings.builder()
            .lowerLimit(100)
            .upperLimit(1300)
            .slowWindow(20)
            .fastWindow(5)
            .slopeDelta(70)
            .plateauLength(2000)
            .plateauDelta(2)
            .build();

    double lowerLimit;
    double upperLimit;
    int slowWindow;
    int fastWindow;
    double slopeDelta;
    int plateauLength;
    double plateauDelta;
}
