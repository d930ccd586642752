package com.gasview.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial set of detector parameters. Null fields leave the current value alone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsOverrides {
    private Double lowerLimit;
    private Double upperLimit;
    private Integer slowWindow;
    private Integer fastWindow;
    private Double slopeDelta;
    private Integer plateauLength;
    private Double plateauDelta;

    public boolean isEmpty() {
        return lowerLimit == null && upperLimit == null
                && slowWindow == null && fastWindow == null
                && slopeDelta == null && plateauLength == null && plateauDelta == null;
    }
}
