package com.gasview.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a detector's output for one series.
 * Columns that were not computed by the last runs are null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionReport {
    private String column;
    private double[] values;
    private DetectorSettings settings;

    private double[] slowMa;
    private double[] fastMa;
    private double[] deltaMa;

    private boolean[] ruptureAlert;
    private boolean[] slopeAlert;
    private boolean[] plateauAlert;
    private boolean[] alert;

    private Map<AlertRule, Integer> counts = new EnumMap<>(AlertRule.class);
    private List<AlertSegment> segments;

    public boolean[] getFlags(AlertRule rule) {
        switch (rule) {
            case RUPTURE:
                return ruptureAlert;
            case SLOPE:
                return slopeAlert;
            case PLATEAU:
                return plateauAlert;
            default:
                return alert;
        }
    }

    public boolean hasMovingAverages() {
        return deltaMa != null;
    }
}
