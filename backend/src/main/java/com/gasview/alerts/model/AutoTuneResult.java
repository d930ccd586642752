package com.gasview.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a self-calibration run: the statistics, the suggested thresholds
 * and which of them the configuration store accepted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AutoTuneResult {
    private double mean;
    private double std;
    private double suggestedLowerLimit;
    private double suggestedUpperLimit;
    private double suggestedSlopeDelta;

    private boolean lowerLimitApplied;
    private boolean upperLimitApplied;
    private boolean slopeDeltaApplied;
    private List<String> rejections = new ArrayList<>();

    // Configuration after tuning
    private DetectorSettings settings;

    public boolean isFullyApplied() {
        return lowerLimitApplied && upperLimitApplied && slopeDeltaApplied;
    }
}
