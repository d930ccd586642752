package com.gasview.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A run of consecutive raised flags for one rule.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertSegment {
    private AlertRule rule;
    private int startIndex;
    private int endIndex;      // inclusive
    private int length;
    private double minValue;   // raw readings inside the run
    private double maxValue;
}
