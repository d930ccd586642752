package com.gasview.alerts.service;

import com.gasview.alerts.model.AlertRule;
import com.gasview.alerts.model.AlertSegment;
import com.gasview.alerts.model.DetectorSettings;

import java.util.ArrayList;
import java.util.List;

public class AlertRuleService {

    /**
     * Readings strictly outside [lowerLimit, upperLimit].
     */
    public boolean[] detectRupture(double[] values, DetectorSettings settings) {
        boolean[] flags = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flags[i] = values[i] < settings.getLowerLimit() || values[i] > settings.getUpperLimit();
        }
        return flags;
    }

    /**
     * Slow/fast moving-average divergence beyond slopeDelta in either direction.
     */
    public boolean[] detectSlope(double[] deltaMa, DetectorSettings settings) {
        double threshold = settings.getSlopeDelta();
        boolean[] flags = new boolean[deltaMa.length];
        for (int i = 0; i < deltaMa.length; i++) {
            flags[i] = deltaMa[i] < -threshold || deltaMa[i] > threshold;
        }
        return flags;
    }

    /**
     * Stuck-sensor detection. Counts consecutive samples whose divergence stays under
     * plateauDelta; the flag is raised once the run is longer than plateauLength.
     * Must scan in time order.
     */
    public boolean[] detectPlateau(double[] deltaMa, DetectorSettings settings) {
        boolean[] flags = new boolean[deltaMa.length];
        int run = 0;
        for (int i = 0; i < deltaMa.length; i++) {
            run = Math.abs(deltaMa[i]) < settings.getPlateauDelta() ? run + 1 : 0;
            flags[i] = run > settings.getPlateauLength();
        }
        return flags;
    }

    public boolean[] combine(boolean[] rupture, boolean[] slope, boolean[] plateau) {
        boolean[] combined = new boolean[rupture.length];
        for (int i = 0; i < rupture.length; i++) {
            combined[i] = rupture[i] || slope[i] || plateau[i];
        }
        return combined;
    }

    public int count(boolean[] flags) {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) count++;
        }
        return count;
    }

    /**
     * Collapse a flag column into runs of consecutive raised flags.
     */
    public List<AlertSegment> extractSegments(AlertRule rule, boolean[] flags, double[] values) {
        List<AlertSegment> segments = new ArrayList<>();

        int start = -1;
        for (int i = 0; i <= flags.length; i++) {
            boolean raised = i < flags.length && flags[i];
            if (raised && start < 0) {
                start = i;
            } else if (!raised && start >= 0) {
                segments.add(buildSegment(rule, start, i - 1, values));
                start = -1;
            }
        }

        return segments;
    }

    private AlertSegment buildSegment(AlertRule rule, int start, int end, double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = start; i <= end; i++) {
            min = Math.min(min, values[i]);
            max = Math.max(max, values[i]);
        }
        return new AlertSegment(rule, start, end, end - start + 1, min, max);
    }
}
