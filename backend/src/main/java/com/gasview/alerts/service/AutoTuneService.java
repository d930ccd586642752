package com.gasview.alerts.service;

import com.gasview.alerts.exception.ValidationException;
import com.gasview.alerts.model.AutoTuneResult;

/**
 * Derives rupture limits and slope threshold from the series' own statistics:
 * limits at mean +/- 2.5 standard deviations, slope delta at 10% of that range.
 */
public class AutoTuneService {

    static final double SIGMA_MULTIPLIER = 2.5;
    static final double SLOPE_RANGE_FRACTION = 0.1;

    public AutoTuneResult suggest(double[] values) {
        double mean = computeMean(values);
        double std = computeStd(values, mean);

        if (!Double.isFinite(mean) || !Double.isFinite(std)) {
            throw new ValidationException("cannot auto-tune: mean or standard deviation of the series is not finite");
        }
        if (std == 0.0) {
            throw new ValidationException(
                    "cannot auto-tune a series with zero standard deviation (all readings equal " + mean + ")");
        }

        double lower = mean - SIGMA_MULTIPLIER * std;
        double upper = mean + SIGMA_MULTIPLIER * std;

        AutoTuneResult result = new AutoTuneResult();
        result.setMean(mean);
        result.setStd(std);
        result.setSuggestedLowerLimit(lower);
        result.setSuggestedUpperLimit(upper);
        result.setSuggestedSlopeDelta(SLOPE_RANGE_FRACTION * (upper - lower));
        return result;
    }

    /**
     * Compute suggestions and write them through the store's setters (lower limit, upper limit,
     * slope delta, in that order). A rejected setter keeps the prior value and is recorded in
     * the result.
     */
    public AutoTuneResult tune(double[] values, ConfigurationStore config) {
        AutoTuneResult result = suggest(values);

        try {
            config.setLowerLimit(result.getSuggestedLowerLimit());
            result.setLowerLimitApplied(true);
        } catch (ValidationException e) {
            result.getRejections().add("lower_limit: " + e.getMessage());
        }

        try {
            config.setUpperLimit(result.getSuggestedUpperLimit());
            result.setUpperLimitApplied(true);
        } catch (ValidationException e) {
            result.getRejections().add("upper_limit: " + e.getMessage());
        }

        try {
            config.setSlopeDelta(result.getSuggestedSlopeDelta());
            result.setSlopeDeltaApplied(true);
        } catch (ValidationException e) {
            result.getRejections().add("slope_delta: " + e.getMessage());
        }

        result.setSettings(config.snapshot());

        System.out.println(String.format("[AutoTune] mean=%.4f std=%.4f -> limits [%.4f, %.4f], slope_delta=%.4f%s",
                result.getMean(), result.getStd(),
                result.getSuggestedLowerLimit(), result.getSuggestedUpperLimit(), result.getSuggestedSlopeDelta(),
                result.isFullyApplied() ? "" : " (partially applied)"));

        return result;
    }

    private double computeMean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        if (Double.isFinite(sum)) {
            return sum / values.length;
        }

        double mean = 0;
        for (double v : values) mean += v / values.length;
        return mean;
    }

    // Population standard deviation, scaled by the largest deviation so the squares cannot overflow
    private double computeStd(double[] values, double mean) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double scale = 0;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
            scale = Math.max(scale, Math.abs(v - mean));
        }
        if (min == max) {
            return 0.0;
        }
        if (!Double.isFinite(scale)) {
            return scale;
        }

        double sumSquares = 0;
        for (double v : values) {
            double diff = (v - mean) / scale;
            sumSquares += diff * diff;
        }
        return scale * Math.sqrt(sumSquares / values.length);
    }
}
