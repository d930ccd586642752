package com.gasview.alerts.service;

import com.gasview.alerts.exception.InsufficientDataException;
import com.gasview.alerts.exception.ValidationException;
import com.gasview.alerts.model.MovingAverages;

import java.util.Arrays;

public class MovingAverageService {

    public MovingAverages compute(double[] values, int slowWindow, int fastWindow) {
        double[] slow = movingAverage(values, slowWindow);
        double[] fast = movingAverage(values, fastWindow);

        double[] delta = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            delta[i] = slow[i] - fast[i];
        }

        return new MovingAverages(slowWindow, fastWindow, slow, fast, delta);
    }

    /**
     * Forward-window mean: position {@code i} averages {@code values[i..i+window-1]}.
     *
     * Only {@code n - window + 1} positions have a full window. The trailing
     * {@code window - 1} positions repeat the last computed average, so the output is
     * always as long as the input and goes stale towards the end of the series.
     */
    public double[] movingAverage(double[] values, int window) {
        if (window <= 0) {
            throw new ValidationException("moving average window must be positive");
        }
        if (window > values.length) {
            throw new InsufficientDataException(
                    String.format("moving average window %d exceeds series length %d", window, values.length),
                    values.length, window);
        }

        double[] result = new double[values.length];
        int valid = values.length - window + 1;

        for (int i = 0; i < valid; i++) {
            double sum = 0.0;
            for (int j = i; j < i + window; j++) {
                sum += values[j];
            }
            result[i] = Double.isFinite(sum) ? sum / window : scaledMean(values, i, window);
        }

        // Pad with the last full-window average
        Arrays.fill(result, valid, values.length, result[valid - 1]);
        return result;
    }

    // Window sum overflowed: average pre-divided readings instead
    private double scaledMean(double[] values, int start, int window) {
        double mean = 0.0;
        for (int j = start; j < start + window; j++) {
            mean += values[j] / window;
        }
        return mean;
    }
}
