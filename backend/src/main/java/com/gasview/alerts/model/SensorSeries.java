package com.gasview.alerts.model;

import lombok.ToString;
import lombok.Value;

import java.util.Objects;

/**
 * One named column of sensor readings in time order. Readings are copied in and never changed.
 */
@Value
@ToString(exclude = "values")
public class SensorSeries {
    public static final String DEFAULT_COLUMN = "values";

    String name;
    double[] values;

    public SensorSeries(String name, double[] values) {
        this.name = Objects.requireNonNull(name, "name");
        this.values = Objects.requireNonNull(values, "values").clone();
    }

    public static SensorSeries of(double... values) {
        return new SensorSeries(DEFAULT_COLUMN, values);
    }

    public double[] getValues() {
        return values.clone();
    }

    public double get(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }
}
