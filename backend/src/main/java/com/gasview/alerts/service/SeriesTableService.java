package com.gasview.alerts.service;

import com.gasview.alerts.exception.ValidationException;
import com.gasview.alerts.model.AlertRule;
import com.gasview.alerts.model.DetectionReport;
import com.gasview.alerts.model.SensorSeries;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between row-oriented tables and {@link SensorSeries}, and writes detector output
 * back as extra columns.
 */
public class SeriesTableService {

    public static final String SLOW_MA = "slow_ma";
    public static final String FAST_MA = "fast_ma";
    public static final String DELTA_MA = "delta_ma";

    public SensorSeries toSeries(List<Map<String, Object>> rows, String column) {
        if (rows == null || rows.isEmpty()) {
            throw new ValidationException("data has no rows");
        }
        if (rows.get(0) != null && !rows.get(0).containsKey(column)) {
            throw new ValidationException("data has no '" + column + "' column");
        }

        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            if (row == null) {
                throw new ValidationException(String.format("row %d is null", i));
            }
            Object cell = row.get(column);
            if (!(cell instanceof Number)) {
                throw new ValidationException(
                        String.format("row %d: '%s' must be numeric, got %s", i, column, cell));
            }
            values[i] = ((Number) cell).doubleValue();
        }
        return new SensorSeries(column, values);
    }

    public SensorSeries toSeries(String column, List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("data has no values");
        }

        double[] readings = new double[values.size()];
        for (int i = 0; i < values.size(); i++) {
            Double value = values.get(i);
            if (value == null) {
                throw new ValidationException(String.format("reading %d in '%s' is missing", i, column));
            }
            readings[i] = value;
        }
        return new SensorSeries(column, readings);
    }

    /**
     * Copy the rows and append every derived column present in the report.
     * Flags are written as 0/1. When {@code rows} is null, rows holding only the raw reading are built.
     */
    public List<Map<String, Object>> annotate(List<Map<String, Object>> rows, DetectionReport report) {
        double[] values = report.getValues();
        List<Map<String, Object>> annotated = new ArrayList<>(values.length);

        for (int i = 0; i < values.length; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (rows != null) {
                row.putAll(rows.get(i));
            } else {
                row.put(report.getColumn(), values[i]);
            }

            if (report.hasMovingAverages()) {
                row.put(SLOW_MA, report.getSlowMa()[i]);
                row.put(FAST_MA, report.getFastMa()[i]);
                row.put(DELTA_MA, report.getDeltaMa()[i]);
            }
            for (AlertRule rule : AlertRule.values()) {
                boolean[] flags = report.getFlags(rule);
                if (flags != null) {
                    row.put(rule.getColumn(), flags[i] ? 1 : 0);
                }
            }

            annotated.add(row);
        }

        return annotated;
    }
}
