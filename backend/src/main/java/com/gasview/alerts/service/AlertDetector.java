package com.gasview.alerts.service;

import com.gasview.alerts.exception.InsufficientDataException;
import com.gasview.alerts.exception.NotReadyException;
import com.gasview.alerts.exception.ValidationException;
import com.gasview.alerts.model.AlertRule;
import com.gasview.alerts.model.AlertSegment;
import com.gasview.alerts.model.AutoTuneResult;
import com.gasview.alerts.model.DetectionReport;
import com.gasview.alerts.model.DetectorSettings;
import com.gasview.alerts.model.MovingAverages;
import com.gasview.alerts.model.SensorSeries;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Detects operational anomalies in one gas-tank sensor series.
 *
 * Three rules are available: rupture of the lower/upper limits, fast slope (divergence
 * between the slow and fast moving averages) and plateau (a long run of near-zero divergence,
 * usually a stuck sensor). {@link #detectAll()} runs them in that order and ORs the flags.
 *
 * An instance owns its configuration, the loaded series and every column derived from it.
 * It is not thread-safe; use one detector per sensor.
 */
public class AlertDetector {

    public static final int MIN_SERIES_LENGTH = 21;

    /**
     * Largest accepted reading magnitude. Keeps the divergence between two averages, and the
     * deviations used by auto-tune, inside the double range.
     */
    public static final double MAX_READING_MAGNITUDE = Double.MAX_VALUE / 4;

    private final ConfigurationStore config;
    private final MovingAverageService movingAverageService = new MovingAverageService();
    private final AlertRuleService ruleService = new AlertRuleService();
    private final AutoTuneService autoTuneService = new AutoTuneService();

    private SensorSeries series;
    private MovingAverages movingAverages;
    private boolean[] ruptureAlert;
    private boolean[] slopeAlert;
    private boolean[] plateauAlert;
    private boolean[] alert;

    public AlertDetector() {
        this(new ConfigurationStore());
    }

    public AlertDetector(ConfigurationStore config) {
        this.config = config;
    }

    /**
     * Load the series to analyse. Previously derived columns are discarded.
     *
     * @throws InsufficientDataException if the series has fewer than {@value #MIN_SERIES_LENGTH} readings
     * @throws ValidationException if a reading is NaN, infinite or beyond {@link #MAX_READING_MAGNITUDE}
     */
    public void setData(SensorSeries series) {
        if (series == null) {
            throw new ValidationException("data must not be null");
        }
        if (series.size() < MIN_SERIES_LENGTH) {
            throw new InsufficientDataException(
                    String.format("insufficient data in '%s' column: %d readings, need at least %d",
                            series.getName(), series.size(), MIN_SERIES_LENGTH),
                    series.size(), MIN_SERIES_LENGTH);
        }
        for (int i = 0; i < series.size(); i++) {
            if (!Double.isFinite(series.get(i))) {
                throw new ValidationException(
                        String.format("reading %d in '%s' column is not a finite number", i, series.getName()));
            }
            if (Math.abs(series.get(i)) > MAX_READING_MAGNITUDE) {
                throw new ValidationException(
                        String.format("reading %d in '%s' column is out of the supported range (|value| <= %e)",
                                i, series.getName(), MAX_READING_MAGNITUDE));
            }
        }

        this.series = series;
        this.movingAverages = null;
        this.ruptureAlert = null;
        this.slopeAlert = null;
        this.plateauAlert = null;
        this.alert = null;
    }

    public boolean isReady() {
        return series != null;
    }

    public SensorSeries getSeries() {
        return series;
    }

    public ConfigurationStore getConfig() {
        return config;
    }

    public boolean[] detectMaxMinRupture() {
        requireSeries();
        ruptureAlert = ruleService.detectRupture(series.getValues(), config.snapshot());
        alert = null;
        return ruptureAlert.clone();
    }

    public boolean[] detectFastSlope() {
        requireSeries();
        refreshMovingAverages();
        slopeAlert = ruleService.detectSlope(movingAverages.getDeltaMa(), config.snapshot());
        alert = null;
        return slopeAlert.clone();
    }

    public boolean[] detectPlateau() {
        requireSeries();
        refreshMovingAverages();
        plateauAlert = ruleService.detectPlateau(movingAverages.getDeltaMa(), config.snapshot());
        alert = null;
        return plateauAlert.clone();
    }

    /**
     * Run rupture, slope and plateau detection and combine them with a logical OR.
     * The moving averages are computed once for the whole pass.
     */
    public DetectionReport detectAll() {
        requireSeries();
        DetectorSettings settings = config.snapshot();
        double[] values = series.getValues();

        ruptureAlert = ruleService.detectRupture(values, settings);
        refreshMovingAverages();
        slopeAlert = ruleService.detectSlope(movingAverages.getDeltaMa(), settings);
        plateauAlert = ruleService.detectPlateau(movingAverages.getDeltaMa(), settings);
        alert = ruleService.combine(ruptureAlert, slopeAlert, plateauAlert);

        return getReport();
    }

    /**
     * Calibrate lower/upper limits and slope delta from the loaded series. Window and plateau
     * parameters are left alone. Check {@link AutoTuneResult#isFullyApplied()}: a suggestion the
     * configuration rejects keeps the previous value.
     */
    public AutoTuneResult autoTune() {
        requireSeries();
        return autoTuneService.tune(series.getValues(), config);
    }

    public DetectionReport getReport() {
        requireSeries();
        DetectionReport report = new DetectionReport();
        report.setColumn(series.getName());
        report.setValues(series.getValues());
        report.setSettings(config.snapshot());

        if (movingAverages != null) {
            report.setSlowMa(movingAverages.getSlowMa().clone());
            report.setFastMa(movingAverages.getFastMa().clone());
            report.setDeltaMa(movingAverages.getDeltaMa().clone());
        }
        report.setRuptureAlert(copy(ruptureAlert));
        report.setSlopeAlert(copy(slopeAlert));
        report.setPlateauAlert(copy(plateauAlert));
        report.setAlert(copy(alert));

        Map<AlertRule, Integer> counts = new EnumMap<>(AlertRule.class);
        List<AlertSegment> segments = new ArrayList<>();
        for (AlertRule rule : AlertRule.values()) {
            boolean[] flags = report.getFlags(rule);
            if (flags == null) {
                continue;
            }
            counts.put(rule, ruleService.count(flags));
            segments.addAll(ruleService.extractSegments(rule, flags, report.getValues()));
        }
        report.setCounts(counts);
        report.setSegments(segments);

        return report;
    }

    private void refreshMovingAverages() {
        movingAverages = movingAverageService.compute(
                series.getValues(), config.getSlowWindow(), config.getFastWindow());
    }

    private void requireSeries() {
        if (series == null) {
            throw new NotReadyException("no data loaded; call setData before running detection");
        }
    }

    private static boolean[] copy(boolean[] flags) {
        return flags == null ? null : flags.clone();
    }
}
