package com.gasview.alerts.service;

import com.gasview.alerts.exception.ValidationException;
import com.gasview.alerts.model.DetectorSettings;
import com.gasview.alerts.model.SettingsOverrides;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationStoreTest {

    private final ConfigurationStore store = new ConfigurationStore();

    @Test
    void newStore_startsFromDefaults() {
        assertEquals(DetectorSettings.DEFAULTS, store.snapshot());
        assertEquals(100, store.getLowerLimit());
        assertEquals(1300, store.getUpperLimit());
        assertEquals(20, store.getSlowWindow());
        assertEquals(5, store.getFastWindow());
        assertEquals(70, store.getSlopeDelta());
        assertEquals(2000, store.getPlateauLength());
        assertEquals(2, store.getPlateauDelta());
    }

    @Test
    void setUpperLimit_rejectsValueNotAboveLowerLimit() {
        assertThrows(ValidationException.class, () -> store.setUpperLimit(100));
        assertThrows(ValidationException.class, () -> store.setUpperLimit(50));

        assertEquals(DetectorSettings.DEFAULTS, store.snapshot(), "Rejected values leave the store unchanged");
    }

    @Test
    void setLowerLimit_isValidatedAgainstCurrentUpperLimit() {
        ValidationException e = assertThrows(ValidationException.class, () -> store.setLowerLimit(1500));
        assertEquals("lower limit must be smaller than upper limit", e.getMessage());
        assertEquals(100, store.getLowerLimit());

        store.setUpperLimit(2000);
        assertDoesNotThrow(() -> store.setLowerLimit(1500), "Accepted once the upper limit has moved");
        assertEquals(1500, store.getLowerLimit());
    }

    @Test
    void setLimits_rejectNonFiniteValues() {
        assertThrows(ValidationException.class, () -> store.setLowerLimit(Double.NaN));
        assertThrows(ValidationException.class, () -> store.setUpperLimit(Double.POSITIVE_INFINITY));
        assertEquals(DetectorSettings.DEFAULTS, store.snapshot());
    }

    @Test
    void setWindows_checkRelationBeforeMinimum() {
        ValidationException relation = assertThrows(ValidationException.class, () -> store.setSlowWindow(5));
        assertEquals("fast_window size must be smaller than slow_window size", relation.getMessage());

        ValidationException minimum = assertThrows(ValidationException.class, () -> store.setSlowWindow(19));
        assertEquals("minimum allowed value for slow_window is 20", minimum.getMessage());

        assertThrows(ValidationException.class, () -> store.setFastWindow(20));
        assertThrows(ValidationException.class, () -> store.setFastWindow(4));

        store.setSlowWindow(60);
        store.setFastWindow(30);
        assertEquals(60, store.getSlowWindow());
        assertEquals(30, store.getFastWindow());
    }

    @Test
    void setSlopeDelta_mustBeNonNegativeAndBelowLimitRange() {
        assertThrows(ValidationException.class, () -> store.setSlopeDelta(-1));
        assertThrows(ValidationException.class, () -> store.setSlopeDelta(1200),
            "Range is 1300 - 100 = 1200");
        assertEquals(70, store.getSlopeDelta());

        store.setSlopeDelta(0);
        assertEquals(0, store.getSlopeDelta());
        store.setSlopeDelta(1199.5);
        assertEquals(1199.5, store.getSlopeDelta());
    }

    @Test
    void setPlateauParameters_enforceMinimums() {
        assertThrows(ValidationException.class, () -> store.setPlateauLength(9));
        assertThrows(ValidationException.class, () -> store.setPlateauDelta(-0.1));

        store.setPlateauLength(10);
        store.setPlateauDelta(0.0);
        assertEquals(10, store.getPlateauLength());
        assertEquals(0.0, store.getPlateauDelta());
    }

    @Test
    void apply_movesRangePastCurrentBounds() {
        store.apply(SettingsOverrides.builder()
            .lowerLimit(2000.0)
            .upperLimit(3000.0)
            .slowWindow(40)
            .fastWindow(30)
            .build());

        assertEquals(2000, store.getLowerLimit());
        assertEquals(3000, store.getUpperLimit());
        assertEquals(40, store.getSlowWindow());
        assertEquals(30, store.getFastWindow());
    }

    @Test
    void apply_narrowsWindowsBelowCurrentFastWindow() {
        store.apply(SettingsOverrides.builder().slowWindow(50).fastWindow(30).build());

        store.apply(SettingsOverrides.builder().slowWindow(25).fastWindow(10).build());

        assertEquals(25, store.getSlowWindow());
        assertEquals(10, store.getFastWindow());
    }

    @Test
    void apply_movesRangeBelowCurrentBounds() {
        store.apply(SettingsOverrides.builder().lowerLimit(2000.0).upperLimit(3000.0).build());

        store.apply(SettingsOverrides.builder().lowerLimit(10.0).upperLimit(50.0).build());

        assertEquals(10, store.getLowerLimit());
        assertEquals(50, store.getUpperLimit());
    }

    @Test
    void apply_keepsAcceptedFieldsAndReportsAllRejections() {
        SettingsOverrides overrides = SettingsOverrides.builder()
            .plateauLength(5)
            .plateauDelta(3.0)
            .fastWindow(2)
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> store.apply(overrides));

        assertEquals(2, e.getErrors().size());
        assertTrue(e.getErrors().contains("minimum allowed value for plateau_length is 10"));
        assertEquals(3.0, store.getPlateauDelta(), "Valid field is still applied");
        assertEquals(2000, store.getPlateauLength());
        assertEquals(5, store.getFastWindow());
    }

    @Test
    void apply_ignoresNullOrEmptyOverrides() {
        store.apply(null);
        store.apply(new SettingsOverrides());

        assertEquals(DetectorSettings.DEFAULTS, store.snapshot());
    }
}
