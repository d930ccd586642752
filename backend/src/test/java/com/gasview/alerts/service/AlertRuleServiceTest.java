package com.gasview.alerts.service;

import com.gasview.alerts.model.AlertRule;
import com.gasview.alerts.model.AlertSegment;
import com.gasview.alerts.model.DetectorSettings;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertRuleServiceTest {

    private final AlertRuleService service = new AlertRuleService();

    @Test
    void detectRupture_flagsOnlyReadingsOutsideLimits() {
        double[] values = {99.9, 100, 700, 1300, 1300.1, 5000};

        boolean[] flags = service.detectRupture(values, DetectorSettings.DEFAULTS);

        assertArrayEquals(new boolean[]{true, false, false, false, true, true}, flags,
            "Limits themselves are inside the allowed range");
    }

    @Test
    void detectSlope_flagsDivergenceInBothDirections() {
        double[] delta = {0, 70, 70.5, -70, -70.5, 200};

        boolean[] flags = service.detectSlope(delta, DetectorSettings.DEFAULTS);

        assertArrayEquals(new boolean[]{false, false, true, false, true, true}, flags);
    }

    @Test
    void detectPlateau_countsRunAndResetsOnBreak() {
        DetectorSettings settings = DetectorSettings.DEFAULTS.toBuilder().plateauLength(10).build();
        double[] delta = new double[25];
        delta[12] = 5.0; // breaks the run

        boolean[] flags = service.detectPlateau(delta, settings);

        for (int i = 0; i < 10; i++) {
            assertFalse(flags[i], "Run not yet longer than plateau length at " + i);
        }
        assertTrue(flags[10]);
        assertTrue(flags[11]);
        assertFalse(flags[12], "Large divergence resets the counter");
        for (int i = 13; i < 23; i++) {
            assertFalse(flags[i], "Counter restarted from zero at " + i);
        }
        assertTrue(flags[23]);
        assertTrue(flags[24]);
    }

    @Test
    void detectPlateau_treatsDeltaEqualToThresholdAsBreak() {
        DetectorSettings settings = DetectorSettings.DEFAULTS.toBuilder().plateauLength(10).build();
        double[] delta = new double[15];
        Arrays.fill(delta, 2.0);

        boolean[] flags = service.detectPlateau(delta, settings);

        assertEquals(0, service.count(flags), "|delta| must be strictly below plateau delta");
    }

    @Test
    void combine_isLogicalOr() {
        boolean[] rupture = {true, false, false, false};
        boolean[] slope = {false, true, false, false};
        boolean[] plateau = {false, false, true, false};

        assertArrayEquals(new boolean[]{true, true, true, false}, service.combine(rupture, slope, plateau));
    }

    @Test
    void extractSegments_collapsesConsecutiveFlags() {
        boolean[] flags = {true, true, false, false, true, false, true, true, true};
        double[] values = {10, 30, 0, 0, 7, 0, 5, 9, 1};

        List<AlertSegment> segments = service.extractSegments(AlertRule.RUPTURE, flags, values);

        assertEquals(3, segments.size());
        assertEquals(new AlertSegment(AlertRule.RUPTURE, 0, 1, 2, 10, 30), segments.get(0));
        assertEquals(new AlertSegment(AlertRule.RUPTURE, 4, 4, 1, 7, 7), segments.get(1));
        assertEquals(new AlertSegment(AlertRule.RUPTURE, 6, 8, 3, 1, 9), segments.get(2),
            "A run reaching the end of the series is closed");
    }

    @Test
    void extractSegments_returnsEmptyWhenNothingRaised() {
        assertTrue(service.extractSegments(AlertRule.SLOPE, new boolean[5], new double[5]).isEmpty());
    }
}
