package com.gasview.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResponse {
    private String column;
    private DetectorSettings settings;
    private AutoTuneResult autoTune;
    private Map<AlertRule, Integer> counts;
    private List<AlertSegment> segments;
    private List<Map<String, Object>> rows;
}
