package com.gasview.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRequest {
    private String column;
    private List<Map<String, Object>> rows;
    private List<Double> values;
    private SettingsOverrides config;
    private Boolean autoTune;
    private List<String> rules;
}
