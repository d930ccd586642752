package com.gasview.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MovingAverages {
    private int slowWindow;
    private int fastWindow;
    private double[] slowMa;
    private double[] fastMa;
    private double[] deltaMa;  // slowMa - fastMa
}
