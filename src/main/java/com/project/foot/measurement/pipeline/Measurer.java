package com.project.foot.measurement.pipeline;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts a bounding box width in pixels to centimeters with the fixed conversion factor,
 * rounded half away from zero to two decimals.
 */
public class Measurer {

    private final BigDecimal cmPerPixel;

    public Measurer(MeasurementParameters parameters) {
        this.cmPerPixel = BigDecimal.valueOf(parameters.cmPerPixel());
    }

    public double lengthCm(BoundingBox box) {
        return BigDecimal.valueOf(box.width())
                .multiply(cmPerPixel)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
