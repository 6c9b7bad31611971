package com.project.foot.measurement.config;

import com.project.foot.measurement.pipeline.MeasurementParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pipeline tuning bound from {@code app.measurement.*}.
 */
@ConfigurationProperties(prefix = "app.measurement")
public class MeasurementProperties {

    /** Gaussian kernel side (must be odd) */
    private int blurKernelSize = MeasurementParameters.DEFAULT_BLUR_KERNEL_SIZE;

    /** Gaussian sigma; 0 derives it from the kernel size */
    private double blurSigma = MeasurementParameters.DEFAULT_BLUR_SIGMA;

    /** Canny hysteresis thresholds (0-255) */
    private double cannyLowThreshold = MeasurementParameters.DEFAULT_CANNY_LOW_THRESHOLD;
    private double cannyHighThreshold = MeasurementParameters.DEFAULT_CANNY_HIGH_THRESHOLD;

    /** Centimeters per pixel; assumes a fixed, uncalibrated camera distance */
    private double cmPerPixel = MeasurementParameters.DEFAULT_CM_PER_PIXEL;

    public MeasurementParameters toParameters() {
        return new MeasurementParameters(blurKernelSize, blurSigma, cannyLowThreshold, cannyHighThreshold, cmPerPixel);
    }

    public int getBlurKernelSize() { return blurKernelSize; }
    public void setBlurKernelSize(int blurKernelSize) { this.blurKernelSize = blurKernelSize; }

    public double getBlurSigma() { return blurSigma; }
    public void setBlurSigma(double blurSigma) { this.blurSigma = blurSigma; }

    public double getCannyLowThreshold() { return cannyLowThreshold; }
    public void setCannyLowThreshold(double cannyLowThreshold) { this.cannyLowThreshold = cannyLowThreshold; }

    public double getCannyHighThreshold() { return cannyHighThreshold; }
    public void setCannyHighThreshold(double cannyHighThreshold) { this.cannyHighThreshold = cannyHighThreshold; }

    public double getCmPerPixel() { return cmPerPixel; }
    public void setCmPerPixel(double cmPerPixel) { this.cmPerPixel = cmPerPixel; }
}
