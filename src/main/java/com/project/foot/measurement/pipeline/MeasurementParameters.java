package com.project.foot.measurement.pipeline;

/**
 * Tunable constants of the measurement pipeline. Instances are immutable and passed to the
 * pipeline at construction, so tests can vary them without touching shared state.
 *
 * @param blurKernelSize     side of the square Gaussian kernel, positive and odd
 * @param blurSigma          Gaussian standard deviation; 0 derives it from the kernel size
 * @param cannyLowThreshold  hysteresis low threshold on the 0-255 scale
 * @param cannyHighThreshold hysteresis high threshold on the 0-255 scale
 * @param cmPerPixel         fixed pixel-to-centimeter conversion factor (uncalibrated)
 */
public record MeasurementParameters(
        int blurKernelSize,
        double blurSigma,
        double cannyLowThreshold,
        double cannyHighThreshold,
        double cmPerPixel
) {

    public static final int DEFAULT_BLUR_KERNEL_SIZE = 5;
    public static final double DEFAULT_BLUR_SIGMA = 0.0;
    public static final double DEFAULT_CANNY_LOW_THRESHOLD = 50.0;
    public static final double DEFAULT_CANNY_HIGH_THRESHOLD = 150.0;
    public static final double DEFAULT_CM_PER_PIXEL = 0.2;

    public MeasurementParameters {
        if (blurKernelSize <= 0 || blurKernelSize % 2 == 0) {
            throw new IllegalArgumentException("Blur kernel size must be positive and odd: " + blurKernelSize);
        }
        if (blurSigma < 0) {
            throw new IllegalArgumentException("Blur sigma must not be negative: " + blurSigma);
        }
        if (cannyLowThreshold < 0 || cannyLowThreshold > cannyHighThreshold) {
            throw new IllegalArgumentException("Canny thresholds must satisfy 0 <= low <= high (low="
                    + cannyLowThreshold + ", high=" + cannyHighThreshold + ")");
        }
        if (!(cmPerPixel > 0)) {
            throw new IllegalArgumentException("Conversion factor must be positive: " + cmPerPixel);
        }
    }

    public static MeasurementParameters defaults() {
        return new MeasurementParameters(
                DEFAULT_BLUR_KERNEL_SIZE,
                DEFAULT_BLUR_SIGMA,
                DEFAULT_CANNY_LOW_THRESHOLD,
                DEFAULT_CANNY_HIGH_THRESHOLD,
                DEFAULT_CM_PER_PIXEL);
    }

    public MeasurementParameters withCmPerPixel(double factor) {
        return new MeasurementParameters(blurKernelSize, blurSigma, cannyLowThreshold, cannyHighThreshold, factor);
    }
}
