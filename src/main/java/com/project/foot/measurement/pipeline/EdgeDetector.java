package com.project.foot.measurement.pipeline;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Canny edge detection: Sobel gradients, non-maximum suppression and hysteresis linking
 * over the 8-neighbourhood. Output pixels are either 0 or 255.
 */
public class EdgeDetector {

    private final double lowThreshold;
    private final double highThreshold;

    public EdgeDetector(MeasurementParameters parameters) {
        this.lowThreshold = parameters.cannyLowThreshold();
        this.highThreshold = parameters.cannyHighThreshold();
    }

    public Mat detect(Mat smoothed) {
        Mat edges = new Mat();
        Imgproc.Canny(smoothed, edges, lowThreshold, highThreshold);
        return edges;
    }
}
