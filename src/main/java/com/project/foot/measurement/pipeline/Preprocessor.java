package com.project.foot.measurement.pipeline;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Reduces a raster to one intensity channel and smooths it before edge detection.
 * Both steps allocate a new matrix and leave their input untouched.
 */
public class Preprocessor {

    private final Size kernelSize;
    private final double sigma;

    public Preprocessor(MeasurementParameters parameters) {
        this.kernelSize = new Size(parameters.blurKernelSize(), parameters.blurKernelSize());
        this.sigma = parameters.blurSigma();
    }

    /** Standard luminance weighting (0.299 R + 0.587 G + 0.114 B). */
    public Mat toGrayscale(Mat raster) {
        if (raster.channels() != 3) {
            throw new IllegalArgumentException("Expected a 3-channel BGR raster, got " + raster.channels());
        }
        Mat gray = new Mat();
        Imgproc.cvtColor(raster, gray, Imgproc.COLOR_BGR2GRAY);
        return gray;
    }

    /** Gaussian blur with replicated borders, so the frame edge never reads as a gradient. */
    public Mat smooth(Mat gray) {
        Mat blurred = new Mat();
        Imgproc.GaussianBlur(gray, blurred, kernelSize, sigma, sigma, Core.BORDER_REPLICATE);
        return blurred;
    }
}
