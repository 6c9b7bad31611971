package com.project.foot.measurement.pipeline;

import com.project.foot.measurement.exceptions.MeasurementException;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decode, grayscale, blur, edge detection, outer contour extraction, largest region
 * selection and bounding box measurement, in that order.
 * <p>
 * Holds no mutable state: every call allocates and releases its own buffers, so a single
 * instance can be shared between request threads. Domain failures come back as
 * {@link MeasurementResult.Failure}; anything unexpected is raised as {@link MeasurementException}.
 */
public class FootMeasurementPipeline {
    private static final Logger log = LoggerFactory.getLogger(FootMeasurementPipeline.class);

    private final MeasurementParameters parameters;
    private final ImageDecoder decoder;
    private final Preprocessor preprocessor;
    private final EdgeDetector edgeDetector;
    private final ContourExtractor contourExtractor;
    private final RegionSelector regionSelector;
    private final Measurer measurer;

    public FootMeasurementPipeline(MeasurementParameters parameters) {
        OpenCvLibrary.load();
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.decoder = new ImageDecoder();
        this.preprocessor = new Preprocessor(parameters);
        this.edgeDetector = new EdgeDetector(parameters);
        this.contourExtractor = new ContourExtractor();
        this.regionSelector = new RegionSelector();
        this.measurer = new Measurer(parameters);
    }

    public MeasurementParameters parameters() {
        return parameters;
    }

    public MeasurementResult measure(byte[] imageBytes, ImageEncoding encoding) {
        Objects.requireNonNull(encoding, "encoding");

        Mat raster;
        try {
            raster = decoder.decode(imageBytes, encoding);
        } catch (ImageDecodeException e) {
            log.debug("Decode failed: {}", e.getMessage());
            return MeasurementResult.failure(FailureKind.DECODE_ERROR, e.getMessage());
        }

        Mat gray = null;
        Mat blurred = null;
        Mat edges = null;
        try {
            log.debug("Decoded {} raster {}x{}", encoding, raster.cols(), raster.rows());
            gray = preprocessor.toGrayscale(raster);
            blurred = preprocessor.smooth(gray);
            edges = edgeDetector.detect(blurred);

            List<Contour> contours = contourExtractor.extract(edges);
            log.debug("Extracted {} outer contours", contours.size());

            Optional<Contour> largest = regionSelector.selectLargest(contours);
            if (largest.isEmpty()) {
                return MeasurementResult.failure(FailureKind.NO_CONTOUR_FOUND, "No contour found in the image");
            }

            BoundingBox box = largest.get().boundingBox();
            return MeasurementResult.success(measurer.lengthCm(box), box);
        } catch (CvException e) {
            throw new MeasurementException("Image processing failed: " + e.getMessage(), e);
        } finally {
            release(raster, gray, blurred, edges);
        }
    }

    private static void release(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null) {
                mat.release();
            }
        }
    }
}
