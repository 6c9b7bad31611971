package com.project.foot.measurement.pipeline;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Traces outer boundaries of connected edge regions (inner contours are dropped) with
 * collinear points compressed away. Results are sorted by {@link Contour#RASTER_ORDER}.
 */
public class ContourExtractor {

    public List<Contour> extract(Mat edgeMap) {
        if (Core.countNonZero(edgeMap) == 0) {
            return List.of();
        }

        List<MatOfPoint> traced = new ArrayList<>();
        Mat hierarchy = new Mat();
        try {
            Imgproc.findContours(edgeMap, traced, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

            List<Contour> contours = new ArrayList<>(traced.size());
            for (MatOfPoint boundary : traced) {
                contours.add(Contour.of(boundary.toArray()));
            }
            contours.sort(Contour.RASTER_ORDER);
            return contours;
        } finally {
            hierarchy.release();
            traced.forEach(Mat::release);
        }
    }
}
