package com.project.foot.measurement.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * Picks the contour enclosing the largest area. Equal areas keep the one met first in the
 * extractor's order.
 */
public class RegionSelector {

    public Optional<Contour> selectLargest(List<Contour> contours) {
        Contour largest = null;
        double largestArea = 0;
        for (Contour contour : contours) {
            double area = contour.area();
            if (largest == null || area > largestArea) {
                largest = contour;
                largestArea = area;
            }
        }
        return Optional.ofNullable(largest);
    }
}
